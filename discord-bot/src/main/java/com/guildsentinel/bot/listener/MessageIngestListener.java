package com.guildsentinel.bot.listener;

import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.pipeline.ProcessingResult;
import com.guildsentinel.core.pipeline.ProtectionPipeline;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.sticker.StickerItem;
import net.dv8tion.jda.api.events.message.MessageDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Feeds guild messages into the {@link ProtectionPipeline} and turns
 * upstream deletions into retractions.
 *
 * <p>
 * Bot and webhook messages and direct messages are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class MessageIngestListener extends ListenerAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(MessageIngestListener.class);

    private final ProtectionPipeline pipeline;

    public MessageIngestListener(ProtectionPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (!event.isFromGuild() || event.getAuthor().isBot() || event.isWebhookMessage()) {
            return;
        }
        MessageEvent message = toEvent(event);
        try {
            pipeline.submit(message).whenComplete((result, error) -> {
                if (error != null) {
                    LOG.error("Processing failed for message {} in guild {}: {}",
                            message.getMessageId(), message.getGuildId(), error.getMessage(), error);
                } else if (result.getStatus() == ProcessingResult.Status.PROCESSED) {
                    LOG.trace("Message {} -> {}", message.getMessageId(), result.getDecision().getAction());
                }
            });
        } catch (IllegalStateException e) {
            LOG.warn("Pipeline not accepting events, skipping message {}", message.getMessageId());
        }
    }

    @Override
    public void onMessageDelete(MessageDeleteEvent event) {
        if (event.isFromGuild()) {
            pipeline.retract(event.getGuild().getId(), event.getMessageId());
        }
    }

    static MessageEvent toEvent(MessageReceivedEvent event) {
        Message message = event.getMessage();
        User author = event.getAuthor();
        Member member = event.getMember();

        MessageEvent.Builder builder = MessageEvent.builder()
                .guildId(event.getGuild().getId())
                .channelId(event.getChannel().getId())
                .messageId(message.getId())
                .authorId(author.getId())
                .content(message.getContentRaw())
                .accountCreatedAt(author.getTimeCreated().toInstant())
                .receivedAt(message.getTimeCreated().toInstant());
        message.getAttachments().forEach(a -> builder.attachment(a.getFileName()));
        for (StickerItem sticker : message.getStickers()) {
            builder.sticker(sticker.getName());
        }
        if (member != null) {
            Set<String> roles = member.getRoles().stream().map(Role::getId).collect(Collectors.toSet());
            builder.authorRoleIds(roles);
            if (member.hasTimeJoined()) {
                builder.joinedAt(member.getTimeJoined().toInstant());
            }
        }
        return builder.build();
    }
}
