package com.guildsentinel.bot.jda;

import com.guildsentinel.core.action.ApiResult;
import com.guildsentinel.core.action.ModerationApi;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.UserSnowflake;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.requests.RestAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ModerationApi} backed by JDA REST actions.
 *
 * <p>
 * Requests are submitted with {@code shouldQueue = false}, so JDA reports
 * rate limits as failures instead of waiting on them; retry timing stays
 * with the action executor.
 * </p>
 *
 * @since 1.0.0
 */
public class JdaModerationApi implements ModerationApi {

    private static final Logger LOG = LoggerFactory.getLogger(JdaModerationApi.class);

    /** Discord rejects timeouts longer than 28 days. */
    static final Duration MAX_TIMEOUT = Duration.ofDays(28);

    private final JDA jda;

    public JdaModerationApi(JDA jda) {
        this.jda = Objects.requireNonNull(jda, "jda must not be null");
    }

    @Override
    public CompletableFuture<ApiResult> mute(String guildId, String userId, Duration duration, String reason) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            return unknown("guild " + guildId);
        }
        Duration timeout = duration.compareTo(MAX_TIMEOUT) > 0 ? MAX_TIMEOUT : duration;
        return submit(guild.timeoutFor(UserSnowflake.fromId(userId), timeout).reason(reason));
    }

    @Override
    public CompletableFuture<ApiResult> deleteMessage(String guildId, String channelId, String messageId) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            return unknown("guild " + guildId);
        }
        GuildMessageChannel channel = guild.getChannelById(GuildMessageChannel.class, channelId);
        if (channel == null) {
            return unknown("channel " + channelId);
        }
        return submit(channel.deleteMessageById(messageId));
    }

    @Override
    public CompletableFuture<ApiResult> warn(String guildId, String userId, String reason) {
        Guild guild = jda.getGuildById(guildId);
        String guildName = guild != null ? guild.getName() : guildId;
        String text = "Your recent message in **" + guildName + "** was flagged. " + reason
                + ". Further violations may lead to a timeout.";
        return submit(jda.openPrivateChannelById(userId).flatMap(channel -> channel.sendMessage(text)));
    }

    private static CompletableFuture<ApiResult> submit(RestAction<?> action) {
        return action.submit(false)
                .handle((ignored, error) -> error == null ? ApiResult.success() : JdaErrorClassifier.classify(error));
    }

    private static CompletableFuture<ApiResult> unknown(String what) {
        LOG.warn("Cannot act: unknown {}", what);
        return CompletableFuture.completedFuture(ApiResult.nonRetryable("unknown " + what));
    }
}
