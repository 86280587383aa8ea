package com.guildsentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single inbound chat message, as delivered by the ingestion layer.
 *
 * <p>
 * Instances are immutable. Attachment and sticker names are kept separately
 * from the text so that the fingerprinter can append stable markers for them.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code guildId}, {@code authorId},
 * {@code messageId} and {@code receivedAt} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MessageEvent {

    private final String guildId;
    private final String channelId;
    private final String messageId;
    private final String authorId;
    private final String content;
    private final List<String> attachments;
    private final List<String> stickers;
    private final Set<String> authorRoleIds;
    private final Instant accountCreatedAt;
    private final Instant joinedAt;
    private final Instant receivedAt;

    private MessageEvent(Builder b) {
        this.guildId = Objects.requireNonNull(b.guildId, "guildId must not be null");
        this.authorId = Objects.requireNonNull(b.authorId, "authorId must not be null");
        this.messageId = Objects.requireNonNull(b.messageId, "messageId must not be null");
        this.receivedAt = Objects.requireNonNull(b.receivedAt, "receivedAt must not be null");
        this.channelId = b.channelId;
        this.content = b.content != null ? b.content : "";
        this.attachments = Collections.unmodifiableList(new ArrayList<>(b.attachments));
        this.stickers = Collections.unmodifiableList(new ArrayList<>(b.stickers));
        this.authorRoleIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.authorRoleIds));
        this.accountCreatedAt = b.accountCreatedAt;
        this.joinedAt = b.joinedAt;
    }

    /**
     * @return the partition this event belongs to
     */
    public PartitionKey partitionKey() {
        return new PartitionKey(guildId, authorId);
    }

    public String getGuildId() {
        return guildId;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getAuthorId() {
        return authorId;
    }

    public String getContent() {
        return content;
    }

    public List<String> getAttachments() {
        return attachments;
    }

    public List<String> getStickers() {
        return stickers;
    }

    public Set<String> getAuthorRoleIds() {
        return authorRoleIds;
    }

    /**
     * @return account creation instant, or {@code null} when the platform did
     *         not report it
     */
    public Instant getAccountCreatedAt() {
        return accountCreatedAt;
    }

    /**
     * @return guild join instant, or {@code null} when unknown
     */
    public Instant getJoinedAt() {
        return joinedAt;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageEvent that)) {
            return false;
        }
        return guildId.equals(that.guildId)
                && messageId.equals(that.messageId)
                && authorId.equals(that.authorId)
                && receivedAt.equals(that.receivedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guildId, messageId, authorId, receivedAt);
    }

    @Override
    public String toString() {
        return "MessageEvent{" +
                "guildId='" + guildId + '\'' +
                ", channelId='" + channelId + '\'' +
                ", messageId='" + messageId + '\'' +
                ", authorId='" + authorId + '\'' +
                ", receivedAt=" + receivedAt +
                '}';
    }

    /**
     * Fluent builder for {@link MessageEvent}.
     */
    public static class Builder {
        private String guildId;
        private String channelId;
        private String messageId;
        private String authorId;
        private String content;
        private final List<String> attachments = new ArrayList<>();
        private final List<String> stickers = new ArrayList<>();
        private final Set<String> authorRoleIds = new LinkedHashSet<>();
        private Instant accountCreatedAt;
        private Instant joinedAt;
        private Instant receivedAt;

        public Builder guildId(String guildId) {
            this.guildId = guildId;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder authorId(String authorId) {
            this.authorId = authorId;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder attachment(String name) {
            this.attachments.add(name);
            return this;
        }

        public Builder attachments(List<String> names) {
            this.attachments.addAll(names);
            return this;
        }

        public Builder sticker(String name) {
            this.stickers.add(name);
            return this;
        }

        public Builder stickers(List<String> names) {
            this.stickers.addAll(names);
            return this;
        }

        public Builder authorRoleIds(Set<String> roleIds) {
            this.authorRoleIds.addAll(roleIds);
            return this;
        }

        public Builder accountCreatedAt(Instant accountCreatedAt) {
            this.accountCreatedAt = accountCreatedAt;
            return this;
        }

        public Builder joinedAt(Instant joinedAt) {
            this.joinedAt = joinedAt;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        /**
         * @return a new immutable {@link MessageEvent}
         * @throws NullPointerException if a required field is missing
         */
        public MessageEvent build() {
            return new MessageEvent(this);
        }
    }
}
