package com.guildsentinel.core.window;

import java.time.Instant;
import java.util.Objects;

/**
 * One past message inside a {@link UserWindow}.
 *
 * @since 1.0.0
 */
public final class WindowEntry {

    private final String messageId;
    private final String channelId;
    private final Instant timestamp;
    private final ContentFingerprint fingerprint;

    public WindowEntry(String messageId, String channelId, Instant timestamp, ContentFingerprint fingerprint) {
        this.messageId = Objects.requireNonNull(messageId, "messageId must not be null");
        this.channelId = channelId;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    public String getMessageId() {
        return messageId;
    }

    public String getChannelId() {
        return channelId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ContentFingerprint getFingerprint() {
        return fingerprint;
    }

    @Override
    public String toString() {
        return "WindowEntry{" + messageId + "@" + timestamp + '}';
    }
}
