package com.guildsentinel.core.decision;

import java.time.Instant;
import java.util.Objects;

/**
 * Mute history of one (guild, user) inside the current escalation chain.
 *
 * @since 1.0.0
 */
public final class OffenseRecord {

    private final int muteCount;
    private final Instant lastMuteAt;

    public OffenseRecord(int muteCount, Instant lastMuteAt) {
        if (muteCount < 1) {
            throw new IllegalArgumentException("muteCount must be >= 1, got: " + muteCount);
        }
        this.muteCount = muteCount;
        this.lastMuteAt = Objects.requireNonNull(lastMuteAt, "lastMuteAt must not be null");
    }

    /**
     * @return mutes in the current chain, the first one included
     */
    public int getMuteCount() {
        return muteCount;
    }

    public Instant getLastMuteAt() {
        return lastMuteAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OffenseRecord that)) {
            return false;
        }
        return muteCount == that.muteCount && lastMuteAt.equals(that.lastMuteAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(muteCount, lastMuteAt);
    }

    @Override
    public String toString() {
        return "OffenseRecord{muteCount=" + muteCount + ", lastMuteAt=" + lastMuteAt + '}';
    }
}
