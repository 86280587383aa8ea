package com.guildsentinel.core.decision;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Repeat-offense escalation for mutes.
 *
 * <p>
 * A mute within {@code window} of the previous mute continues the chain and
 * doubles the duration; otherwise the chain restarts at the base duration.
 * The window is measured from the most recent mute. Durations never exceed
 * {@code cap}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EscalationPolicy {

    private final Duration window;
    private final Duration cap;

    /**
     * @param window escalation window (default 24 hours)
     * @param cap    upper bound on any mute (default 7 days)
     */
    public EscalationPolicy(Duration window, Duration cap) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.cap = Objects.requireNonNull(cap, "cap must not be null");
        if (window.isNegative() || window.isZero() || cap.isNegative() || cap.isZero()) {
            throw new IllegalArgumentException("window and cap must be positive");
        }
    }

    public static EscalationPolicy defaults() {
        return new EscalationPolicy(Duration.ofHours(24), Duration.ofDays(7));
    }

    /**
     * Plan the next mute.
     *
     * @param prior previous record, or {@code null}
     * @param now   instant of the offending message
     * @param base  guild's base mute duration
     * @return planned escalation
     */
    public Escalation plan(OffenseRecord prior, Instant now, Duration base) {
        int level = isActive(prior, now) ? prior.getMuteCount() : 0;
        return new Escalation(level, durationFor(level, base), new OffenseRecord(level + 1, now));
    }

    /**
     * @return {@code true} if a mute at {@code now} continues the chain
     */
    public boolean isActive(OffenseRecord prior, Instant now) {
        return prior != null && Duration.between(prior.getLastMuteAt(), now).compareTo(window) < 0;
    }

    /**
     * {@code min(cap, base * 2^level)}.
     */
    public Duration durationFor(int level, Duration base) {
        Duration duration = base.compareTo(cap) > 0 ? cap : base;
        for (int i = 0; i < level && duration.compareTo(cap) < 0; i++) {
            duration = duration.multipliedBy(2);
        }
        return duration.compareTo(cap) > 0 ? cap : duration;
    }

    public Duration getWindow() {
        return window;
    }

    public Duration getCap() {
        return cap;
    }

    /**
     * Result of {@link #plan}.
     */
    public static final class Escalation {
        private final int level;
        private final Duration duration;
        private final OffenseRecord next;

        Escalation(int level, Duration duration, OffenseRecord next) {
            this.level = level;
            this.duration = duration;
            this.next = next;
        }

        /** Prior mutes in the chain; 0 for a first offense. */
        public int getLevel() {
            return level;
        }

        public Duration getDuration() {
            return duration;
        }

        /** Record to store once the mute is committed. */
        public OffenseRecord getNext() {
            return next;
        }
    }
}
