package com.guildsentinel.core.decision;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EscalationPolicy}.
 */
class EscalationPolicyTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final Duration BASE = Duration.ofHours(6);

    private final EscalationPolicy policy = EscalationPolicy.defaults();

    @Test
    @DisplayName("Should use the base duration for a first offense")
    void shouldUseBaseForFirstOffense() {
        EscalationPolicy.Escalation plan = policy.plan(null, T0, BASE);

        assertThat(plan.getLevel()).isZero();
        assertThat(plan.getDuration()).isEqualTo(BASE);
        assertThat(plan.getNext()).isEqualTo(new OffenseRecord(1, T0));
    }

    @Test
    @DisplayName("Should double within the window, measured from the most recent mute")
    void shouldDoubleWithinWindow() {
        EscalationPolicy.Escalation second = policy.plan(new OffenseRecord(1, T0), T0.plus(Duration.ofHours(23)), BASE);
        EscalationPolicy.Escalation third = policy.plan(second.getNext(), T0.plus(Duration.ofHours(46)), BASE);

        assertThat(second.getDuration()).isEqualTo(Duration.ofHours(12));
        assertThat(third.getDuration()).isEqualTo(Duration.ofHours(24));
        assertThat(third.getNext().getMuteCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reset once the window has elapsed")
    void shouldResetAfterWindow() {
        EscalationPolicy.Escalation plan = policy.plan(new OffenseRecord(3, T0), T0.plus(Duration.ofHours(24)), BASE);

        assertThat(plan.getLevel()).isZero();
        assertThat(plan.getDuration()).isEqualTo(BASE);
    }

    @Test
    @DisplayName("Should never exceed the cap")
    void shouldCap() {
        assertThat(policy.durationFor(5, BASE)).isEqualTo(Duration.ofDays(7));
        assertThat(policy.durationFor(40, BASE)).isEqualTo(Duration.ofDays(7));
        assertThat(policy.durationFor(0, Duration.ofDays(30))).isEqualTo(Duration.ofDays(7));
    }

    @Test
    @DisplayName("Should produce non-decreasing durations across a chain")
    void shouldBeMonotonic() {
        OffenseRecord record = null;
        Duration previous = Duration.ZERO;
        for (int i = 0; i < 10; i++) {
            EscalationPolicy.Escalation plan = policy.plan(record, T0.plus(Duration.ofHours(i)), BASE);
            assertThat(plan.getDuration()).isGreaterThanOrEqualTo(previous);
            previous = plan.getDuration();
            record = plan.getNext();
        }
        assertThat(previous).isEqualTo(Duration.ofDays(7));
    }
}
