package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.config.SensitivityLevel;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.support.TestEvents;
import com.guildsentinel.core.window.Fingerprinter;
import com.guildsentinel.core.window.WindowSnapshot;
import com.guildsentinel.core.window.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RateRule}.
 */
class RateRuleTest {

    private RateRule rule;
    private WindowStore store;

    @BeforeEach
    void setUp() {
        rule = new RateRule(TestEvents.rule("rate", "rate"));
        store = new WindowStore(50, Duration.ofMinutes(10), new Fingerprinter());
    }

    @Test
    @DisplayName("Should NOT fire below the medium threshold")
    void shouldNotFireBelowThreshold() {
        WindowSnapshot snapshot = burst(4, Duration.ofSeconds(1));

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM))).isEmpty();
    }

    @Test
    @DisplayName("Should fire with base confidence exactly at the threshold")
    void shouldFireAtThreshold() {
        WindowSnapshot snapshot = burst(5, Duration.ofSeconds(1));

        Optional<RuleSignal> signal = rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM));

        assertThat(signal).isPresent();
        assertThat(signal.get().getConfidence()).isCloseTo(0.75, within(1e-9));
        assertThat(signal.get().getEvidence()).containsExactly("5 messages in 10 seconds (threshold: 5)");
    }

    @Test
    @DisplayName("Should scale confidence with the excess and cap it at 1")
    void shouldScaleConfidence() {
        SensitivityConfig medium = TestEvents.sensitivity(SensitivityLevel.MEDIUM);

        assertThat(rule.evaluate(burst(7, Duration.ofMillis(500)), medium).get().getConfidence())
                .isCloseTo(0.85, within(1e-9));
    }

    @Test
    @DisplayName("Should cap confidence at 1 for large bursts")
    void shouldCapConfidence() {
        WindowSnapshot snapshot = burst(15, Duration.ofMillis(300));

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM)).get().getConfidence())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should use the sensitivity-specific threshold")
    void shouldUseSensitivityThreshold() {
        WindowSnapshot three = burst(3, Duration.ofSeconds(2));

        assertThat(rule.evaluate(three, TestEvents.sensitivity(SensitivityLevel.HIGH))).isPresent();
        assertThat(rule.evaluate(three, TestEvents.sensitivity(SensitivityLevel.LOW))).isEmpty();
    }

    @Test
    @DisplayName("Should only count messages in the trailing window")
    void shouldIgnoreOldMessages() {
        for (int i = 0; i < 4; i++) {
            store.record(TestEvents.message("u1", "old " + i, Duration.ofSeconds(i)));
        }
        WindowSnapshot snapshot = store.record(TestEvents.message("u1", "late", Duration.ofSeconds(30)));

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM))).isEmpty();
    }

    private WindowSnapshot burst(int count, Duration spacing) {
        WindowSnapshot snapshot = null;
        for (int i = 0; i < count; i++) {
            snapshot = store.record(TestEvents.message("u1", "message number " + i, spacing.multipliedBy(i)));
        }
        return snapshot;
    }
}
