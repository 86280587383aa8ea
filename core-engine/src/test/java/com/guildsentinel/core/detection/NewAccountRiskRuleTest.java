package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityLevel;
import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.support.TestEvents;
import com.guildsentinel.core.window.Fingerprinter;
import com.guildsentinel.core.window.WindowStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NewAccountRiskRule}.
 */
class NewAccountRiskRuleTest {

    private final NewAccountRiskRule rule = new NewAccountRiskRule(
            TestEvents.rule("new-account-risk", "new-account"));

    @Test
    @DisplayName("Should emit a modifier for accounts younger than seven days")
    void shouldFlagYoungAccount() {
        MessageEvent event = TestEvents.builder("u1", "hi", TestEvents.T0)
                .accountCreatedAt(TestEvents.T0.minus(Duration.ofDays(2)))
                .build();

        Optional<RuleSignal> signal = evaluate(event);

        assertThat(signal).isPresent();
        assertThat(signal.get().isModifier()).isTrue();
        assertThat(signal.get().getMultiplier()).isEqualTo(1.5);
        assertThat(signal.get().getEvidence()).anyMatch(e -> e.startsWith("account age 2d"));
    }

    @Test
    @DisplayName("Should emit a modifier for members who joined minutes ago")
    void shouldFlagRecentJoin() {
        MessageEvent event = TestEvents.builder("u1", "hi", TestEvents.T0)
                .joinedAt(TestEvents.T0.minus(Duration.ofMinutes(3)))
                .build();

        assertThat(evaluate(event)).isPresent();
    }

    @Test
    @DisplayName("Should NOT apply to established members")
    void shouldIgnoreEstablished() {
        assertThat(evaluate(TestEvents.message("u1", "hi", Duration.ZERO))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT apply when ages are unknown")
    void shouldIgnoreUnknownAges() {
        MessageEvent event = TestEvents.builder("u1", "hi", TestEvents.T0)
                .accountCreatedAt(null)
                .joinedAt(null)
                .build();

        assertThat(evaluate(event)).isEmpty();
    }

    private Optional<RuleSignal> evaluate(MessageEvent event) {
        WindowStore store = new WindowStore(50, Duration.ofMinutes(10), new Fingerprinter());
        return rule.evaluate(store.record(event), TestEvents.sensitivity(SensitivityLevel.MEDIUM));
    }
}
