package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityLevel;
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
 * Unit tests for {@link SpamContentRule}.
 */
class SpamContentRuleTest {

    private final SpamContentRule rule = new SpamContentRule(TestEvents.rule("spam-content", "spam"));

    @Test
    @DisplayName("Should fire for shouted keyword spam")
    void shouldDetectSpam() {
        Optional<RuleSignal> signal = evaluate("FREE MONEY!!! CLICK HERE NOW!!! WINNER");

        assertThat(signal).isPresent();
        assertThat(signal.get().getConfidence()).isEqualTo(1.0);
        assertThat(signal.get().getEvidence())
                .contains("spam keyword: free", "spam keyword: money", "6 exclamation marks");
    }

    @Test
    @DisplayName("Should NOT fire for ordinary chat")
    void shouldIgnoreOrdinaryChat() {
        assertThat(evaluate("hey, are we still on for tonight?")).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire for a single keyword")
    void shouldStayBelowThreshold() {
        assertThat(evaluate("free lunch in the break room")).isEmpty();
    }

    @Test
    @DisplayName("Should match keywords on word boundaries only")
    void shouldRespectWordBoundaries() {
        assertThat(evaluate("freedom fighters report their earnings")).isEmpty();
    }

    @Test
    @DisplayName("Should count repeated invite links and character runs")
    void shouldDetectInvitesAndRepeats() {
        Optional<RuleSignal> signal = evaluate(
                "giveaway joinnnnnn discord.gg/aaa discord.gg/bbb discord.gg/ccc");

        assertThat(signal).isPresent();
        assertThat(signal.get().getEvidence()).contains("3 invite links", "repeated characters");
    }

    private Optional<RuleSignal> evaluate(String content) {
        WindowStore store = new WindowStore(50, Duration.ofMinutes(10), new Fingerprinter());
        return rule.evaluate(store.record(TestEvents.message("u1", content, Duration.ZERO)),
                TestEvents.sensitivity(SensitivityLevel.MEDIUM));
    }
}
