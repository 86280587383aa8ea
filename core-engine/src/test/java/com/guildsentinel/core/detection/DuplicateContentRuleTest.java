package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityLevel;
import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.support.TestEvents;
import com.guildsentinel.core.window.Fingerprinter;
import com.guildsentinel.core.window.WindowSnapshot;
import com.guildsentinel.core.window.WindowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DuplicateContentRule}.
 */
class DuplicateContentRuleTest {

    private DuplicateContentRule rule;
    private WindowStore store;

    @BeforeEach
    void setUp() {
        rule = new DuplicateContentRule(TestEvents.rule("duplicate-content", "duplicate"));
        store = new WindowStore(50, Duration.ofMinutes(10), new Fingerprinter());
    }

    @Test
    @DisplayName("Should fire for two identical messages under medium sensitivity")
    void shouldFireForPairUnderMedium() {
        WindowSnapshot snapshot = send("buy cheap gold now", "buy cheap gold now");

        Optional<RuleSignal> signal = rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM));

        assertThat(signal).isPresent();
        assertThat(signal.get().getConfidence()).isCloseTo(0.85, within(1e-9));
    }

    @Test
    @DisplayName("Should fire for near duplicates at or above the similarity threshold")
    void shouldFireForNearDuplicates() {
        WindowSnapshot snapshot = send("join my server for prizes", "join my server for prizes!!1");

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM))).isPresent();
    }

    @Test
    @DisplayName("Should NOT fire for dissimilar messages")
    void shouldNotFireBelowThreshold() {
        WindowSnapshot snapshot = send("good morning everyone", "anyone up for a match later?");

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM))).isEmpty();
    }

    @Test
    @DisplayName("Should require three consecutive copies under low sensitivity")
    void shouldRequireLongerRunUnderLow() {
        assertThat(rule.evaluate(send("spam spam spam", "spam spam spam"),
                TestEvents.sensitivity(SensitivityLevel.LOW))).isEmpty();

        store = new WindowStore(50, Duration.ofMinutes(10), new Fingerprinter());
        assertThat(rule.evaluate(send("spam spam spam", "spam spam spam", "spam spam spam"),
                TestEvents.sensitivity(SensitivityLevel.LOW))).isPresent();
    }

    @Test
    @DisplayName("Should stop the run at the first dissimilar message")
    void shouldRequireConsecutiveRun() {
        WindowSnapshot snapshot = send("promo code abc123", "the weather is lovely today", "promo code abc123");

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM))).isEmpty();
    }

    @Test
    @DisplayName("Should report the most recent pair when similarities tie")
    void shouldPreferMostRecentPairOnTie() {
        List<MessageEvent> events = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            events.add(TestEvents.message("u1", "free nitro here", Duration.ofSeconds(i)));
        }
        WindowSnapshot snapshot = null;
        for (MessageEvent event : events) {
            snapshot = store.record(event);
        }

        RuleSignal signal = rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM)).orElseThrow();

        assertThat(signal.getEvidence().get(0)).startsWith(
                "messages " + events.get(1).getMessageId() + " and " + events.get(2).getMessageId());
    }

    @Test
    @DisplayName("Should raise confidence for longer runs")
    void shouldRaiseConfidenceForLongRuns() {
        WindowSnapshot snapshot = send("same", "same", "same", "same", "same");

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.MEDIUM)).get().getConfidence())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should ignore messages with no textual content")
    void shouldIgnoreEmptyFingerprints() {
        WindowSnapshot snapshot = send("", "");

        assertThat(rule.evaluate(snapshot, TestEvents.sensitivity(SensitivityLevel.HIGH))).isEmpty();
    }

    private WindowSnapshot send(String... contents) {
        WindowSnapshot snapshot = null;
        for (int i = 0; i < contents.length; i++) {
            snapshot = store.record(TestEvents.message("u1", contents[i], Duration.ofSeconds(i)));
        }
        return snapshot;
    }
}
