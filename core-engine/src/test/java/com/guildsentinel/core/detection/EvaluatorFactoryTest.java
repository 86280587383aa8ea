package com.guildsentinel.core.detection;

import com.guildsentinel.core.model.RuleDefinition;
import com.guildsentinel.core.support.TestEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EvaluatorFactory}.
 */
class EvaluatorFactoryTest {

    @Test
    @DisplayName("Should map every rule type to its evaluator")
    void shouldCreateEachType() {
        assertThat(EvaluatorFactory.create(TestEvents.rule("r", "rate"))).isInstanceOf(RateRule.class);
        assertThat(EvaluatorFactory.create(TestEvents.rule("d", "duplicate")))
                .isInstanceOf(DuplicateContentRule.class);
        assertThat(EvaluatorFactory.create(TestEvents.rule("l", "LINK"))).isInstanceOf(SuspiciousLinkRule.class);
        assertThat(EvaluatorFactory.create(TestEvents.rule("n", "new-account")))
                .isInstanceOf(NewAccountRiskRule.class);
        assertThat(EvaluatorFactory.create(TestEvents.rule("s", "spam"))).isInstanceOf(SpamContentRule.class);
    }

    @Test
    @DisplayName("Should throw for an unknown rule type")
    void shouldRejectUnknownType() {
        assertThatThrownBy(() -> EvaluatorFactory.create(TestEvents.rule("x", "telepathy")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown rule type");
    }

    @Test
    @DisplayName("Should skip disabled rules and keep configured order")
    void shouldSkipDisabled() {
        RuleDefinition disabled = TestEvents.rule("dup", "duplicate");
        disabled.setEnabled(false);

        List<RuleEvaluator> evaluators = EvaluatorFactory.createAll(
                List.of(TestEvents.rule("rate", "rate"), disabled, TestEvents.rule("link", "link")));

        assertThat(evaluators).extracting(RuleEvaluator::getRuleName).containsExactly("rate", "link");
        assertThatThrownBy(() -> evaluators.add(null)).isInstanceOf(UnsupportedOperationException.class);
    }
}
