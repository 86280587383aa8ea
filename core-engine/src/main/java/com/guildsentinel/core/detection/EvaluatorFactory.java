package com.guildsentinel.core.detection;

import com.guildsentinel.core.model.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link RuleEvaluator} instances from
 * {@link RuleDefinition} configurations.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the new type string here and create the corresponding evaluator.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluatorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluatorFactory.class);

    private EvaluatorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create an evaluator for the given rule.
     *
     * @param rule the rule definition; must not be {@code null}
     * @return an appropriate {@link RuleEvaluator} instance
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static RuleEvaluator create(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");

        return switch (rule.getType()) {
            case "rate" -> new RateRule(rule);
            case "duplicate" -> new DuplicateContentRule(rule);
            case "link" -> new SuspiciousLinkRule(rule);
            case "new-account" -> new NewAccountRiskRule(rule);
            case "spam" -> new SpamContentRule(rule);
            default -> throw new IllegalArgumentException(
                    "Unknown rule type: '" + rule.getType()
                            + "'. Supported types: rate, duplicate, link, new-account, spam");
        };
    }

    /**
     * Create evaluators for every enabled rule in the supplied list.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong> and keeps the
     * configured order.
     * </p>
     *
     * @param rules list of rule definitions; must not be {@code null}
     * @return unmodifiable list of evaluators
     * @throws NullPointerException if {@code rules} is {@code null}
     */
    public static List<RuleEvaluator> createAll(List<RuleDefinition> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        List<RuleEvaluator> evaluators = rules.stream()
                .filter(RuleDefinition::isEnabled)
                .map(EvaluatorFactory::create)
                .toList();
        LOG.info("Created {} evaluator(s) from {} rule definition(s)", evaluators.size(), rules.size());
        return Collections.unmodifiableList(evaluators);
    }
}
