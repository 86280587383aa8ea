package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.model.RuleDefinition;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flood detection.
 *
 * <p>
 * Counts the user's messages inside a short trailing window (10 seconds by
 * default) ending at the newest message. The rule fires once the count
 * reaches the guild's rate threshold. Confidence starts at 0.75 at the
 * threshold and grows linearly, reaching 1.0 at twice the threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class RateRule implements RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RateRule.class);

    static final double BASE_CONFIDENCE = 0.75;

    private final String ruleName;
    private final double weight;
    private final Duration window;

    /**
     * @param rule the rule definition
     * @throws IllegalArgumentException if {@code windowSeconds} is invalid
     */
    public RateRule(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.weight = rule.getWeight();
        if (rule.getWindowSeconds() <= 0) {
            throw new IllegalArgumentException(
                    "windowSeconds must be > 0 for rule '" + ruleName + "', got: " + rule.getWindowSeconds());
        }
        this.window = Duration.ofSeconds(rule.getWindowSeconds());
    }

    @Override
    public Optional<RuleSignal> evaluate(WindowSnapshot snapshot, SensitivityConfig config) {
        int threshold = config.getThresholds().getRateThreshold();
        int count = snapshot.countWithin(window);
        if (count < threshold) {
            return Optional.empty();
        }

        double confidence = Math.min(1.0,
                BASE_CONFIDENCE + (1.0 - BASE_CONFIDENCE) * (count - threshold) / threshold);
        LOG.debug("Rule [{}] fired for {}: {} messages in {}s (threshold {})",
                ruleName, snapshot.getKey(), count, window.getSeconds(), threshold);
        return Optional.of(RuleSignal.detection(ruleName, confidence, List.of(String.format(
                "%d messages in %d seconds (threshold: %d)", count, window.getSeconds(), threshold))));
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public double getWeight() {
        return weight;
    }
}
