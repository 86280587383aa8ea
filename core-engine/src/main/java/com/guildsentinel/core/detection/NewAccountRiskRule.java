package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.RuleDefinition;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * New-account risk modifier.
 *
 * <p>
 * Emits a {@link RuleSignal.Kind#MODIFIER} when the author's account is
 * younger than {@code accountAgeDays} or joined the guild less than
 * {@code joinAgeMinutes} ago. The decision engine multiplies the combined
 * confidence of the other rules by {@code multiplier}; on its own this rule
 * never produces an action.
 * </p>
 *
 * @since 1.0.0
 */
public class NewAccountRiskRule implements RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(NewAccountRiskRule.class);

    private final String ruleName;
    private final double weight;
    private final Duration maxAccountAge;
    private final Duration maxJoinAge;
    private final double multiplier;

    public NewAccountRiskRule(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.weight = rule.getWeight();
        this.maxAccountAge = Duration.ofDays(rule.getAccountAgeDays());
        this.maxJoinAge = Duration.ofMinutes(rule.getJoinAgeMinutes());
        this.multiplier = rule.getMultiplier();
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                    "multiplier must be >= 1 for rule '" + ruleName + "', got: " + multiplier);
        }
    }

    @Override
    public Optional<RuleSignal> evaluate(WindowSnapshot snapshot, SensitivityConfig config) {
        MessageEvent event = snapshot.getLatestEvent();
        if (event == null) {
            return Optional.empty();
        }
        Instant now = event.getReceivedAt();
        List<String> evidence = new ArrayList<>();

        Instant created = event.getAccountCreatedAt();
        if (created != null) {
            Duration age = Duration.between(created, now);
            if (age.compareTo(maxAccountAge) < 0) {
                evidence.add(String.format("account age %dd %dh (limit: %dd)",
                        age.toDays(), age.toHoursPart(), maxAccountAge.toDays()));
            }
        }
        Instant joined = event.getJoinedAt();
        if (joined != null) {
            Duration sinceJoin = Duration.between(joined, now);
            if (sinceJoin.compareTo(maxJoinAge) < 0) {
                evidence.add(String.format("joined %d minute(s) ago (limit: %d)",
                        sinceJoin.toMinutes(), maxJoinAge.toMinutes()));
            }
        }

        if (evidence.isEmpty()) {
            return Optional.empty();
        }
        LOG.debug("Rule [{}] applies to {}: {}", ruleName, snapshot.getKey(), evidence);
        return Optional.of(RuleSignal.modifier(ruleName, multiplier, evidence));
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
