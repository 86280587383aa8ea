package com.guildsentinel.core.detection;

import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.window.WindowSnapshot;

import java.util.Optional;

/**
 * Contract for all moderation rules.
 * <p>
 * Evaluators are <strong>stateless</strong>: everything they need arrives in
 * the snapshot and the guild's configuration, so one instance is shared by
 * every worker and every partition.
 * </p>
 * <p>
 * Implementations must not throw on malformed input; they return
 * {@link Optional#empty()} instead.
 * </p>
 */
public interface RuleEvaluator {

    /**
     * Evaluate the newest message of a window.
     *
     * @param snapshot window including the message under evaluation
     * @param config   the guild's configuration snapshot
     * @return a signal if the rule fires, empty otherwise
     */
    Optional<RuleSignal> evaluate(WindowSnapshot snapshot, SensitivityConfig config);

    /**
     * Return the unique name of the rule this evaluator enforces.
     *
     * @return rule name
     */
    String getRuleName();

    /**
     * @return weight of this rule's confidence in the combined score
     */
    double getWeight();
}
