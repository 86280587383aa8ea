package com.guildsentinel.core.decision;

/**
 * Receives diagnostics from the engine's evaluation loop.
 */
public interface EvaluatorMonitor {

    EvaluatorMonitor NOOP = new EvaluatorMonitor() {
    };

    /**
     * An evaluator threw; its result was treated as "no signal".
     */
    default void onEvaluatorError(String ruleName, RuntimeException error) {
    }

    /**
     * An evaluator exceeded the per-rule time budget.
     */
    default void onSlowEvaluator(String ruleName, long elapsedNanos) {
    }
}
