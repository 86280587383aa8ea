package com.guildsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of one rule evaluator for one message.
 *
 * <p>
 * A {@link Kind#DETECTION} signal carries a confidence in [0, 1] that
 * contributes to the weighted sum. A {@link Kind#MODIFIER} signal carries a
 * multiplier instead and never causes an action on its own.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleSignal {

    /** How the decision engine should combine the signal. */
    public enum Kind {
        DETECTION,
        MODIFIER
    }

    private final String ruleName;
    private final Kind kind;
    private final double confidence;
    private final double multiplier;
    private final List<String> evidence;

    private RuleSignal(String ruleName, Kind kind, double confidence, double multiplier, List<String> evidence) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName must not be null");
        this.kind = kind;
        this.confidence = clamp(confidence);
        this.multiplier = multiplier;
        this.evidence = Collections.unmodifiableList(new ArrayList<>(evidence));
    }

    /**
     * Create a detection signal.
     *
     * @param ruleName   name of the firing rule
     * @param confidence confidence, clamped to [0, 1]
     * @param evidence   human-readable evidence lines
     * @return new signal
     */
    public static RuleSignal detection(String ruleName, double confidence, List<String> evidence) {
        return new RuleSignal(ruleName, Kind.DETECTION, confidence, 1.0, evidence);
    }

    /**
     * Create a modifier signal.
     *
     * @param ruleName   name of the rule
     * @param multiplier factor applied to the combined confidence; must be
     *                   &gt;= 1
     * @param evidence   human-readable evidence lines
     * @return new signal
     */
    public static RuleSignal modifier(String ruleName, double multiplier, List<String> evidence) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        return new RuleSignal(ruleName, Kind.MODIFIER, 0.0, multiplier, evidence);
    }

    public String getRuleName() {
        return ruleName;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isModifier() {
        return kind == Kind.MODIFIER;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RuleSignal that)) {
            return false;
        }
        return Double.compare(confidence, that.confidence) == 0
                && Double.compare(multiplier, that.multiplier) == 0
                && ruleName.equals(that.ruleName)
                && kind == that.kind
                && evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, kind, confidence, multiplier, evidence);
    }

    @Override
    public String toString() {
        return "RuleSignal{" +
                "rule='" + ruleName + '\'' +
                ", kind=" + kind +
                ", confidence=" + confidence +
                ", multiplier=" + multiplier +
                ", evidence=" + evidence +
                '}';
    }
}
