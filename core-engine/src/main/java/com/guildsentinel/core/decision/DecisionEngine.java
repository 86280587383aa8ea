package com.guildsentinel.core.decision;

import com.guildsentinel.core.config.RuleThresholds;
import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.detection.RuleEvaluator;
import com.guildsentinel.core.model.Decision;
import com.guildsentinel.core.model.DecisionStage;
import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.ModerationAction;
import com.guildsentinel.core.model.PartitionKey;
import com.guildsentinel.core.model.RuleSignal;
import com.guildsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a window snapshot into a {@link Decision}.
 *
 * <h3>Evaluation loop</h3>
 * <p>
 * Every enabled evaluator runs in configured order. An evaluator that throws
 * is treated as "no signal" and reported to the {@link EvaluatorMonitor}.
 * </p>
 *
 * <h3>Scoring</h3>
 * <pre>
 *   combined = min(1, sum(weight_i * confidence_i) * product(modifier_j))
 * </pre>
 * <p>
 * Modifiers (new-account risk) apply only when at least one detection fired,
 * and only then appear among the triggering rules. The combined score is
 * mapped through the guild's bands: at or above {@code muteBand} mutes, at or
 * above {@code warnBand} warns, anything lower takes no action.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * {@link #evaluate} has no side effects: the same snapshot, configuration and
 * offense state always produce an equal decision. {@link #decide} is
 * {@code evaluate} plus the offense-record commit for mutes. All time
 * arithmetic uses the message's receive time.
 * </p>
 *
 * @since 1.0.0
 */
public class DecisionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionEngine.class);

    private final List<RuleEvaluator> evaluators;
    private final OffenseStore offenses;
    private final EscalationPolicy escalation;
    private final Clock clock;
    private final EvaluatorMonitor monitor;
    private final long budgetNanos;

    /**
     * @param evaluators   rule evaluators in evaluation order
     * @param offenses     offense store
     * @param escalation   mute escalation policy
     * @param clock        clock used for decision timestamps
     * @param monitor      diagnostics sink
     * @param budgetMicros per-evaluator time budget; slower runs are reported
     */
    public DecisionEngine(List<RuleEvaluator> evaluators, OffenseStore offenses, EscalationPolicy escalation,
            Clock clock, EvaluatorMonitor monitor, long budgetMicros) {
        this.evaluators = List.copyOf(Objects.requireNonNull(evaluators, "evaluators must not be null"));
        this.offenses = Objects.requireNonNull(offenses, "offenses must not be null");
        this.escalation = Objects.requireNonNull(escalation, "escalation must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.monitor = monitor != null ? monitor : EvaluatorMonitor.NOOP;
        this.budgetNanos = budgetMicros * 1_000L;
    }

    /**
     * Compute the decision without committing anything.
     *
     * @param snapshot window including the message under evaluation
     * @param config   guild configuration snapshot
     * @return decision
     */
    public Decision evaluate(WindowSnapshot snapshot, SensitivityConfig config) {
        Verdict verdict = score(snapshot, config);
        if (verdict.action != ModerationAction.MUTE) {
            return build(snapshot, config, verdict, null, 0);
        }
        EscalationPolicy.Escalation plan = escalation.plan(
                offenses.peek(snapshot.getKey()), snapshot.getTakenAt(), config.getBaseMuteDuration());
        return build(snapshot, config, verdict, plan.getDuration(), plan.getLevel());
    }

    /**
     * Compute the decision and, for a mute, commit the offense record.
     *
     * @param snapshot window including the message under evaluation
     * @param config   guild configuration snapshot
     * @return decision
     */
    public Decision decide(WindowSnapshot snapshot, SensitivityConfig config) {
        Verdict verdict = score(snapshot, config);
        if (verdict.action != ModerationAction.MUTE) {
            return build(snapshot, config, verdict, null, 0);
        }
        EscalationPolicy.Escalation committed = offenses.escalate(
                snapshot.getKey(), snapshot.getTakenAt(), config.getBaseMuteDuration(), escalation);
        if (committed.getLevel() > 0) {
            LOG.info("Escalating mute for {} to {} (level {})",
                    snapshot.getKey(), committed.getDuration(), committed.getLevel());
        }
        return build(snapshot, config, verdict, committed.getDuration(), committed.getLevel());
    }

    public EscalationPolicy getEscalationPolicy() {
        return escalation;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Verdict score(WindowSnapshot snapshot, SensitivityConfig config) {
        List<RuleSignal> detections = new ArrayList<>();
        List<RuleSignal> modifiers = new ArrayList<>();
        double weighted = 0.0;

        for (RuleEvaluator evaluator : evaluators) {
            if (!config.isRuleEnabled(evaluator.getRuleName())) {
                continue;
            }
            Optional<RuleSignal> signal = runEvaluator(evaluator, snapshot, config);
            if (signal.isEmpty()) {
                continue;
            }
            RuleSignal s = signal.get();
            if (s.isModifier()) {
                modifiers.add(s);
            } else {
                detections.add(s);
                weighted += evaluator.getWeight() * s.getConfidence();
            }
        }

        if (detections.isEmpty()) {
            return new Verdict(ModerationAction.NONE, 0.0, List.of());
        }

        double multiplier = 1.0;
        for (RuleSignal modifier : modifiers) {
            multiplier *= modifier.getMultiplier();
        }
        double combined = Math.min(1.0, weighted * multiplier);

        List<RuleSignal> fired = new ArrayList<>(detections);
        fired.addAll(modifiers);
        return new Verdict(band(combined, config.getThresholds()), combined, fired);
    }

    private Optional<RuleSignal> runEvaluator(RuleEvaluator evaluator, WindowSnapshot snapshot,
            SensitivityConfig config) {
        long start = System.nanoTime();
        try {
            Optional<RuleSignal> signal = evaluator.evaluate(snapshot, config);
            return signal != null ? signal : Optional.empty();
        } catch (RuntimeException e) {
            LOG.warn("Rule [{}] failed for {}, treating as no signal: {}",
                    evaluator.getRuleName(), snapshot.getKey(), e.getMessage(), e);
            monitor.onEvaluatorError(evaluator.getRuleName(), e);
            return Optional.empty();
        } finally {
            long elapsed = System.nanoTime() - start;
            if (budgetNanos > 0 && elapsed > budgetNanos) {
                LOG.debug("Rule [{}] took {}us for {}", evaluator.getRuleName(), elapsed / 1_000, snapshot.getKey());
                monitor.onSlowEvaluator(evaluator.getRuleName(), elapsed);
            }
        }
    }

    private static ModerationAction band(double combined, RuleThresholds thresholds) {
        if (combined >= thresholds.getMuteBand()) {
            return ModerationAction.MUTE;
        }
        if (combined >= thresholds.getWarnBand()) {
            return ModerationAction.WARN;
        }
        return ModerationAction.NONE;
    }

    private Decision build(WindowSnapshot snapshot, SensitivityConfig config, Verdict verdict,
            Duration duration, int level) {
        PartitionKey key = snapshot.getKey();
        MessageEvent event = snapshot.getLatestEvent();
        Decision decision = Decision.builder()
                .guildId(key.getGuildId())
                .userId(key.getUserId())
                .channelId(event != null ? event.getChannelId() : null)
                .messageId(event != null ? event.getMessageId() : null)
                .action(verdict.action)
                .confidence(verdict.confidence)
                .duration(duration)
                .escalationLevel(level)
                .triggeringRules(verdict.signals.stream().map(RuleSignal::getRuleName).toList())
                .signals(verdict.signals)
                .sensitivity(config.getLevel().label())
                .configGap(config.isFallback())
                .stage(stageOf(verdict.action, level))
                .createdAt(now())
                .build();
        if (decision.getAction().isActionable()) {
            LOG.debug("Decision for {}: {}", key, decision);
        }
        return decision;
    }

    private static DecisionStage stageOf(ModerationAction action, int level) {
        if (!action.isActionable()) {
            return DecisionStage.EVALUATED;
        }
        return level > 0 ? DecisionStage.ESCALATED : DecisionStage.DECIDED;
    }

    private Instant now() {
        return clock.instant();
    }

    private static final class Verdict {
        final ModerationAction action;
        final double confidence;
        final List<RuleSignal> signals;

        Verdict(ModerationAction action, double confidence, List<RuleSignal> signals) {
            this.action = action;
            this.confidence = confidence;
            this.signals = signals;
        }
    }
}
