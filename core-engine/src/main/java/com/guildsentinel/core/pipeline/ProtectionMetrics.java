package com.guildsentinel.core.pipeline;

import com.guildsentinel.core.config.GuildConfigRegistry;
import com.guildsentinel.core.decision.EvaluatorMonitor;
import com.guildsentinel.core.model.ActionOutcome;
import com.guildsentinel.core.model.ModerationAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for the protection pipeline.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code events_processed_total} - events that reached a decision</li>
 * <li>{@code events_dropped_total{reason}} - queue_full, retracted, quarantined, exempt</li>
 * <li>{@code evaluator_errors_total{rule}} / {@code evaluator_slow_total{rule}}</li>
 * <li>{@code config_gaps_total} - evaluations that fell back to defaults</li>
 * <li>{@code decisions_total{action}}</li>
 * <li>{@code actions_executed_total{outcome}}</li>
 * <li>{@code circuit_rejections_total{endpoint}}</li>
 * <li>{@code partitions_failed_total}</li>
 * <li>{@code processing_latency} - intake to audit, per event</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ProtectionMetrics implements EvaluatorMonitor {

    public static final String REASON_QUEUE_FULL = "queue_full";
    public static final String REASON_RETRACTED = "retracted";
    public static final String REASON_QUARANTINED = "quarantined";
    public static final String REASON_EXEMPT = "exempt";

    private final MeterRegistry registry;
    private final Counter eventsProcessed;
    private final Counter partitionsFailed;
    private final Timer processingLatency;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public ProtectionMetrics(MeterRegistry registry) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
        this.eventsProcessed = Counter.builder("events_processed_total").register(this.registry);
        this.partitionsFailed = Counter.builder("partitions_failed_total").register(this.registry);
        this.processingLatency = Timer.builder("processing_latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(this.registry);
    }

    /** In-memory registry, for tests and embedded use. */
    public static ProtectionMetrics simple() {
        return new ProtectionMetrics(new SimpleMeterRegistry());
    }

    /**
     * Expose the registry's fallback counter as {@code config_gaps_total}.
     */
    public void bindConfigGaps(GuildConfigRegistry configs) {
        FunctionCounter.builder("config_gaps_total", configs, GuildConfigRegistry::getConfigGapCount)
                .register(registry);
    }

    public void incrementEventsProcessed() {
        eventsProcessed.increment();
    }

    public void incrementDropped(String reason) {
        counter("events_dropped_total", "reason", reason).increment();
    }

    public void incrementDecision(ModerationAction action) {
        counter("decisions_total", "action", action.name()).increment();
    }

    public void incrementActionOutcome(ActionOutcome.Status status) {
        counter("actions_executed_total", "outcome", status.name()).increment();
    }

    public void incrementCircuitRejection(String endpoint) {
        counter("circuit_rejections_total", "endpoint", endpoint).increment();
    }

    public void incrementPartitionsFailed() {
        partitionsFailed.increment();
    }

    public void recordLatency(Duration elapsed) {
        processingLatency.record(elapsed);
    }

    @Override
    public void onEvaluatorError(String ruleName, RuntimeException error) {
        counter("evaluator_errors_total", "rule", ruleName).increment();
    }

    @Override
    public void onSlowEvaluator(String ruleName, long elapsedNanos) {
        counter("evaluator_slow_total", "rule", ruleName).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Current value of a tagged counter, 0 if it was never incremented.
     */
    public double count(String name, String tagKey, String tagValue) {
        Counter c = registry.find(name).tag(tagKey, safeTag(tagValue)).counter();
        return c == null ? 0.0 : c.count();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        String value = safeTag(tagValue);
        return counters.computeIfAbsent(name + "|" + value,
                k -> Counter.builder(name).tag(tagKey, value).register(registry));
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        return raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
