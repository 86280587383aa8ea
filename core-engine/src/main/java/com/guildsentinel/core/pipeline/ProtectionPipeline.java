package com.guildsentinel.core.pipeline;

import com.guildsentinel.core.action.ActionExecutor;
import com.guildsentinel.core.action.ApiEndpoint;
import com.guildsentinel.core.action.EndpointBreaker;
import com.guildsentinel.core.action.ModerationApi;
import com.guildsentinel.core.action.RetryPolicy;
import com.guildsentinel.core.audit.AuditLog;
import com.guildsentinel.core.config.GuildConfigRegistry;
import com.guildsentinel.core.config.ProtectionConfig;
import com.guildsentinel.core.config.SensitivityConfig;
import com.guildsentinel.core.decision.DecisionEngine;
import com.guildsentinel.core.decision.EscalationPolicy;
import com.guildsentinel.core.decision.OffenseStore;
import com.guildsentinel.core.detection.EvaluatorFactory;
import com.guildsentinel.core.model.ActionOutcome;
import com.guildsentinel.core.model.AuditLogEntry;
import com.guildsentinel.core.model.CallResult;
import com.guildsentinel.core.model.Decision;
import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.model.PartitionKey;
import com.guildsentinel.core.model.RuleDefinition;
import com.guildsentinel.core.window.Fingerprinter;
import com.guildsentinel.core.window.PartitionFailureException;
import com.guildsentinel.core.window.WindowSnapshot;
import com.guildsentinel.core.window.WindowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process protection pipeline.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   submit(event)
 *     → worker chosen by (guild, user) hash, bounded queue
 *     → retraction / quarantine / exemption checks
 *     → WindowStore.record
 *     → DecisionEngine.decide
 *     → ActionExecutor.execute (async, retries on the scheduler)
 *     → AuditLog.append
 *     → future completes with a ProcessingResult
 * </pre>
 *
 * <h3>Ordering</h3>
 * <p>
 * All events of one (guild, user) partition land on the same worker, so the
 * window and offense updates for a partition happen in submission order.
 * Different partitions run concurrently on different workers. Action
 * execution and auditing continue off the worker thread, so a slow or
 * rate-limited API never stalls intake.
 * </p>
 *
 * <h3>Backpressure</h3>
 * <p>
 * Each worker owns a fixed-capacity queue. A full queue drops the event,
 * counts it as {@code queue_full} and completes its future as
 * {@link ProcessingResult.Status#DROPPED}; {@link #submit} never blocks.
 * </p>
 *
 * @since 1.0.0
 */
public class ProtectionPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProtectionPipeline.class);

    private final GuildConfigRegistry configs;
    private final WindowStore windows;
    private final OffenseStore offenses;
    private final DecisionEngine engine;
    private final ActionExecutor executor;
    private final AuditLog auditLog;
    private final ProtectionMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final boolean recordSignalOnly;
    private final Duration sweepInterval;
    private final Duration retractionTtl;

    private final Worker[] workers;
    private final Map<String, Instant> retracted = new ConcurrentHashMap<>();
    private final Set<PartitionKey> quarantined = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ProtectionPipeline(Builder b) {
        this.configs = Objects.requireNonNull(b.configs, "configs must not be null");
        this.windows = Objects.requireNonNull(b.windows, "windows must not be null");
        this.offenses = Objects.requireNonNull(b.offenses, "offenses must not be null");
        this.engine = Objects.requireNonNull(b.engine, "engine must not be null");
        this.executor = Objects.requireNonNull(b.executor, "executor must not be null");
        this.auditLog = Objects.requireNonNull(b.auditLog, "auditLog must not be null");
        this.metrics = b.metrics != null ? b.metrics : ProtectionMetrics.simple();
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler must not be null");
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.recordSignalOnly = b.recordSignalOnly;
        this.sweepInterval = b.sweepInterval;
        this.retractionTtl = b.retractionTtl != null ? b.retractionTtl : windows.getMaxAge();
        if (b.workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got: " + b.workers);
        }
        if (b.queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1, got: " + b.queueCapacity);
        }
        this.workers = new Worker[b.workers];
        for (int i = 0; i < workers.length; i++) {
            workers[i] = new Worker(i, b.queueCapacity);
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the worker threads and the idle-state sweep.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (Worker worker : workers) {
            worker.start();
        }
        if (sweepInterval != null && !sweepInterval.isZero()) {
            scheduler.scheduleAtFixedRate(this::sweepSafely, sweepInterval.toMillis(), sweepInterval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
        LOG.info("Protection pipeline started with {} worker(s)", workers.length);
    }

    /**
     * Stop intake and the workers. Queued events that never started are
     * completed as dropped; in-flight actions may still finish on the
     * scheduler until it is shut down.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        for (Worker worker : workers) {
            worker.interrupt();
        }
        for (Worker worker : workers) {
            try {
                worker.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            worker.drain();
        }
        LOG.info("Protection pipeline stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Intake
    // ---------------------------------------------------------------

    /**
     * Queue an event on its partition's worker.
     *
     * @param event inbound message
     * @return future result; completes exceptionally only when the audit
     *         entry could not be written
     * @throws IllegalStateException if the pipeline is not running
     */
    public CompletableFuture<ProcessingResult> submit(MessageEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!running.get()) {
            throw new IllegalStateException("Pipeline is not running");
        }
        Task task = new Task(event);
        Worker worker = workers[Math.floorMod(event.partitionKey().hashCode(), workers.length)];
        if (!worker.queue.offer(task)) {
            metrics.incrementDropped(ProtectionMetrics.REASON_QUEUE_FULL);
            LOG.warn("Worker {} queue full, dropping message {} from {}", worker.index, event.getMessageId(),
                    event.partitionKey());
            task.result.complete(ProcessingResult.skipped(ProcessingResult.Status.DROPPED, "queue full"));
        } else if (!running.get() && worker.queue.remove(task)) {
            // stop() may already have drained this queue
            task.result.complete(ProcessingResult.skipped(ProcessingResult.Status.DROPPED, "shutdown"));
        }
        return task.result;
    }

    /**
     * Mark a message as deleted upstream. An event not yet started is skipped;
     * one already being evaluated runs to completion.
     */
    public void retract(String guildId, String messageId) {
        retracted.put(retractionKey(guildId, messageId), clock.instant());
    }

    /**
     * Lift the quarantine of a partition and discard its window.
     */
    public void resetPartition(PartitionKey key) {
        windows.clear(key);
        if (quarantined.remove(key)) {
            LOG.info("Partition {} reset by operator", key);
        }
    }

    public boolean isQuarantined(PartitionKey key) {
        return quarantined.contains(key);
    }

    /** Events waiting across all worker queues. */
    public int queueDepth() {
        int depth = 0;
        for (Worker worker : workers) {
            depth += worker.queue.size();
        }
        return depth;
    }

    /**
     * Evict idle windows, expired offense records and stale retraction markers.
     */
    public void sweep() {
        Instant now = clock.instant();
        int windowsRemoved = windows.evictExpired(now);
        int offensesRemoved = offenses.evictExpired(now, engine.getEscalationPolicy());
        Instant cutoff = now.minus(retractionTtl);
        retracted.values().removeIf(at -> at.isBefore(cutoff));
        LOG.debug("Sweep removed {} window(s) and {} offense record(s)", windowsRemoved, offensesRemoved);
    }

    public GuildConfigRegistry getConfigs() {
        return configs;
    }

    public ActionExecutor getExecutor() {
        return executor;
    }

    public AuditLog getAuditLog() {
        return auditLog;
    }

    public ProtectionMetrics getMetrics() {
        return metrics;
    }

    // ---------------------------------------------------------------
    // Processing (worker thread)
    // ---------------------------------------------------------------

    private void process(Task task) {
        MessageEvent event = task.event;
        PartitionKey key = event.partitionKey();

        if (retracted.remove(retractionKey(event.getGuildId(), event.getMessageId())) != null) {
            metrics.incrementDropped(ProtectionMetrics.REASON_RETRACTED);
            task.result.complete(ProcessingResult.skipped(ProcessingResult.Status.RETRACTED, "message deleted"));
            return;
        }
        if (quarantined.contains(key)) {
            metrics.incrementDropped(ProtectionMetrics.REASON_QUARANTINED);
            task.result.complete(ProcessingResult.skipped(ProcessingResult.Status.QUARANTINED,
                    "partition quarantined"));
            return;
        }

        SensitivityConfig config = configs.resolve(event.getGuildId());
        if (config.isExempt(event.getAuthorRoleIds())) {
            metrics.incrementDropped(ProtectionMetrics.REASON_EXEMPT);
            task.result.complete(ProcessingResult.skipped(ProcessingResult.Status.EXEMPT, "exempt role"));
            return;
        }

        Decision decision;
        try {
            WindowSnapshot snapshot = windows.record(event);
            decision = engine.decide(snapshot, config);
        } catch (PartitionFailureException e) {
            quarantine(key, e);
            task.result.complete(ProcessingResult.skipped(ProcessingResult.Status.FAILED, e.getMessage()));
            return;
        }
        metrics.incrementEventsProcessed();
        metrics.incrementDecision(decision.getAction());

        executor.execute(decision)
                .thenApply(outcome -> finish(decision, outcome))
                .whenComplete((result, error) -> {
                    metrics.recordLatency(Duration.ofNanos(System.nanoTime() - task.startNanos));
                    if (error != null) {
                        task.result.completeExceptionally(error);
                    } else {
                        task.result.complete(result);
                    }
                });
    }

    private ProcessingResult finish(Decision decision, ActionOutcome outcome) {
        Decision terminal = decision.withOutcome(outcome);
        if (outcome.getStatus() != ActionOutcome.Status.SKIPPED) {
            metrics.incrementActionOutcome(outcome.getStatus());
        }
        for (CallResult call : outcome.getCalls()) {
            if (call.getStatus() == CallResult.Status.REJECTED) {
                metrics.incrementCircuitRejection(call.getEndpoint());
            }
        }
        if (!shouldAudit(terminal)) {
            return ProcessingResult.processed(terminal, null);
        }
        AuditLogEntry entry = AuditLogEntry.fromDecision(terminal);
        try {
            auditLog.append(entry);
        } catch (RuntimeException e) {
            LOG.error("Audit write failed for message {} in guild {}: {}",
                    terminal.getMessageId(), terminal.getGuildId(), e.getMessage(), e);
            throw e;
        }
        return ProcessingResult.processed(terminal, entry);
    }

    private boolean shouldAudit(Decision decision) {
        if (decision.getAction().isActionable()) {
            return true;
        }
        return !recordSignalOnly || !decision.getSignals().isEmpty();
    }

    private void quarantine(PartitionKey key, PartitionFailureException e) {
        quarantined.add(key);
        windows.clear(key);
        metrics.incrementPartitionsFailed();
        LOG.error("Partition {} quarantined after internal failure: {}", key, e.getMessage(), e);
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            LOG.error("Idle-state sweep failed: {}", e.getMessage(), e);
        }
    }

    private static String retractionKey(String guildId, String messageId) {
        return guildId + '/' + messageId;
    }

    // ---------------------------------------------------------------
    // Workers
    // ---------------------------------------------------------------

    private static final class Task {
        final MessageEvent event;
        final long startNanos = System.nanoTime();
        final CompletableFuture<ProcessingResult> result = new CompletableFuture<>();

        Task(MessageEvent event) {
            this.event = event;
        }
    }

    private final class Worker extends Thread {
        final int index;
        final BlockingQueue<Task> queue;

        Worker(int index, int capacity) {
            super("protection-worker-" + index);
            this.index = index;
            this.queue = new ArrayBlockingQueue<>(capacity);
            setDaemon(true);
        }

        @Override
        public void run() {
            while (running.get()) {
                Task task;
                try {
                    task = queue.take();
                } catch (InterruptedException e) {
                    break;
                }
                try {
                    process(task);
                } catch (RuntimeException e) {
                    LOG.error("Unexpected failure processing {} on {}: {}",
                            task.event.getMessageId(), getName(), e.getMessage(), e);
                    task.result.completeExceptionally(e);
                }
            }
        }

        void drain() {
            Task task;
            while ((task = queue.poll()) != null) {
                task.result.complete(ProcessingResult.skipped(ProcessingResult.Status.DROPPED, "shutdown"));
            }
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Assemble a pipeline with every component built from a loaded
     * configuration.
     *
     * @param config    validated configuration
     * @param api       outbound moderation API
     * @param auditLog  audit sink
     * @param metrics   metrics; {@code null} for an in-memory registry
     * @param scheduler scheduler for retries and sweeps
     * @param clock     clock
     * @return builder pre-populated with all components
     */
    public static Builder fromConfig(ProtectionConfig config, ModerationApi api, AuditLog auditLog,
            ProtectionMetrics metrics, ScheduledExecutorService scheduler, Clock clock) {
        ProtectionMetrics m = metrics != null ? metrics : ProtectionMetrics.simple();
        GuildConfigRegistry registry = GuildConfigRegistry.fromConfig(config);
        m.bindConfigGaps(registry);

        ProtectionConfig.WindowSettings w = config.getWindow();
        WindowStore windows = new WindowStore(w.getMaxMessages(), w.maxAge(), new Fingerprinter());

        ProtectionConfig.EscalationSettings e = config.getEscalation();
        EscalationPolicy escalation = new EscalationPolicy(Duration.ofHours(e.getWindowHours()),
                Duration.ofMinutes(e.getCapMinutes()));
        OffenseStore offenses = new OffenseStore();
        DecisionEngine engine = new DecisionEngine(EvaluatorFactory.createAll(config.getRules()), offenses,
                escalation, clock, m, config.getRuntime().getEvaluatorBudgetMicros());

        ProtectionConfig.CircuitBreakerSettings cb = config.getCircuitBreaker();
        Map<ApiEndpoint, EndpointBreaker> breakers = ActionExecutor.breakersFor(cb.getFailureThreshold(),
                Duration.ofSeconds(cb.getCoolDownSeconds()));
        ProtectionConfig.RetrySettings r = config.getRetry();
        RetryPolicy retry = new RetryPolicy(r.getMaxAttempts(), r.getBaseDelayMillis(), r.getMaxDelayMillis(),
                r.getMultiplier(), r.isJitter());
        ActionExecutor executor = new ActionExecutor(api, breakers, retry, scheduler, clock, linkRuleName(config));

        return builder()
                .configs(registry)
                .windows(windows)
                .offenses(offenses)
                .engine(engine)
                .executor(executor)
                .auditLog(auditLog)
                .metrics(m)
                .scheduler(scheduler)
                .clock(clock)
                .workers(config.getRuntime().getWorkers())
                .queueCapacity(config.getRuntime().getQueueCapacity())
                .recordSignalOnly(config.getAudit().isRecordSignalOnly());
    }

    /**
     * Daemon scheduler sized for retry timers and the sweep.
     */
    public static ScheduledExecutorService newScheduler() {
        AtomicInteger count = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "protection-scheduler-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static String linkRuleName(ProtectionConfig config) {
        for (RuleDefinition rule : config.getRules()) {
            if ("link".equals(rule.getType())) {
                return rule.getName();
            }
        }
        return ActionExecutor.DEFAULT_LINK_RULE;
    }

    public static class Builder {
        private GuildConfigRegistry configs;
        private WindowStore windows;
        private OffenseStore offenses;
        private DecisionEngine engine;
        private ActionExecutor executor;
        private AuditLog auditLog;
        private ProtectionMetrics metrics;
        private ScheduledExecutorService scheduler;
        private Clock clock;
        private int workers = 4;
        private int queueCapacity = 1024;
        private boolean recordSignalOnly = true;
        private Duration sweepInterval = Duration.ofMinutes(1);
        private Duration retractionTtl;

        public Builder configs(GuildConfigRegistry configs) {
            this.configs = configs;
            return this;
        }

        public Builder windows(WindowStore windows) {
            this.windows = windows;
            return this;
        }

        public Builder offenses(OffenseStore offenses) {
            this.offenses = offenses;
            return this;
        }

        public Builder engine(DecisionEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder executor(ActionExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder auditLog(AuditLog auditLog) {
            this.auditLog = auditLog;
            return this;
        }

        public Builder metrics(ProtectionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder recordSignalOnly(boolean recordSignalOnly) {
            this.recordSignalOnly = recordSignalOnly;
            return this;
        }

        /** {@code null} or zero disables the periodic sweep. */
        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder retractionTtl(Duration retractionTtl) {
            this.retractionTtl = retractionTtl;
            return this;
        }

        public ProtectionPipeline build() {
            return new ProtectionPipeline(this);
        }
    }
}
