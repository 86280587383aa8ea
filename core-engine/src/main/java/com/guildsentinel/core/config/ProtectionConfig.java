package com.guildsentinel.core.config;

import com.guildsentinel.core.model.RuleDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for {@code protection.yml}.
 *
 * <p>
 * Expected YAML structure (every section is optional and defaults as shown):
 * </p>
 *
 * <pre>
 * window:
 *   maxMessages: 50
 *   maxAgeSeconds: 600
 * rules:
 *   - name: rate
 *     type: rate
 *     windowSeconds: 10
 * escalation:
 *   baseMuteMinutes: 360
 *   windowHours: 24
 *   capMinutes: 10080
 * circuitBreaker:
 *   failureThreshold: 5
 *   coolDownSeconds: 30
 * retry:
 *   maxAttempts: 3
 *   baseDelayMillis: 1000
 *   maxDelayMillis: 32000
 *   multiplier: 2.0
 *   jitter: true
 * runtime:
 *   workers: 4
 *   queueCapacity: 1024
 *   evaluatorBudgetMicros: 1000
 * audit:
 *   path: data/audit-log.jsonl
 *   maxEntriesPerGuild: 10000
 *   recordSignalOnly: true
 * guilds:
 *   "123": { sensitivity: high }
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class ProtectionConfig {

    private WindowSettings window = new WindowSettings();
    private List<RuleDefinition> rules = new ArrayList<>();
    private EscalationSettings escalation = new EscalationSettings();
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();
    private RetrySettings retry = new RetrySettings();
    private RuntimeSettings runtime = new RuntimeSettings();
    private AuditSettings audit = new AuditSettings();
    private Map<String, GuildSettings> guilds = new LinkedHashMap<>();

    /**
     * Validate every section. Collects all errors and throws a single
     * exception if anything is invalid.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        if (window.getMaxMessages() < 1) {
            errors.add("window.maxMessages must be >= 1");
        }
        if (window.getMaxAgeSeconds() < 1) {
            errors.add("window.maxAgeSeconds must be >= 1");
        }
        if (escalation.getBaseMuteMinutes() < 1) {
            errors.add("escalation.baseMuteMinutes must be >= 1");
        }
        if (escalation.getWindowHours() < 1) {
            errors.add("escalation.windowHours must be >= 1");
        }
        if (escalation.getCapMinutes() < escalation.getBaseMuteMinutes()) {
            errors.add("escalation.capMinutes must be >= baseMuteMinutes");
        }
        if (circuitBreaker.getFailureThreshold() < 1) {
            errors.add("circuitBreaker.failureThreshold must be >= 1");
        }
        if (circuitBreaker.getCoolDownSeconds() < 1) {
            errors.add("circuitBreaker.coolDownSeconds must be >= 1");
        }
        if (retry.getMaxAttempts() < 1) {
            errors.add("retry.maxAttempts must be >= 1");
        }
        if (retry.getBaseDelayMillis() < 0 || retry.getMaxDelayMillis() < retry.getBaseDelayMillis()) {
            errors.add("retry delays must satisfy 0 <= baseDelayMillis <= maxDelayMillis");
        }
        if (retry.getMultiplier() < 1.0) {
            errors.add("retry.multiplier must be >= 1");
        }
        if (runtime.getWorkers() < 1) {
            errors.add("runtime.workers must be >= 1");
        }
        if (runtime.getQueueCapacity() < 1) {
            errors.add("runtime.queueCapacity must be >= 1");
        }
        if (audit.getPath() == null || audit.getPath().isBlank()) {
            errors.add("audit.path is required");
        }
        if (audit.getMaxEntriesPerGuild() < 1) {
            errors.add("audit.maxEntriesPerGuild must be >= 1");
        }
        for (Map.Entry<String, GuildSettings> entry : guilds.entrySet()) {
            if (entry.getValue() == null) {
                errors.add("Guild '" + entry.getKey() + "' has no settings");
            } else {
                errors.addAll(entry.getValue().validate(entry.getKey()));
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Protection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return enabled rule definitions only
     */
    public List<RuleDefinition> enabledRules() {
        return rules.stream().filter(RuleDefinition::isEnabled).toList();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public WindowSettings getWindow() {
        return window;
    }

    public void setWindow(WindowSettings window) {
        this.window = window != null ? window : new WindowSettings();
    }

    /**
     * @return unmodifiable list of rule definitions
     */
    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public EscalationSettings getEscalation() {
        return escalation;
    }

    public void setEscalation(EscalationSettings escalation) {
        this.escalation = escalation != null ? escalation : new EscalationSettings();
    }

    public CircuitBreakerSettings getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreakerSettings circuitBreaker) {
        this.circuitBreaker = circuitBreaker != null ? circuitBreaker : new CircuitBreakerSettings();
    }

    public RetrySettings getRetry() {
        return retry;
    }

    public void setRetry(RetrySettings retry) {
        this.retry = retry != null ? retry : new RetrySettings();
    }

    public RuntimeSettings getRuntime() {
        return runtime;
    }

    public void setRuntime(RuntimeSettings runtime) {
        this.runtime = runtime != null ? runtime : new RuntimeSettings();
    }

    public AuditSettings getAudit() {
        return audit;
    }

    public void setAudit(AuditSettings audit) {
        this.audit = audit != null ? audit : new AuditSettings();
    }

    public Map<String, GuildSettings> getGuilds() {
        return guilds;
    }

    public void setGuilds(Map<String, GuildSettings> guilds) {
        this.guilds = guilds != null ? new LinkedHashMap<>(guilds) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "ProtectionConfig{rules=" + rules + ", guilds=" + guilds.keySet() + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Bounds of each per-user window. */
    public static class WindowSettings {
        private int maxMessages = 50;
        private int maxAgeSeconds = 600;

        public int getMaxMessages() {
            return maxMessages;
        }

        public void setMaxMessages(int maxMessages) {
            this.maxMessages = maxMessages;
        }

        public int getMaxAgeSeconds() {
            return maxAgeSeconds;
        }

        public void setMaxAgeSeconds(int maxAgeSeconds) {
            this.maxAgeSeconds = maxAgeSeconds;
        }

        public Duration maxAge() {
            return Duration.ofSeconds(maxAgeSeconds);
        }
    }

    /** Mute escalation policy. */
    public static class EscalationSettings {
        private int baseMuteMinutes = 360;
        private int windowHours = 24;
        private int capMinutes = 10_080;

        public int getBaseMuteMinutes() {
            return baseMuteMinutes;
        }

        public void setBaseMuteMinutes(int baseMuteMinutes) {
            this.baseMuteMinutes = baseMuteMinutes;
        }

        public int getWindowHours() {
            return windowHours;
        }

        public void setWindowHours(int windowHours) {
            this.windowHours = windowHours;
        }

        public int getCapMinutes() {
            return capMinutes;
        }

        public void setCapMinutes(int capMinutes) {
            this.capMinutes = capMinutes;
        }
    }

    /** Circuit breaker shared by every call to one endpoint. */
    public static class CircuitBreakerSettings {
        private int failureThreshold = 5;
        private int coolDownSeconds = 30;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getCoolDownSeconds() {
            return coolDownSeconds;
        }

        public void setCoolDownSeconds(int coolDownSeconds) {
            this.coolDownSeconds = coolDownSeconds;
        }
    }

    /** Retry with exponential backoff. */
    public static class RetrySettings {
        private int maxAttempts = 3;
        private long baseDelayMillis = 1_000;
        private long maxDelayMillis = 32_000;
        private double multiplier = 2.0;
        private boolean jitter = true;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMillis() {
            return baseDelayMillis;
        }

        public void setBaseDelayMillis(long baseDelayMillis) {
            this.baseDelayMillis = baseDelayMillis;
        }

        public long getMaxDelayMillis() {
            return maxDelayMillis;
        }

        public void setMaxDelayMillis(long maxDelayMillis) {
            this.maxDelayMillis = maxDelayMillis;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    /** Worker pool sizing. */
    public static class RuntimeSettings {
        private int workers = 4;
        private int queueCapacity = 1024;
        private long evaluatorBudgetMicros = 1_000;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public long getEvaluatorBudgetMicros() {
            return evaluatorBudgetMicros;
        }

        public void setEvaluatorBudgetMicros(long evaluatorBudgetMicros) {
            this.evaluatorBudgetMicros = evaluatorBudgetMicros;
        }
    }

    /** Audit log file and in-memory index. */
    public static class AuditSettings {
        private String path = "data/audit-log.jsonl";
        private int maxEntriesPerGuild = 10_000;
        private boolean recordSignalOnly = true;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getMaxEntriesPerGuild() {
            return maxEntriesPerGuild;
        }

        public void setMaxEntriesPerGuild(int maxEntriesPerGuild) {
            this.maxEntriesPerGuild = maxEntriesPerGuild;
        }

        public boolean isRecordSignalOnly() {
            return recordSignalOnly;
        }

        public void setRecordSignalOnly(boolean recordSignalOnly) {
            this.recordSignalOnly = recordSignalOnly;
        }
    }
}
