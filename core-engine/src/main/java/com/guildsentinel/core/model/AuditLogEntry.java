package com.guildsentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit record for one terminal decision.
 *
 * <p>
 * Serialized to one JSON line per entry by the audit log. {@code moderatorId}
 * is {@code null} for every entry written by the automated pipeline.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromDecision(Decision)} for pipeline output, or the
 * {@link Builder}. {@code guildId}, {@code userId}, {@code action} and
 * {@code timestamp} are required.
 * </p>
 *
 * @since 1.0.0
 */
public class AuditLogEntry {

    private String id;
    private String guildId;
    private String userId;
    private String channelId;
    private String messageId;
    private ModerationAction action;
    private List<String> triggeringRules = new ArrayList<>();
    private double confidence;
    private Long durationSeconds;
    private String moderatorId;
    private Instant decidedAt;
    private Instant timestamp;
    private String outcome;
    private int attempts;
    private String failureReason;

    /** No-arg constructor required by Jackson. */
    public AuditLogEntry() {
    }

    private AuditLogEntry(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.guildId = Objects.requireNonNull(b.guildId, "guildId must not be null");
        this.userId = Objects.requireNonNull(b.userId, "userId must not be null");
        this.action = Objects.requireNonNull(b.action, "action must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.channelId = b.channelId;
        this.messageId = b.messageId;
        this.triggeringRules = new ArrayList<>(b.triggeringRules);
        this.confidence = b.confidence;
        this.durationSeconds = b.durationSeconds;
        this.moderatorId = b.moderatorId;
        this.decidedAt = b.decidedAt;
        this.outcome = b.outcome;
        this.attempts = b.attempts;
        this.failureReason = b.failureReason;
    }

    /**
     * Build the entry for a terminal decision. The entry timestamp is the
     * instant the last outbound call completed, or the decision time when no
     * call was made.
     *
     * @param decision decision, normally carrying an outcome
     * @return new entry
     */
    public static AuditLogEntry fromDecision(Decision decision) {
        Objects.requireNonNull(decision, "decision must not be null");
        ActionOutcome result = decision.getOutcome();
        Builder builder = builder()
                .guildId(decision.getGuildId())
                .userId(decision.getUserId())
                .channelId(decision.getChannelId())
                .messageId(decision.getMessageId())
                .action(decision.getAction())
                .triggeringRules(decision.getTriggeringRules())
                .confidence(decision.getConfidence())
                .durationSeconds(decision.getDuration() != null ? decision.getDuration().getSeconds() : null)
                .decidedAt(decision.getCreatedAt());
        if (result != null) {
            builder.timestamp(result.getCompletedAt())
                    .outcome(result.getStatus().name())
                    .attempts(result.getTotalAttempts())
                    .failureReason(result.getFailureSummary());
        } else {
            builder.timestamp(decision.getCreatedAt())
                    .outcome(ActionOutcome.Status.SKIPPED.name());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getGuildId() {
        return guildId;
    }

    public void setGuildId(String guildId) {
        this.guildId = guildId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getChannelId() {
        return channelId;
    }

    public void setChannelId(String channelId) {
        this.channelId = channelId;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public ModerationAction getAction() {
        return action;
    }

    public void setAction(ModerationAction action) {
        this.action = action;
    }

    public List<String> getTriggeringRules() {
        return triggeringRules;
    }

    public void setTriggeringRules(List<String> triggeringRules) {
        this.triggeringRules = triggeringRules != null ? new ArrayList<>(triggeringRules) : new ArrayList<>();
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public Long getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Long durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public String getModeratorId() {
        return moderatorId;
    }

    public void setModeratorId(String moderatorId) {
        this.moderatorId = moderatorId;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public void setDecidedAt(Instant decidedAt) {
        this.decidedAt = decidedAt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuditLogEntry that)) {
            return false;
        }
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "AuditLogEntry{" +
                "id='" + id + '\'' +
                ", guildId='" + guildId + '\'' +
                ", userId='" + userId + '\'' +
                ", action=" + action +
                ", rules=" + triggeringRules +
                ", outcome='" + outcome + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }

    /**
     * Fluent builder for {@link AuditLogEntry}.
     */
    public static class Builder {
        private String id;
        private String guildId;
        private String userId;
        private String channelId;
        private String messageId;
        private ModerationAction action;
        private List<String> triggeringRules = List.of();
        private double confidence;
        private Long durationSeconds;
        private String moderatorId;
        private Instant decidedAt;
        private Instant timestamp;
        private String outcome;
        private int attempts;
        private String failureReason;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder guildId(String guildId) {
            this.guildId = guildId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder action(ModerationAction action) {
            this.action = action;
            return this;
        }

        public Builder triggeringRules(List<String> triggeringRules) {
            this.triggeringRules = triggeringRules;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder durationSeconds(Long durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder moderatorId(String moderatorId) {
            this.moderatorId = moderatorId;
            return this;
        }

        public Builder decidedAt(Instant decidedAt) {
            this.decidedAt = decidedAt;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        /**
         * @return the new entry
         * @throws NullPointerException if a required field is missing
         */
        public AuditLogEntry build() {
            return new AuditLogEntry(this);
        }
    }
}
