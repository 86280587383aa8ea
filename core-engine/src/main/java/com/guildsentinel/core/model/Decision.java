package com.guildsentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Verdict for one message: aggregated confidence, chosen action, mute
 * duration and the rules that produced it.
 *
 * <p>
 * Immutable. The action outcome is attached with {@link #withOutcome} once the
 * executor has finished, yielding a new instance at stage
 * {@link DecisionStage#TERMINAL}.
 * </p>
 *
 * <p>
 * Equality covers the verdict only; {@code createdAt}, {@code stage} and the
 * attached outcome are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class Decision {

    private final String guildId;
    private final String userId;
    private final String channelId;
    private final String messageId;
    private final ModerationAction action;
    private final double confidence;
    private final Duration duration;
    private final int escalationLevel;
    private final List<String> triggeringRules;
    private final List<RuleSignal> signals;
    private final String sensitivity;
    private final boolean configGap;
    private final DecisionStage stage;
    private final Instant createdAt;
    private final ActionOutcome outcome;

    private Decision(Builder b) {
        this.guildId = Objects.requireNonNull(b.guildId, "guildId must not be null");
        this.userId = Objects.requireNonNull(b.userId, "userId must not be null");
        this.channelId = b.channelId;
        this.messageId = b.messageId;
        this.action = Objects.requireNonNull(b.action, "action must not be null");
        this.confidence = b.confidence;
        this.duration = b.duration;
        this.escalationLevel = b.escalationLevel;
        this.triggeringRules = Collections.unmodifiableList(new ArrayList<>(b.triggeringRules));
        this.signals = Collections.unmodifiableList(new ArrayList<>(b.signals));
        this.sensitivity = b.sensitivity;
        this.configGap = b.configGap;
        this.stage = Objects.requireNonNull(b.stage, "stage must not be null");
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.outcome = b.outcome;
    }

    /**
     * Attach the executor's final outcome.
     *
     * @param outcome final outcome; must not be {@code null}
     * @return a terminal copy of this decision
     */
    public Decision withOutcome(ActionOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        return toBuilder().outcome(outcome).stage(DecisionStage.TERMINAL).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .guildId(guildId)
                .userId(userId)
                .channelId(channelId)
                .messageId(messageId)
                .action(action)
                .confidence(confidence)
                .duration(duration)
                .escalationLevel(escalationLevel)
                .triggeringRules(triggeringRules)
                .signals(signals)
                .sensitivity(sensitivity)
                .configGap(configGap)
                .stage(stage)
                .createdAt(createdAt)
                .outcome(outcome);
    }

    public String getGuildId() {
        return guildId;
    }

    public String getUserId() {
        return userId;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getMessageId() {
        return messageId;
    }

    public ModerationAction getAction() {
        return action;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * @return mute duration, or {@code null} unless the action is
     *         {@link ModerationAction#MUTE}
     */
    public Duration getDuration() {
        return duration;
    }

    /**
     * @return number of prior mutes inside the escalation window (0 = first)
     */
    public int getEscalationLevel() {
        return escalationLevel;
    }

    public boolean isEscalated() {
        return escalationLevel > 0;
    }

    public List<String> getTriggeringRules() {
        return triggeringRules;
    }

    public List<RuleSignal> getSignals() {
        return signals;
    }

    public String getSensitivity() {
        return sensitivity;
    }

    /**
     * @return {@code true} if the guild had no configuration and defaults
     *         were used
     */
    public boolean isConfigGap() {
        return configGap;
    }

    public DecisionStage getStage() {
        return stage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return executor outcome, or {@code null} before execution
     */
    public ActionOutcome getOutcome() {
        return outcome;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Decision that)) {
            return false;
        }
        return Double.compare(confidence, that.confidence) == 0
                && escalationLevel == that.escalationLevel
                && configGap == that.configGap
                && guildId.equals(that.guildId)
                && userId.equals(that.userId)
                && Objects.equals(channelId, that.channelId)
                && Objects.equals(messageId, that.messageId)
                && action == that.action
                && Objects.equals(duration, that.duration)
                && triggeringRules.equals(that.triggeringRules)
                && signals.equals(that.signals)
                && Objects.equals(sensitivity, that.sensitivity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guildId, userId, channelId, messageId, action, confidence,
                duration, escalationLevel, triggeringRules, signals, sensitivity, configGap);
    }

    @Override
    public String toString() {
        return "Decision{" +
                "guildId='" + guildId + '\'' +
                ", userId='" + userId + '\'' +
                ", messageId='" + messageId + '\'' +
                ", action=" + action +
                ", confidence=" + String.format("%.3f", confidence) +
                ", duration=" + duration +
                ", escalationLevel=" + escalationLevel +
                ", triggeringRules=" + triggeringRules +
                ", stage=" + stage +
                '}';
    }

    /**
     * Fluent builder for {@link Decision}.
     */
    public static class Builder {
        private String guildId;
        private String userId;
        private String channelId;
        private String messageId;
        private ModerationAction action = ModerationAction.NONE;
        private double confidence;
        private Duration duration;
        private int escalationLevel;
        private List<String> triggeringRules = List.of();
        private List<RuleSignal> signals = List.of();
        private String sensitivity;
        private boolean configGap;
        private DecisionStage stage = DecisionStage.DECIDED;
        private Instant createdAt;
        private ActionOutcome outcome;

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

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder escalationLevel(int escalationLevel) {
            this.escalationLevel = escalationLevel;
            return this;
        }

        public Builder triggeringRules(List<String> triggeringRules) {
            this.triggeringRules = triggeringRules;
            return this;
        }

        public Builder signals(List<RuleSignal> signals) {
            this.signals = signals;
            return this;
        }

        public Builder sensitivity(String sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder configGap(boolean configGap) {
            this.configGap = configGap;
            return this;
        }

        public Builder stage(DecisionStage stage) {
            this.stage = stage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder outcome(ActionOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Decision build() {
            return new Decision(this);
        }
    }
}
