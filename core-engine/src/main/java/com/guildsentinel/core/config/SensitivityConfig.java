package com.guildsentinel.core.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-guild configuration snapshot.
 *
 * <p>
 * One snapshot is resolved at the start of each evaluation and used for the
 * whole message, so a concurrent update never produces a mixed view.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensitivityConfig {

    /** Base mute duration when a guild does not override it. */
    public static final Duration DEFAULT_MUTE = Duration.ofHours(6);

    private final String guildId;
    private final SensitivityLevel level;
    private final RuleThresholds thresholds;
    private final Duration baseMuteDuration;
    private final Set<String> disabledRules;
    private final Set<String> exemptRoleIds;
    private final boolean fallback;

    private SensitivityConfig(Builder b) {
        this.guildId = Objects.requireNonNull(b.guildId, "guildId must not be null");
        this.level = Objects.requireNonNull(b.level, "level must not be null");
        this.thresholds = b.thresholds != null ? b.thresholds : level.defaults();
        this.baseMuteDuration = b.baseMuteDuration != null ? b.baseMuteDuration : DEFAULT_MUTE;
        if (baseMuteDuration.isNegative() || baseMuteDuration.isZero()) {
            throw new IllegalArgumentException("baseMuteDuration must be positive, got: " + baseMuteDuration);
        }
        this.disabledRules = Collections.unmodifiableSet(new LinkedHashSet<>(b.disabledRules));
        this.exemptRoleIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.exemptRoleIds));
        this.fallback = b.fallback;
    }

    /**
     * Defaults used when a guild has no configuration at all.
     *
     * @param guildId  guild being evaluated
     * @param baseMute process-wide base mute duration
     * @return a {@code medium} snapshot flagged as fallback
     */
    public static SensitivityConfig fallback(String guildId, Duration baseMute) {
        return builder()
                .guildId(guildId)
                .level(SensitivityLevel.MEDIUM)
                .baseMuteDuration(baseMute)
                .fallback(true)
                .build();
    }

    public String getGuildId() {
        return guildId;
    }

    public SensitivityLevel getLevel() {
        return level;
    }

    public RuleThresholds getThresholds() {
        return thresholds;
    }

    public Duration getBaseMuteDuration() {
        return baseMuteDuration;
    }

    public Set<String> getDisabledRules() {
        return disabledRules;
    }

    public Set<String> getExemptRoleIds() {
        return exemptRoleIds;
    }

    /**
     * @return {@code true} if this snapshot was synthesised for an
     *         unconfigured guild
     */
    public boolean isFallback() {
        return fallback;
    }

    public boolean isRuleEnabled(String ruleName) {
        return !disabledRules.contains(ruleName);
    }

    /**
     * @param roleIds roles held by a message author
     * @return {@code true} if any of them is exempt from moderation
     */
    public boolean isExempt(Set<String> roleIds) {
        if (exemptRoleIds.isEmpty() || roleIds == null) {
            return false;
        }
        for (String roleId : roleIds) {
            if (exemptRoleIds.contains(roleId)) {
                return true;
            }
        }
        return false;
    }

    public Builder toBuilder() {
        return builder()
                .guildId(guildId)
                .level(level)
                .thresholds(thresholds)
                .baseMuteDuration(baseMuteDuration)
                .disabledRules(disabledRules)
                .exemptRoleIds(exemptRoleIds)
                .fallback(fallback);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SensitivityConfig that)) {
            return false;
        }
        return fallback == that.fallback
                && guildId.equals(that.guildId)
                && level == that.level
                && thresholds.equals(that.thresholds)
                && baseMuteDuration.equals(that.baseMuteDuration)
                && disabledRules.equals(that.disabledRules)
                && exemptRoleIds.equals(that.exemptRoleIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guildId, level, thresholds, baseMuteDuration, disabledRules, exemptRoleIds, fallback);
    }

    @Override
    public String toString() {
        return "SensitivityConfig{" +
                "guildId='" + guildId + '\'' +
                ", level=" + level.label() +
                ", thresholds=" + thresholds +
                ", baseMute=" + baseMuteDuration +
                ", disabledRules=" + disabledRules +
                ", fallback=" + fallback +
                '}';
    }

    /**
     * Fluent builder for {@link SensitivityConfig}. Thresholds default to the
     * level's preset when not set explicitly.
     */
    public static class Builder {
        private String guildId;
        private SensitivityLevel level = SensitivityLevel.MEDIUM;
        private RuleThresholds thresholds;
        private Duration baseMuteDuration;
        private Set<String> disabledRules = Set.of();
        private Set<String> exemptRoleIds = Set.of();
        private boolean fallback;

        public Builder guildId(String guildId) {
            this.guildId = guildId;
            return this;
        }

        public Builder level(SensitivityLevel level) {
            this.level = level;
            return this;
        }

        public Builder thresholds(RuleThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder baseMuteDuration(Duration baseMuteDuration) {
            this.baseMuteDuration = baseMuteDuration;
            return this;
        }

        public Builder disabledRules(Set<String> disabledRules) {
            this.disabledRules = disabledRules;
            return this;
        }

        public Builder exemptRoleIds(Set<String> exemptRoleIds) {
            this.exemptRoleIds = exemptRoleIds;
            return this;
        }

        public Builder fallback(boolean fallback) {
            this.fallback = fallback;
            return this;
        }

        public SensitivityConfig build() {
            return new SensitivityConfig(this);
        }
    }
}
