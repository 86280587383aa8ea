package com.guildsentinel.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * YAML view of one guild's settings under the {@code guilds} section.
 *
 * <pre>
 * guilds:
 *   "123456789":
 *     sensitivity: high
 *     muteMinutes: 120
 *     disabledRules: [spam-content]
 *     exemptRoleIds: ["42"]
 *     rateThreshold: 4
 * </pre>
 *
 * @since 1.0.0
 */
public class GuildSettings {

    private String sensitivity = "medium";
    private Integer muteMinutes;
    private List<String> disabledRules = new ArrayList<>();
    private List<String> exemptRoleIds = new ArrayList<>();

    // Threshold overrides; null keeps the level preset
    private Integer rateThreshold;
    private Double duplicateSimilarity;
    private Integer duplicateRun;
    private Double warnBand;
    private Double muteBand;

    /**
     * Convert to an immutable snapshot.
     *
     * @param guildId     guild the settings belong to
     * @param defaultMute base mute used when {@code muteMinutes} is not set
     * @return snapshot
     * @throws IllegalArgumentException if a value is out of range
     */
    public SensitivityConfig toSensitivityConfig(String guildId, Duration defaultMute) {
        SensitivityLevel level = SensitivityLevel.parse(sensitivity);
        RuleThresholds thresholds = level.defaults()
                .override(rateThreshold, duplicateSimilarity, duplicateRun, warnBand, muteBand);
        return SensitivityConfig.builder()
                .guildId(guildId)
                .level(level)
                .thresholds(thresholds)
                .baseMuteDuration(muteMinutes != null ? Duration.ofMinutes(muteMinutes) : defaultMute)
                .disabledRules(new LinkedHashSet<>(disabledRules))
                .exemptRoleIds(new LinkedHashSet<>(exemptRoleIds))
                .build();
    }

    /**
     * @param guildId guild id used in error messages
     * @return list of problems, empty when valid
     */
    public List<String> validate(String guildId) {
        List<String> errors = new ArrayList<>();
        try {
            toSensitivityConfig(guildId, SensitivityConfig.DEFAULT_MUTE);
        } catch (IllegalArgumentException e) {
            errors.add("Guild '" + guildId + "': " + e.getMessage());
        }
        if (muteMinutes != null && muteMinutes <= 0) {
            errors.add("Guild '" + guildId + "' requires 'muteMinutes' > 0");
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(String sensitivity) {
        this.sensitivity = sensitivity;
    }

    public Integer getMuteMinutes() {
        return muteMinutes;
    }

    public void setMuteMinutes(Integer muteMinutes) {
        this.muteMinutes = muteMinutes;
    }

    public List<String> getDisabledRules() {
        return disabledRules;
    }

    public void setDisabledRules(List<String> disabledRules) {
        this.disabledRules = disabledRules != null ? new ArrayList<>(disabledRules) : new ArrayList<>();
    }

    public List<String> getExemptRoleIds() {
        return exemptRoleIds;
    }

    public void setExemptRoleIds(List<String> exemptRoleIds) {
        this.exemptRoleIds = exemptRoleIds != null ? new ArrayList<>(exemptRoleIds) : new ArrayList<>();
    }

    public Integer getRateThreshold() {
        return rateThreshold;
    }

    public void setRateThreshold(Integer rateThreshold) {
        this.rateThreshold = rateThreshold;
    }

    public Double getDuplicateSimilarity() {
        return duplicateSimilarity;
    }

    public void setDuplicateSimilarity(Double duplicateSimilarity) {
        this.duplicateSimilarity = duplicateSimilarity;
    }

    public Integer getDuplicateRun() {
        return duplicateRun;
    }

    public void setDuplicateRun(Integer duplicateRun) {
        this.duplicateRun = duplicateRun;
    }

    public Double getWarnBand() {
        return warnBand;
    }

    public void setWarnBand(Double warnBand) {
        this.warnBand = warnBand;
    }

    public Double getMuteBand() {
        return muteBand;
    }

    public void setMuteBand(Double muteBand) {
        this.muteBand = muteBand;
    }
}
