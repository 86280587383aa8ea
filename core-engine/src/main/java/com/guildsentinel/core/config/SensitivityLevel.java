package com.guildsentinel.core.config;

import java.util.Locale;

/**
 * Named threshold presets a guild can choose from.
 *
 * <table>
 * <caption>Default thresholds</caption>
 * <tr><th>level</th><th>rate / 10s</th><th>dup similarity</th><th>dup run</th><th>warn</th><th>mute</th></tr>
 * <tr><td>low</td><td>8</td><td>0.80</td><td>3</td><td>0.60</td><td>0.85</td></tr>
 * <tr><td>medium</td><td>5</td><td>0.70</td><td>2</td><td>0.45</td><td>0.70</td></tr>
 * <tr><td>high</td><td>3</td><td>0.60</td><td>2</td><td>0.30</td><td>0.50</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum SensitivityLevel {

    LOW(new RuleThresholds(8, 0.80, 3, 0.60, 0.85)),
    MEDIUM(new RuleThresholds(5, 0.70, 2, 0.45, 0.70)),
    HIGH(new RuleThresholds(3, 0.60, 2, 0.30, 0.50));

    private final RuleThresholds defaults;

    SensitivityLevel(RuleThresholds defaults) {
        this.defaults = defaults;
    }

    public RuleThresholds defaults() {
        return defaults;
    }

    /**
     * Parse a level name, case-insensitively.
     *
     * @param value level name
     * @return matching level
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SensitivityLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Sensitivity level must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown sensitivity level: '" + value + "'. Supported: low, medium, high", e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
