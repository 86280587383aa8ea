package com.guildsentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single moderation rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code rate} - message count inside a short trailing window</li>
 * <li>{@code duplicate} - near-duplicate content across recent messages</li>
 * <li>{@code link} - denylisted or scam-looking links</li>
 * <li>{@code new-account} - risk multiplier for young accounts and fresh
 * joins</li>
 * <li>{@code spam} - single-message spam heuristics</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared rule type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    /** Unique rule name used in decisions, audit entries and metrics. */
    private String name;

    /** Rule type: "rate", "duplicate", "link", "new-account" or "spam". */
    private String type;

    private boolean enabled = true;

    /** Contribution of this rule's confidence to the weighted sum. */
    private double weight = 1.0;

    // --- Rate fields ---
    private int windowSeconds = 10;

    // --- Duplicate fields ---
    /** Number of previous messages compared against the newest one. */
    private int lookback = 10;

    // --- Link fields ---
    private List<String> denylistDomains = new ArrayList<>();
    private List<String> denylistPatterns = new ArrayList<>();
    private List<String> scamKeywords = new ArrayList<>(List.of(
            "nitro", "free", "gift", "giveaway", "steam", "airdrop", "claim"));
    private List<String> shortenerDomains = new ArrayList<>(List.of(
            "bit.ly", "tinyurl.com", "t.co", "goo.gl", "is.gd", "cutt.ly", "rb.gy", "short.link"));
    private List<String> allowlistDomains = new ArrayList<>(List.of(
            "discord.com", "discord.gg", "github.com", "youtube.com", "wikipedia.org", "google.com",
            "steampowered.com", "steamcommunity.com"));

    // --- New-account fields ---
    private int accountAgeDays = 7;
    private int joinAgeMinutes = 10;
    private double multiplier = 1.5;

    // --- Spam fields ---
    private List<String> spamKeywords = new ArrayList<>(List.of(
            "free", "money", "prize", "winner", "click here", "limited offer",
            "buy now", "discount", "crypto", "giveaway", "earn", "investment"));
    private double scoreThreshold = 0.5;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        }
        if (weight < 0) {
            errors.add("Rule '" + name + "' requires 'weight' >= 0");
        }

        if (type != null) {
            switch (type) {
                case "rate" -> {
                    if (windowSeconds <= 0) {
                        errors.add("Rate rule '" + name + "' requires 'windowSeconds' > 0");
                    }
                }
                case "duplicate" -> {
                    if (lookback < 1) {
                        errors.add("Duplicate rule '" + name + "' requires 'lookback' >= 1");
                    }
                }
                case "link" -> {
                    for (String pattern : denylistPatterns) {
                        if (pattern == null || pattern.isBlank()) {
                            errors.add("Link rule '" + name + "' has a blank denylist pattern");
                        }
                    }
                }
                case "new-account" -> {
                    if (accountAgeDays < 0 || joinAgeMinutes < 0) {
                        errors.add("New-account rule '" + name + "' requires non-negative age limits");
                    }
                    if (multiplier < 1.0) {
                        errors.add("New-account rule '" + name + "' requires 'multiplier' >= 1");
                    }
                }
                case "spam" -> {
                    if (scoreThreshold <= 0 || scoreThreshold > 1) {
                        errors.add("Spam rule '" + name + "' requires 'scoreThreshold' in (0, 1]");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: rate, duplicate, link, new-account, spam");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid RuleDefinition: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getLookback() {
        return lookback;
    }

    public void setLookback(int lookback) {
        this.lookback = lookback;
    }

    public List<String> getDenylistDomains() {
        return denylistDomains;
    }

    public void setDenylistDomains(List<String> denylistDomains) {
        this.denylistDomains = denylistDomains != null ? new ArrayList<>(denylistDomains) : new ArrayList<>();
    }

    public List<String> getDenylistPatterns() {
        return denylistPatterns;
    }

    public void setDenylistPatterns(List<String> denylistPatterns) {
        this.denylistPatterns = denylistPatterns != null ? new ArrayList<>(denylistPatterns) : new ArrayList<>();
    }

    public List<String> getScamKeywords() {
        return scamKeywords;
    }

    public void setScamKeywords(List<String> scamKeywords) {
        this.scamKeywords = scamKeywords != null ? new ArrayList<>(scamKeywords) : new ArrayList<>();
    }

    public List<String> getShortenerDomains() {
        return shortenerDomains;
    }

    public void setShortenerDomains(List<String> shortenerDomains) {
        this.shortenerDomains = shortenerDomains != null ? new ArrayList<>(shortenerDomains) : new ArrayList<>();
    }

    public List<String> getAllowlistDomains() {
        return allowlistDomains;
    }

    public void setAllowlistDomains(List<String> allowlistDomains) {
        this.allowlistDomains = allowlistDomains != null ? new ArrayList<>(allowlistDomains) : new ArrayList<>();
    }

    public int getAccountAgeDays() {
        return accountAgeDays;
    }

    public void setAccountAgeDays(int accountAgeDays) {
        this.accountAgeDays = accountAgeDays;
    }

    public int getJoinAgeMinutes() {
        return joinAgeMinutes;
    }

    public void setJoinAgeMinutes(int joinAgeMinutes) {
        this.joinAgeMinutes = joinAgeMinutes;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }

    public List<String> getSpamKeywords() {
        return spamKeywords;
    }

    public void setSpamKeywords(List<String> spamKeywords) {
        this.spamKeywords = spamKeywords != null ? new ArrayList<>(spamKeywords) : new ArrayList<>();
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    public void setScoreThreshold(double scoreThreshold) {
        this.scoreThreshold = scoreThreshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", enabled=" + enabled +
                ", weight=" + weight +
                '}';
    }
}
