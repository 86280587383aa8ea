package com.guildsentinel.bot;

import java.time.Duration;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable process settings for the Guild Sentinel bot.
 *
 * <p>
 * Values are resolved from environment variables with defaults. Everything
 * that describes moderation behaviour lives in the protection YAML file; this
 * object only carries what the process needs to connect and to find that
 * file.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code DISCORD_TOKEN} - bot token, required</li>
 * <li>{@code PROTECTION_CONFIG_PATH} - YAML file; blank means the bundled
 * {@code protection.yml}</li>
 * <li>{@code HEALTH_PORT} - health endpoint port, default 8080</li>
 * <li>{@code CONFIG_RELOAD_SECONDS} - how often the YAML file is checked for
 * changes, default 30; 0 disables reloading</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class BotConfig {

    public static final String ENV_TOKEN = "DISCORD_TOKEN";
    public static final String ENV_CONFIG_PATH = "PROTECTION_CONFIG_PATH";
    public static final String ENV_HEALTH_PORT = "HEALTH_PORT";
    public static final String ENV_RELOAD_SECONDS = "CONFIG_RELOAD_SECONDS";

    private final String discordToken;
    private final String protectionConfigPath;
    private final int healthPort;
    private final long configReloadSeconds;

    private BotConfig(Builder b) {
        this.discordToken = b.discordToken;
        this.protectionConfigPath = b.protectionConfigPath;
        this.healthPort = b.healthPort;
        this.configReloadSeconds = b.configReloadSeconds;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link BotConfig} from environment variables.
     *
     * @return validated configuration
     * @throws IllegalStateException    if the token is missing or a number
     *                                  cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static BotConfig fromEnvironment() {
        return fromLookup(System::getenv);
    }

    static BotConfig fromLookup(UnaryOperator<String> lookup) {
        String token = value(lookup, ENV_TOKEN, null);
        if (token == null) {
            throw new IllegalStateException(ENV_TOKEN + " must be set");
        }
        try {
            return new Builder()
                    .discordToken(token)
                    .protectionConfigPath(value(lookup, ENV_CONFIG_PATH, ""))
                    .healthPort(Integer.parseInt(value(lookup, ENV_HEALTH_PORT, "8080")))
                    .configReloadSeconds(Long.parseLong(value(lookup, ENV_RELOAD_SECONDS, "30")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDiscordToken() {
        return discordToken;
    }

    public String getProtectionConfigPath() {
        return protectionConfigPath;
    }

    public boolean hasProtectionConfigPath() {
        return !protectionConfigPath.isBlank();
    }

    public int getHealthPort() {
        return healthPort;
    }

    /**
     * @return reload interval, or {@link Duration#ZERO} when disabled
     */
    public Duration getConfigReloadInterval() {
        return Duration.ofSeconds(configReloadSeconds);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String discordToken;
        private String protectionConfigPath = "";
        private int healthPort = 8080;
        private long configReloadSeconds = 30;

        public Builder discordToken(String v) {
            this.discordToken = v;
            return this;
        }

        public Builder protectionConfigPath(String v) {
            this.protectionConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder configReloadSeconds(long v) {
            this.configReloadSeconds = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link BotConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public BotConfig build() {
            if (discordToken == null || discordToken.isBlank()) {
                throw new IllegalArgumentException("discordToken must not be null or blank");
            }
            if (protectionConfigPath == null) {
                protectionConfigPath = "";
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException("healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (configReloadSeconds < 0) {
                throw new IllegalArgumentException(
                        "configReloadSeconds must be >= 0, got: " + configReloadSeconds);
            }
            return new BotConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(UnaryOperator<String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "BotConfig{" +
                "discordToken='****'" +
                ", protectionConfigPath='" + protectionConfigPath + '\'' +
                ", healthPort=" + healthPort +
                ", configReloadSeconds=" + configReloadSeconds +
                '}';
    }
}
