package com.guildsentinel.bot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BotConfig}.
 */
class BotConfigTest {

    @Test
    @DisplayName("Should apply defaults when only the token is set")
    void shouldApplyDefaults() {
        BotConfig config = BotConfig.fromLookup(env(Map.of("DISCORD_TOKEN", "secret")));

        assertThat(config.getDiscordToken()).isEqualTo("secret");
        assertThat(config.hasProtectionConfigPath()).isFalse();
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getConfigReloadInterval()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Should read every variable")
    void shouldReadVariables() {
        Map<String, String> vars = new HashMap<>();
        vars.put("DISCORD_TOKEN", "secret");
        vars.put("PROTECTION_CONFIG_PATH", "/etc/sentinel/protection.yml");
        vars.put("HEALTH_PORT", "9090");
        vars.put("CONFIG_RELOAD_SECONDS", "0");

        BotConfig config = BotConfig.fromLookup(env(vars));

        assertThat(config.getProtectionConfigPath()).isEqualTo("/etc/sentinel/protection.yml");
        assertThat(config.hasProtectionConfigPath()).isTrue();
        assertThat(config.getHealthPort()).isEqualTo(9090);
        assertThat(config.getConfigReloadInterval()).isZero();
    }

    @Test
    @DisplayName("Should fail fast without a token")
    void shouldRequireToken() {
        assertThatThrownBy(() -> BotConfig.fromLookup(env(Map.of("DISCORD_TOKEN", "  "))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DISCORD_TOKEN");
    }

    @Test
    @DisplayName("Should reject unparseable numbers")
    void shouldRejectBadNumbers() {
        assertThatThrownBy(() -> BotConfig.fromLookup(env(Map.of("DISCORD_TOKEN", "t", "HEALTH_PORT", "http"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Should validate ranges in the builder")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> new BotConfig.Builder().discordToken("t").healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new BotConfig.Builder().discordToken("t").configReloadSeconds(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BotConfig.Builder().build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should not print the token")
    void shouldMaskToken() {
        BotConfig config = new BotConfig.Builder().discordToken("super-secret").build();

        assertThat(config.toString()).doesNotContain("super-secret");
    }

    private static UnaryOperator<String> env(Map<String, String> vars) {
        return vars::get;
    }
}
