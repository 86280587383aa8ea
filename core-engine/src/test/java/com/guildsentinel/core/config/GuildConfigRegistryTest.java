package com.guildsentinel.core.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GuildConfigRegistry}.
 */
class GuildConfigRegistryTest {

    private GuildConfigRegistry registry;

    @BeforeEach
    void setUp() {
        registry = GuildConfigRegistry.fromConfig(ConfigLoader.fromClasspath("test-protection.yml"));
    }

    @Test
    @DisplayName("Should resolve configured guilds without counting a gap")
    void shouldResolveConfigured() {
        SensitivityConfig config = registry.resolve("100");

        assertThat(config.getLevel()).isEqualTo(SensitivityLevel.HIGH);
        assertThat(config.isFallback()).isFalse();
        assertThat(registry.getConfigGapCount()).isZero();
    }

    @Test
    @DisplayName("Should fall back to medium for unknown guilds and count the gap")
    void shouldFallBack() {
        SensitivityConfig config = registry.resolve("unknown");
        registry.resolve("unknown");

        assertThat(config.getLevel()).isEqualTo(SensitivityLevel.MEDIUM);
        assertThat(config.isFallback()).isTrue();
        assertThat(config.getBaseMuteDuration()).isEqualTo(Duration.ofMinutes(60));
        assertThat(registry.getConfigGapCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should apply updates to the next resolution only")
    void shouldSwapSnapshots() {
        SensitivityConfig before = registry.resolve("100");

        registry.update(before.toBuilder().level(SensitivityLevel.LOW).thresholds(null).build());

        assertThat(before.getLevel()).isEqualTo(SensitivityLevel.HIGH);
        assertThat(registry.resolve("100").getLevel()).isEqualTo(SensitivityLevel.LOW);
        assertThat(registry.resolve("100").getThresholds()).isEqualTo(SensitivityLevel.LOW.defaults());
    }

    @Test
    @DisplayName("Should replace every guild on reload")
    void shouldReload() {
        registry.update(SensitivityConfig.builder().guildId("300").build());

        registry.reload(ConfigLoader.fromClasspath("test-protection.yml"));

        assertThat(registry.guildIds()).isEqualTo(Set.of("100", "200"));
    }

    @Test
    @DisplayName("Should fall back after a guild is removed")
    void shouldRemove() {
        registry.remove("200");

        assertThat(registry.resolve("200").isFallback()).isTrue();
    }

    @Test
    @DisplayName("Should detect exempt roles")
    void shouldDetectExemptRoles() {
        SensitivityConfig config = registry.resolve("100");

        assertThat(config.isExempt(Set.of("member", "mods"))).isTrue();
        assertThat(config.isExempt(Set.of("member"))).isFalse();
        assertThat(config.isExempt(null)).isFalse();
    }
}
