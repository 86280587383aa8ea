package com.guildsentinel.bot;

import com.guildsentinel.core.config.GuildConfigRegistry;
import com.guildsentinel.core.config.SensitivityLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfigReloader}.
 */
class ConfigReloaderTest {

    @TempDir
    Path tempDir;

    private Path file;
    private GuildConfigRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        file = tempDir.resolve("protection.yml");
        write("guilds:\n  \"300\":\n    sensitivity: low\n", Instant.parse("2024-05-01T00:00:00Z"));
        registry = new GuildConfigRegistry(Duration.ofHours(6));
    }

    @Test
    @DisplayName("Should do nothing while the file is unchanged")
    void shouldIgnoreUnchangedFile() {
        ConfigReloader reloader = new ConfigReloader(file, registry);

        assertThat(reloader.checkNow()).isFalse();
        assertThat(registry.guildIds()).isEmpty();
    }

    @Test
    @DisplayName("Should apply new guild settings when the file changes")
    void shouldReloadChangedFile() throws Exception {
        ConfigReloader reloader = new ConfigReloader(file, registry);

        write("guilds:\n  \"300\":\n    sensitivity: high\n  \"301\": {}\n", Instant.parse("2024-05-01T00:01:00Z"));

        assertThat(reloader.checkNow()).isTrue();
        assertThat(registry.guildIds()).containsExactlyInAnyOrder("300", "301");
        assertThat(registry.resolve("300").getLevel()).isEqualTo(SensitivityLevel.HIGH);
        assertThat(reloader.checkNow()).isFalse();
    }

    @Test
    @DisplayName("Should keep the previous settings when the new file is invalid")
    void shouldKeepSettingsOnInvalidFile() throws Exception {
        ConfigReloader reloader = new ConfigReloader(file, registry);
        write("guilds:\n  \"300\":\n    sensitivity: high\n", Instant.parse("2024-05-01T00:01:00Z"));
        reloader.checkNow();

        write("guilds:\n  \"300\":\n    sensitivity: extreme\n", Instant.parse("2024-05-01T00:02:00Z"));

        assertThat(reloader.checkNow()).isFalse();
        assertThat(registry.resolve("300").getLevel()).isEqualTo(SensitivityLevel.HIGH);
    }

    @Test
    @DisplayName("Should tolerate the file disappearing")
    void shouldTolerateMissingFile() throws Exception {
        ConfigReloader reloader = new ConfigReloader(file, registry);
        Files.delete(file);

        assertThat(reloader.checkNow()).isFalse();
    }

    private void write(String yaml, Instant modified) throws Exception {
        Files.writeString(file, yaml);
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }
}
