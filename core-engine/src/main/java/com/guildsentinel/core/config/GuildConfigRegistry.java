package com.guildsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the current {@link SensitivityConfig} snapshot of every guild.
 *
 * <p>
 * Reads are lock-free. {@link #update} swaps one guild's snapshot,
 * {@link #reload} swaps the whole table; evaluations already holding a
 * snapshot keep using it, the next message sees the new one.
 * </p>
 *
 * <p>
 * A guild without configuration resolves to {@code medium} defaults. Every
 * such lookup increments {@link #getConfigGapCount()}; the warning is logged
 * once per guild.
 * </p>
 *
 * @since 1.0.0
 */
public class GuildConfigRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(GuildConfigRegistry.class);

    private volatile Map<String, SensitivityConfig> guilds = Map.of();
    private volatile Duration defaultMute;
    private final Set<String> reportedGaps = ConcurrentHashMap.newKeySet();
    private final AtomicLong configGaps = new AtomicLong();

    public GuildConfigRegistry(Duration defaultMute) {
        this.defaultMute = Objects.requireNonNull(defaultMute, "defaultMute must not be null");
    }

    /**
     * Build a registry populated from a loaded configuration.
     *
     * @param config validated configuration
     * @return populated registry
     */
    public static GuildConfigRegistry fromConfig(ProtectionConfig config) {
        GuildConfigRegistry registry = new GuildConfigRegistry(
                Duration.ofMinutes(config.getEscalation().getBaseMuteMinutes()));
        registry.reload(config);
        return registry;
    }

    /**
     * Resolve the snapshot to use for one evaluation.
     *
     * @param guildId guild of the message
     * @return configured snapshot, or a {@code medium} fallback
     */
    public SensitivityConfig resolve(String guildId) {
        SensitivityConfig config = guilds.get(guildId);
        if (config != null) {
            return config;
        }
        configGaps.incrementAndGet();
        if (reportedGaps.add(guildId)) {
            LOG.warn("No protection config for guild {}, falling back to medium sensitivity", guildId);
        }
        return SensitivityConfig.fallback(guildId, defaultMute);
    }

    /**
     * Replace one guild's snapshot.
     *
     * @param config new snapshot; must not be {@code null}
     */
    public synchronized void update(SensitivityConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Map<String, SensitivityConfig> next = new HashMap<>(guilds);
        next.put(config.getGuildId(), config);
        guilds = Collections.unmodifiableMap(next);
        reportedGaps.remove(config.getGuildId());
        LOG.info("Updated protection config for guild {}: {}", config.getGuildId(), config);
    }

    /**
     * Remove a guild; subsequent lookups fall back to defaults.
     *
     * @param guildId guild to remove
     */
    public synchronized void remove(String guildId) {
        Map<String, SensitivityConfig> next = new HashMap<>(guilds);
        if (next.remove(guildId) != null) {
            guilds = Collections.unmodifiableMap(next);
            LOG.info("Removed protection config for guild {}", guildId);
        }
    }

    /**
     * Replace every guild with the contents of a freshly loaded file.
     *
     * @param config validated configuration
     */
    public synchronized void reload(ProtectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Duration mute = Duration.ofMinutes(config.getEscalation().getBaseMuteMinutes());
        Map<String, SensitivityConfig> next = new HashMap<>();
        for (Map.Entry<String, GuildSettings> entry : config.getGuilds().entrySet()) {
            next.put(entry.getKey(), entry.getValue().toSensitivityConfig(entry.getKey(), mute));
        }
        defaultMute = mute;
        guilds = Collections.unmodifiableMap(next);
        reportedGaps.clear();
        LOG.info("Reloaded protection config for {} guild(s)", next.size());
    }

    /**
     * @return configured guild ids
     */
    public Set<String> guildIds() {
        return guilds.keySet();
    }

    /**
     * @return number of lookups that fell back to defaults
     */
    public long getConfigGapCount() {
        return configGaps.get();
    }
}
