package com.guildsentinel.bot;

import com.guildsentinel.core.config.ConfigLoader;
import com.guildsentinel.core.config.GuildConfigRegistry;
import com.guildsentinel.core.config.ProtectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls the protection YAML file and hot-swaps guild settings when its
 * modification time changes.
 *
 * <p>
 * Only the {@code guilds} section takes effect without a restart; rules,
 * window bounds and runtime sizing are fixed when the pipeline is built. A
 * file that fails to load or validate is logged and ignored, and the
 * previous settings stay in force.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigReloader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigReloader.class);

    private final Path path;
    private final GuildConfigRegistry registry;
    private volatile FileTime lastModified;
    private ScheduledFuture<?> task;

    public ConfigReloader(Path path, GuildConfigRegistry registry) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.lastModified = modifiedTime();
    }

    /**
     * Check the file once.
     *
     * @return {@code true} if new guild settings were applied
     */
    public synchronized boolean checkNow() {
        FileTime current = modifiedTime();
        if (current == null || current.equals(lastModified)) {
            return false;
        }
        lastModified = current;
        try {
            ProtectionConfig config = ConfigLoader.fromFile(path.toString());
            registry.reload(config);
            LOG.info("Reloaded guild settings from {} ({} guild(s))", path, registry.guildIds().size());
            return true;
        } catch (RuntimeException e) {
            LOG.error("Ignoring invalid protection config {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Start polling on the scheduler.
     *
     * @param scheduler scheduler to run on
     * @param interval  poll interval; zero disables polling
     */
    public synchronized void start(ScheduledExecutorService scheduler, Duration interval) {
        if (interval.isZero() || task != null) {
            return;
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::checkNow, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Watching {} for changes every {}s", path, interval.getSeconds());
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    private FileTime modifiedTime() {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            LOG.warn("Cannot stat protection config {}: {}", path, e.getMessage());
            return null;
        }
    }
}
