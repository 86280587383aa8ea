package com.guildsentinel.bot;

import com.guildsentinel.bot.jda.JdaModerationApi;
import com.guildsentinel.bot.listener.MessageIngestListener;
import com.guildsentinel.core.audit.JsonlAuditLog;
import com.guildsentinel.core.config.ConfigLoader;
import com.guildsentinel.core.config.ProtectionConfig;
import com.guildsentinel.core.pipeline.ProtectionMetrics;
import com.guildsentinel.core.pipeline.ProtectionPipeline;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Main entry point for the Guild Sentinel bot.
 *
 * <h3>Start-up</h3>
 *
 * <pre>
 *   BotConfig (env)
 *     → ProtectionConfig (YAML)
 *     → JsonlAuditLog, replayed from disk
 *     → JDA login, await ready
 *     → ProtectionPipeline wired to the JDA moderation API
 *     → message listener, health server, config reloader
 * </pre>
 *
 * <p>
 * A shutdown hook stops intake first, then the helpers, and closes the
 * audit file last.
 * </p>
 *
 * @since 1.0.0
 */
public final class GuildSentinelBot {

    private static final Logger LOG = LoggerFactory.getLogger(GuildSentinelBot.class);

    private GuildSentinelBot() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Process settings
        BotConfig config = BotConfig.fromEnvironment();
        LOG.info("Starting Guild Sentinel with config: {}", config);

        // 2. Protection rules and guild settings
        ProtectionConfig protection = config.hasProtectionConfigPath()
                ? ConfigLoader.fromFile(config.getProtectionConfigPath())
                : ConfigLoader.load();

        // 3. Audit log
        JsonlAuditLog auditLog = new JsonlAuditLog(Paths.get(protection.getAudit().getPath()),
                protection.getAudit().getMaxEntriesPerGuild());
        auditLog.load();

        // 4. Gateway
        JDA jda = JDABuilder.createDefault(config.getDiscordToken())
                .enableIntents(List.of(
                        GatewayIntent.GUILD_MESSAGES,
                        GatewayIntent.MESSAGE_CONTENT,
                        GatewayIntent.GUILD_MEMBERS))
                .build();
        jda.awaitReady();

        // 5. Pipeline
        ScheduledExecutorService scheduler = ProtectionPipeline.newScheduler();
        ProtectionPipeline pipeline = ProtectionPipeline.fromConfig(protection, new JdaModerationApi(jda),
                auditLog, ProtectionMetrics.simple(), scheduler, Clock.systemUTC()).build();
        pipeline.start();
        jda.addEventListener(new MessageIngestListener(pipeline));

        // 6. Health endpoint and hot reload
        HealthServer healthServer = new HealthServer(pipeline);
        healthServer.start(config.getHealthPort());

        ConfigReloader reloader = null;
        if (config.hasProtectionConfigPath()) {
            reloader = new ConfigReloader(Path.of(config.getProtectionConfigPath()), pipeline.getConfigs());
            reloader.start(scheduler, config.getConfigReloadInterval());
        }

        ConfigReloader watcher = reloader;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down Guild Sentinel");
            jda.shutdown();
            pipeline.stop();
            if (watcher != null) {
                watcher.stop();
            }
            healthServer.stop();
            scheduler.shutdown();
            try {
                auditLog.close();
            } catch (IOException e) {
                LOG.error("Failed to close audit log: {}", e.getMessage(), e);
            }
        }, "guild-sentinel-shutdown"));

        LOG.info("Guild Sentinel ready in {} guild(s)", jda.getGuilds().size());
    }
}
