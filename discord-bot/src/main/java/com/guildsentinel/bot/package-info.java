/**
 * Deployable Discord bot for Guild Sentinel.
 *
 * <p>
 * This package wires the core protection pipeline to the Discord gateway:
 * guild messages go in through JDA, moderation actions go out through JDA
 * REST calls.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.guildsentinel.bot.GuildSentinelBot} - main entry point</li>
 * <li>{@link com.guildsentinel.bot.BotConfig} - environment-driven
 * configuration</li>
 * <li>{@link com.guildsentinel.bot.ConfigReloader} - hot reload of guild
 * settings</li>
 * <li>{@link com.guildsentinel.bot.HealthServer} - HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.guildsentinel.bot;
