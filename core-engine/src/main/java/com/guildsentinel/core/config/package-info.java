/**
 * Configuration loading, validation and per-guild snapshots.
 *
 * <p>
 * {@code protection.yml} is loaded by
 * {@link com.guildsentinel.core.config.ConfigLoader} into a
 * {@link com.guildsentinel.core.config.ProtectionConfig}. Guild sections are
 * turned into immutable
 * {@link com.guildsentinel.core.config.SensitivityConfig} snapshots held by
 * {@link com.guildsentinel.core.config.GuildConfigRegistry}, which can be
 * updated at runtime without restarting the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
package com.guildsentinel.core.config;
