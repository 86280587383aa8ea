/**
 * Pluggable moderation rules.
 *
 * <p>
 * All rules implement the
 * {@link com.guildsentinel.core.detection.RuleEvaluator} interface and are
 * instantiated via {@link com.guildsentinel.core.detection.EvaluatorFactory}.
 * Built-in rule types:
 * </p>
 * <ul>
 * <li>{@link com.guildsentinel.core.detection.RateRule}: message flood
 * inside a short trailing window</li>
 * <li>{@link com.guildsentinel.core.detection.DuplicateContentRule}:
 * consecutive near-duplicate messages</li>
 * <li>{@link com.guildsentinel.core.detection.SuspiciousLinkRule}: scam and
 * malware links</li>
 * <li>{@link com.guildsentinel.core.detection.NewAccountRiskRule}: multiplier
 * for young accounts</li>
 * <li>{@link com.guildsentinel.core.detection.SpamContentRule}: single-message
 * spam heuristics</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new rule type, implement {@code RuleEvaluator} and register the
 * type string in {@code EvaluatorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.guildsentinel.core.detection;
