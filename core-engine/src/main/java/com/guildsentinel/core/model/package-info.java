/**
 * Domain model shared by every stage of the moderation pipeline.
 *
 * <p>
 * {@link com.guildsentinel.core.model.MessageEvent} enters the pipeline,
 * evaluators emit {@link com.guildsentinel.core.model.RuleSignal}s, the
 * decision engine produces a {@link com.guildsentinel.core.model.Decision},
 * the executor attaches an {@link com.guildsentinel.core.model.ActionOutcome}
 * and the audit log persists an
 * {@link com.guildsentinel.core.model.AuditLogEntry}.
 * </p>
 *
 * @since 1.0.0
 */
package com.guildsentinel.core.model;
