/**
 * Audit trail of moderation decisions.
 *
 * <p>
 * {@link com.guildsentinel.core.audit.JsonlAuditLog} is the durable
 * implementation: JSON lines via Jackson, fsync per append, replay on start.
 * </p>
 *
 * @since 1.0.0
 */
package com.guildsentinel.core.audit;
