/**
 * Outbound moderation calls with circuit breaking and retry.
 *
 * <p>
 * {@link com.guildsentinel.core.action.ActionExecutor} turns a decision into
 * calls on a {@link com.guildsentinel.core.action.ModerationApi}. Each
 * endpoint has one process-wide
 * {@link com.guildsentinel.core.action.EndpointBreaker}; retries follow
 * {@link com.guildsentinel.core.action.RetryPolicy} and are driven by the
 * tagged {@link com.guildsentinel.core.action.ApiResult}, not by exceptions.
 * </p>
 *
 * @since 1.0.0
 */
package com.guildsentinel.core.action;
