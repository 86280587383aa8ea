package com.guildsentinel.core.action;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound moderation calls against the chat platform.
 *
 * <p>
 * Implementations report failures through {@link ApiResult}. A future that
 * completes exceptionally is treated as a retryable transient failure.
 * </p>
 */
public interface ModerationApi {

    /**
     * Time the user out.
     *
     * @param guildId  guild
     * @param userId   user to mute
     * @param duration mute length
     * @param reason   audit reason shown on the platform
     * @return future result
     */
    CompletableFuture<ApiResult> mute(String guildId, String userId, Duration duration, String reason);

    /**
     * Delete a single message.
     *
     * @return future result
     */
    CompletableFuture<ApiResult> deleteMessage(String guildId, String channelId, String messageId);

    /**
     * Notify the user that their message was flagged.
     *
     * @return future result
     */
    CompletableFuture<ApiResult> warn(String guildId, String userId, String reason);
}
