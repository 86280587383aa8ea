package com.guildsentinel.core.action;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tagged result of one call to the moderation API.
 *
 * <p>
 * Retry decisions are driven from the tag, never from exceptions:
 * {@link Kind#RETRYABLE} covers rate limits (optionally carrying the
 * server's wait hint) and transient network or server errors;
 * {@link Kind#NON_RETRYABLE} covers validation and permission errors.
 * </p>
 *
 * @since 1.0.0
 */
public final class ApiResult {

    /** Result category. */
    public enum Kind {
        SUCCESS,
        RETRYABLE,
        NON_RETRYABLE
    }

    private static final ApiResult SUCCESS = new ApiResult(Kind.SUCCESS, null, null);

    private final Kind kind;
    private final String message;
    private final Duration waitHint;

    private ApiResult(Kind kind, String message, Duration waitHint) {
        this.kind = kind;
        this.message = message;
        this.waitHint = waitHint;
    }

    public static ApiResult success() {
        return SUCCESS;
    }

    public static ApiResult retryable(String message) {
        return new ApiResult(Kind.RETRYABLE, message, null);
    }

    /**
     * @param message  description
     * @param waitHint server-provided delay before the next attempt
     * @return retryable result carrying the hint
     */
    public static ApiResult rateLimited(String message, Duration waitHint) {
        return new ApiResult(Kind.RETRYABLE, message, Objects.requireNonNull(waitHint, "waitHint must not be null"));
    }

    public static ApiResult nonRetryable(String message) {
        return new ApiResult(Kind.NON_RETRYABLE, message, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }

    public String getMessage() {
        return message;
    }

    public Optional<Duration> getWaitHint() {
        return Optional.ofNullable(waitHint);
    }

    @Override
    public String toString() {
        return kind + (message != null ? "(" + message + ")" : "")
                + (waitHint != null ? " retryAfter=" + waitHint.toMillis() + "ms" : "");
    }
}
