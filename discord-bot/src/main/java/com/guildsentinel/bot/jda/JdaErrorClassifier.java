package com.guildsentinel.bot.jda;

import com.guildsentinel.core.action.ApiResult;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.RateLimitedException;
import net.dv8tion.jda.api.requests.ErrorResponse;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps JDA request failures to {@link ApiResult}s.
 *
 * <ul>
 * <li>rate limits are retryable and carry the server's retry-after</li>
 * <li>Discord 5xx responses and network errors are retryable</li>
 * <li>every other Discord error response (missing permissions, unknown
 * member or message, closed DMs) is permanent</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JdaErrorClassifier {

    private JdaErrorClassifier() {
        // utility class, not instantiable
    }

    public static ApiResult classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RateLimitedException rate) {
            return ApiResult.rateLimited("rate limited on " + rate.getRateLimitedRoute(),
                    Duration.ofMillis(Math.max(0, rate.getRetryAfter())));
        }
        if (cause instanceof ErrorResponseException response) {
            return classify(response.getErrorResponse(), response.isServerError(),
                    response.getErrorCode() + " " + response.getMeaning());
        }
        if (cause instanceof IOException) {
            return ApiResult.retryable("network error: " + describe(cause));
        }
        if (cause instanceof CancellationException) {
            return ApiResult.retryable("request cancelled");
        }
        return ApiResult.retryable(describe(cause));
    }

    static ApiResult classify(ErrorResponse response, boolean serverError, String message) {
        if (serverError || response == ErrorResponse.SERVER_ERROR) {
            return ApiResult.retryable(message);
        }
        return ApiResult.nonRetryable(message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + (error.getMessage() != null ? ": " + error.getMessage() : "");
    }
}
