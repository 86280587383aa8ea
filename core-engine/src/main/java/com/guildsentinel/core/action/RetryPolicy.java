package com.guildsentinel.core.action;

import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * <pre>
 *   backoff(n) = min(maxDelay, baseDelay * multiplier^(n-1)) * jitter
 *   jitter     in [0.75, 1.0] when enabled, 1.0 otherwise
 *   delay(n)   = max(backoff(n), serverWaitHint)
 * </pre>
 *
 * <p>
 * {@code n} is the number of attempts already made. A server wait hint is
 * never shortened. {@link #retryConfig()} turns the policy into a
 * Resilience4j {@link RetryConfig} that retries {@link ApiResult}s tagged
 * retryable.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetryPolicy {

    static final double JITTER_FLOOR = 0.75;

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final double multiplier;
    private final boolean jitter;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis, double multiplier,
            boolean jitter) {
        this(maxAttempts, baseDelayMillis, maxDelayMillis, multiplier, jitter,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1)
     */
    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis, double multiplier,
            boolean jitter, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (baseDelayMillis < 0 || maxDelayMillis < baseDelayMillis) {
            throw new IllegalArgumentException(
                    "delays must satisfy 0 <= base <= max, got: " + baseDelayMillis + " / " + maxDelayMillis);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Computed backoff before attempt {@code attemptsMade + 1}.
     */
    public long backoffMillis(int attemptsMade) {
        double raw = baseDelayMillis * Math.pow(multiplier, Math.max(0, attemptsMade - 1));
        double capped = Math.min(maxDelayMillis, raw);
        if (jitter) {
            capped *= JITTER_FLOOR + (1.0 - JITTER_FLOOR) * random.getAsDouble();
        }
        return Math.round(capped);
    }

    /**
     * Delay before the next attempt, honouring a server wait hint.
     *
     * @param attemptsMade attempts already made
     * @param waitHint     server-provided hint, if any
     * @return delay in milliseconds
     */
    public long delayMillis(int attemptsMade, Optional<Duration> waitHint) {
        long computed = backoffMillis(attemptsMade);
        return waitHint.map(h -> Math.max(h.toMillis(), computed)).orElse(computed);
    }

    /**
     * Delay for a Resilience4j retry. A failed stage carries no wait hint.
     */
    public long intervalMillis(int attemptsMade, Either<Throwable, ApiResult> outcome) {
        Optional<Duration> hint = outcome.isRight() && outcome.get() != null
                ? outcome.get().getWaitHint()
                : Optional.empty();
        return Math.max(1L, delayMillis(attemptsMade, hint));
    }

    public RetryConfig retryConfig() {
        return retryConfig(this::intervalMillis);
    }

    /**
     * @param intervals delay function; a negative value stops retrying
     * @return config retrying retryable results up to {@code maxAttempts}
     */
    public RetryConfig retryConfig(IntervalBiFunction<ApiResult> intervals) {
        return RetryConfig.<ApiResult>custom()
                .maxAttempts(maxAttempts)
                .retryOnResult(ApiResult::isRetryable)
                .intervalBiFunction(intervals)
                .build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
