package com.guildsentinel.core.action;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Circuit breaker guarding one API endpoint, backed by a Resilience4j
 * {@link CircuitBreaker}.
 *
 * <pre>
 *   CLOSED    --(failureThreshold consecutive failures)--&gt; OPEN
 *   OPEN      --(coolDown elapsed, next permission)-------&gt; HALF_OPEN
 *   HALF_OPEN --(trial success)--&gt; CLOSED
 *   HALF_OPEN --(trial failure)--&gt; OPEN
 * </pre>
 *
 * <p>
 * A count-based window of {@code failureThreshold} calls with a 100% failure
 * rate threshold opens the circuit after exactly that many consecutive
 * transient failures. {@code HALF_OPEN} admits a single trial call.
 * </p>
 *
 * <p>
 * Each granted {@link Permit} remembers the state generation it was issued
 * in; every state transition starts a new generation. A result reported on a
 * permit from an earlier generation is dropped, so a slow call that started
 * while the circuit was closed can neither close the circuit nor free the
 * trial slot while a trial is in flight.
 * </p>
 *
 * @since 1.0.0
 */
public class EndpointBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointBreaker.class);

    private final String name;
    private final CircuitBreaker delegate;
    private final AtomicLong generation = new AtomicLong();
    private final LongAdder rejected = new LongAdder();

    /**
     * @param name             endpoint name used in logs
     * @param failureThreshold consecutive failures that open the circuit
     * @param coolDown         time spent open before a trial call
     */
    public EndpointBreaker(String name, int failureThreshold, Duration coolDown) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        Objects.requireNonNull(coolDown, "coolDown must not be null");
        if (coolDown.toMillis() < 1) {
            throw new IllegalArgumentException("coolDown must be at least 1ms, got: " + coolDown);
        }
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(coolDown)
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordExceptions(TransientFailure.class)
                .ignoreExceptions(PermanentFailure.class)
                .build();
        this.delegate = CircuitBreaker.of(name, config);
        this.delegate.getEventPublisher().onStateTransition(event -> {
            generation.incrementAndGet();
            if (event.getStateTransition().getToState() == CircuitBreaker.State.OPEN) {
                LOG.warn("Circuit [{}] {}, cooling down for {}s", name, event.getStateTransition(),
                        coolDown.toSeconds());
            } else {
                LOG.info("Circuit [{}] {}", name, event.getStateTransition());
            }
        });
    }

    /**
     * Ask for permission to make one call. A granted permit must be completed
     * exactly once through {@link Permit#record(ApiResult)}.
     *
     * @return the permit, or empty when the call is short-circuited
     */
    public synchronized Optional<Permit> tryAcquire() {
        if (!delegate.tryAcquirePermission()) {
            rejected.increment();
            return Optional.empty();
        }
        return Optional.of(new Permit(generation.get(), delegate.getCurrentTimestamp()));
    }

    private synchronized void complete(Permit permit, ApiResult result) {
        if (permit.issuedIn != generation.get()) {
            LOG.debug("Circuit [{}] dropping {} from an earlier state", name, result.getKind());
            return;
        }
        long duration = delegate.getCurrentTimestamp() - permit.startedAt;
        TimeUnit unit = delegate.getTimestampUnit();
        switch (result.getKind()) {
            case SUCCESS -> delegate.onSuccess(duration, unit);
            case RETRYABLE -> delegate.onError(duration, unit, new TransientFailure(result.getMessage()));
            default -> delegate.onError(duration, unit, new PermanentFailure(result.getMessage()));
        }
    }

    public CircuitState getState() {
        return switch (delegate.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    /**
     * @return transient failures in the current window
     */
    public int getFailedCalls() {
        return delegate.getMetrics().getNumberOfFailedCalls();
    }

    /**
     * @return number of calls short-circuited so far
     */
    public long getRejectedCount() {
        return rejected.sum();
    }

    public String getName() {
        return name;
    }

    /**
     * Permission for one call, tied to the state it was granted in.
     */
    public final class Permit {

        private final long issuedIn;
        private final long startedAt;
        private boolean recorded;

        private Permit(long issuedIn, long startedAt) {
            this.issuedIn = issuedIn;
            this.startedAt = startedAt;
        }

        /**
         * Report the call's result. Transient failures count towards opening
         * the circuit; non-retryable results only release the permit.
         * Repeated calls are ignored.
         */
        public void record(ApiResult result) {
            Objects.requireNonNull(result, "result must not be null");
            synchronized (EndpointBreaker.this) {
                if (recorded) {
                    return;
                }
                recorded = true;
            }
            complete(this, result);
        }
    }

    /** Counted towards the failure rate. */
    static final class TransientFailure extends RuntimeException {
        TransientFailure(String message) {
            super(message, null, false, false);
        }
    }

    /** Ignored by the failure rate; only releases the permit. */
    static final class PermanentFailure extends RuntimeException {
        PermanentFailure(String message) {
            super(message, null, false, false);
        }
    }
}
