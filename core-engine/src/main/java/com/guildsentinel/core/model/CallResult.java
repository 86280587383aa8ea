package com.guildsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Final result of one outbound moderation call after retries.
 *
 * @since 1.0.0
 */
public final class CallResult {

    /** Terminal status of one call. */
    public enum Status {
        SUCCEEDED,
        /** Non-retryable failure, or retryable failure with attempts exhausted. */
        FAILED,
        /** Short-circuited by an open circuit breaker. */
        REJECTED
    }

    private final String endpoint;
    private final Status status;
    private final int attempts;
    private final String failureReason;
    private final List<Long> backoffMillis;

    public CallResult(String endpoint, Status status, int attempts, String failureReason, List<Long> backoffMillis) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.attempts = attempts;
        this.failureReason = failureReason;
        this.backoffMillis = Collections.unmodifiableList(new ArrayList<>(backoffMillis));
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getFailureReason() {
        return failureReason;
    }

    /**
     * @return delay waited before each retry, in order
     */
    public List<Long> getBackoffMillis() {
        return backoffMillis;
    }

    @Override
    public String toString() {
        return endpoint + ":" + status + "(attempts=" + attempts
                + (failureReason != null ? ", reason=" + failureReason : "") + ")";
    }
}
