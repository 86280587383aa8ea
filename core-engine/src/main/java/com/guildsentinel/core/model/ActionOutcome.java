package com.guildsentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Aggregated result of executing every call planned for one decision.
 *
 * @since 1.0.0
 */
public final class ActionOutcome {

    /** Overall status of the call sequence. */
    public enum Status {
        /** Nothing to execute. */
        SKIPPED,
        SUCCEEDED,
        /** The primary call succeeded but an auxiliary one (e.g. delete) failed. */
        PARTIAL,
        FAILED
    }

    private final Status status;
    private final List<CallResult> calls;
    private final Instant completedAt;

    private ActionOutcome(Status status, List<CallResult> calls, Instant completedAt) {
        this.status = status;
        this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
        this.completedAt = Objects.requireNonNull(completedAt, "completedAt must not be null");
    }

    public static ActionOutcome skipped(Instant at) {
        return new ActionOutcome(Status.SKIPPED, List.of(), at);
    }

    /**
     * Summarise a finished call sequence. The last call is the primary one.
     *
     * @param calls       results in execution order; must not be empty
     * @param completedAt instant the last call completed
     * @return aggregated outcome
     */
    public static ActionOutcome of(List<CallResult> calls, Instant completedAt) {
        if (calls.isEmpty()) {
            return skipped(completedAt);
        }
        boolean primaryOk = calls.get(calls.size() - 1).isSuccess();
        boolean allOk = calls.stream().allMatch(CallResult::isSuccess);
        Status status;
        if (allOk) {
            status = Status.SUCCEEDED;
        } else if (primaryOk) {
            status = Status.PARTIAL;
        } else {
            status = Status.FAILED;
        }
        return new ActionOutcome(status, calls, completedAt);
    }

    public Status getStatus() {
        return status;
    }

    public List<CallResult> getCalls() {
        return calls;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * @return total number of API attempts across all calls
     */
    public int getTotalAttempts() {
        return calls.stream().mapToInt(CallResult::getAttempts).sum();
    }

    /**
     * @return joined failure reasons of failed calls, or {@code null}
     */
    public String getFailureSummary() {
        String summary = calls.stream()
                .filter(c -> !c.isSuccess())
                .map(c -> c.getEndpoint() + ": " + c.getFailureReason())
                .collect(Collectors.joining("; "));
        return summary.isEmpty() ? null : summary;
    }

    @Override
    public String toString() {
        return "ActionOutcome{status=" + status + ", calls=" + calls + ", completedAt=" + completedAt + '}';
    }
}
