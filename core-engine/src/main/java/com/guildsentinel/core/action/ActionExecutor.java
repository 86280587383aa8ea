package com.guildsentinel.core.action;

import com.guildsentinel.core.model.ActionOutcome;
import com.guildsentinel.core.model.CallResult;
import com.guildsentinel.core.model.Decision;
import com.guildsentinel.core.model.ModerationAction;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Executes a {@link Decision} against the {@link ModerationApi}.
 *
 * <h3>Call plans</h3>
 * <ul>
 * <li>{@code MUTE}: delete the message, then time the user out</li>
 * <li>{@code WARN}: warn the user; when the suspicious-link rule fired the
 * message is deleted first</li>
 * <li>{@code NONE}: nothing, the outcome is {@code SKIPPED}</li>
 * </ul>
 * <p>
 * Calls run in order; a failed auxiliary call does not stop the primary one.
 * </p>
 *
 * <h3>Resilience</h3>
 * <p>
 * Each call runs inside a Resilience4j {@link Retry} built from the
 * {@link RetryPolicy}, and every attempt asks its endpoint's
 * {@link EndpointBreaker} for a permit. Retryable results are retried after
 * the backoff (or the server's longer wait hint) on the scheduler, so no
 * worker thread ever sleeps. Non-retryable results and open circuits end the
 * call immediately.
 * Nothing here throws to the caller: the returned future always completes
 * normally with an {@link ActionOutcome}.
 * </p>
 *
 * @since 1.0.0
 */
public class ActionExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ActionExecutor.class);

    /** Rule name whose firing adds a delete to a warning. */
    public static final String DEFAULT_LINK_RULE = "suspicious-link";

    private final ModerationApi api;
    private final Map<ApiEndpoint, EndpointBreaker> breakers;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final String linkRuleName;

    /**
     * @param api          outbound API
     * @param breakers     one breaker per endpoint; every endpoint must be present
     * @param retryPolicy  retry policy
     * @param scheduler    scheduler for backoff delays
     * @param clock        clock for completion timestamps
     * @param linkRuleName name of the rule whose warnings also delete the message
     */
    public ActionExecutor(ModerationApi api, Map<ApiEndpoint, EndpointBreaker> breakers, RetryPolicy retryPolicy,
            ScheduledExecutorService scheduler, Clock clock, String linkRuleName) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.breakers = Collections.unmodifiableMap(new EnumMap<>(breakers));
        for (ApiEndpoint endpoint : ApiEndpoint.values()) {
            if (!this.breakers.containsKey(endpoint)) {
                throw new IllegalArgumentException("No circuit breaker for endpoint " + endpoint);
            }
        }
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.linkRuleName = linkRuleName != null ? linkRuleName : DEFAULT_LINK_RULE;
    }

    /**
     * Create one breaker per endpoint with identical settings.
     *
     * @return mutable map of breakers
     */
    public static Map<ApiEndpoint, EndpointBreaker> breakersFor(int failureThreshold, Duration coolDown) {
        Map<ApiEndpoint, EndpointBreaker> map = new EnumMap<>(ApiEndpoint.class);
        for (ApiEndpoint endpoint : ApiEndpoint.values()) {
            map.put(endpoint, new EndpointBreaker(endpoint.label(), failureThreshold, coolDown));
        }
        return map;
    }

    /**
     * Run the call plan for a decision.
     *
     * @param decision decided message
     * @return future outcome; never completes exceptionally
     */
    public CompletableFuture<ActionOutcome> execute(Decision decision) {
        Objects.requireNonNull(decision, "decision must not be null");
        List<PlannedCall> plan = plan(decision);
        if (plan.isEmpty()) {
            return CompletableFuture.completedFuture(ActionOutcome.skipped(clock.instant()));
        }

        List<CallResult> results = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PlannedCall call : plan) {
            chain = chain.thenCompose(ignored -> call(call.endpoint, call.operation))
                    .thenAccept(results::add);
        }
        return chain.handle((ignored, error) -> {
            if (error != null) {
                LOG.error("Action chain for {} aborted: {}", decision.getMessageId(), error.getMessage(), error);
            }
            ActionOutcome outcome = ActionOutcome.of(new ArrayList<>(results), clock.instant());
            logOutcome(decision, outcome);
            return outcome;
        });
    }

    public Map<ApiEndpoint, EndpointBreaker> getBreakers() {
        return breakers;
    }

    // ---------------------------------------------------------------
    // Planning
    // ---------------------------------------------------------------

    List<PlannedCall> plan(Decision decision) {
        List<PlannedCall> plan = new ArrayList<>();
        String guildId = decision.getGuildId();
        String userId = decision.getUserId();
        String reason = reason(decision);
        boolean canDelete = decision.getChannelId() != null && decision.getMessageId() != null;

        if (decision.getAction() == ModerationAction.MUTE) {
            if (canDelete) {
                plan.add(deleteCall(decision));
            }
            Duration duration = decision.getDuration();
            plan.add(new PlannedCall(ApiEndpoint.MUTE, () -> api.mute(guildId, userId, duration, reason)));
        } else if (decision.getAction() == ModerationAction.WARN) {
            if (canDelete && decision.getTriggeringRules().contains(linkRuleName)) {
                plan.add(deleteCall(decision));
            }
            plan.add(new PlannedCall(ApiEndpoint.WARN, () -> api.warn(guildId, userId, reason)));
        }
        return plan;
    }

    private PlannedCall deleteCall(Decision decision) {
        return new PlannedCall(ApiEndpoint.DELETE_MESSAGE, () -> api.deleteMessage(
                decision.getGuildId(), decision.getChannelId(), decision.getMessageId()));
    }

    private static String reason(Decision decision) {
        return "Automated moderation: " + String.join(", ", decision.getTriggeringRules());
    }

    // ---------------------------------------------------------------
    // Retry loop
    // ---------------------------------------------------------------

    private CompletableFuture<CallResult> call(ApiEndpoint endpoint, Supplier<CompletableFuture<ApiResult>> op) {
        EndpointBreaker breaker = breakers.get(endpoint);
        CallTracker tracker = new CallTracker();
        Retry retry = Retry.of(endpoint.label(), retryPolicy.retryConfig((attemptsMade, outcome) -> {
            if (scheduler.isShutdown()) {
                tracker.schedulerGone = true;
                return -1L;
            }
            long delay = retryPolicy.intervalMillis(attemptsMade, outcome);
            tracker.backoffs.add(delay);
            LOG.debug("Call [{}] attempt {} failed, retrying in {}ms", endpoint.label(), attemptsMade, delay);
            return delay;
        }));

        CompletableFuture<ApiResult> attempts;
        try {
            attempts = retry.executeCompletionStage(scheduler, () -> attempt(breaker, op, tracker))
                    .toCompletableFuture();
        } catch (RejectedExecutionException e) {
            attempts = CompletableFuture.failedFuture(e);
        }
        return attempts.handle((result, error) -> toCallResult(endpoint, tracker, result, error));
    }

    private CompletionStage<ApiResult> attempt(EndpointBreaker breaker, Supplier<CompletableFuture<ApiResult>> op,
            CallTracker tracker) {
        Optional<EndpointBreaker.Permit> permit = breaker.tryAcquire();
        if (permit.isEmpty()) {
            tracker.rejected = true;
            return CompletableFuture.completedFuture(ApiResult.nonRetryable("circuit open"));
        }
        tracker.attempts.incrementAndGet();

        CompletableFuture<ApiResult> future;
        try {
            future = op.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.completedFuture(ApiResult.retryable(describe(e)));
        }
        if (future == null) {
            future = CompletableFuture.completedFuture(ApiResult.retryable("no response"));
        }
        return future.handle((result, error) -> {
            ApiResult tagged;
            if (error != null) {
                tagged = ApiResult.retryable(describe(error));
            } else {
                tagged = result != null ? result : ApiResult.retryable("empty result");
            }
            permit.get().record(tagged);
            return tagged;
        });
    }

    private static CallResult toCallResult(ApiEndpoint endpoint, CallTracker tracker, ApiResult result,
            Throwable error) {
        int attempts = tracker.attempts.get();
        List<Long> backoffs = tracker.backoffs;
        if (error != null) {
            LOG.error("Unexpected error calling {}: {}", endpoint.label(), describe(error), error);
            return new CallResult(endpoint.label(), CallResult.Status.FAILED, attempts, describe(error), backoffs);
        }
        if (tracker.rejected) {
            LOG.warn("Circuit [{}] open, rejecting call after {} attempt(s)", endpoint.label(), attempts);
            return new CallResult(endpoint.label(), CallResult.Status.REJECTED, attempts, "circuit open", backoffs);
        }
        switch (result.getKind()) {
            case SUCCESS:
                return new CallResult(endpoint.label(), CallResult.Status.SUCCEEDED, attempts, null, backoffs);
            case NON_RETRYABLE:
                LOG.warn("Call [{}] failed permanently: {}", endpoint.label(), result.getMessage());
                return new CallResult(endpoint.label(), CallResult.Status.FAILED, attempts, result.getMessage(),
                        backoffs);
            default:
                String reason = tracker.schedulerGone
                        ? "retry scheduler unavailable: " + result.getMessage()
                        : result.getMessage();
                LOG.warn("Call [{}] failed after {} attempt(s): {}", endpoint.label(), attempts, reason);
                return new CallResult(endpoint.label(), CallResult.Status.FAILED, attempts, reason, backoffs);
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }

    private void logOutcome(Decision decision, ActionOutcome outcome) {
        if (outcome.getStatus() == ActionOutcome.Status.SUCCEEDED) {
            LOG.info("Executed {} for {}/{} in {} attempt(s)", decision.getAction(),
                    decision.getGuildId(), decision.getUserId(), outcome.getTotalAttempts());
        } else {
            LOG.warn("{} for {}/{} ended {}: {}", decision.getAction(), decision.getGuildId(),
                    decision.getUserId(), outcome.getStatus(), outcome.getFailureSummary());
        }
    }

    /** Per-call state shared between attempts. */
    private static final class CallTracker {
        final AtomicInteger attempts = new AtomicInteger();
        final List<Long> backoffs = new CopyOnWriteArrayList<>();
        volatile boolean rejected;
        volatile boolean schedulerGone;
    }

    static final class PlannedCall {
        final ApiEndpoint endpoint;
        final Supplier<CompletableFuture<ApiResult>> operation;

        PlannedCall(ApiEndpoint endpoint, Supplier<CompletableFuture<ApiResult>> operation) {
            this.endpoint = endpoint;
            this.operation = operation;
        }
    }
}
