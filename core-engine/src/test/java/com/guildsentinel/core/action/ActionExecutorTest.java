package com.guildsentinel.core.action;

import com.guildsentinel.core.model.ActionOutcome;
import com.guildsentinel.core.model.CallResult;
import com.guildsentinel.core.model.Decision;
import com.guildsentinel.core.model.ModerationAction;
import com.guildsentinel.core.support.FakeModerationApi;
import com.guildsentinel.core.support.MutableClock;
import com.guildsentinel.core.support.TestEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ActionExecutor}.
 */
class ActionExecutorTest {

    private static final Duration COOL_DOWN = Duration.ofMillis(60);

    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private FakeModerationApi api;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = new MutableClock(TestEvents.T0);
        api = new FakeModerationApi();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Call plans
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should skip decisions without an action")
    void shouldSkipNone() throws Exception {
        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.NONE, List.of()));

        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.SKIPPED);
        assertThat(outcome.getCalls()).isEmpty();
        assertThat(api.getCalls()).isEmpty();
    }

    @Test
    @DisplayName("Should delete the message and then time the user out on MUTE")
    void shouldDeleteThenMute() throws Exception {
        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.MUTE, List.of("rate")));

        assertThat(api.getCalls()).containsExactly("delete:m1", "mute:u1/360m");
        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.SUCCEEDED);
        assertThat(outcome.getTotalAttempts()).isEqualTo(2);
        assertThat(outcome.getCompletedAt()).isEqualTo(TestEvents.T0);
    }

    @Test
    @DisplayName("Should only warn when the link rule did not fire")
    void shouldWarnOnly() throws Exception {
        run(executor(5, 3), decision(ModerationAction.WARN, List.of("duplicate-content")));

        assertThat(api.getCalls()).containsExactly("warn:u1");
    }

    @Test
    @DisplayName("Should delete a warned message that carried a suspicious link")
    void shouldDeleteLinkMessageOnWarn() throws Exception {
        run(executor(5, 3), decision(ModerationAction.WARN, List.of(ActionExecutor.DEFAULT_LINK_RULE)));

        assertThat(api.getCalls()).containsExactly("delete:m1", "warn:u1");
    }

    @Test
    @DisplayName("Should mute without deleting when the message id is unknown")
    void shouldMuteWithoutMessage() throws Exception {
        Decision decision = decision(ModerationAction.MUTE, List.of("rate")).toBuilder()
                .messageId(null)
                .build();

        run(executor(5, 3), decision);

        assertThat(api.getCalls()).containsExactly("mute:u1/360m");
    }

    // ---------------------------------------------------------------
    // Retries
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should retry transient failures with exponential backoff")
    void shouldRetryTransientFailures() throws Exception {
        api.script(ApiEndpoint.WARN, ApiResult.retryable("503"), ApiResult.retryable("503"));

        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.WARN, List.of("rate")));

        CallResult warn = outcome.getCalls().get(0);
        assertThat(warn.getStatus()).isEqualTo(CallResult.Status.SUCCEEDED);
        assertThat(warn.getAttempts()).isEqualTo(3);
        assertThat(warn.getBackoffMillis()).containsExactly(1L, 2L);
        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.SUCCEEDED);
    }

    @Test
    @DisplayName("Should give up after the maximum number of attempts")
    void shouldGiveUpAfterMaxAttempts() throws Exception {
        api.script(ApiEndpoint.WARN, ApiResult.retryable("503"), ApiResult.retryable("503"),
                ApiResult.retryable("503"));

        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.WARN, List.of("rate")));

        assertThat(api.count(ApiEndpoint.WARN)).isEqualTo(3);
        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.FAILED);
        assertThat(outcome.getFailureSummary()).contains("warn: 503");
    }

    @Test
    @DisplayName("Should not retry permanent failures nor count them against the circuit")
    void shouldNotRetryPermanentFailures() throws Exception {
        ActionExecutor executor = executor(5, 3);
        api.script(ApiEndpoint.WARN, ApiResult.nonRetryable("403 missing permissions"));

        ActionOutcome outcome = run(executor, decision(ModerationAction.WARN, List.of("rate")));

        assertThat(api.count(ApiEndpoint.WARN)).isEqualTo(1);
        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.FAILED);
        EndpointBreaker breaker = executor.getBreakers().get(ApiEndpoint.WARN);
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getFailedCalls()).isZero();
    }

    @Test
    @DisplayName("Should wait at least as long as the server asks")
    void shouldHonourWaitHint() throws Exception {
        api.script(ApiEndpoint.WARN, ApiResult.rateLimited("429", Duration.ofMillis(20)));

        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.WARN, List.of("rate")));

        assertThat(outcome.getCalls().get(0).getBackoffMillis()).containsExactly(20L);
        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.SUCCEEDED);
    }

    @Test
    @DisplayName("Should treat a thrown exception as a transient failure")
    void shouldRetryThrownException() throws Exception {
        api.scriptThrow(ApiEndpoint.MUTE, new IllegalStateException("socket reset"));

        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.MUTE, List.of("rate")));

        assertThat(api.count(ApiEndpoint.MUTE)).isEqualTo(2);
        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.SUCCEEDED);
    }

    @Test
    @DisplayName("Should report PARTIAL when the delete fails but the mute succeeds")
    void shouldReportPartial() throws Exception {
        api.script(ApiEndpoint.DELETE_MESSAGE, ApiResult.nonRetryable("404 unknown message"));

        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.MUTE, List.of("rate")));

        assertThat(api.getCalls()).containsExactly("delete:m1", "mute:u1/360m");
        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.PARTIAL);
        assertThat(outcome.getFailureSummary()).isEqualTo("delete: 404 unknown message");
    }

    @Test
    @DisplayName("Should stop retrying once the scheduler is shut down")
    void shouldStopRetryingWithoutScheduler() throws Exception {
        api.script(ApiEndpoint.WARN, ApiResult.retryable("503"));
        scheduler.shutdown();

        ActionOutcome outcome = run(executor(5, 3), decision(ModerationAction.WARN, List.of("rate")));

        CallResult warn = outcome.getCalls().get(0);
        assertThat(warn.getStatus()).isEqualTo(CallResult.Status.FAILED);
        assertThat(warn.getAttempts()).isEqualTo(1);
        assertThat(warn.getFailureReason()).isEqualTo("retry scheduler unavailable: 503");
        assertThat(warn.getBackoffMillis()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Circuit breaking
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should fail fast while the circuit is open and recover after a successful trial")
    void shouldFailFastWhileOpen() throws Exception {
        ActionExecutor executor = executor(2, 1);
        api.script(ApiEndpoint.WARN, ApiResult.retryable("500"), ApiResult.retryable("500"));
        Decision decision = decision(ModerationAction.WARN, List.of("rate"));

        run(executor, decision);
        run(executor, decision);
        ActionOutcome rejected = run(executor, decision);

        assertThat(api.count(ApiEndpoint.WARN)).isEqualTo(2);
        assertThat(rejected.getStatus()).isEqualTo(ActionOutcome.Status.FAILED);
        assertThat(rejected.getCalls().get(0).getStatus()).isEqualTo(CallResult.Status.REJECTED);
        assertThat(rejected.getCalls().get(0).getAttempts()).isZero();

        Thread.sleep(COOL_DOWN.toMillis() + 40);
        ActionOutcome trial = run(executor, decision);

        assertThat(trial.getStatus()).isEqualTo(ActionOutcome.Status.SUCCEEDED);
        assertThat(executor.getBreakers().get(ApiEndpoint.WARN).getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Should keep circuits independent per endpoint")
    void shouldIsolateEndpoints() throws Exception {
        ActionExecutor executor = executor(1, 1);
        api.script(ApiEndpoint.DELETE_MESSAGE, ApiResult.retryable("500"));

        ActionOutcome outcome = run(executor, decision(ModerationAction.MUTE, List.of("rate")));

        assertThat(outcome.getStatus()).isEqualTo(ActionOutcome.Status.PARTIAL);
        assertThat(executor.getBreakers().get(ApiEndpoint.DELETE_MESSAGE).getState()).isEqualTo(CircuitState.OPEN);
        assertThat(executor.getBreakers().get(ApiEndpoint.MUTE).getState()).isEqualTo(CircuitState.CLOSED);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private ActionExecutor executor(int failureThreshold, int maxAttempts) {
        return new ActionExecutor(api,
                ActionExecutor.breakersFor(failureThreshold, COOL_DOWN),
                new RetryPolicy(maxAttempts, 1, 5, 2.0, false),
                scheduler, clock, ActionExecutor.DEFAULT_LINK_RULE);
    }

    private static ActionOutcome run(ActionExecutor executor, Decision decision) throws Exception {
        return executor.execute(decision).get(5, TimeUnit.SECONDS);
    }

    private static Decision decision(ModerationAction action, List<String> rules) {
        return Decision.builder()
                .guildId(TestEvents.GUILD)
                .userId("u1")
                .channelId("c1")
                .messageId("m1")
                .action(action)
                .confidence(action == ModerationAction.NONE ? 0.0 : 0.9)
                .duration(action == ModerationAction.MUTE ? Duration.ofHours(6) : null)
                .triggeringRules(rules)
                .createdAt(TestEvents.T0)
                .build();
    }
}
