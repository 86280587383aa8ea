package com.guildsentinel.core.action;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EndpointBreaker}.
 */
class EndpointBreakerTest {

    private static final Duration COOL_DOWN = Duration.ofMillis(60);

    private EndpointBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = new EndpointBreaker("mute", 3, COOL_DOWN);
    }

    @Test
    @DisplayName("Should stay closed below the failure threshold")
    void shouldStayClosed() {
        fail(breaker, 2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.tryAcquire()).isPresent();
    }

    @Test
    @DisplayName("Should need consecutive failures to open")
    void shouldResetOnSuccess() {
        fail(breaker, 2);
        breaker.tryAcquire().orElseThrow().record(ApiResult.success());
        fail(breaker, 2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getFailedCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should open after N consecutive failures and fail fast until the cool-down")
    void shouldOpenAndRejectCalls() {
        fail(breaker, 3);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.tryAcquire()).isEmpty();
        assertThat(breaker.tryAcquire()).isEmpty();
        assertThat(breaker.getRejectedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should allow exactly one trial call after the cool-down")
    void shouldAllowSingleTrial() throws Exception {
        fail(breaker, 3);
        awaitCoolDown();

        assertThat(breaker.tryAcquire()).isPresent();
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.tryAcquire()).isEmpty();
    }

    @Test
    @DisplayName("Should close when the trial succeeds")
    void shouldCloseOnTrialSuccess() throws Exception {
        fail(breaker, 3);
        awaitCoolDown();

        breaker.tryAcquire().orElseThrow().record(ApiResult.success());

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.tryAcquire()).isPresent();
        assertThat(breaker.tryAcquire()).isPresent();
    }

    @Test
    @DisplayName("Should reopen and restart the cool-down when the trial fails")
    void shouldReopenOnTrialFailure() throws Exception {
        fail(breaker, 3);
        awaitCoolDown();

        breaker.tryAcquire().orElseThrow().record(ApiResult.retryable("503"));

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.tryAcquire()).isEmpty();
        awaitCoolDown();
        assertThat(breaker.tryAcquire()).isPresent();
    }

    @Test
    @DisplayName("Should release the trial slot on a permanent failure")
    void shouldReleaseTrialOnPermanentFailure() throws Exception {
        fail(breaker, 3);
        awaitCoolDown();

        breaker.tryAcquire().orElseThrow().record(ApiResult.nonRetryable("403"));

        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.tryAcquire()).isPresent();
    }

    @Test
    @DisplayName("Should not count permanent failures")
    void shouldIgnorePermanentFailuresWhenClosed() {
        for (int i = 0; i < 10; i++) {
            breaker.tryAcquire().orElseThrow().record(ApiResult.nonRetryable("403"));
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getFailedCalls()).isZero();
    }

    @Test
    @DisplayName("Should not admit a second trial when a call from the closed state ends permanently")
    void shouldKeepSingleTrialDespiteLateNeutralResult() throws Exception {
        EndpointBreaker single = new EndpointBreaker("warn", 1, COOL_DOWN);
        EndpointBreaker.Permit slow = single.tryAcquire().orElseThrow();
        fail(single, 1);
        awaitCoolDown();
        EndpointBreaker.Permit trial = single.tryAcquire().orElseThrow();

        slow.record(ApiResult.nonRetryable("403"));

        assertThat(single.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(single.tryAcquire()).isEmpty();

        trial.record(ApiResult.success());
        assertThat(single.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Should not close on a success from the closed state while the trial is in flight")
    void shouldIgnoreLateSuccessDuringTrial() throws Exception {
        EndpointBreaker single = new EndpointBreaker("warn", 1, COOL_DOWN);
        EndpointBreaker.Permit slow = single.tryAcquire().orElseThrow();
        fail(single, 1);
        awaitCoolDown();
        EndpointBreaker.Permit trial = single.tryAcquire().orElseThrow();

        slow.record(ApiResult.success());

        assertThat(single.getState()).isEqualTo(CircuitState.HALF_OPEN);

        trial.record(ApiResult.retryable("503"));
        assertThat(single.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    @DisplayName("Should count a permit only once")
    void shouldRecordPermitOnce() {
        EndpointBreaker.Permit permit = breaker.tryAcquire().orElseThrow();

        permit.record(ApiResult.retryable("503"));
        permit.record(ApiResult.retryable("503"));
        permit.record(ApiResult.retryable("503"));

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getFailedCalls()).isEqualTo(1);
    }

    private static void fail(EndpointBreaker target, int times) {
        for (int i = 0; i < times; i++) {
            Optional<EndpointBreaker.Permit> permit = target.tryAcquire();
            assertThat(permit).isPresent();
            permit.get().record(ApiResult.retryable("503"));
        }
    }

    private static void awaitCoolDown() throws InterruptedException {
        Thread.sleep(COOL_DOWN.toMillis() + 40);
    }
}
