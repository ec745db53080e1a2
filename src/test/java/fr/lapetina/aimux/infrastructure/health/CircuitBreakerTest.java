package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.domain.model.CircuitState;
import fr.lapetina.aimux.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private MutableClock clock;
    private List<String> transitions;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.start();
        transitions = new ArrayList<>();
        // 3 failures to open, 2 probe successes to close, 1s cooldown doubling up to 8s
        HealthPolicy policy = new HealthPolicy(3, 2, Duration.ofSeconds(1), Duration.ofSeconds(8));
        circuitBreaker = new CircuitBreaker("alpha", policy, clock,
                (id, from, to) -> transitions.add(from.state() + "->" + to.state()));
    }

    private void openCircuit() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuitBreaker.tryAcquireDispatch()).hasValueSatisfying(permit -> {
            assertThat(permit.providerId()).isEqualTo("alpha");
            assertThat(permit.isProbe()).isFalse();
        });
        assertThat(circuitBreaker.tryAcquireDispatch()).isPresent();
        assertThat(circuitBreaker.tryAcquireProbe()).isEmpty();
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);

        circuitBreaker.recordFailure(); // Third failure hits threshold

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(circuitBreaker.isDispatchable()).isFalse();
        assertThat(circuitBreaker.tryAcquireDispatch()).isEmpty();
        assertThat(transitions).containsExactly("CLOSED->OPEN");
    }

    @Test
    @DisplayName("should reset failure streak on success")
    void shouldResetFailureStreakOnSuccess() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getFailureStreak()).isEqualTo(2);

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getFailureStreak()).isZero();
        assertThat(transitions).isEmpty();
    }

    @Test
    @DisplayName("should stay OPEN until the cooldown elapses")
    void shouldStayOpenDuringCooldown() {
        openCircuit();

        clock.advanceMillis(999);
        assertThat(circuitBreaker.tryAcquireDispatch()).isEmpty();

        clock.advanceMillis(1);
        assertThat(circuitBreaker.tryAcquireDispatch()).hasValueSatisfying(permit ->
                assertThat(permit.isProbe()).isTrue());
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    @DisplayName("should close after two probe successes")
    void shouldCloseAfterProbeSuccesses() {
        openCircuit();
        clock.advance(Duration.ofSeconds(1));

        circuitBreaker.recordSuccess(circuitBreaker.tryAcquireDispatch().orElseThrow());
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

        circuitBreaker.recordSuccess(circuitBreaker.tryAcquireDispatch().orElseThrow());

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED");
    }

    @Test
    @DisplayName("should reopen with a doubled cooldown when the probe fails")
    void shouldReopenOnProbeFailure() {
        openCircuit();
        clock.advance(Duration.ofSeconds(1));
        DispatchPermit probe = circuitBreaker.tryAcquireDispatch().orElseThrow();

        circuitBreaker.recordFailure(probe);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(circuitBreaker.getHealthState().cooldown()).isEqualTo(Duration.ofSeconds(2));

        clock.advance(Duration.ofSeconds(1));
        assertThat(circuitBreaker.tryAcquireDispatch()).isEmpty();
        clock.advance(Duration.ofSeconds(1));
        assertThat(circuitBreaker.tryAcquireDispatch()).isPresent();
    }

    @Test
    @DisplayName("should return the probe slot on release")
    void shouldReleaseProbeSlot() {
        openCircuit();
        clock.advance(Duration.ofSeconds(1));
        DispatchPermit probe = circuitBreaker.tryAcquireDispatch().orElseThrow();
        assertThat(circuitBreaker.tryAcquireDispatch()).isEmpty();

        circuitBreaker.releaseProbe(probe);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(circuitBreaker.tryAcquireProbe()).hasValueSatisfying(next ->
                assertThat(next.probeTicket()).isNotEqualTo(probe.probeTicket()));
    }

    @Test
    @DisplayName("should go back to CLOSED on admin reset")
    void shouldResetToClosed() {
        openCircuit();

        circuitBreaker.reset();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuitBreaker.getFailureStreak()).isZero();
        assertThat(circuitBreaker.tryAcquireDispatch()).isPresent();
        assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->CLOSED");
    }

    @Test
    @DisplayName("should keep working when the transition listener throws")
    void shouldSurviveFailingListener() {
        CircuitBreaker breaker = new CircuitBreaker("beta",
                new HealthPolicy(1, 1, Duration.ofSeconds(1), Duration.ofSeconds(1)), clock,
                (id, from, to) -> {
                    throw new IllegalStateException("listener failure");
                });

        breaker.recordFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Nested
    @DisplayName("Late outcomes while HALF_OPEN")
    class LateOutcomeTests {

        private DispatchPermit closedDispatch;
        private DispatchPermit probe;

        @BeforeEach
        void dispatchThenOpen() {
            closedDispatch = circuitBreaker.tryAcquireDispatch().orElseThrow();
            openCircuit();
            clock.advance(Duration.ofSeconds(1));
            probe = circuitBreaker.tryAcquireDispatch().orElseThrow();
        }

        @Test
        @DisplayName("should keep the single probe slot when an earlier dispatch succeeds late")
        void shouldIgnoreLateSuccess() {
            circuitBreaker.recordSuccess(closedDispatch);

            HealthState state = circuitBreaker.getHealthState();
            assertThat(state.state()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(state.probeSuccesses()).isZero();
            assertThat(state.probeInFlight()).isTrue();
            assertThat(circuitBreaker.tryAcquireDispatch()).isEmpty();
            assertThat(circuitBreaker.tryAcquireProbe()).isEmpty();
        }

        @Test
        @DisplayName("should not reopen when an earlier dispatch fails late")
        void shouldIgnoreLateFailure() {
            circuitBreaker.recordFailure(closedDispatch);
            circuitBreaker.recordFailure();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(circuitBreaker.getHealthState().cooldown()).isEqualTo(Duration.ofSeconds(1));
            assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN");
        }

        @Test
        @DisplayName("should not free the probe slot for a release without the probe permit")
        void shouldIgnoreForeignRelease() {
            circuitBreaker.releaseProbe(closedDispatch);

            assertThat(circuitBreaker.getHealthState().probeInFlight()).isTrue();
            assertThat(circuitBreaker.tryAcquireDispatch()).isEmpty();
        }

        @Test
        @DisplayName("should still let the probe decide after a late outcome")
        void shouldLetProbeDecide() {
            circuitBreaker.recordSuccess(closedDispatch);

            circuitBreaker.recordFailure(probe);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(circuitBreaker.getHealthState().cooldown()).isEqualTo(Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("should ignore a stale probe permit once a newer probe holds the slot")
        void shouldIgnoreStaleProbe() {
            circuitBreaker.releaseProbe(probe);
            DispatchPermit newer = circuitBreaker.tryAcquireProbe().orElseThrow();

            circuitBreaker.recordFailure(probe);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(circuitBreaker.getHealthState().probeTicket()).isEqualTo(newer.probeTicket());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should grant a single probe slot to concurrent callers")
        void shouldGrantSingleProbe() throws InterruptedException {
            openCircuit();
            clock.advance(Duration.ofSeconds(1));

            int threads = 32;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger granted = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        if (circuitBreaker.tryAcquireDispatch().isPresent()) {
                            granted.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(granted.get()).isEqualTo(1);
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        }

        @Test
        @DisplayName("should open exactly once under concurrent failures")
        void shouldOpenOnce() throws InterruptedException {
            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch done = new CountDownLatch(threads);

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        circuitBreaker.recordFailure();
                    } finally {
                        done.countDown();
                    }
                });
            }

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(transitions).containsExactly("CLOSED->OPEN");
        }
    }
}
