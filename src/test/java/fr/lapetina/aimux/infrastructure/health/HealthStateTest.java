package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.domain.model.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthStateTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static final long UNPROBED = DispatchPermit.NO_PROBE;
    private static final long PROBE = 7L;

    private final HealthPolicy policy = new HealthPolicy(3, 2, Duration.ofSeconds(1), Duration.ofSeconds(8));

    @Test
    @DisplayName("should start CLOSED and dispatchable")
    void shouldStartClosed() {
        HealthState state = HealthState.initial(T0, policy);

        assertThat(state.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(state.failureStreak()).isZero();
        assertThat(state.cooldown()).isEqualTo(Duration.ofSeconds(1));
        assertThat(state.isDispatchable(T0)).isTrue();
        assertThat(state.isProbeGrantable(T0)).isFalse();
    }

    @Test
    @DisplayName("should open only when the streak reaches the failure threshold")
    void shouldOpenAtThreshold() {
        HealthState state = HealthState.initial(T0, policy)
                .onFailure(T0, policy, UNPROBED)
                .onFailure(T0, policy, UNPROBED);
        assertThat(state.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(state.failureStreak()).isEqualTo(2);

        state = state.onFailure(T0, policy, UNPROBED);

        assertThat(state.state()).isEqualTo(CircuitState.OPEN);
        assertThat(state.openedAt()).isEqualTo(T0);
        assertThat(state.nextRetryAt()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    @DisplayName("should clear the streak on a success while closed")
    void shouldClearStreakOnSuccess() {
        HealthState state = HealthState.initial(T0, policy)
                .onFailure(T0, policy, UNPROBED)
                .onFailure(T0, policy, UNPROBED)
                .onSuccess(T0, policy, UNPROBED);

        assertThat(state.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(state.failureStreak()).isZero();
    }

    @Test
    @DisplayName("should return the same instance when nothing changes")
    void shouldReturnSameInstanceWhenUnchanged() {
        HealthState initial = HealthState.initial(T0, policy);

        assertThat(initial.onSuccess(T0, policy, UNPROBED)).isSameAs(initial);
        assertThat(initial.releaseProbe(PROBE)).isSameAs(initial);
    }

    @Test
    @DisplayName("should refuse a probe before the cooldown and grant one after")
    void shouldGateProbeOnCooldown() {
        HealthState open = opened();

        assertThat(open.isDispatchable(T0.plusMillis(999))).isFalse();
        assertThat(open.isProbeGrantable(T0.plusMillis(1000))).isTrue();
        assertThatThrownBy(() -> open.claimProbe(T0.plusMillis(500), PROBE))
                .isInstanceOf(IllegalStateException.class);

        HealthState halfOpen = open.claimProbe(T0.plusSeconds(1), PROBE);
        assertThat(halfOpen.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(halfOpen.probeInFlight()).isTrue();
        assertThat(halfOpen.isDispatchable(T0.plusSeconds(1))).isFalse();
    }

    @Test
    @DisplayName("should reopen with a doubled cooldown when a probe fails")
    void shouldDoubleCooldownOnProbeFailure() {
        Instant probeAt = T0.plusSeconds(1);
        HealthState reopened = opened().claimProbe(probeAt, PROBE).onFailure(probeAt, policy, PROBE);

        assertThat(reopened.state()).isEqualTo(CircuitState.OPEN);
        assertThat(reopened.cooldown()).isEqualTo(Duration.ofSeconds(2));
        assertThat(reopened.openedAt()).isEqualTo(probeAt);
        assertThat(reopened.nextRetryAt()).isEqualTo(probeAt.plusSeconds(2));
    }

    @Test
    @DisplayName("should cap the cooldown at the configured maximum")
    void shouldCapCooldown() {
        HealthState state = opened();
        Instant now = T0;
        Duration[] expected = {
                Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8), Duration.ofSeconds(8)
        };
        for (Duration cooldown : expected) {
            now = state.nextRetryAt();
            state = state.claimProbe(now, PROBE).onFailure(now, policy, PROBE);
            assertThat(state.cooldown()).isEqualTo(cooldown);
        }
    }

    @Test
    @DisplayName("should close after enough probe successes and restore the base cooldown")
    void shouldCloseAfterProbeSuccesses() {
        Instant first = T0.plusSeconds(1);
        HealthState state = opened().claimProbe(first, PROBE).onFailure(first, policy, PROBE);
        Instant second = state.nextRetryAt();

        state = state.claimProbe(second, PROBE).onSuccess(second, policy, PROBE);
        assertThat(state.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(state.probeSuccesses()).isEqualTo(1);
        assertThat(state.probeInFlight()).isFalse();

        state = state.claimProbe(second, PROBE).onSuccess(second, policy, PROBE);
        assertThat(state.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(state.failureStreak()).isZero();
        assertThat(state.cooldown()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("should ignore late outcomes while OPEN")
    void shouldIgnoreOutcomesWhileOpen() {
        HealthState open = opened();

        assertThat(open.onSuccess(T0, policy, UNPROBED)).isSameAs(open);
        assertThat(open.onFailure(T0, policy, UNPROBED)).isSameAs(open);
    }

    @Test
    @DisplayName("should free the probe slot without counting an outcome")
    void shouldReleaseProbe() {
        HealthState halfOpen = opened().claimProbe(T0.plusSeconds(1), PROBE);

        HealthState released = halfOpen.releaseProbe(PROBE);

        assertThat(released.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(released.probeInFlight()).isFalse();
        assertThat(released.probeSuccesses()).isZero();
        assertThat(released.failureStreak()).isEqualTo(halfOpen.failureStreak());
    }

    @Test
    @DisplayName("should ignore outcomes without the probe ticket while HALF_OPEN")
    void shouldIgnoreForeignOutcomesWhileHalfOpen() {
        HealthState halfOpen = opened().claimProbe(T0.plusSeconds(1), PROBE);

        assertThat(halfOpen.onSuccess(T0.plusSeconds(1), policy, UNPROBED)).isSameAs(halfOpen);
        assertThat(halfOpen.onFailure(T0.plusSeconds(1), policy, UNPROBED)).isSameAs(halfOpen);
        assertThat(halfOpen.onSuccess(T0.plusSeconds(1), policy, PROBE + 1)).isSameAs(halfOpen);
        assertThat(halfOpen.releaseProbe(UNPROBED)).isSameAs(halfOpen);
        assertThat(halfOpen.probeTicket()).isEqualTo(PROBE);
    }

    @Test
    @DisplayName("should reject the reserved ticket value when claiming a probe")
    void shouldRejectEmptyTicket() {
        HealthState open = opened();

        assertThatThrownBy(() -> open.claimProbe(T0.plusSeconds(1), UNPROBED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private HealthState opened() {
        return HealthState.initial(T0, policy)
                .onFailure(T0, policy, UNPROBED)
                .onFailure(T0, policy, UNPROBED)
                .onFailure(T0, policy, UNPROBED);
    }
}
