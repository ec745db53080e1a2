package fr.lapetina.aimux.infrastructure.registry;

import fr.lapetina.aimux.domain.model.FailureCause;
import fr.lapetina.aimux.domain.model.Outcome;

/**
 * Rolling window of the last N attempt outcomes of one provider.
 *
 * Mean latency covers successful attempts and timeouts: a timed-out attempt is sampled at the
 * latency it was cut off at, so a provider that keeps timing out ranks as slow rather than cold.
 * Other failures are counted but not sampled. Guarded by the instance lock; every operation is O(1).
 */
public final class PerformanceStats {

    private final int windowSize;
    private final long[] latenciesMs;
    private final boolean[] successes;
    private final boolean[] sampled;
    private int next;
    private int size;
    private int successesInWindow;
    private int samplesInWindow;
    private long sampledLatencySumMs;

    private long totalSuccesses;
    private long totalFailures;
    private long totalTimeouts;

    public PerformanceStats(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1: " + windowSize);
        }
        this.windowSize = windowSize;
        this.latenciesMs = new long[windowSize];
        this.successes = new boolean[windowSize];
        this.sampled = new boolean[windowSize];
    }

    public synchronized void record(Outcome outcome) {
        if (size == windowSize) {
            if (successes[next]) {
                successesInWindow--;
            }
            if (sampled[next]) {
                samplesInWindow--;
                sampledLatencySumMs -= latenciesMs[next];
            }
        } else {
            size++;
        }

        long latencyMs = outcome.latency().toMillis();
        boolean timedOut = !outcome.success() && outcome.cause() == FailureCause.TIMEOUT;
        latenciesMs[next] = latencyMs;
        successes[next] = outcome.success();
        sampled[next] = outcome.success() || timedOut;
        if (sampled[next]) {
            samplesInWindow++;
            sampledLatencySumMs += latencyMs;
        }
        if (outcome.success()) {
            successesInWindow++;
            totalSuccesses++;
        } else {
            totalFailures++;
            if (timedOut) {
                totalTimeouts++;
            }
        }
        next = (next + 1) % windowSize;
    }

    /**
     * Mean latency of the sampled attempts in the window, NaN when there are none.
     */
    public synchronized double meanLatencyMs() {
        if (samplesInWindow == 0) {
            return Double.NaN;
        }
        return (double) sampledLatencySumMs / samplesInWindow;
    }

    /**
     * Number of latency samples behind {@link #meanLatencyMs()}.
     */
    public synchronized int sampleCount() {
        return samplesInWindow;
    }

    /**
     * Share of successful attempts in the window, 1.0 when the window is empty.
     */
    public synchronized double successRate() {
        if (size == 0) {
            return 1.0;
        }
        return (double) successesInWindow / size;
    }

    public synchronized void reset() {
        next = 0;
        size = 0;
        successesInWindow = 0;
        samplesInWindow = 0;
        sampledLatencySumMs = 0;
        totalSuccesses = 0;
        totalFailures = 0;
        totalTimeouts = 0;
    }

    public synchronized RegistryStatus.PerformanceView view() {
        return new RegistryStatus.PerformanceView(
                size, samplesInWindow,
                samplesInWindow == 0 ? null : (double) sampledLatencySumMs / samplesInWindow,
                size == 0 ? 1.0 : (double) successesInWindow / size,
                totalSuccesses, totalFailures, totalTimeouts
        );
    }

    public int getWindowSize() {
        return windowSize;
    }
}
