package fr.lapetina.aimux.support;

import fr.lapetina.aimux.domain.bridge.Bridge;
import fr.lapetina.aimux.domain.bridge.BridgeException;
import fr.lapetina.aimux.domain.bridge.BridgeResponse;
import fr.lapetina.aimux.domain.bridge.Dispatch;
import fr.lapetina.aimux.domain.bridge.ProviderDescriptor;
import fr.lapetina.aimux.domain.model.FailureCause;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Bridge test double. Each call to {@link #send} consumes the next scripted step;
 * once the script is empty the fallback step answers.
 */
public final class ScriptedBridge implements Bridge {

    private final String name;
    private final Queue<Function<Dispatch, BridgeResponse>> script = new ConcurrentLinkedQueue<>();
    private final List<Dispatch> dispatches = new CopyOnWriteArrayList<>();
    private final AtomicInteger probes = new AtomicInteger();
    private final AtomicInteger describeCalls = new AtomicInteger();
    private volatile Function<Dispatch, BridgeResponse> fallback;
    private volatile BooleanSupplier probe = () -> true;
    private volatile ProviderDescriptor descriptor = ProviderDescriptor.textOnly();
    private volatile MutableClock clock;
    private volatile Duration simulatedLatency = Duration.ZERO;

    public ScriptedBridge(String name) {
        this.name = name;
        this.fallback = succeed("ok from " + name);
    }

    public static ScriptedBridge succeeding(String name) {
        return new ScriptedBridge(name);
    }

    public static ScriptedBridge failing(String name, FailureCause cause) {
        return new ScriptedBridge(name).always(fail(cause));
    }

    // ==================== STEPS ====================

    public Function<Dispatch, BridgeResponse> succeed(Object body) {
        return dispatch -> new BridgeResponse(body, Map.of("bridge", name));
    }

    public static Function<Dispatch, BridgeResponse> fail(FailureCause cause) {
        return dispatch -> {
            throw new BridgeException(cause, "scripted " + cause);
        };
    }

    public static Function<Dispatch, BridgeResponse> block() {
        return dispatch -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw BridgeException.timeout("interrupted while blocking");
        };
    }

    public static Function<Dispatch, BridgeResponse> throwing(RuntimeException exception) {
        return dispatch -> {
            throw exception;
        };
    }

    public static Function<Dispatch, BridgeResponse> throwingError() {
        return dispatch -> {
            throw new AssertionError("bridge blew up");
        };
    }

    public static Function<Dispatch, BridgeResponse> returningNull() {
        return dispatch -> null;
    }

    // ==================== SCRIPTING ====================

    public ScriptedBridge then(Function<Dispatch, BridgeResponse> step) {
        script.add(step);
        return this;
    }

    public ScriptedBridge thenFail(FailureCause cause) {
        return then(fail(cause));
    }

    public ScriptedBridge thenSucceed(Object body) {
        return then(succeed(body));
    }

    public ScriptedBridge always(Function<Dispatch, BridgeResponse> step) {
        this.fallback = step;
        return this;
    }

    public ScriptedBridge alwaysSucceed() {
        return always(succeed("ok from " + name));
    }

    public ScriptedBridge probeResult(boolean result) {
        return probeWith(() -> result);
    }

    public ScriptedBridge probeWith(BooleanSupplier probe) {
        this.probe = probe;
        return this;
    }

    public ScriptedBridge describing(ProviderDescriptor descriptor) {
        this.descriptor = descriptor;
        return this;
    }

    /**
     * Advances the given clock by {@code latency} on every send, so latency stats see it.
     */
    public ScriptedBridge simulateLatency(MutableClock clock, Duration latency) {
        this.clock = clock;
        this.simulatedLatency = latency;
        return this;
    }

    // ==================== BRIDGE ====================

    @Override
    public BridgeResponse send(Dispatch dispatch) {
        dispatches.add(dispatch);
        MutableClock c = clock;
        if (c != null) {
            c.advance(simulatedLatency);
        }
        Function<Dispatch, BridgeResponse> step = script.poll();
        if (step == null) {
            step = fallback;
        }
        return step.apply(dispatch);
    }

    @Override
    public boolean healthProbe() {
        probes.incrementAndGet();
        return probe.getAsBoolean();
    }

    @Override
    public ProviderDescriptor describe() {
        describeCalls.incrementAndGet();
        return descriptor;
    }

    // ==================== INSPECTION ====================

    public String getName() {
        return name;
    }

    public int callCount() {
        return dispatches.size();
    }

    public List<Dispatch> getDispatches() {
        return dispatches;
    }

    public int probeCount() {
        return probes.get();
    }

    public int describeCount() {
        return describeCalls.get();
    }

    @Override
    public String toString() {
        return "ScriptedBridge{" + name + '}';
    }
}
