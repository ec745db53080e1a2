package fr.lapetina.aimux.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventHolder;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;

import java.util.Locale;

/**
 * Turns routing events into Micrometer meters.
 *
 * Records:
 * - Attempt count and latency by provider and outcome
 * - Route results
 * - Circuit transitions by target state
 * - Rejected credentials and configuration reloads
 */
public final class EventMetricsHandler implements EventHandler<RoutingEventHolder> {

    private final MetricsRegistry metricsRegistry;

    public EventMetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RoutingEventHolder holder, long sequence, boolean endOfBatch) {
        RoutingEvent event = holder.get();
        if (event == null) {
            return;
        }
        switch (event.type()) {
            case ATTEMPT_SUCCEEDED -> metricsRegistry.recordAttempt(
                    event.providerId(), "success", event.latency());
            case ATTEMPT_FAILED -> metricsRegistry.recordAttempt(
                    event.providerId(), outcomeTag(event), event.latency());
            case ROUTE_SUCCEEDED -> metricsRegistry.incrementRouteCount("success");
            case ROUTE_EXHAUSTED -> metricsRegistry.incrementRouteCount("exhausted");
            case NO_ELIGIBLE_PROVIDER -> metricsRegistry.incrementRouteCount("no_eligible_provider");
            case NO_CREDENTIAL_AVAILABLE -> metricsRegistry.incrementRouteCount("no_credential");
            case CIRCUIT_TRANSITION -> metricsRegistry.incrementCircuitTransition(
                    event.providerId(), event.toState());
            case CREDENTIAL_AUTH_FAILURE -> metricsRegistry.incrementAuthFailure(
                    event.providerId(), event.credentialId());
            case CONFIG_RELOADED -> metricsRegistry.incrementConfigReload(true);
            case CONFIG_REJECTED -> metricsRegistry.incrementConfigReload(false);
            case PROVIDER_RESET -> { }
        }
    }

    private static String outcomeTag(RoutingEvent event) {
        return event.cause() != null ? event.cause().name().toLowerCase(Locale.ROOT) : "unknown";
    }
}
