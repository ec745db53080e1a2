package fr.lapetina.aimux.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes every routing event to the log with request context in the MDC.
 *
 * Failures that need an operator's attention log at WARN; the routine
 * per-attempt traffic logs at DEBUG.
 */
public final class EventLoggingHandler implements EventHandler<RoutingEventHolder> {

    private static final Logger log = LoggerFactory.getLogger(EventLoggingHandler.class);

    @Override
    public void onEvent(RoutingEventHolder holder, long sequence, boolean endOfBatch) {
        RoutingEvent event = holder.get();
        if (event == null) {
            return;
        }
        setupMDC(event);
        try {
            logEvent(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(RoutingEvent event) {
        if (event.requestId() != null) {
            MDC.put("requestId", event.requestId());
        }
        if (event.correlationId() != null) {
            MDC.put("correlationId", event.correlationId());
        }
        if (event.providerId() != null) {
            MDC.put("providerId", event.providerId());
        }
        MDC.put("eventType", event.type().name());
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("correlationId");
        MDC.remove("providerId");
        MDC.remove("eventType");
    }

    private void logEvent(RoutingEvent event) {
        switch (event.type()) {
            case ATTEMPT_SUCCEEDED -> log.debug("Attempt succeeded: requestId={}, provider={}, credential={}, attempt={}, latency={}",
                    event.requestId(), event.providerId(), event.credentialId(), event.attempts(), event.latency());
            case ATTEMPT_FAILED -> log.debug("Attempt failed: requestId={}, provider={}, credential={}, attempt={}, cause={}, message={}",
                    event.requestId(), event.providerId(), event.credentialId(), event.attempts(), event.cause(), event.message());
            case ROUTE_SUCCEEDED -> log.info("Route completed: requestId={}, provider={}, attempts={}, latency={}",
                    event.requestId(), event.providerId(), event.attempts(), event.latency());
            case ROUTE_EXHAUSTED -> log.warn("Route exhausted: requestId={}, attempts={}, lastCause={}, latency={}",
                    event.requestId(), event.attempts(), event.cause(), event.latency());
            case NO_ELIGIBLE_PROVIDER -> log.warn("No eligible provider: requestId={}, message={}",
                    event.requestId(), event.message());
            case NO_CREDENTIAL_AVAILABLE -> log.warn("No credential available: requestId={}, message={}",
                    event.requestId(), event.message());
            case CIRCUIT_TRANSITION -> log.info("Circuit transition: provider={}, {} -> {}, failureStreak={}",
                    event.providerId(), event.fromState(), event.toState(), event.attempts());
            case CREDENTIAL_AUTH_FAILURE -> log.warn("Credential rejected: provider={}, credential={}, message={}",
                    event.providerId(), event.credentialId(), event.message());
            case PROVIDER_RESET -> log.info("Provider reset: provider={}", event.providerId());
            case CONFIG_RELOADED -> log.info("Configuration reloaded: providers={}, {}",
                    event.attempts(), event.message());
            case CONFIG_REJECTED -> log.warn("Configuration rejected: {}", event.message());
        }
    }
}
