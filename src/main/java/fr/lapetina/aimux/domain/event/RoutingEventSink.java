package fr.lapetina.aimux.domain.event;

/**
 * Where routing components publish their events. Implementations must never block the caller.
 */
@FunctionalInterface
public interface RoutingEventSink {

    void emit(RoutingEvent event);

    static RoutingEventSink noop() {
        return event -> { };
    }
}
