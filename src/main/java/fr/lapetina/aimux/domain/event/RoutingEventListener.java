package fr.lapetina.aimux.domain.event;

/**
 * Consumer of routing events, called on the event bus consumer thread.
 * Exceptions thrown by a listener are logged and do not affect other listeners.
 */
@FunctionalInterface
public interface RoutingEventListener {

    void onEvent(RoutingEvent event);
}
