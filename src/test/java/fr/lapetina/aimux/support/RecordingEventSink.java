package fr.lapetina.aimux.support;

import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventSink;
import fr.lapetina.aimux.domain.event.RoutingEventType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Synchronous sink that keeps every event, in emission order.
 */
public final class RecordingEventSink implements RoutingEventSink {

    private final List<RoutingEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(RoutingEvent event) {
        events.add(event);
    }

    public List<RoutingEvent> all() {
        return events;
    }

    public List<RoutingEvent> ofType(RoutingEventType type) {
        return events.stream()
                .filter(e -> e.type() == type)
                .collect(Collectors.toList());
    }

    public List<RoutingEventType> types() {
        return events.stream()
                .map(RoutingEvent::type)
                .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
