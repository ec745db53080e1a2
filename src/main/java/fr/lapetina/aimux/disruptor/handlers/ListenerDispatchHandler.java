package fr.lapetina.aimux.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.aimux.domain.event.RoutingEvent;
import fr.lapetina.aimux.domain.event.RoutingEventHolder;
import fr.lapetina.aimux.domain.event.RoutingEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Final stage handler: fans each event out to the registered listeners,
 * then clears the slot for reuse.
 */
public final class ListenerDispatchHandler implements EventHandler<RoutingEventHolder> {

    private static final Logger log = LoggerFactory.getLogger(ListenerDispatchHandler.class);

    private final List<RoutingEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(RoutingEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(RoutingEventListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    @Override
    public void onEvent(RoutingEventHolder holder, long sequence, boolean endOfBatch) {
        try {
            RoutingEvent event = holder.get();
            if (event == null) {
                return;
            }
            for (RoutingEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Routing event listener failed: type={}, listener={}",
                            event.type(), listener, e);
                }
            }
        } finally {
            holder.clear();
        }
    }
}
