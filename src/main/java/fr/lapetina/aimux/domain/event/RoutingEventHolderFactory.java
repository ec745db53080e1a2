package fr.lapetina.aimux.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates ring buffer slots.
 */
public final class RoutingEventHolderFactory implements EventFactory<RoutingEventHolder> {

    @Override
    public RoutingEventHolder newInstance() {
        return new RoutingEventHolder();
    }
}
