package fr.lapetina.aimux.domain.event;

/**
 * Mutable ring buffer slot carrying one {@link RoutingEvent}.
 *
 * <p>Reused across the ring buffer; only event bus handlers touch it.
 */
public final class RoutingEventHolder {

    private RoutingEvent event;
    private long sequence = -1;

    public void set(RoutingEvent event, long sequence) {
        this.event = event;
        this.sequence = sequence;
    }

    public RoutingEvent get() {
        return event;
    }

    public long getSequence() {
        return sequence;
    }

    public void clear() {
        this.event = null;
        this.sequence = -1;
    }

    @Override
    public String toString() {
        return "RoutingEventHolder{" +
                "sequence=" + sequence +
                ", event=" + event +
                '}';
    }
}
