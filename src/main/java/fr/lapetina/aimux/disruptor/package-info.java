/**
 * Asynchronous delivery of routing events on an LMAX Disruptor ring buffer.
 *
 * <p>Routing never waits for observers: publishing claims a slot with {@code tryNext()}
 * and drops the event when the buffer is full. Consumers run in two stages:
 * <pre>
 * (Logging, Metrics) → Listener dispatch
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aimux.disruptor.EventBus} - Publisher and consumer wiring</li>
 *   <li>{@link fr.lapetina.aimux.disruptor.handlers.ListenerDispatchHandler} - Fan-out to registered listeners</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.aimux.disruptor;
