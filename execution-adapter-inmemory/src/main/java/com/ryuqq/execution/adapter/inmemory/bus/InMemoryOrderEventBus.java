package com.ryuqq.execution.adapter.inmemory.bus;

import com.ryuqq.execution.core.event.OrderEvent;
import com.ryuqq.execution.core.event.OrderEventListener;
import com.ryuqq.execution.core.spi.OrderEventSource;
import com.ryuqq.execution.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory implementation of {@link OrderEventSource} for testing and reference purposes.
 *
 * <p>Published events are queued and delivered to every subscriber when
 * {@link #dispatchPending()} is called. Deferring delivery mirrors a real exchange, where the
 * acknowledgement of an order arrives after the placing call has returned, and keeps tests
 * deterministic.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Pending Queue:</strong> ConcurrentLinkedQueue&lt;OrderEvent&gt; - FIFO delivery order</li>
 *   <li><strong>Subscribers:</strong> CopyOnWriteArrayList&lt;Registration&gt; - snapshot iteration during delivery</li>
 *   <li><strong>Delivery Failures:</strong> CopyOnWriteArrayList&lt;DeliveryFailure&gt; - listener exceptions</li>
 * </ul>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Fan-out: every subscriber receives every event, in publish order</li>
 *   <li>Isolation: a failing listener is recorded and does not block the others</li>
 *   <li>Idempotent unsubscribe via {@link Subscription#close()}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryOrderEventBus bus = new InMemoryOrderEventBus();
 * Subscription subscription = bus.subscribe(event -&gt; handle(event));
 *
 * bus.publish(new OrderCanceledEvent("order-1", "EX-1", now));
 * bus.dispatchPending(); // handle() runs here
 *
 * subscription.close();
 * </pre>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class InMemoryOrderEventBus implements OrderEventSource {

    private final Logger log;
    private final ConcurrentLinkedQueue<OrderEvent> pending = new ConcurrentLinkedQueue<>();
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final List<DeliveryFailure> failures = new CopyOnWriteArrayList<>();
    private final Object dispatchLock = new Object();

    /**
     * Creates a new bus with the class logger.
     */
    public InMemoryOrderEventBus() {
        this(null);
    }

    /**
     * Creates a new bus.
     *
     * @param logger logger (class logger if null)
     */
    public InMemoryOrderEventBus(Logger logger) {
        this.log = logger != null ? logger : LoggerFactory.getLogger(InMemoryOrderEventBus.class);
    }

    @Override
    public Subscription subscribe(OrderEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Registration registration = new Registration(listener);
        registrations.add(registration);
        return registration;
    }

    /**
     * Queues an event for delivery.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     */
    public void publish(OrderEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        pending.add(event);
    }

    /**
     * Delivers all queued events, in publish order, to the current subscribers.
     *
     * <p>Events published by a listener during delivery are delivered in the same call,
     * after the events already queued.</p>
     *
     * @return number of events delivered
     */
    public int dispatchPending() {
        synchronized (dispatchLock) {
            int delivered = 0;
            OrderEvent event;
            while ((event = pending.poll()) != null) {
                deliver(event);
                delivered++;
            }
            return delivered;
        }
    }

    private void deliver(OrderEvent event) {
        for (Registration registration : registrations) {
            if (registration.closed.get()) {
                continue;
            }
            try {
                registration.listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Order event listener failed for {} (order {})",
                    event.getClass().getSimpleName(), event.orderId(), e);
                failures.add(new DeliveryFailure(event, e, System.currentTimeMillis()));
            }
        }
    }

    /**
     * Clears queued events, subscribers and recorded failures. Used for test cleanup.
     */
    public void clear() {
        pending.clear();
        registrations.clear();
        failures.clear();
    }

    /**
     * Returns the number of events waiting for delivery. Used for test assertions.
     *
     * @return pending count
     */
    public int pendingSize() {
        return pending.size();
    }

    /**
     * Returns the number of active subscribers. Used for test assertions.
     *
     * @return subscriber count
     */
    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Returns the listener failures recorded so far. Used for test assertions.
     *
     * @return list of failures
     */
    public List<DeliveryFailure> getDeliveryFailures() {
        return new ArrayList<>(failures);
    }

    /**
     * A listener failure captured during delivery.
     *
     * @param event the event being delivered
     * @param error the exception thrown by the listener
     * @param failedAt failure timestamp (epoch millis)
     */
    public record DeliveryFailure(OrderEvent event, RuntimeException error, long failedAt) {
    }

    private final class Registration implements Subscription {

        private final OrderEventListener listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Registration(OrderEventListener listener) {
            this.listener = listener;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                registrations.remove(this);
            }
        }
    }
}
