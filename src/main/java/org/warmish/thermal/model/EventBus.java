package org.warmish.thermal.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * EventBus
 *
 * <p>Simple message bus for decoupled communication between the engine, the ROI controller
 * and whatever displays their results:
 *   - Components subscribe to an event type ({@link RoiEvent}, {@link EngineEvent}, ...).
 *   - Posting is synchronous: every matching subscriber runs on the caller's thread before
 *     {@link #post(Object)} returns.
 *   - A subscriber that throws is logged and skipped; the remaining subscribers still run.</p>
 *
 * <p>Because delivery is synchronous, a subscriber may call straight back into the component
 * that posted the event. {@link org.warmish.thermal.controller.RoiController} relies on its
 * own reentrancy guard for that case; the bus does not try to detect cycles.</p>
 */
public class EventBus {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

    /**
     * Handle returned by {@link #subscribe(Class, Consumer)}; closing it removes the subscriber.
     */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Registration<T> {
        private final Class<T> eventType;
        private final Consumer<? super T> handler;

        private Registration(Class<T> eventType, Consumer<? super T> handler) {
            this.eventType = eventType;
            this.handler = handler;
        }

        private boolean accepts(Object event) {
            return eventType.isInstance(event);
        }

        private void deliver(Object event) {
            handler.accept(eventType.cast(event));
        }
    }

    /**
     * Registers a handler for every posted event that is an instance of {@code eventType}.
     *
     * @param eventType event class to listen for (subclasses are delivered too)
     * @param handler   callback, invoked synchronously on the posting thread
     * @return subscription that can be closed to stop delivery
     */
    public <T> Subscription subscribe(Class<T> eventType, Consumer<? super T> handler) {
        if (eventType == null || handler == null) {
            throw new IllegalArgumentException("Event type and handler must not be null");
        }
        Registration<T> registration = new Registration<>(eventType, handler);
        registrations.add(registration);
        logger.debug("Subscribed handler for {} ({} subscribers total)",
                eventType.getSimpleName(), registrations.size());
        return () -> {
            if (registrations.remove(registration)) {
                logger.debug("Unsubscribed handler for {}", eventType.getSimpleName());
            }
        };
    }

    /**
     * Delivers an event to all matching subscribers in registration order.
     *
     * @param event the event to deliver; null is ignored
     * @return number of subscribers that received the event without throwing
     */
    public int post(Object event) {
        if (event == null) {
            logger.warn("Ignoring null event");
            return 0;
        }
        // Snapshot so that handlers subscribing during delivery only see later events
        List<Registration<?>> targets = new ArrayList<>();
        for (Registration<?> registration : registrations) {
            if (registration.accepts(event)) {
                targets.add(registration);
            }
        }

        int delivered = 0;
        for (Registration<?> registration : targets) {
            try {
                registration.deliver(event);
                delivered++;
            } catch (RuntimeException e) {
                logger.error("Subscriber for {} failed while handling {}",
                        registration.eventType.getSimpleName(), event, e);
            }
        }
        return delivered;
    }

    /**
     * @return number of live subscriptions
     */
    public int getSubscriberCount() {
        return registrations.size();
    }
}
