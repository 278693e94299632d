package com.releasewatch.core.bus;

import com.releasewatch.core.events.Event;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe for operational events. A handler receives every published event
 * that is an instance of the type it subscribed to, so subscribing to {@link Event} sees all of
 * them. Handlers run on the publishing thread in subscription order; a failing handler is
 * reported to the error callback and never reaches the publisher.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final CopyOnWriteArrayList<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> Subscription subscribe(Class<T> type, Consumer<? super T> handler) {
        Registration<T> registration = new Registration<>(type, handler);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public void publish(Event event) {
        for (Registration<?> registration : registrations) {
            try {
                registration.offer(event);
            } catch (Exception ex) {
                onHandlerError.accept(event, ex);
            }
        }
    }

    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Handle returned by {@link #subscribe}; cancelling stops further deliveries.
     */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private static final class Registration<T extends Event> {
        private final Class<T> type;
        private final Consumer<? super T> handler;

        private Registration(Class<T> type, Consumer<? super T> handler) {
            this.type = type;
            this.handler = handler;
        }

        void offer(Event event) {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        }
    }
}
