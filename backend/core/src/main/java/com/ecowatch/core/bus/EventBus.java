package com.ecowatch.core.bus;

import com.ecowatch.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publish/subscribe.
 *
 * <p>Handlers registered for {@link Event} itself receive every published event. A failing
 * handler is reported to the error callback and does not stop delivery to the others.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? extends Event>>> subscribers =
            new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void subscribeAll(Consumer<Event> handler) {
        subscribe(Event.class, handler);
    }

    public void publish(Event event) {
        deliver(subscribers.getOrDefault(event.getClass(), List.of()), event);
        if (event.getClass() != Event.class) {
            deliver(subscribers.getOrDefault(Event.class, List.of()), event);
        }
    }

    private void deliver(List<Consumer<? extends Event>> handlers, Event event) {
        for (Consumer<? extends Event> rawHandler : handlers) {
            invokeHandler(rawHandler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void invokeHandler(Consumer<? extends Event> rawHandler, Event event) {
        try {
            ((Consumer<T>) rawHandler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
