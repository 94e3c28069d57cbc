package com.taskwarden.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for task and pool instrumentation events.
 *
 * <p>Every event travels on exactly one keyed channel: its task's channel when it carries a
 * {@code taskId}, otherwise the channel of the pool named by its {@code source}. Wildcard
 * subscribers see everything. Delivery is synchronous on the publishing thread; a failing
 * subscriber is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<TaskwardenEvent>>> taskChannels = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<TaskwardenEvent>>> poolChannels = new ConcurrentHashMap<>();
    private final List<Consumer<TaskwardenEvent>> wildcard = new CopyOnWriteArrayList<>();

    public void publish(TaskwardenEvent event) {
        log.debug("Event {} (task={}, source={})", event.eventType(), event.taskId(), event.source());

        List<Consumer<TaskwardenEvent>> channel = event.taskId() != null
                ? taskChannels.get(event.taskId())
                : event.source() != null ? poolChannels.get(event.source()) : null;
        if (channel != null) {
            channel.forEach(subscriber -> deliver(subscriber, event));
        }
        wildcard.forEach(subscriber -> deliver(subscriber, event));
    }

    /** Events of one task: agent text, completion decisions, the final outcome. */
    public Subscription subscribe(String taskId, Consumer<TaskwardenEvent> consumer) {
        return join(taskChannels, taskId, consumer);
    }

    /** Task-less events published by the pool with the given name. */
    public Subscription subscribePool(String poolName, Consumer<TaskwardenEvent> consumer) {
        return join(poolChannels, poolName, consumer);
    }

    public Subscription subscribeAll(Consumer<TaskwardenEvent> consumer) {
        wildcard.add(consumer);
        return () -> wildcard.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static Subscription join(Map<String, List<Consumer<TaskwardenEvent>>> channels, String key,
                                     Consumer<TaskwardenEvent> consumer) {
        channels.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> channels.computeIfPresent(key, (k, subscribers) -> {
            subscribers.remove(consumer);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    private static void deliver(Consumer<TaskwardenEvent> subscriber, TaskwardenEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
