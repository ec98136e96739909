package com.stagehand.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for pipeline status changes.
 *
 * Delivery is synchronous on the publishing thread. A listener that throws is
 * logged and skipped; the remaining listeners still receive the event.
 */
@Component
public class PipelineEventBus {

    private static final Logger log = LoggerFactory.getLogger(PipelineEventBus.class);

    private final List<Consumer<PipelineEvent>>              global = new CopyOnWriteArrayList<>();
    private final Map<String, List<Consumer<PipelineEvent>>> byTask = new ConcurrentHashMap<>();

    /** Receive every event. Closing the returned handle unsubscribes. */
    public Subscription subscribe(Consumer<PipelineEvent> listener) {
        global.add(listener);
        return () -> global.remove(listener);
    }

    /** Receive events for one task only. */
    public Subscription subscribe(String taskId, Consumer<PipelineEvent> listener) {
        List<Consumer<PipelineEvent>> listeners =
                byTask.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>());
        listeners.add(listener);
        return () -> {
            listeners.remove(listener);
            byTask.computeIfPresent(taskId, (k, v) -> v.isEmpty() ? null : v);
        };
    }

    public void publish(PipelineEvent event) {
        log.debug("{} task={} execution={} {} -> {}", event.type(), event.taskId(),
                event.executionId(), event.fromStatus(), event.toStatus());
        deliver(global, event);
        List<Consumer<PipelineEvent>> listeners = byTask.get(event.taskId());
        if (listeners != null) deliver(listeners, event);
    }

    private static void deliver(List<Consumer<PipelineEvent>> listeners, PipelineEvent event) {
        for (Consumer<PipelineEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Pipeline listener failed on {} for task {}: {}",
                        event.type(), event.taskId(), e.getMessage(), e);
            }
        }
    }

    /** Handle returned by subscribe; closing it is idempotent. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
