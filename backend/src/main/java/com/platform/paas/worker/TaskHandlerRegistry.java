package com.platform.paas.worker;

import com.platform.paas.queue.TaskKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handlers indexed by the task kind they execute.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {
    
    private final Map<TaskKind, TaskHandler> handlers;
    
    public TaskHandlerRegistry(List<TaskHandler> handlers) {
        Map<TaskKind, TaskHandler> byKind = new EnumMap<>(TaskKind.class);
        for (TaskHandler handler : handlers) {
            TaskHandler previous = byKind.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException(String.format("Two handlers for %s: %s and %s",
                    handler.kind(), previous.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
        }
        this.handlers = Collections.unmodifiableMap(byKind);
        for (TaskKind kind : TaskKind.values()) {
            if (!byKind.containsKey(kind)) {
                log.warn("No handler registered for task kind {}", kind);
            }
        }
        log.info("Registered {} task handler(s)", byKind.size());
    }
    
    public Optional<TaskHandler> find(TaskKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }
}
