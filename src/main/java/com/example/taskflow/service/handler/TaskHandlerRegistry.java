package com.example.taskflow.service.handler;

import com.example.taskflow.domain.enums.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each task type to the one handler that builds its trigger and runs its firings.
 * <p>
 * Handler beans are collected at startup; two handlers claiming the same task type
 * stop the context from starting.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final List<TaskHandler> handlerBeans;

    public TaskHandlerRegistry(List<TaskHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var existing = handlers.putIfAbsent(handler.getTaskType(), handler);
            if (existing != null) {
                throw new IllegalStateException(String.format("Task type %s is claimed by both %s and %s",
                        handler.getTaskType().getCode(),
                        existing.getClass().getSimpleName(),
                        handler.getClass().getSimpleName()));
            }
        }

        var unhandled = EnumSet.allOf(TaskType.class);
        unhandled.removeAll(handlers.keySet());
        if (!unhandled.isEmpty()) {
            log.warn("Task types without a handler, creating them will fail: {}", unhandled);
        }
        log.info("Task handlers ready for {}", handlers.keySet());
    }

    public Optional<TaskHandler> getHandler(TaskType taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    /**
     * @throws IllegalArgumentException if no handler is registered for the type
     */
    public TaskHandler getHandlerOrThrow(TaskType taskType) {
        return getHandler(taskType).orElseThrow(() -> new IllegalArgumentException("No handler registered for task type: " + taskType));
    }
}
