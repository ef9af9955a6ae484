package com.example.taskflow.service;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.domain.enums.TaskType;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.dto.CreateScheduledTaskRequest;
import com.example.taskflow.dto.ScheduledTaskResponse;
import com.example.taskflow.exception.TaskNotFoundException;
import com.example.taskflow.mapper.TaskMapper;
import com.example.taskflow.scheduling.JobRegistry;
import com.example.taskflow.service.executor.ScheduledTaskRunner;
import com.example.taskflow.service.handler.TaskHandlerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Service for managing user-defined scheduled tasks.
 * <p>
 * Provides:
 * - Task creation, each task backed by one registry job under the task's id
 * - Listing and lookup
 * - Pause/resume and deletion, always going through the registry first
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledTaskService {

    private final JobRegistry jobRegistry;
    private final TaskHandlerRegistry handlerRegistry;
    private final ScheduledTaskRunner taskRunner;
    private final TaskMapper taskMapper;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<String, ScheduledTask> tasks = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();

    @PostConstruct
    public void registerMetrics() {
        metricsConfig.registerGauge("taskflow_scheduled_tasks", "Number of scheduled tasks", this, ScheduledTaskService::taskCount);
    }

    // === Task Creation ===

    public ScheduledTaskResponse createTask(CreateScheduledTaskRequest request) {
        return toResponse(createTask(request.getTaskType(), request.getSchedule(), request.getParameters(), request.getDescription()));
    }

    /**
     * Create a task and register its job.
     *
     * @throws IllegalArgumentException for an unknown task type or bad parameters
     * @throws com.example.taskflow.exception.InvalidTriggerException if no trigger can be built
     */
    public ScheduledTask createTask(String taskType, String schedule, Map<String, Object> parameters, String description) {
        var type = TaskType.fromCode(taskType);
        var handler = handlerRegistry.getHandlerOrThrow(type);

        var task = ScheduledTask.builder()
                .taskType(type)
                .schedule(schedule)
                .parameters(parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>())
                .description(description != null ? description : "")
                .enabled(true)
                .createdAt(clock.instant())
                .build();

        handler.validate(task);
        var trigger = handler.buildTrigger(task);

        var taskId = "scheduled_task_" + sequence.incrementAndGet();
        task.setTaskId(taskId);
        task.setTrigger(trigger.describe());
        task.setJobId(jobRegistry.add(taskId, trigger, () -> taskRunner.run(task)));

        lock.lock();
        try {
            tasks.put(taskId, task);
        } finally {
            lock.unlock();
        }

        log.info("Created scheduled task {} of type {} ({})", taskId, type.getCode(), task.getTrigger());
        return task;
    }

    // === Task Queries ===

    /**
     * Snapshot of all tasks in creation order
     */
    public List<ScheduledTask> listTasks() {
        lock.lock();
        try {
            return new ArrayList<>(tasks.values());
        } finally {
            lock.unlock();
        }
    }

    public List<ScheduledTaskResponse> listTaskResponses() {
        return listTasks().stream().map(this::toResponse).toList();
    }

    public ScheduledTask getTask(String taskId) {
        lock.lock();
        try {
            var task = tasks.get(taskId);
            if (task == null) {
                throw new TaskNotFoundException(taskId);
            }
            return task;
        } finally {
            lock.unlock();
        }
    }

    public ScheduledTaskResponse getTaskResponse(String taskId) {
        return toResponse(getTask(taskId));
    }

    // === Status Management ===

    /**
     * Remove the task's job, then the task. The record stays if the job cannot be removed.
     */
    public void deleteTask(String taskId) {
        var task = getTask(taskId);
        jobRegistry.remove(task.getJobId());

        lock.lock();
        try {
            tasks.remove(taskId);
        } finally {
            lock.unlock();
        }
        log.info("Deleted scheduled task {}", taskId);
    }

    public ScheduledTaskResponse pauseTask(String taskId) {
        var task = getTask(taskId);
        jobRegistry.pause(task.getJobId());
        task.setEnabled(false);
        log.info("Paused scheduled task {}", taskId);
        return toResponse(task);
    }

    public ScheduledTaskResponse resumeTask(String taskId) {
        var task = getTask(taskId);
        jobRegistry.resume(task.getJobId());
        task.setEnabled(true);
        log.info("Resumed scheduled task {}", taskId);
        return toResponse(task);
    }

    public int taskCount() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    private ScheduledTaskResponse toResponse(ScheduledTask task) {
        var nextRunAt = jobRegistry.get(task.getJobId())
                .map(job -> job.nextFireTime(clock.instant()))
                .orElse(null);
        return taskMapper.toResponse(task, nextRunAt);
    }
}
