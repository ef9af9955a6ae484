package com.example.taskflow.service.executor;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.service.alert.SlackAlertService;
import com.example.taskflow.service.handler.TaskExecutionResult;
import com.example.taskflow.service.handler.TaskHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Runs one firing of a scheduled task.
 * <p>
 * Handles:
 * - Handler lookup and invocation
 * - Run bookkeeping on the task (last run, last error, run count)
 * - Metrics recording
 * - Slack alert on failure
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledTaskRunner {

    private final TaskHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Execute a task with full bookkeeping. Never throws.
     *
     * @return true if execution was successful
     */
    public boolean run(ScheduledTask task) {
        var taskId = task.getTaskId();
        log.info("Starting execution of task {} (type: {})", taskId, task.getTaskType());

        var timerSample = metricsConfig.startTaskExecutionTimer();
        TaskExecutionResult result;
        try {
            var handler = handlerRegistry.getHandlerOrThrow(task.getTaskType());
            result = handler.execute(task);
        } catch (Exception e) {
            log.error("Unexpected error executing task {}: {}", taskId, e.getMessage(), e);
            result = TaskExecutionResult.failure(e);
        }

        task.recordRun(clock.instant(), result.isSuccess() ? null : result.getErrorMessage());
        metricsConfig.recordTaskExecution(timerSample, task.getTaskType(), result.isSuccess());

        if (result.isSuccess()) {
            if (result.isSuppressed()) {
                log.info("Task {} ran without sending: {}", taskId, result.getNotes());
            } else {
                log.info("Task {} completed successfully", taskId);
            }
            return true;
        }

        log.warn("Task {} failed: {} ({})", taskId, result.getErrorMessage(), result.getErrorType());
        metricsConfig.recordTaskFailure(task.getTaskType(), result.getErrorType());
        slackAlertService.sendTaskFailureAlert(task, result.getErrorMessage());
        return false;
    }
}
