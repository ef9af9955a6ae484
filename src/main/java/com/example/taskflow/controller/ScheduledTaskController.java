package com.example.taskflow.controller;

import com.example.taskflow.dto.CreateScheduledTaskRequest;
import com.example.taskflow.dto.OperationResponse;
import com.example.taskflow.dto.ScheduledTaskListResponse;
import com.example.taskflow.dto.ScheduledTaskResponse;
import com.example.taskflow.service.ScheduledTaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API controller for scheduled task management.
 * <p>
 * Provides endpoints for:
 * - Creating daily summary, weekly report and custom cron tasks
 * - Listing and retrieving tasks
 * - Pausing, resuming and deleting tasks
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/scheduled-tasks")
@Tag(name = "Scheduled Tasks", description = "APIs for managing recurring reminder tasks")
public class ScheduledTaskController {

    private final ScheduledTaskService scheduledTaskService;

    @PostMapping
    @Operation(summary = "Create a scheduled task", description = "Register a recurring task of type daily_summary, weekly_report or custom")
    public ResponseEntity<ScheduledTaskResponse> createTask(@Valid @RequestBody CreateScheduledTaskRequest request) {
        log.info("API: Create scheduled task of type {}", request.getTaskType());
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduledTaskService.createTask(request));
    }

    @GetMapping
    @Operation(summary = "List scheduled tasks", description = "All tasks in creation order")
    public ScheduledTaskListResponse listTasks() {
        return ScheduledTaskListResponse.builder()
                .tasks(scheduledTaskService.listTaskResponses())
                .build();
    }

    @GetMapping("/{taskId}")
    @Operation(summary = "Get scheduled task")
    public ScheduledTaskResponse getTask(@Parameter(description = "Task ID") @PathVariable String taskId) {
        return scheduledTaskService.getTaskResponse(taskId);
    }

    @DeleteMapping("/{taskId}")
    @Operation(summary = "Delete scheduled task", description = "Stop the task's job and remove the task")
    public OperationResponse deleteTask(@Parameter(description = "Task ID") @PathVariable String taskId) {
        log.info("API: Delete scheduled task {}", taskId);
        scheduledTaskService.deleteTask(taskId);
        return OperationResponse.ok("Task deleted successfully");
    }

    @PostMapping("/{taskId}/pause")
    @Operation(summary = "Pause scheduled task", description = "Skip firings until resumed")
    public ScheduledTaskResponse pauseTask(@Parameter(description = "Task ID") @PathVariable String taskId) {
        log.info("API: Pause scheduled task {}", taskId);
        return scheduledTaskService.pauseTask(taskId);
    }

    @PostMapping("/{taskId}/resume")
    @Operation(summary = "Resume scheduled task")
    public ScheduledTaskResponse resumeTask(@Parameter(description = "Task ID") @PathVariable String taskId) {
        log.info("API: Resume scheduled task {}", taskId);
        return scheduledTaskService.resumeTask(taskId);
    }
}
