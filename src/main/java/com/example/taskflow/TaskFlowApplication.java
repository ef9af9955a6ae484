package com.example.taskflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TaskFlow Backend Application
 * <p>
 * HTTP backend for the TaskFlow app that forwards push notifications to
 * Firebase Cloud Messaging and runs recurring reminder jobs.
 * <p>
 * Features:
 * - Firebase ID token login exchanged for a short-lived session JWT
 * - Single, topic and bulk push delivery with per-token failure detail
 * - Recurring jobs (interval, daily, weekly, cron) with pause/resume
 * - Per-user notification preferences and activity rollups
 * - Per-client sliding window rate limiting
 */
@SpringBootApplication
public class TaskFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskFlowApplication.class, args);
    }
}
