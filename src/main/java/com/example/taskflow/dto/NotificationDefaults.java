package com.example.taskflow.dto;

final class NotificationDefaults {

    static final String TITLE = "TaskFlow Notification";
    static final String BODY = "";

    private NotificationDefaults() {
    }
}
