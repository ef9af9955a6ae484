package com.example.taskflow.service;

import com.example.taskflow.dto.PreferencesResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-user notification preferences, kept in process memory.
 * <p>
 * Preferences are created with defaults on first access and merged on update.
 * {@link #shouldSend(String, String)} fails open: when a flag is missing or the
 * lookup fails, the notification is allowed.
 */
@Slf4j
@Service
public class UserPreferencesService {

    private static final Map<String, Object> DEFAULT_PREFERENCES;

    private static final Map<String, String> CATEGORY_FLAGS = Map.of(
            "task_assignment", "taskAssignment",
            "task_due_date", "taskDueDate",
            "daily_summary", "dailySummary",
            "weekly_summary", "weeklySummary"
    );

    static {
        var defaults = new LinkedHashMap<String, Object>();
        defaults.put("emailNotifications", true);
        defaults.put("pushNotifications", true);
        defaults.put("dailySummary", true);
        defaults.put("weeklySummary", true);
        defaults.put("taskAssignment", true);
        defaults.put("taskDueDate", true);
        defaults.put("emailFrequency", "daily");
        DEFAULT_PREFERENCES = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, Map<String, Object>> preferences = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Get a copy of the user's preferences, storing defaults on first access
     */
    public PreferencesResponse getPreferences(String userId) {
        lock.lock();
        try {
            return PreferencesResponse.builder()
                    .userId(userId)
                    .preferences(new LinkedHashMap<>(getOrCreate(userId)))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Merge a partial update into the user's preferences. Unknown keys are stored as given.
     */
    public void updatePreferences(String userId, Map<String, Object> partial) {
        lock.lock();
        try {
            var current = getOrCreate(userId);
            if (partial != null) {
                current.putAll(partial);
            }
        } finally {
            lock.unlock();
        }
        log.info("Updated preferences for user {}: {}", userId, partial != null ? partial.keySet() : "[]");
    }

    /**
     * Whether a notification of the given category may be sent to the user
     */
    public boolean shouldSend(String userId, String category) {
        try {
            var flag = CATEGORY_FLAGS.getOrDefault(category, category);
            Object value;
            lock.lock();
            try {
                value = getOrCreate(userId).get(flag);
            } finally {
                lock.unlock();
            }
            return !(value instanceof Boolean allowed) || allowed;
        } catch (RuntimeException e) {
            log.warn("Preference lookup failed for user {} category {}, allowing notification: {}",
                    userId, category, e.getMessage());
            return true;
        }
    }

    public static Map<String, Object> defaultPreferences() {
        return DEFAULT_PREFERENCES;
    }

    private Map<String, Object> getOrCreate(String userId) {
        return preferences.computeIfAbsent(userId, id -> {
            log.debug("Creating default preferences for user {}", id);
            return new LinkedHashMap<>(DEFAULT_PREFERENCES);
        });
    }
}
