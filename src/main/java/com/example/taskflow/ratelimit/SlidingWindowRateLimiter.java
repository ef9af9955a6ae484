package com.example.taskflow.ratelimit;

import com.example.taskflow.config.RateLimitProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-client request limiter over a rolling window.
 * <p>
 * Keeps the timestamps of each client's admitted requests. Pruning, the limit
 * check and the append happen under one lock.
 */
@Slf4j
@Component
public class SlidingWindowRateLimiter {

    /**
     * Tracked clients above which idle entries are evicted inline
     */
    static final int EVICTION_THRESHOLD = 10_000;

    private final RateLimitProperties properties;
    private final Clock clock;

    private final Map<String, Deque<Long>> requests = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SlidingWindowRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public record Decision(boolean allowed, long retryAfterSeconds) {
    }

    /**
     * Admit one request for the client if it is under its limit
     */
    public Decision tryAcquire(String clientKey) {
        var now = clock.millis();
        var windowMillis = properties.getWindowSeconds() * 1000L;
        var windowStart = now - windowMillis;

        lock.lock();
        try {
            if (requests.size() >= EVICTION_THRESHOLD) {
                var evicted = evictIdleLocked(windowStart);
                log.debug("Evicted {} idle rate limit entries", evicted);
            }
            var timestamps = requests.computeIfAbsent(clientKey, key -> new ArrayDeque<>());
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= windowStart) {
                timestamps.pollFirst();
            }
            if (timestamps.size() >= properties.getMaxRequests()) {
                var retryAfterMillis = timestamps.peekFirst() + windowMillis - now;
                return new Decision(false, Math.max(1, (retryAfterMillis + 999) / 1000));
            }
            timestamps.addLast(now);
            return new Decision(true, 0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop clients with no request inside the current window
     */
    public int evictIdle() {
        var windowStart = clock.millis() - properties.getWindowSeconds() * 1000L;
        lock.lock();
        try {
            return evictIdleLocked(windowStart);
        } finally {
            lock.unlock();
        }
    }

    private int evictIdleLocked(long windowStart) {
        var before = requests.size();
        requests.values().removeIf(timestamps -> timestamps.isEmpty() || timestamps.peekLast() <= windowStart);
        return before - requests.size();
    }

    public int trackedClients() {
        lock.lock();
        try {
            return requests.size();
        } finally {
            lock.unlock();
        }
    }
}
