package com.example.taskflow.scheduling;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A registered (trigger, callback) pair.
 * <p>
 * Owned by {@link JobRegistry}. The schedule keeps running while the job is paused;
 * a paused job's firings are skipped, so resuming picks the original cadence back up.
 */
@Getter
public class ScheduledJob {

    private final String id;
    private final TriggerSpec trigger;

    @Getter(AccessLevel.NONE)
    private final Runnable callback;

    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean enabled = new AtomicBoolean(true);

    @Getter(AccessLevel.NONE)
    private final AtomicLong fireCount = new AtomicLong();

    private volatile Instant lastFiredAt;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.PACKAGE)
    private volatile ScheduledFuture<?> future;

    ScheduledJob(String id, TriggerSpec trigger, Runnable callback, Instant createdAt) {
        this.id = id;
        this.trigger = trigger;
        this.callback = callback;
        this.createdAt = createdAt;
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public long getFireCount() {
        return fireCount.get();
    }

    /**
     * Next time the schedule is due, or null if paused or not scheduled
     */
    public Instant nextFireTime(Instant now) {
        var current = future;
        if (current == null || current.isDone() || !isEnabled()) {
            return null;
        }
        return now.plusMillis(Math.max(0, current.getDelay(TimeUnit.MILLISECONDS)));
    }

    void setEnabled(boolean value) {
        enabled.set(value);
    }

    void run(Instant firedAt) {
        lastFiredAt = firedAt;
        fireCount.incrementAndGet();
        callback.run();
    }

    void cancel() {
        var current = future;
        if (current != null) {
            current.cancel(false);
        }
    }
}
