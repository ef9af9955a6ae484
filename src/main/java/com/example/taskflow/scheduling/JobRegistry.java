package com.example.taskflow.scheduling;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.exception.DuplicateJobException;
import com.example.taskflow.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of recurring jobs keyed by id.
 * <p>
 * Jobs fire on the scheduler pool. The registry lock guards only the job map,
 * callbacks always run outside it, so management calls never wait on a running
 * callback and a firing never waits on a management call.
 * <p>
 * A callback that throws is logged and counted; its schedule keeps running.
 */
@Slf4j
@Component
public class JobRegistry {

    private final TaskScheduler taskScheduler;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public JobRegistry(@Qualifier("jobTaskScheduler") TaskScheduler taskScheduler, MetricsConfig metricsConfig, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void registerMetrics() {
        metricsConfig.registerGauge("taskflow_jobs_registered", "Number of registered jobs", this, JobRegistry::size);
    }

    /**
     * Register a job under a generated id
     *
     * @return the new job id
     */
    public String add(TriggerSpec trigger, Runnable callback) {
        return add("job_" + UUID.randomUUID(), trigger, callback);
    }

    /**
     * Register a job under the given id
     *
     * @throws DuplicateJobException if the id is already taken
     */
    public String add(String jobId, TriggerSpec trigger, Runnable callback) {
        var springTrigger = trigger.toTrigger();
        var job = new ScheduledJob(jobId, trigger, callback, clock.instant());

        lock.lock();
        try {
            if (jobs.containsKey(jobId)) {
                throw new DuplicateJobException(jobId);
            }
            job.setFuture(taskScheduler.schedule(() -> fire(job), springTrigger));
            jobs.put(jobId, job);
        } finally {
            lock.unlock();
        }

        log.info("Registered job {} ({})", jobId, trigger.describe());
        return jobId;
    }

    /**
     * Stop future firings and discard the job
     *
     * @throws JobNotFoundException if no job has this id
     */
    public void remove(String jobId) {
        ScheduledJob job;
        lock.lock();
        try {
            job = jobs.remove(jobId);
        } finally {
            lock.unlock();
        }

        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        job.cancel();
        log.info("Removed job {}", jobId);
    }

    public void pause(String jobId) {
        getOrThrow(jobId).setEnabled(false);
        log.info("Paused job {}", jobId);
    }

    public void resume(String jobId) {
        getOrThrow(jobId).setEnabled(true);
        log.info("Resumed job {}", jobId);
    }

    public Optional<ScheduledJob> get(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String jobId) {
        return get(jobId).isPresent();
    }

    /**
     * Snapshot of all jobs in registration order
     */
    public List<ScheduledJob> list() {
        lock.lock();
        try {
            return new ArrayList<>(jobs.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        List<ScheduledJob> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(jobs.values());
            jobs.clear();
        } finally {
            lock.unlock();
        }
        snapshot.forEach(ScheduledJob::cancel);
        log.info("Job registry stopped, cancelled {} jobs", snapshot.size());
    }

    private ScheduledJob getOrThrow(String jobId) {
        return get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    void fire(ScheduledJob job) {
        if (!job.isEnabled()) {
            log.debug("Job {} is paused, skipping firing", job.getId());
            metricsConfig.recordJobExecution("skipped");
            return;
        }

        try {
            log.debug("Firing job {}", job.getId());
            job.run(clock.instant());
            metricsConfig.recordJobExecution("success");
        } catch (Exception e) {
            log.error("Job {} callback failed: {}", job.getId(), e.getMessage(), e);
            metricsConfig.recordJobExecution("failure");
        }
    }
}
