package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.WorkerExecutorProperties;
import com.example.tscribe_backend.exception.JobInterruptedException;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Polls the work queue and hands each claim to {@link JobExecutor}, at most
 * {@code worker.concurrency} at a time. Stops dequeuing on shutdown and force-fails whatever is
 * still running once {@code worker.shutdown-grace} has passed.
 */
@Service
public class WorkerService implements SmartLifecycle {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

    private final WorkQueue queue;
    private final JobExecutor jobExecutor;
    private final RecoveryService recovery;
    private final Executor workerExecutor;
    private final WorkerExecutorProperties properties;
    private final Semaphore slots;
    private final String workerId;

    private volatile boolean accepting = false;

    public WorkerService(WorkQueue queue,
                         JobExecutor jobExecutor,
                         RecoveryService recovery,
                         @Qualifier("workerTaskExecutor") Executor workerExecutor,
                         WorkerExecutorProperties properties) {
        this.queue = queue;
        this.jobExecutor = jobExecutor;
        this.recovery = recovery;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.slots = new Semaphore(properties.effectiveConcurrency());
        this.workerId = properties.resolvedId();
    }

    @Scheduled(fixedDelayString = "${worker.poll-interval-ms:2000}")
    public void poll() {
        if (!properties.isEnabled() || !accepting) {
            return;
        }
        if (!recovery.isComplete()) {
            LOGGER.debug("Worker poll tick - waiting for startup recovery");
            return;
        }
        while (accepting && slots.tryAcquire()) {
            Optional<WorkQueue.Claim> claim;
            try {
                claim = queue.dequeue(workerId, properties.getJobTimeout());
            } catch (RuntimeException e) {
                slots.release();
                LOGGER.warn("Dequeue failed worker={} err={}", workerId, e.toString());
                return;
            }
            if (claim.isEmpty()) {
                slots.release();
                LOGGER.debug("Worker poll tick - queue empty");
                return;
            }
            submit(claim.get());
        }
    }

    private void submit(WorkQueue.Claim claim) {
        LOGGER.info("Worker claimed jobId={} worker={}", claim.jobId(), workerId);
        try {
            workerExecutor.execute(() -> {
                try {
                    jobExecutor.execute(claim);
                } finally {
                    slots.release();
                }
            });
        } catch (TaskRejectedException e) {
            slots.release();
            LOGGER.error("Worker pool rejected jobId={}, returning it to the queue", claim.jobId());
            queue.remove(claim.jobId());
            queue.enqueue(claim.jobId());
        }
    }

    public String workerId() {
        return workerId;
    }

    @Override
    public void start() {
        accepting = true;
        LOGGER.info("Worker started id={} concurrency={} enabled={}", workerId, properties.effectiveConcurrency(), properties.isEnabled());
    }

    @Override
    public void stop() {
        accepting = false;
        int permits = properties.effectiveConcurrency();
        long graceMs = properties.getShutdownGrace().toMillis();
        LOGGER.info("Worker stopping, waiting up to {}ms for {} in-flight job(s)", graceMs, jobExecutor.inFlight());
        try {
            if (slots.tryAcquire(permits, graceMs, TimeUnit.MILLISECONDS)) {
                slots.release(permits);
                LOGGER.info("Worker stopped cleanly");
                return;
            }
            int aborted = jobExecutor.abortAll(new JobInterruptedException(JobExecutor.SHUTDOWN_CAUSE));
            LOGGER.warn("Shutdown grace elapsed, aborted {} job(s)", aborted);
            long unwindMs = properties.getCancelGrace().toMillis() * 2;
            if (slots.tryAcquire(permits, unwindMs, TimeUnit.MILLISECONDS)) {
                slots.release(permits);
            } else {
                LOGGER.warn("Worker stopped with {} job(s) still unwinding", jobExecutor.inFlight());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobExecutor.abortAll(new JobInterruptedException(JobExecutor.SHUTDOWN_CAUSE));
        }
    }

    @Override
    public boolean isRunning() {
        return accepting;
    }

    /** Stops before the executors and the datasource it writes through. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1024;
    }
}
