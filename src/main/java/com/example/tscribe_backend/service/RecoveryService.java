package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.WorkerExecutorProperties;
import com.example.tscribe_backend.exception.JobRecordGoneException;
import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.repository.JobRepository;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import com.example.tscribe_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reconciliation between the job table and the work queue. At startup, jobs left mid-phase by a dead
 * worker are failed and QUEUED jobs the queue lost are re-enqueued. A claim is left alone only while
 * its deadline has not passed and its owner may still be running: another host, or a process on this
 * host that is still alive. A periodic pass fails jobs whose claim deadline ran out, which covers
 * workers on other hosts that died without coming back.
 */
@Service
public class RecoveryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecoveryService.class);
    static final String RESTART_CAUSE = "Job interrupted by worker restart";
    static final String LEASE_EXPIRED_CAUSE = "Job interrupted: owning worker stopped before the deadline";

    private final JobRepository jobRepository;
    private final WorkQueue queue;
    private final JobStateWriter stateWriter;
    private final WorkerExecutorProperties properties;
    private final Clock clock;
    private final AtomicBoolean complete = new AtomicBoolean(false);

    public RecoveryService(JobRepository jobRepository,
                           WorkQueue queue,
                           JobStateWriter stateWriter,
                           WorkerExecutorProperties properties,
                           Clock clock) {
        this.jobRepository = jobRepository;
        this.queue = queue;
        this.stateWriter = stateWriter;
        this.properties = properties;
        this.clock = clock;
    }

    public record RecoveryReport(int failed, int requeued) {}

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        try {
            if (!properties.getRecovery().isEnabled()) {
                LOGGER.info("Startup recovery disabled");
                return;
            }
            RecoveryReport report = reconcile();
            LOGGER.info("Startup recovery done failed={} requeued={}", report.failed(), report.requeued());
        } catch (RuntimeException e) {
            LOGGER.error("Startup recovery failed: {}", e.toString(), e);
        } finally {
            complete.set(true);
        }
    }

    /** Whether the worker loop may start dequeuing. */
    public boolean isComplete() {
        return complete.get();
    }

    @Scheduled(fixedDelayString = "${worker.recovery.reap-interval:PT5M}",
            initialDelayString = "${worker.recovery.reap-interval:PT5M}")
    public void scheduledReap() {
        if (!properties.getRecovery().isEnabled() || !complete.get()) {
            return;
        }
        try {
            int failed = reapExpired();
            if (failed > 0) {
                LOGGER.warn("Failed {} job(s) with expired claims", failed);
            }
        } catch (RuntimeException e) {
            LOGGER.error("Expired claim pass failed: {}", e.toString(), e);
        }
    }

    /**
     * Fails non-terminal jobs whose claim deadline passed more than the cancel grace ago. By then the
     * owning executor, if it were alive, would already have recorded its own deadline failure.
     */
    public int reapExpired() {
        Instant cutoff = clock.instant().minus(properties.getCancelGrace());
        int failed = 0;
        for (Job job : jobRepository.findByStatusIn(JobStatus.NON_TERMINAL)) {
            Optional<WorkQueue.Claim> claim = queue.claimOf(job.getId());
            if (claim.isEmpty() || claim.get().deadline() == null || claim.get().deadline().isAfter(cutoff)) {
                continue;
            }
            if (failInterrupted(job, LEASE_EXPIRED_CAUSE)) {
                failed++;
            }
        }
        return failed;
    }

    public RecoveryReport reconcile() {
        String self = properties.resolvedId();
        List<Job> open = jobRepository.findByStatusIn(JobStatus.NON_TERMINAL).stream()
                .sorted(Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        int failed = 0;
        int requeued = 0;

        for (Job job : open) {
            Optional<WorkQueue.Claim> claim = queue.claimOf(job.getId());
            if (claim.isPresent() && heldByLiveWorker(claim.get(), self)) {
                LOGGER.debug("Job owned by another worker, skipping jobId={} owner={}", job.getId(), claim.get().owner());
                continue;
            }
            switch (job.getStatus()) {
                case DOWNLOADING, TRANSCRIBING -> {
                    if (failInterrupted(job, RESTART_CAUSE)) {
                        failed++;
                    }
                }
                case QUEUED -> {
                    if (claim.isPresent()) {
                        if (failInterrupted(job, RESTART_CAUSE)) {
                            failed++;
                        }
                    } else if (queue.stateOf(job.getId()) == WorkQueue.EntryState.ABSENT) {
                        queue.enqueue(job.getId());
                        requeued++;
                        LOGGER.info("Re-enqueued orphaned job jobId={}", job.getId());
                    }
                }
                default -> { }
            }
        }
        return new RecoveryReport(failed, requeued);
    }

    private boolean heldByLiveWorker(WorkQueue.Claim claim, String self) {
        String owner = claim.owner();
        if (owner == null || owner.equals(self)) {
            return false;
        }
        if (claim.deadline() == null || !claim.deadline().isAfter(clock.instant())) {
            return false;
        }
        OptionalLong pid = localPidOf(owner, WorkerExecutorProperties.localHost());
        return pid.isEmpty() || processAlive(pid.getAsLong());
    }

    /** The pid in an owner tag of the form {@code <host>:<pid>} when {@code host} is this machine. */
    static OptionalLong localPidOf(String owner, String host) {
        int sep = owner.lastIndexOf(':');
        if (sep <= 0 || !owner.substring(0, sep).equals(host)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(owner.substring(sep + 1)));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    protected boolean processAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private boolean failInterrupted(Job job, String cause) {
        boolean written;
        try {
            written = stateWriter.markFailed(job.getId(), cause);
        } catch (JobRecordGoneException e) {
            written = false;
        }
        queue.remove(job.getId());
        if (written) {
            LOGGER.warn("Failed interrupted job jobId={} status={} cause={}", job.getId(), job.getStatus(), cause);
        }
        return written;
    }
}
