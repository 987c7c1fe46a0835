package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.WorkerExecutorProperties;
import com.example.tscribe_backend.exception.DownloadException;
import com.example.tscribe_backend.exception.InfrastructureException;
import com.example.tscribe_backend.exception.JobDeadlineExceededException;
import com.example.tscribe_backend.exception.JobInterruptedException;
import com.example.tscribe_backend.exception.JobRecordGoneException;
import com.example.tscribe_backend.exception.TranscriptionException;
import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.repository.JobRepository;
import com.example.tscribe_backend.service.Interfaces.StorageService;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one claimed job from dequeue to release. The pipeline runs on a separate phase thread so the
 * deadline (or a shutdown) can interrupt it; any subprocess it started is killed with it. Whatever
 * happens, the job ends in a terminal state, its workspace is deleted and its queue entry is
 * acknowledged.
 */
@Component
public class JobExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobExecutor.class);
    static final String SHUTDOWN_CAUSE = "Job interrupted by worker shutdown";
    private static final String MDC_JOB_ID = "jobId";

    private final JobRepository jobRepository;
    private final StorageService storage;
    private final WorkQueue queue;
    private final TranscriptionPipeline pipeline;
    private final JobStateWriter stateWriter;
    private final AsyncTaskExecutor phaseExecutor;
    private final WorkerExecutorProperties properties;
    private final Clock clock;

    private final Map<UUID, RunningJob> running = new ConcurrentHashMap<>();

    public JobExecutor(JobRepository jobRepository,
                       StorageService storage,
                       WorkQueue queue,
                       TranscriptionPipeline pipeline,
                       JobStateWriter stateWriter,
                       @Qualifier("jobPhaseExecutor") AsyncTaskExecutor phaseExecutor,
                       WorkerExecutorProperties properties,
                       Clock clock) {
        this.jobRepository = jobRepository;
        this.storage = storage;
        this.queue = queue;
        this.pipeline = pipeline;
        this.stateWriter = stateWriter;
        this.phaseExecutor = phaseExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public void execute(WorkQueue.Claim claim) {
        UUID jobId = claim.jobId();
        MDC.put(MDC_JOB_ID, jobId.toString());
        long t0 = System.nanoTime();
        JobWorkspace workspace = null;
        try {
            Optional<Job> record = jobRepository.findById(jobId);
            if (record.isEmpty()) {
                LOGGER.warn("Claimed job has no record, dropping jobId={}", jobId);
                return;
            }
            Job job = record.get();
            if (job.getStatus() != JobStatus.QUEUED) {
                LOGGER.warn("Claimed job is not QUEUED, dropping jobId={} status={}", jobId, job.getStatus());
                return;
            }

            LOGGER.info("JOB START jobId={} url={} deadline={}", jobId, job.getUrl(), claim.deadline());
            workspace = storage.openWorkspace(jobId);
            PhaseResult result = runUntilDeadline(job, workspace, claim.deadline());
            finish(jobId, result, t0);
        } catch (RuntimeException e) {
            LOGGER.error("Job {} failed outside the pipeline: {}", jobId, e.toString(), e);
            fail(jobId, failureCause(e), t0);
        } finally {
            if (workspace != null) {
                workspace.release();
            }
            try {
                queue.acknowledge(jobId);
            } catch (RuntimeException e) {
                LOGGER.warn("Queue acknowledge failed jobId={} err={}", jobId, e.toString());
            }
            MDC.remove(MDC_JOB_ID);
        }
    }

    /** Cancels every in-flight job with {@code reason}; each ends FAILED through the normal path. */
    public int abortAll(RuntimeException reason) {
        int n = 0;
        for (RunningJob job : running.values()) {
            if (job.abort(reason)) {
                n++;
            }
        }
        return n;
    }

    public int inFlight() {
        return running.size();
    }

    private PhaseResult runUntilDeadline(Job job, JobWorkspace workspace, Instant deadline) {
        UUID jobId = job.getId();
        RunningJob run = new RunningJob();
        run.future = phaseExecutor.submit(() -> {
            MDC.put(MDC_JOB_ID, jobId.toString());
            try {
                return pipeline.run(job, workspace);
            } finally {
                MDC.remove(MDC_JOB_ID);
                run.finished.countDown();
            }
        });
        running.put(jobId, run);
        try {
            long waitMs = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
            try {
                return PhaseResult.done(run.future.get(waitMs, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                run.abort(new JobDeadlineExceededException(properties.getJobTimeout()));
            } catch (CancellationException e) {
                LOGGER.debug("Phase thread cancelled jobId={}", jobId);
            } catch (ExecutionException e) {
                if (run.reason.get() == null) {
                    return PhaseResult.failed(e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.abort(new JobInterruptedException(SHUTDOWN_CAUSE));
            }

            awaitUnwind(jobId, run);
            return PhaseResult.failed(run.reason.get());
        } finally {
            running.remove(jobId);
        }
    }

    private void awaitUnwind(UUID jobId, RunningJob run) {
        try {
            if (!run.finished.await(properties.getCancelGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Phase thread did not stop within {}s jobId={}", properties.getCancelGrace().toSeconds(), jobId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void finish(UUID jobId, PhaseResult result, long t0) {
        if (result.failure() == null) {
            if (result.source().isPresent()) {
                LOGGER.info("JOB DONE jobId={} source={} in={}ms", jobId, result.source().get().wireName(), elapsedMs(t0));
            } else {
                LOGGER.info("JOB ENDED jobId={} without result, state was changed elsewhere in={}ms", jobId, elapsedMs(t0));
            }
            return;
        }
        Throwable failure = result.failure();
        if (failure instanceof JobRecordGoneException) {
            LOGGER.info("JOB ABANDONED jobId={} record was deleted in={}ms", jobId, elapsedMs(t0));
            return;
        }
        if (!(failure instanceof DownloadException || failure instanceof TranscriptionException
                || failure instanceof JobDeadlineExceededException || failure instanceof JobInterruptedException)) {
            LOGGER.error("Job {} failed: {}", jobId, failure.toString(), failure);
        }
        fail(jobId, failureCause(failure), t0);
    }

    private void fail(UUID jobId, String cause, long t0) {
        try {
            if (stateWriter.markFailed(jobId, cause)) {
                LOGGER.info("JOB FAILED jobId={} cause={} in={}ms", jobId, cause, elapsedMs(t0));
            } else {
                LOGGER.info("Job already terminal, failure not recorded jobId={} cause={}", jobId, cause);
            }
        } catch (JobRecordGoneException e) {
            LOGGER.info("JOB ABANDONED jobId={} record was deleted", jobId);
        } catch (RuntimeException e) {
            LOGGER.error("Could not record failure jobId={} cause={} err={}", jobId, cause, e.toString());
        }
    }

    /** The user-visible error for a failed job. Never empty. */
    static String failureCause(Throwable t) {
        if (t instanceof DownloadException) {
            return "Download failed: " + t.getMessage();
        }
        if (t instanceof TranscriptionException) {
            return "Transcription failed: " + t.getMessage();
        }
        if (t instanceof JobDeadlineExceededException || t instanceof JobInterruptedException) {
            return t.getMessage();
        }
        if (t instanceof InfrastructureException || t instanceof DataAccessException) {
            return "Infrastructure error: " + t.getMessage();
        }
        return "Internal error: " + t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }

    private record PhaseResult(Optional<TranscriptSource> source, Throwable failure) {
        static PhaseResult done(Optional<TranscriptSource> source) {
            return new PhaseResult(source == null ? Optional.empty() : source, null);
        }

        static PhaseResult failed(Throwable failure) {
            return new PhaseResult(Optional.empty(), failure);
        }
    }

    private static final class RunningJob {
        private volatile Future<Optional<TranscriptSource>> future;
        private final AtomicReference<RuntimeException> reason = new AtomicReference<>();
        private final CountDownLatch finished = new CountDownLatch(1);

        boolean abort(RuntimeException why) {
            if (!reason.compareAndSet(null, why)) {
                return false;
            }
            Future<?> f = future;
            if (f != null) {
                f.cancel(true);
            }
            return true;
        }
    }
}
