package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.WorkerExecutorProperties;
import com.example.tscribe_backend.dto.TranscriptSegment;
import com.example.tscribe_backend.exception.InfrastructureException;
import com.example.tscribe_backend.exception.JobRecordGoneException;
import com.example.tscribe_backend.repository.JobRepository;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptFormats;
import com.example.tscribe_backend.util.TranscriptSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Worker-side writes to the job record. Each write is a guarded update, retried with exponential
 * backoff when the store is briefly unavailable.
 * <ul>
 *     <li>returns {@code true} when the row changed,</li>
 *     <li>returns {@code false} when the guard rejected it (job already moved on),</li>
 *     <li>throws {@link JobRecordGoneException} when the record was deleted,</li>
 *     <li>throws {@link InfrastructureException} once the retry budget is spent.</li>
 * </ul>
 */
@Component
public class JobStateWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobStateWriter.class);

    private final JobRepository jobRepository;
    private final Clock clock;
    private final WorkerExecutorProperties.StoreRetry retry;

    public JobStateWriter(JobRepository jobRepository, Clock clock, WorkerExecutorProperties properties) {
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.retry = properties.getStoreRetry();
    }

    public boolean markDownloading(UUID jobId) {
        return write(jobId, "markDownloading", () -> jobRepository.markDownloading(jobId, clock.instant()));
    }

    public boolean markTranscribing(UUID jobId, String title, Double durationSeconds) {
        return write(jobId, "markTranscribing",
                () -> jobRepository.markTranscribing(jobId, title, durationSeconds, clock.instant()));
    }

    /** Monotonic: values at or below the stored progress are rejected by the guard. */
    public boolean updateProgress(UUID jobId, int progress) {
        int p = Math.max(0, Math.min(100, progress));
        return write(jobId, "updateProgress", () -> jobRepository.updateProgress(jobId, p, clock.instant()));
    }

    public boolean markDone(UUID jobId,
                            JobStatus from,
                            String text,
                            List<TranscriptSegment> segments,
                            TranscriptSource source,
                            String detectedLanguage,
                            String title,
                            Double durationSeconds) {
        String segmentsJson = TranscriptFormats.writeSegments(segments);
        return write(jobId, "markDone", () -> jobRepository.markDone(
                jobId, from, text, segmentsJson, source, detectedLanguage, title, durationSeconds, clock.instant()));
    }

    public boolean markFailed(UUID jobId, String error) {
        String cause = (error == null || error.isBlank()) ? "Unknown error" : error;
        return write(jobId, "markFailed", () -> jobRepository.markFailed(jobId, cause, clock.instant()));
    }

    private boolean write(UUID jobId, String op, Supplier<Integer> update) {
        int rows = withRetry(op, update);
        if (rows > 0) {
            return true;
        }
        if (!withRetry(op + "/exists", () -> jobRepository.existsById(jobId))) {
            throw new JobRecordGoneException(jobId);
        }
        LOGGER.debug("{} rejected by status guard jobId={}", op, jobId);
        return false;
    }

    private <T> T withRetry(String op, Supplier<T> call) {
        try {
            return Mono.fromSupplier(call)
                    .retryWhen(Retry.backoff(Math.max(0, retry.getMaxAttempts() - 1), retry.getBackoff())
                            .filter(JobStateWriter::isTransient)
                            .doBeforeRetry(s -> LOGGER.warn("Store write {} failed (attempt {}), retrying: {}",
                                    op, s.totalRetries() + 1, s.failure().toString()))
                            .onRetryExhaustedThrow((spec, signal) -> new InfrastructureException(
                                    "record store unavailable during " + op + ": " + signal.failure().getMessage(),
                                    signal.failure())))
                    .block();
        } catch (DataAccessException e) {
            throw new InfrastructureException("record store rejected " + op + ": " + e.getMessage(), e);
        }
    }

    static boolean isTransient(Throwable t) {
        return t instanceof TransientDataAccessException
                || t instanceof RecoverableDataAccessException
                || t instanceof DataAccessResourceFailureException
                || t instanceof CannotCreateTransactionException;
    }
}
