package com.example.tscribe_backend.repository;

import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptSource;
import jakarta.transaction.Transactional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Every state-changing update is guarded by the statuses it may leave from, so a late or illegal
 * transition (e.g. a pipeline finishing after its deadline already failed the job) updates nothing.
 * Callers treat a zero row count as "rejected" and check {@link #existsById} to tell a deleted
 * record apart.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    List<Job> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<Job> findByStatusIn(Collection<JobStatus> statuses);

    long countByStatus(JobStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("delete from Job j where j.id = :id")
    int deleteJobById(@Param("id") UUID id);

    /** Phase boundary: progress moves to at least 5, never down. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.status = com.example.tscribe_backend.util.JobStatus.DOWNLOADING,
               j.progress = case when j.progress < 5 then 5 else j.progress end,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.tscribe_backend.util.JobStatus.QUEUED
        """)
    int markDownloading(@Param("id") UUID id, @Param("now") Instant now);

    /** Phase boundary: progress moves to at least 10, never down. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.status = com.example.tscribe_backend.util.JobStatus.TRANSCRIBING,
               j.progress = case when j.progress < 10 then 10 else j.progress end,
               j.title = coalesce(:title, j.title),
               j.durationSeconds = coalesce(:duration, j.durationSeconds),
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.tscribe_backend.util.JobStatus.DOWNLOADING
        """)
    int markTranscribing(@Param("id") UUID id,
                         @Param("title") String title,
                         @Param("duration") Double durationSeconds,
                         @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.progress = :progress,
               j.updatedAt = :now
         where j.id = :id
           and j.status = com.example.tscribe_backend.util.JobStatus.TRANSCRIBING
           and j.progress < :progress
        """)
    int updateProgress(@Param("id") UUID id, @Param("progress") int progress, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.status = com.example.tscribe_backend.util.JobStatus.DONE,
               j.progress = 100,
               j.resultText = :text,
               j.resultSegmentsJson = :segments,
               j.source = :source,
               j.detectedLanguage = :language,
               j.title = coalesce(:title, j.title),
               j.durationSeconds = coalesce(:duration, j.durationSeconds),
               j.error = null,
               j.completedAt = :now,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = :from
        """)
    int markDone(@Param("id") UUID id,
                 @Param("from") JobStatus from,
                 @Param("text") String text,
                 @Param("segments") String segmentsJson,
                 @Param("source") TranscriptSource source,
                 @Param("language") String detectedLanguage,
                 @Param("title") String title,
                 @Param("duration") Double durationSeconds,
                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update Job j
           set j.status = com.example.tscribe_backend.util.JobStatus.FAILED,
               j.error = :error,
               j.resultText = null,
               j.completedAt = :now,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in (com.example.tscribe_backend.util.JobStatus.QUEUED,
                            com.example.tscribe_backend.util.JobStatus.DOWNLOADING,
                            com.example.tscribe_backend.util.JobStatus.TRANSCRIBING)
        """)
    int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);
}
