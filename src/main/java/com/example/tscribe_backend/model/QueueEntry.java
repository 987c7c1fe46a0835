package com.example.tscribe_backend.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Reference to a job waiting in (or claimed from) the database-backed work queue.
 * An unclaimed entry is pending; a claimed entry belongs to exactly one worker until acknowledged.
 */
@Entity
@Table(
        name = "job_queue",
        indexes = {
                @Index(name = "idx_job_queue_pending", columnList = "claimed_at, enqueued_at")
        }
)
public class QueueEntry {
    @Id
    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "enqueued_at", nullable = false, updatable = false)
    private Instant enqueuedAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "claimed_by", length = 128)
    private String claimedBy;

    @Column(name = "deadline_at")
    private Instant deadlineAt;

    protected QueueEntry() {}

    public QueueEntry(UUID jobId, Instant enqueuedAt) {
        this.jobId = jobId;
        this.enqueuedAt = enqueuedAt;
    }

    public UUID getJobId() {
        return jobId;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public String getClaimedBy() {
        return claimedBy;
    }

    public Instant getDeadlineAt() {
        return deadlineAt;
    }

    public boolean isClaimed() {
        return claimedAt != null;
    }
}
