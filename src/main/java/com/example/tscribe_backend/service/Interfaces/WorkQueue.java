package com.example.tscribe_backend.service.Interfaces;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Carries job ids from submission to a worker. Approximately FIFO. A successful {@link #dequeue}
 * hands an id to exactly one caller; concurrent callers never receive the same id.
 */
public interface WorkQueue {

    /** Ownership of a dequeued id: who holds it and until when. */
    record Claim(UUID jobId, String owner, Instant deadline) {}

    enum EntryState { PENDING, CLAIMED, ABSENT }

    /**
     * Makes the job visible to workers. Inside a transaction the id becomes visible only once that
     * transaction commits. Enqueueing an id that is already present is a no-op.
     */
    void enqueue(UUID jobId);

    /** Claims the oldest pending id, if any, stamping a deadline of now + {@code jobTimeout}. Never blocks. */
    Optional<Claim> dequeue(String workerId, Duration jobTimeout);

    /** Drops the entry, pending or claimed. */
    void remove(UUID jobId);

    /** Called by the owning worker once the job reached a terminal state (or was abandoned). */
    default void acknowledge(UUID jobId) {
        remove(jobId);
    }

    EntryState stateOf(UUID jobId);

    /** The current claim on {@code jobId}, if a worker holds it. */
    Optional<Claim> claimOf(UUID jobId);

    /** Whether entries survive a process restart. */
    boolean isDurable();
}
