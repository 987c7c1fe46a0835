package com.example.tscribe_backend.service;

import com.example.tscribe_backend.model.QueueEntry;
import com.example.tscribe_backend.repository.QueueEntryRepository;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue rows live next to the job records, so a job and its queue entry are written in the same
 * transaction. Dequeue locks the oldest unclaimed row with {@code FOR UPDATE SKIP LOCKED}, which keeps
 * concurrent workers (in this process or others) from claiming the same id.
 */
public class DatabaseWorkQueue implements WorkQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseWorkQueue.class);

    private final QueueEntryRepository repository;
    private final Clock clock;

    public DatabaseWorkQueue(QueueEntryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void enqueue(UUID jobId) {
        if (repository.existsById(jobId)) {
            LOGGER.warn("Job already queued jobId={}", jobId);
            return;
        }
        repository.save(new QueueEntry(jobId, clock.instant()));
    }

    @Override
    @Transactional
    public Optional<Claim> dequeue(String workerId, Duration jobTimeout) {
        Optional<UUID> next = repository.selectOnePendingIdForUpdate();
        if (next.isEmpty()) {
            return Optional.empty();
        }
        UUID jobId = next.get();
        Instant now = clock.instant();
        Instant deadline = now.plus(jobTimeout);
        if (repository.claim(jobId, workerId, now, deadline) == 0) {
            return Optional.empty();
        }
        LOGGER.debug("Claimed jobId={} owner={} deadline={}", jobId, workerId, deadline);
        return Optional.of(new Claim(jobId, workerId, deadline));
    }

    @Override
    @Transactional
    public void remove(UUID jobId) {
        repository.deleteByJobId(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public EntryState stateOf(UUID jobId) {
        return repository.findById(jobId)
                .map(e -> e.isClaimed() ? EntryState.CLAIMED : EntryState.PENDING)
                .orElse(EntryState.ABSENT);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Claim> claimOf(UUID jobId) {
        return repository.findById(jobId)
                .filter(QueueEntry::isClaimed)
                .map(e -> new Claim(e.getJobId(), e.getClaimedBy(), e.getDeadlineAt()));
    }

    @Override
    public boolean isDurable() {
        return true;
    }
}
