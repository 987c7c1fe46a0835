package com.example.tscribe_backend.service;

import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Single-process queue. Entries do not survive a restart; recovery re-enqueues QUEUED records.
 */
public class InMemoryWorkQueue implements WorkQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryWorkQueue.class);

    private final Queue<UUID> pending = new ConcurrentLinkedQueue<>();
    private final Set<UUID> pendingIds = ConcurrentHashMap.newKeySet();
    private final Map<UUID, Claim> claimed = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWorkQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void enqueue(UUID jobId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            // the record must be committed before a worker can see the id
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    push(jobId);
                }
            });
            return;
        }
        push(jobId);
    }

    private void push(UUID jobId) {
        if (claimed.containsKey(jobId)) {
            LOGGER.warn("Job already claimed, not re-queued jobId={}", jobId);
            return;
        }
        if (pendingIds.add(jobId)) {
            pending.offer(jobId);
        }
    }

    @Override
    public Optional<Claim> dequeue(String workerId, Duration jobTimeout) {
        UUID jobId;
        while ((jobId = pending.poll()) != null) {
            // removed while pending: skip the stale id
            if (pendingIds.remove(jobId)) {
                Claim claim = new Claim(jobId, workerId, clock.instant().plus(jobTimeout));
                claimed.put(jobId, claim);
                return Optional.of(claim);
            }
        }
        return Optional.empty();
    }

    @Override
    public void remove(UUID jobId) {
        pendingIds.remove(jobId);
        pending.remove(jobId);
        claimed.remove(jobId);
    }

    @Override
    public EntryState stateOf(UUID jobId) {
        if (claimed.containsKey(jobId)) return EntryState.CLAIMED;
        if (pendingIds.contains(jobId)) return EntryState.PENDING;
        return EntryState.ABSENT;
    }

    @Override
    public Optional<Claim> claimOf(UUID jobId) {
        return Optional.ofNullable(claimed.get(jobId));
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    public int pendingCount() {
        return pendingIds.size();
    }
}
