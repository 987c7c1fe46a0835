package com.example.tscribe_backend.service;

import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryWorkQueueTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final InMemoryWorkQueue queue = new InMemoryWorkQueue(clock);

    @Test
    void dequeueIsFifoAndStampsDeadline() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        queue.enqueue(first);
        queue.enqueue(second);

        WorkQueue.Claim claim = queue.dequeue("w1", Duration.ofHours(2)).orElseThrow();

        assertThat(claim.jobId()).isEqualTo(first);
        assertThat(claim.owner()).isEqualTo("w1");
        assertThat(claim.deadline()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
        assertThat(queue.stateOf(first)).isEqualTo(WorkQueue.EntryState.CLAIMED);
        assertThat(queue.stateOf(second)).isEqualTo(WorkQueue.EntryState.PENDING);
    }

    @Test
    void duplicateEnqueueIsNoOp() {
        UUID id = UUID.randomUUID();
        queue.enqueue(id);
        queue.enqueue(id);

        assertThat(queue.pendingCount()).isEqualTo(1);
        queue.dequeue("w1", Duration.ofMinutes(1));
        queue.enqueue(id);
        assertThat(queue.dequeue("w2", Duration.ofMinutes(1))).isEmpty();
    }

    @Test
    void removedPendingIdIsNeverHandedOut() {
        UUID id = UUID.randomUUID();
        queue.enqueue(id);
        queue.remove(id);

        assertThat(queue.dequeue("w1", Duration.ofMinutes(1))).isEmpty();
        assertThat(queue.stateOf(id)).isEqualTo(WorkQueue.EntryState.ABSENT);
    }

    @Test
    void acknowledgeDropsTheClaim() {
        UUID id = UUID.randomUUID();
        queue.enqueue(id);
        queue.dequeue("w1", Duration.ofMinutes(1));

        queue.acknowledge(id);

        assertThat(queue.claimOf(id)).isEmpty();
        assertThat(queue.stateOf(id)).isEqualTo(WorkQueue.EntryState.ABSENT);
    }

    @Test
    void concurrentDequeuesNeverShareAnId() throws Exception {
        int jobs = 500;
        for (int i = 0; i < jobs; i++) {
            queue.enqueue(UUID.randomUUID());
        }
        Set<UUID> seen = ConcurrentHashMap.newKeySet();
        List<UUID> all = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        for (int t = 0; t < 8; t++) {
            String worker = "w" + t;
            pool.submit(() -> {
                go.await();
                Optional<WorkQueue.Claim> c;
                while ((c = queue.dequeue(worker, Duration.ofMinutes(1))).isPresent()) {
                    seen.add(c.get().jobId());
                    all.add(c.get().jobId());
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(all).hasSize(jobs);
        assertThat(seen).hasSize(jobs);
    }
}
