package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.WorkerExecutorProperties;
import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.repository.JobRepository;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import com.example.tscribe_backend.util.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecoveryServiceTest {

    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");
    private final Clock clock = Clock.fixed(now, ZoneOffset.UTC);
    private final JobRepository jobRepository = mock(JobRepository.class);
    private final JobStateWriter stateWriter = mock(JobStateWriter.class);
    private InMemoryWorkQueue queue;
    private WorkerExecutorProperties props;
    private RecoveryService recovery;

    @BeforeEach
    void setUp() {
        queue = new InMemoryWorkQueue(clock);
        props = new WorkerExecutorProperties();
        props.setId("worker-self");
        recovery = new RecoveryService(jobRepository, queue, stateWriter, props, clock);
        when(stateWriter.markFailed(any(), anyString())).thenReturn(true);
    }

    private Job job(JobStatus status, int minutesAgo) {
        Job job = new Job("https://example.com/" + UUID.randomUUID(), null);
        job.setId(UUID.randomUUID());
        job.setStatus(status);
        job.setCreatedAt(now.minusSeconds(minutesAgo * 60L));
        return job;
    }

    @Test
    void midPhaseJobsAreFailedAsInterrupted() {
        Job downloading = job(JobStatus.DOWNLOADING, 5);
        Job transcribing = job(JobStatus.TRANSCRIBING, 4);
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(downloading, transcribing));

        RecoveryService.RecoveryReport report = recovery.reconcile();

        assertThat(report.failed()).isEqualTo(2);
        verify(stateWriter).markFailed(downloading.getId(), "Job interrupted by worker restart");
        verify(stateWriter).markFailed(transcribing.getId(), "Job interrupted by worker restart");
    }

    @Test
    void queuedJobsLostByTheQueueAreReEnqueuedOldestFirst() {
        Job newer = job(JobStatus.QUEUED, 1);
        Job older = job(JobStatus.QUEUED, 10);
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(newer, older));

        RecoveryService.RecoveryReport report = recovery.reconcile();

        assertThat(report.requeued()).isEqualTo(2);
        assertThat(queue.dequeue("w", Duration.ofMinutes(1)).orElseThrow().jobId()).isEqualTo(older.getId());
        verify(stateWriter, never()).markFailed(any(), any());
    }

    @Test
    void pendingQueuedJobIsLeftAlone() {
        Job queued = job(JobStatus.QUEUED, 1);
        queue.enqueue(queued.getId());
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(queued));

        RecoveryService.RecoveryReport report = recovery.reconcile();

        assertThat(report).isEqualTo(new RecoveryService.RecoveryReport(0, 0));
        assertThat(queue.pendingCount()).isEqualTo(1);
    }

    @Test
    void claimHeldByAnotherLiveWorkerIsRespected() {
        Job running = job(JobStatus.TRANSCRIBING, 3);
        queue.enqueue(running.getId());
        queue.dequeue("worker-other", Duration.ofHours(1));
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(running));

        assertThat(recovery.reconcile().failed()).isZero();
        verify(stateWriter, never()).markFailed(any(), any());
    }

    @Test
    void ownStaleClaimOnQueuedJobIsFailed() {
        Job claimed = job(JobStatus.QUEUED, 3);
        queue.enqueue(claimed.getId());
        queue.dequeue("worker-self", Duration.ofHours(1));
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(claimed));

        assertThat(recovery.reconcile().failed()).isEqualTo(1);
        assertThat(queue.stateOf(claimed.getId())).isEqualTo(WorkQueue.EntryState.ABSENT);
    }

    @Test
    void defaultIdentityFailsClaimLeftByDeadProcessOnThisHost() {
        WorkerExecutorProperties defaults = new WorkerExecutorProperties();
        long self = ProcessHandle.current().pid();
        RecoveryService restarted = new FakeLivenessRecovery(defaults, Set.of(self));
        Job downloading = job(JobStatus.DOWNLOADING, 3);
        queue.enqueue(downloading.getId());
        queue.dequeue(WorkerExecutorProperties.localHost() + ":" + (self + 1), Duration.ofSeconds(7200));
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(downloading));

        RecoveryService.RecoveryReport report = restarted.reconcile();

        assertThat(defaults.resolvedId()).isEqualTo(WorkerExecutorProperties.localHost() + ":" + self);
        assertThat(report.failed()).isEqualTo(1);
        verify(stateWriter).markFailed(downloading.getId(), "Job interrupted by worker restart");
        assertThat(queue.stateOf(downloading.getId())).isEqualTo(WorkQueue.EntryState.ABSENT);
    }

    @Test
    void claimOfUnknownPidOnThisHostIsTreatedAsDead() {
        RecoveryService restarted = new RecoveryService(jobRepository, queue, stateWriter, new WorkerExecutorProperties(), clock);
        Job transcribing = job(JobStatus.TRANSCRIBING, 3);
        queue.enqueue(transcribing.getId());
        queue.dequeue(WorkerExecutorProperties.localHost() + ":" + Integer.MAX_VALUE, Duration.ofSeconds(7200));
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(transcribing));

        assertThat(restarted.reconcile().failed()).isEqualTo(1);
    }

    @Test
    void liveSiblingProcessOnThisHostKeepsItsClaim() {
        RecoveryService restarted = new FakeLivenessRecovery(new WorkerExecutorProperties(), Set.of(4242L));
        Job running = job(JobStatus.TRANSCRIBING, 3);
        queue.enqueue(running.getId());
        queue.dequeue(WorkerExecutorProperties.localHost() + ":4242", Duration.ofHours(1));
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(running));

        assertThat(restarted.reconcile().failed()).isZero();
        verify(stateWriter, never()).markFailed(any(), any());
    }

    @Test
    void expiredClaimsAreFailedByThePeriodicPass() {
        Job stuck = job(JobStatus.TRANSCRIBING, 200);
        Job fresh = job(JobStatus.DOWNLOADING, 1);
        InMemoryWorkQueue earlier = new InMemoryWorkQueue(Clock.fixed(now.minus(Duration.ofHours(3)), ZoneOffset.UTC));
        earlier.enqueue(stuck.getId());
        earlier.dequeue("worker-on-another-host", Duration.ofHours(2));
        earlier.enqueue(fresh.getId());
        earlier.dequeue("worker-on-another-host", Duration.ofHours(5));
        RecoveryService periodic = new RecoveryService(jobRepository, earlier, stateWriter, props, clock);
        when(jobRepository.findByStatusIn(anyCollection())).thenReturn(List.of(stuck, fresh));

        assertThat(periodic.reapExpired()).isEqualTo(1);
        verify(stateWriter).markFailed(stuck.getId(), RecoveryService.LEASE_EXPIRED_CAUSE);
        verify(stateWriter, never()).markFailed(eq(fresh.getId()), anyString());
        assertThat(earlier.stateOf(stuck.getId())).isEqualTo(WorkQueue.EntryState.ABSENT);
        assertThat(earlier.stateOf(fresh.getId())).isEqualTo(WorkQueue.EntryState.CLAIMED);
    }

    @Test
    void periodicPassWaitsForStartupReconcile() {
        recovery.scheduledReap();

        verify(jobRepository, never()).findByStatusIn(anyCollection());
    }

    @Test
    void ownerTagsFromOtherHostsCarryNoLocalPid() {
        assertThat(RecoveryService.localPidOf("vm:2752", "vm")).hasValue(2752L);
        assertThat(RecoveryService.localPidOf("other:2752", "vm")).isEmpty();
        assertThat(RecoveryService.localPidOf("worker-self", "vm")).isEmpty();
        assertThat(RecoveryService.localPidOf("vm:abc", "vm")).isEmpty();
    }

    @Test
    void readyEventCompletesEvenWhenDisabled() {
        props.getRecovery().setEnabled(false);

        recovery.onReady();

        assertThat(recovery.isComplete()).isTrue();
        verify(jobRepository, never()).findByStatusIn(anyCollection());
    }

    private class FakeLivenessRecovery extends RecoveryService {
        private final Set<Long> alive;

        FakeLivenessRecovery(WorkerExecutorProperties properties, Set<Long> alive) {
            super(jobRepository, queue, stateWriter, properties, clock);
            this.alive = alive;
        }

        @Override
        protected boolean processAlive(long pid) {
            return alive.contains(pid);
        }
    }
}
