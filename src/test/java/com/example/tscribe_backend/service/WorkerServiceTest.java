package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.WorkerExecutorProperties;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkerServiceTest {

    private final WorkQueue queue = mock(WorkQueue.class);
    private final JobExecutor jobExecutor = mock(JobExecutor.class);
    private final RecoveryService recovery = mock(RecoveryService.class);
    private WorkerExecutorProperties props;

    @BeforeEach
    void setUp() {
        props = new WorkerExecutorProperties();
        props.setId("worker-test");
        props.setConcurrency(2);
        props.setShutdownGrace(Duration.ofMillis(100));
        props.setCancelGrace(Duration.ofMillis(50));
        when(recovery.isComplete()).thenReturn(true);
    }

    private WorkQueue.Claim claim() {
        return new WorkQueue.Claim(UUID.randomUUID(), "worker-test", Instant.now().plusSeconds(60));
    }

    @Test
    void pollFillsFreeSlotsOnly() {
        List<Runnable> submitted = new ArrayList<>();
        Executor deferred = submitted::add;
        when(queue.dequeue(anyString(), any())).thenReturn(Optional.of(claim()), Optional.of(claim()), Optional.of(claim()));
        WorkerService worker = new WorkerService(queue, jobExecutor, recovery, deferred, props);
        worker.start();

        worker.poll();

        assertThat(submitted).hasSize(2);
        verify(queue, times(2)).dequeue("worker-test", props.getJobTimeout());

        submitted.get(0).run();
        worker.poll();
        assertThat(submitted).hasSize(3);
    }

    @Test
    void noDequeueBeforeRecoveryOrWhenStopped() {
        WorkerService worker = new WorkerService(queue, jobExecutor, recovery, new SyncTaskExecutor(), props);

        worker.poll();
        worker.start();
        when(recovery.isComplete()).thenReturn(false);
        worker.poll();

        verify(queue, never()).dequeue(anyString(), any());
    }

    @Test
    void emptyQueueReleasesTheSlot() {
        when(queue.dequeue(anyString(), any())).thenReturn(Optional.empty());
        WorkerService worker = new WorkerService(queue, jobExecutor, recovery, new SyncTaskExecutor(), props);
        worker.start();

        worker.poll();
        worker.poll();

        verify(queue, times(2)).dequeue(anyString(), any());
        verify(jobExecutor, never()).execute(any());
    }

    @Test
    void stopAbortsJobsStillRunningAfterGrace() {
        List<Runnable> submitted = new ArrayList<>();
        when(queue.dequeue(anyString(), any())).thenReturn(Optional.of(claim()), Optional.empty());
        WorkerService worker = new WorkerService(queue, jobExecutor, recovery, submitted::add, props);
        worker.start();
        worker.poll();

        worker.stop();

        assertThat(worker.isRunning()).isFalse();
        verify(jobExecutor).abortAll(any());
    }

    @Test
    void cleanStopDoesNotAbort() {
        WorkerService worker = new WorkerService(queue, jobExecutor, recovery, new SyncTaskExecutor(), props);
        worker.start();

        worker.stop();

        verify(jobExecutor, never()).abortAll(any());
    }
}
