package com.example.tscribe_backend.service;

import com.example.tscribe_backend.exception.JobRecordGoneException;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProgressPublisherTest {

    private final JobStateWriter writer = mock(JobStateWriter.class);
    private final UUID jobId = UUID.randomUUID();

    @Test
    void writesOnlyIncreasingValues() {
        ProgressPublisher publisher = new ProgressPublisher(writer, new SyncTaskExecutor());
        ProgressPublisher.Channel channel = publisher.open(jobId);

        channel.onProgress(10);
        channel.onProgress(5);
        channel.onProgress(10);
        channel.onProgress(120);

        verify(writer).updateProgress(jobId, 10);
        verify(writer).updateProgress(jobId, 100);
        verify(writer, never()).updateProgress(jobId, 5);
        assertThat(channel.lastWritten()).isEqualTo(100);
    }

    @Test
    void burstsCollapseIntoLatestValue() {
        List<Runnable> tasks = new ArrayList<>();
        TaskExecutor deferred = tasks::add;
        ProgressPublisher.Channel channel = new ProgressPublisher(writer, deferred).open(jobId);

        channel.onProgress(1);
        channel.onProgress(2);
        channel.onProgress(3);
        assertThat(tasks).hasSize(1);

        tasks.get(0).run();

        verify(writer).updateProgress(jobId, 3);
        verify(writer, never()).updateProgress(jobId, 1);
    }

    @Test
    void closedChannelDropsValues() {
        ProgressPublisher.Channel channel = new ProgressPublisher(writer, new SyncTaskExecutor()).open(jobId);

        channel.close();
        channel.onProgress(50);

        verify(writer, never()).updateProgress(eq(jobId), anyInt());
    }

    @Test
    void goneRecordStopsFurtherWrites() {
        when(writer.updateProgress(jobId, 10)).thenThrow(new JobRecordGoneException(jobId));
        ProgressPublisher.Channel channel = new ProgressPublisher(writer, new SyncTaskExecutor()).open(jobId);

        channel.onProgress(10);
        channel.onProgress(20);

        verify(writer, never()).updateProgress(jobId, 20);
    }
}
