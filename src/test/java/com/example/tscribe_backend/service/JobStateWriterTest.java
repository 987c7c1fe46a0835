package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.WorkerExecutorProperties;
import com.example.tscribe_backend.exception.InfrastructureException;
import com.example.tscribe_backend.exception.JobRecordGoneException;
import com.example.tscribe_backend.repository.JobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobStateWriterTest {

    @Mock
    private JobRepository jobRepository;

    private JobStateWriter writer;
    private final UUID jobId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        WorkerExecutorProperties props = new WorkerExecutorProperties();
        props.getStoreRetry().setMaxAttempts(3);
        props.getStoreRetry().setBackoff(Duration.ofMillis(1));
        writer = new JobStateWriter(jobRepository, Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC), props);
    }

    @Test
    void guardedUpdateReportsRejection() {
        when(jobRepository.markDownloading(eq(jobId), any())).thenReturn(0);
        when(jobRepository.existsById(jobId)).thenReturn(true);

        assertThat(writer.markDownloading(jobId)).isFalse();
    }

    @Test
    void deletedRecordIsReported() {
        when(jobRepository.markDownloading(eq(jobId), any())).thenReturn(0);
        when(jobRepository.existsById(jobId)).thenReturn(false);

        assertThatThrownBy(() -> writer.markDownloading(jobId)).isInstanceOf(JobRecordGoneException.class);
    }

    @Test
    void transientFailuresAreRetried() {
        when(jobRepository.markFailed(eq(jobId), eq("boom"), any()))
                .thenThrow(new QueryTimeoutException("slow"))
                .thenReturn(1);

        assertThat(writer.markFailed(jobId, "boom")).isTrue();
        verify(jobRepository, times(2)).markFailed(eq(jobId), eq("boom"), any());
    }

    @Test
    void exhaustedRetriesBecomeInfrastructureError() {
        when(jobRepository.markFailed(eq(jobId), any(), any())).thenThrow(new QueryTimeoutException("down"));

        assertThatThrownBy(() -> writer.markFailed(jobId, "x"))
                .isInstanceOf(InfrastructureException.class)
                .hasMessageContaining("record store unavailable");
        verify(jobRepository, times(3)).markFailed(eq(jobId), any(), any());
    }

    @Test
    void nonTransientFailuresAreNotRetried() {
        when(jobRepository.markDownloading(eq(jobId), any())).thenThrow(new DataIntegrityViolationException("bad"));

        assertThatThrownBy(() -> writer.markDownloading(jobId)).isInstanceOf(InfrastructureException.class);
        verify(jobRepository, times(1)).markDownloading(eq(jobId), any());
    }

    @Test
    void blankErrorIsReplaced() {
        when(jobRepository.markFailed(eq(jobId), eq("Unknown error"), any())).thenReturn(1);

        assertThat(writer.markFailed(jobId, "  ")).isTrue();
    }

    @Test
    void progressIsClamped() {
        when(jobRepository.updateProgress(eq(jobId), anyInt(), any())).thenReturn(1);

        writer.updateProgress(jobId, 140);

        verify(jobRepository).updateProgress(eq(jobId), eq(100), any());
    }
}
