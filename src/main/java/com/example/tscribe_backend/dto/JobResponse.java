package com.example.tscribe_backend.dto;

import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptSource;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(
        UUID id,
        String url,
        JobStatus status,
        String title,
        String language,
        String detectedLanguage,
        Double durationSeconds,
        int progress,
        String resultText,
        String error,
        TranscriptSource source,
        Instant createdAt,
        Instant completedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getUrl(),
                job.getStatus(),
                job.getTitle(),
                job.getRequestedLanguage(),
                job.getDetectedLanguage(),
                job.getDurationSeconds(),
                job.getProgress(),
                job.getResultText(),
                job.getError(),
                job.getSource(),
                job.getCreatedAt(),
                job.getCompletedAt()
        );
    }
}
