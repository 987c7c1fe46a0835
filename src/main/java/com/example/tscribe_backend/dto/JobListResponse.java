package com.example.tscribe_backend.dto;

import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptSource;

import java.time.Instant;
import java.util.UUID;

/** List view of a job: no transcript text, no error detail. */
public record JobListResponse(
        UUID id,
        String url,
        JobStatus status,
        String title,
        int progress,
        TranscriptSource source,
        Instant createdAt,
        Instant completedAt
) {
    public static JobListResponse from(Job job) {
        return new JobListResponse(
                job.getId(),
                job.getUrl(),
                job.getStatus(),
                job.getTitle(),
                job.getProgress(),
                job.getSource(),
                job.getCreatedAt(),
                job.getCompletedAt()
        );
    }
}
