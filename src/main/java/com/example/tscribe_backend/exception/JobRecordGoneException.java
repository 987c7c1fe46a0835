package com.example.tscribe_backend.exception;

import java.util.UUID;

/** The job record was deleted while a worker still held the job. */
public class JobRecordGoneException extends RuntimeException {
    private final UUID jobId;

    public JobRecordGoneException(UUID jobId) {
        super("Job record " + jobId + " no longer exists");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
