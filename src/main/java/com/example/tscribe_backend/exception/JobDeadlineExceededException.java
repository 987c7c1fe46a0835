package com.example.tscribe_backend.exception;

import java.time.Duration;

public class JobDeadlineExceededException extends RuntimeException {
    public JobDeadlineExceededException(Duration limit) {
        super("Job exceeded time limit of " + limit.toSeconds() + "s");
    }
}
