package com.example.tscribe_backend.exception;

/** A job was cut off by its owning worker going away (shutdown grace expired). */
public class JobInterruptedException extends RuntimeException {
    public JobInterruptedException(String message) {
        super(message);
    }
}
