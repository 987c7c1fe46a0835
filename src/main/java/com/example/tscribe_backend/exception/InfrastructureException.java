package com.example.tscribe_backend.exception;

/** Record store or queue stayed unavailable after the bounded retry budget. */
public class InfrastructureException extends RuntimeException {
    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
