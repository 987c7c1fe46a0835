package com.example.tscribe_backend.exception;

/** Speech-to-text engine failure (unsupported codec, corrupt audio, engine crash, server error). */
public class TranscriptionException extends RuntimeException {
    public TranscriptionException(String message) {
        super(message);
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
