package com.example.tscribe_backend.exception;

/**
 * Media acquisition failed. The message is shown to the user verbatim, so it should read as a cause
 * ("Video unavailable or removed") rather than a stack trace.
 */
public class DownloadException extends RuntimeException {
    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
