package com.example.tscribe_backend.exception;

public class UrlRejectedException extends RuntimeException {
    public UrlRejectedException(String reason) {
        super(reason);
    }
}
