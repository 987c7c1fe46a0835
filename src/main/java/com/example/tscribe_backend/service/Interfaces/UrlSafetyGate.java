package com.example.tscribe_backend.service.Interfaces;

import com.example.tscribe_backend.exception.UrlRejectedException;

/** Screens submitted URLs before a job is created. */
public interface UrlSafetyGate {
    /**
     * @throws UrlRejectedException with a user-facing reason when the URL must not be fetched
     */
    void validate(String url) throws UrlRejectedException;
}
