package com.example.tscribe_backend.engine.Interfaces;

import com.example.tscribe_backend.engine.SubtitleFetchResult;

/**
 * Fast path: existing platform captions instead of speech-to-text.
 * "No captions" and "could not ask" are outcomes, not exceptions; anything thrown is a bug.
 */
public interface SubtitleFetcher {
    SubtitleFetchResult fetch(String url, String requestedLanguage);
}
