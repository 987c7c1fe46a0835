package com.example.tscribe_backend.util;

import java.util.Locale;
import java.util.Optional;

public enum TranscriptFormat {
    SRT("text/srt"),
    VTT("text/vtt"),
    TXT("text/plain"),
    JSON("application/json");

    private final String contentType;

    TranscriptFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    public String fileName() {
        return "transcript." + name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TranscriptFormat> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
