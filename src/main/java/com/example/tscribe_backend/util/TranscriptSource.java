package com.example.tscribe_backend.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Which path produced a finished transcript. */
public enum TranscriptSource {
    SUBTITLES,
    WHISPER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
