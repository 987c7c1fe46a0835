package com.example.tscribe_backend.engine.Interfaces;

import com.example.tscribe_backend.dto.TranscriptSegment;
import com.example.tscribe_backend.exception.TranscriptionException;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

public interface TranscriptionEngine {
    record Request(UUID jobId, Path audio, String langHint, Double durationSeconds) {}
    record Result(String text,
                  List<TranscriptSegment> segments,
                  String lang,
                  String provider) {}

    /** Receives percent values in [0,100]; may be called from any thread. */
    @FunctionalInterface
    interface ProgressListener {
        ProgressListener NOOP = percent -> { };

        void onProgress(int percent);
    }

    Result transcribe(Request req, ProgressListener progress) throws TranscriptionException;
}
