package com.example.tscribe_backend.engine;

import com.example.tscribe_backend.dto.TranscriptSegment;

import java.util.List;

public record SubtitleFetchResult(
        Outcome outcome,
        List<TranscriptSegment> segments,
        String language,
        String title,
        Double durationSeconds,
        String detail
) {
    public enum Outcome {
        FOUND,
        NOT_AVAILABLE,
        TRANSPORT_ERROR
    }

    public static SubtitleFetchResult found(List<TranscriptSegment> segments, String language, String title, Double durationSeconds) {
        return new SubtitleFetchResult(Outcome.FOUND, List.copyOf(segments), language, title, durationSeconds, null);
    }

    public static SubtitleFetchResult notAvailable(String detail) {
        return new SubtitleFetchResult(Outcome.NOT_AVAILABLE, List.of(), null, null, null, detail);
    }

    public static SubtitleFetchResult transportError(String detail) {
        return new SubtitleFetchResult(Outcome.TRANSPORT_ERROR, List.of(), null, null, null, detail);
    }

    public boolean isFound() {
        return outcome == Outcome.FOUND;
    }

    public String text() {
        return segments.stream().map(TranscriptSegment::text).reduce((a, b) -> a + "\n" + b).orElse("");
    }
}
