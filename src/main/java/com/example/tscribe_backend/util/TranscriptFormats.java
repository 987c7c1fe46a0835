package com.example.tscribe_backend.util;

import com.example.tscribe_backend.dto.TranscriptSegment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders stored segments as SRT, WebVTT, plain text or JSON, and (de)serializes the segment list
 * kept on the job record.
 */
public final class TranscriptFormats {
    private TranscriptFormats() {}

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<TranscriptSegment>> SEGMENT_LIST = new TypeReference<>() {};

    public static String render(List<TranscriptSegment> segments, TranscriptFormat format) {
        return switch (format) {
            case SRT -> toSrt(segments);
            case VTT -> toVtt(segments);
            case TXT -> toText(segments);
            case JSON -> toJson(segments);
        };
    }

    public static String toSrt(List<TranscriptSegment> segments) {
        StringBuilder sb = new StringBuilder();
        int n = 1;
        for (TranscriptSegment seg : segments) {
            sb.append(n++).append('\n')
                    .append(timestamp(seg.start(), ',')).append(" --> ").append(timestamp(seg.end(), ',')).append('\n')
                    .append(seg.text()).append('\n')
                    .append('\n');
        }
        return sb.toString();
    }

    public static String toVtt(List<TranscriptSegment> segments) {
        StringBuilder sb = new StringBuilder("WEBVTT\n\n");
        for (TranscriptSegment seg : segments) {
            sb.append(timestamp(seg.start(), '.')).append(" --> ").append(timestamp(seg.end(), '.')).append('\n')
                    .append(seg.text()).append('\n')
                    .append('\n');
        }
        return sb.toString();
    }

    public static String toText(List<TranscriptSegment> segments) {
        return segments.stream().map(TranscriptSegment::text).collect(Collectors.joining("\n"));
    }

    public static String toJson(List<TranscriptSegment> segments) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(segments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render segments as JSON", e);
        }
    }

    /** HH:MM:SS followed by {@code sep} and milliseconds. */
    public static String timestamp(double seconds, char sep) {
        long totalMs = Math.round(Math.max(0, seconds) * 1000.0);
        long h = totalMs / 3_600_000;
        long m = (totalMs % 3_600_000) / 60_000;
        long s = (totalMs % 60_000) / 1000;
        long ms = totalMs % 1000;
        return String.format("%02d:%02d:%02d%c%03d", h, m, s, sep, ms);
    }

    public static String writeSegments(List<TranscriptSegment> segments) {
        try {
            return MAPPER.writeValueAsString(segments == null ? List.of() : segments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize segments", e);
        }
    }

    public static List<TranscriptSegment> readSegments(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return MAPPER.readValue(json, SEGMENT_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored segments are not valid JSON", e);
        }
    }
}
