package com.example.tscribe_backend.util;

import com.example.tscribe_backend.dto.TranscriptSegment;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses caption tracks (YouTube json3 and WebVTT/SRT cue text) into timed segments.
 */
public final class SubtitleParser {
    private SubtitleParser() {}

    // hours are optional in WebVTT; SRT uses a comma before the millis
    private static final Pattern CUE_TIMING = Pattern.compile(
            "^(?:(\\d{1,2}):)?(\\d{2}):(\\d{2})[.,](\\d{3})\\s*-->\\s*(?:(\\d{1,2}):)?(\\d{2}):(\\d{2})[.,](\\d{3})");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    public static List<TranscriptSegment> parseJson3(JsonNode root) {
        List<TranscriptSegment> out = new ArrayList<>();
        if (root == null) return out;
        for (JsonNode event : root.path("events")) {
            JsonNode segs = event.path("segs");
            if (!segs.isArray() || segs.isEmpty()) continue;

            List<String> parts = new ArrayList<>();
            for (JsonNode seg : segs) {
                String t = seg.path("utf8").asText("").strip();
                if (!t.isEmpty()) parts.add(t);
            }
            String text = String.join(" ", parts).strip();
            if (text.isEmpty()) continue;

            long startMs = event.path("tStartMs").asLong(0);
            long durMs = event.path("dDurationMs").asLong(0);
            out.add(new TranscriptSegment(startMs / 1000.0, (startMs + durMs) / 1000.0, text));
        }
        return out;
    }

    public static List<TranscriptSegment> parseVtt(String content) {
        List<TranscriptSegment> out = new ArrayList<>();
        if (content == null || content.isBlank()) return out;

        String[] lines = content.strip().split("\\r?\\n");
        int i = 0;
        while (i < lines.length) {
            Matcher m = CUE_TIMING.matcher(lines[i].strip());
            if (!m.find()) {
                i++;
                continue;
            }
            double start = seconds(m.group(1), m.group(2), m.group(3), m.group(4));
            double end = seconds(m.group(5), m.group(6), m.group(7), m.group(8));

            i++;
            List<String> text = new ArrayList<>();
            while (i < lines.length && !lines[i].isBlank() && !CUE_TIMING.matcher(lines[i].strip()).find()) {
                String clean = TAG.matcher(lines[i].strip()).replaceAll("").strip();
                if (!clean.isEmpty()) text.add(clean);
                i++;
            }
            String joined = String.join(" ", text).strip();
            if (!joined.isEmpty()) {
                out.add(new TranscriptSegment(start, end, joined));
            }
        }
        return out;
    }

    private static double seconds(String h, String m, String s, String ms) {
        int hours = h == null ? 0 : Integer.parseInt(h);
        return hours * 3600 + Integer.parseInt(m) * 60 + Integer.parseInt(s) + Integer.parseInt(ms) / 1000.0;
    }
}
