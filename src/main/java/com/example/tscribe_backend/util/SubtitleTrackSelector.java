package com.example.tscribe_backend.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks one caption track from yt-dlp's {@code subtitles} / {@code automatic_captions} maps.
 * Order: requested language (manual, then auto), each default language (manual, then auto),
 * first manual track, first automatic track.
 */
public final class SubtitleTrackSelector {
    private SubtitleTrackSelector() {}

    // YouTube lists chat replay under subtitles; it is not a caption track
    private static final String LIVE_CHAT = "live_chat";

    public record Selection(String language, boolean automatic, JsonNode formats) {}

    public record Track(String url, String ext) {}

    public static Optional<Selection> select(JsonNode manual, JsonNode automatic, String requested, List<String> defaults) {
        if (requested != null && !requested.isBlank()) {
            Optional<Selection> hit = exact(manual, automatic, requested.trim());
            if (hit.isPresent()) return hit;
        }
        for (String lang : defaults) {
            Optional<Selection> hit = exact(manual, automatic, lang);
            if (hit.isPresent()) return hit;
        }
        Optional<Selection> anyManual = first(manual, false);
        if (anyManual.isPresent()) return anyManual;
        return first(automatic, true);
    }

    /** json3 first, then vtt/srt, then whatever the first listed format is. */
    public static Optional<Track> pickFormat(JsonNode formats) {
        if (formats == null || !formats.isArray() || formats.isEmpty()) return Optional.empty();
        for (JsonNode f : formats) {
            if ("json3".equals(f.path("ext").asText()) && hasUrl(f)) {
                return Optional.of(new Track(f.path("url").asText(), "json3"));
            }
        }
        for (JsonNode f : formats) {
            String ext = f.path("ext").asText();
            if (("vtt".equals(ext) || "srt".equals(ext)) && hasUrl(f)) {
                return Optional.of(new Track(f.path("url").asText(), ext));
            }
        }
        JsonNode f = formats.get(0);
        return hasUrl(f) ? Optional.of(new Track(f.path("url").asText(), f.path("ext").asText(""))) : Optional.empty();
    }

    private static Optional<Selection> exact(JsonNode manual, JsonNode automatic, String lang) {
        if (hasTrack(manual, lang)) return Optional.of(new Selection(lang, false, manual.get(lang)));
        if (hasTrack(automatic, lang)) return Optional.of(new Selection(lang, true, automatic.get(lang)));
        return Optional.empty();
    }

    private static Optional<Selection> first(JsonNode tracks, boolean automatic) {
        if (tracks == null || !tracks.isObject()) return Optional.empty();
        Iterator<Map.Entry<String, JsonNode>> it = tracks.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!LIVE_CHAT.equals(e.getKey()) && e.getValue().isArray() && !e.getValue().isEmpty()) {
                return Optional.of(new Selection(e.getKey(), automatic, e.getValue()));
            }
        }
        return Optional.empty();
    }

    private static boolean hasTrack(JsonNode tracks, String lang) {
        return tracks != null && tracks.isObject() && tracks.path(lang).isArray() && !tracks.path(lang).isEmpty();
    }

    private static boolean hasUrl(JsonNode format) {
        return format != null && format.hasNonNull("url") && !format.path("url").asText().isBlank();
    }
}
