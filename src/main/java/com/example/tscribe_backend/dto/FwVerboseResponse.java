package com.example.tscribe_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** faster-whisper server reply for {@code response_format=verbose_json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FwVerboseResponse(
        String task,
        String language,
        Double duration,
        String text,
        List<Seg> segments
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Seg(
            Double start,
            Double end,
            String text
    ) {}
}
