package com.example.tscribe_backend.dto;

/** One timed block of transcript text; times are seconds from the start of the media. */
public record TranscriptSegment(double start, double end, String text) {}
