package com.example.tscribe_backend.dto;

/** A rendered transcript file ready to be sent as an attachment. */
public record TranscriptExport(String fileName, String contentType, String body) {}
