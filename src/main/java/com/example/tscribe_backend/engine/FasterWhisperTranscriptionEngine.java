package com.example.tscribe_backend.engine;

import com.example.tscribe_backend.dto.FwVerboseResponse;
import com.example.tscribe_backend.dto.TranscriptSegment;
import com.example.tscribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.tscribe_backend.exception.TranscriptionException;
import com.example.tscribe_backend.service.FasterWhisperClient;
import reactor.core.Exceptions;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Sends the whole file to a faster-whisper server in one request. The server does not stream, so
 * progress is reported as 0 on start and 100 on completion.
 */
public class FasterWhisperTranscriptionEngine implements TranscriptionEngine {
    private final FasterWhisperClient client;

    public FasterWhisperTranscriptionEngine(FasterWhisperClient client) {
        this.client = client;
    }

    @Override
    public Result transcribe(Request req, ProgressListener progress) {
        if (req.audio() == null || !Files.exists(req.audio())) {
            throw new TranscriptionException("Audio file not found: " + req.audio());
        }
        progress.onProgress(0);

        FwVerboseResponse resp;
        try {
            resp = client.transcribeFile(req.audio(), req.langHint());
        } catch (TranscriptionException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TranscriptionException te) {
                throw te;
            }
            if (cause instanceof TimeoutException) {
                throw new TranscriptionException("faster-whisper did not answer in time", cause);
            }
            throw new TranscriptionException("faster-whisper request failed: " + cause.getMessage(), cause);
        }
        if (resp == null) {
            throw new TranscriptionException("faster-whisper returned an empty response");
        }

        List<TranscriptSegment> segments = new ArrayList<>();
        if (resp.segments() != null) {
            for (var seg : resp.segments()) {
                String text = safeTrim(seg.text());
                if (text.isEmpty()) continue;
                double s = seg.start() == null ? 0.0 : seg.start();
                double e = seg.end() == null ? s : seg.end();
                segments.add(new TranscriptSegment(s, e, text));
            }
        }

        String text = segments.isEmpty()
                ? safeTrim(resp.text())
                : segments.stream().map(TranscriptSegment::text).collect(Collectors.joining("\n"));
        if (text.isEmpty()) {
            throw new TranscriptionException("No speech recognized in audio");
        }

        String lang = (resp.language() != null && !resp.language().isBlank())
                ? resp.language().toLowerCase(Locale.ROOT)
                : req.langHint();

        progress.onProgress(100);
        return new Result(text, segments, lang, "faster-whisper");
    }

    private static String safeTrim(String s) {
        return s == null ? "" : s.trim();
    }
}
