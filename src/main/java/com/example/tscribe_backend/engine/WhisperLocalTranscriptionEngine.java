package com.example.tscribe_backend.engine;

import com.example.tscribe_backend.dto.TranscriptSegment;
import com.example.tscribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.tscribe_backend.exception.TranscriptionException;
import com.example.tscribe_backend.util.ProcessRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs the openai-whisper CLI against the downloaded audio. With {@code --verbose True} the CLI prints
 * one {@code [mm:ss.mmm --> mm:ss.mmm] text} line per decoded segment; the end timestamp over the
 * media duration drives progress.
 */
public class WhisperLocalTranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(WhisperLocalTranscriptionEngine.class);
    private static final int LOG_SNIPPET_MAX = 4_000;
    private static final Pattern SEGMENT_LINE = Pattern.compile(
            "^\\[(?:(\\d+):)?(\\d{1,2}):(\\d{2})\\.(\\d{3})\\s*-->\\s*(?:(\\d+):)?(\\d{1,2}):(\\d{2})\\.(\\d{3})]");

    private final String whisperCmd;
    private final String whisperModel;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public WhisperLocalTranscriptionEngine(String whisperCmd, String whisperModel, Duration timeout, ObjectMapper objectMapper) {
        this.whisperCmd = whisperCmd != null ? whisperCmd : "whisper";
        this.whisperModel = whisperModel != null ? whisperModel : "base";
        this.timeout = timeout != null ? timeout : Duration.ofHours(2);
        this.objectMapper = Objects.requireNonNull(objectMapper);
    }

    @Override
    public Result transcribe(Request req, ProgressListener progress) {
        Path input = req.audio();
        if (input == null || !Files.exists(input)) {
            throw new TranscriptionException("Audio file not found: " + input);
        }
        Path outDir = input.toAbsolutePath().getParent().resolve("whisper-out");
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new TranscriptionException("Cannot create whisper output directory " + outDir, e);
        }

        List<String> cmd = new ArrayList<>();
        cmd.add(whisperCmd);
        cmd.add(input.toAbsolutePath().toString());
        cmd.add("--model");
        cmd.add(whisperModel);
        if (req.langHint() != null && !req.langHint().isBlank()) {
            cmd.add("--language");
            cmd.add(req.langHint());
        }
        cmd.add("--output_format");
        cmd.add("json");
        cmd.add("--output_dir");
        cmd.add(outDir.toAbsolutePath().toString());
        cmd.add("--verbose");
        cmd.add("True");

        progress.onProgress(0);
        ProcessRunner.Result result;
        try {
            result = runProcess(cmd, timeout, progressParser(req.durationSeconds(), progress));
        } catch (IOException e) {
            throw new TranscriptionException("whisper could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Transcription interrupted", e);
        }

        if (result.timedOut()) {
            throw new TranscriptionException("whisper timed out after " + timeout.toSeconds() + "s");
        }
        if (result.code() != 0) {
            throw new TranscriptionException("whisper exit=" + result.code() + " log="
                    + ProcessRunner.truncate(result.output(), LOG_SNIPPET_MAX));
        }

        String base = input.getFileName().toString().replaceFirst("\\.[^.]+$", "");
        Path json = outDir.resolve(base + ".json");
        if (!Files.exists(json)) {
            throw new TranscriptionException("whisper did not produce JSON at: " + json);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(json));
        } catch (IOException e) {
            throw new TranscriptionException("Unreadable whisper output " + json, e);
        }

        Result parsed = parseWhisperJson(root, req.langHint());
        if (parsed.text().isBlank()) {
            throw new TranscriptionException("No speech recognized in audio");
        }
        progress.onProgress(100);
        LOGGER.debug("whisper produced segments={} lang={}", parsed.segments().size(), parsed.lang());
        return parsed;
    }

    protected ProcessRunner.Result runProcess(List<String> cmd, Duration timeout, Consumer<String> onLine)
            throws IOException, InterruptedException {
        return ProcessRunner.run(cmd, timeout, onLine);
    }

    /** Maps {@code [.. --> end]} lines to percent of {@code durationSeconds}; capped below 100 until the run ends. */
    static Consumer<String> progressParser(Double durationSeconds, ProgressListener progress) {
        if (durationSeconds == null || durationSeconds <= 0) {
            return line -> { };
        }
        return line -> {
            Matcher m = SEGMENT_LINE.matcher(line.strip());
            if (!m.find()) {
                return;
            }
            double end = seconds(m.group(5), m.group(6), m.group(7), m.group(8));
            int pct = (int) Math.min(99, Math.floor(end / durationSeconds * 100.0));
            progress.onProgress(Math.max(0, pct));
        };
    }

    private Result parseWhisperJson(JsonNode root, String langHint) {
        List<TranscriptSegment> segments = new ArrayList<>();
        for (JsonNode seg : root.path("segments")) {
            String text = seg.path("text").asText("").strip();
            if (text.isEmpty()) continue;
            segments.add(new TranscriptSegment(seg.path("start").asDouble(0), seg.path("end").asDouble(0), text));
        }
        String text = segments.isEmpty()
                ? root.path("text").asText("").strip()
                : segments.stream().map(TranscriptSegment::text).collect(Collectors.joining("\n"));
        String lang = root.hasNonNull("language")
                ? root.get("language").asText().toLowerCase(Locale.ROOT)
                : langHint;
        return new Result(text, segments, lang, "whisper-local");
    }

    private static double seconds(String h, String m, String s, String ms) {
        int hours = h == null ? 0 : Integer.parseInt(h);
        return hours * 3600 + Integer.parseInt(m) * 60 + Integer.parseInt(s) + Integer.parseInt(ms) / 1000.0;
    }
}
