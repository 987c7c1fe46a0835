package com.example.tscribe_backend.service;

import com.example.tscribe_backend.exception.DownloadException;
import com.example.tscribe_backend.util.ProcessRunner;
import com.example.tscribe_backend.util.YtDlp;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Slow path acquisition: yt-dlp pulls the best audio stream and ffmpeg converts it to
 * {@code <jobDir>/audio.wav}. Every failure becomes a {@link DownloadException} whose message is
 * the user-facing cause.
 */
@Component
public class MediaDownloader {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaDownloader.class);
    private static final int LOG_SNIPPET_MAX = 4_000;
    static final String AUDIO_FILE = "audio.wav";

    private final String ytdlp;
    private final String cookiesFile;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public MediaDownloader(@Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlp,
                           @Value("${downloader.cookies-file:#{null}}") String cookiesFile,
                           @Value("${downloader.timeout:PT1H}") Duration timeout,
                           ObjectMapper objectMapper) {
        this.ytdlp = ytdlp;
        this.cookiesFile = cookiesFile;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    public record DownloadedMedia(Path audio, String title, Double durationSeconds) {}

    public DownloadedMedia download(String url, JobWorkspace workspace) {
        Path target = workspace.dir().resolve(AUDIO_FILE);
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--no-playlist",
                "--no-progress",
                "-f", "bestaudio/best",
                "-x", "--audio-format", "wav",
                "--no-simulate", "--dump-json"
        ));
        YtDlp.appendCookies(cmd, cookiesFile);
        cmd.add("-o");
        cmd.add(workspace.dir().resolve("audio.%(ext)s").toString());
        cmd.add(url);

        ProcessRunner.Result result;
        try {
            result = runProcess(cmd, timeout);
        } catch (IOException e) {
            throw new DownloadException("Downloader could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cleanupPartial(workspace.dir());
            throw new DownloadException("Download interrupted", e);
        }

        if (result.timedOut()) {
            String partialNote = cleanupPartial(workspace.dir());
            throw new DownloadException("Download timed out after " + timeout.toSeconds() + "s" + partialNote);
        }

        if (result.code() != 0 || !Files.exists(target)) {
            String output = result.output();
            cleanupPartial(workspace.dir());
            LOGGER.warn("yt-dlp failed exit={} url={} log={}", result.code(), url, ProcessRunner.truncate(output, LOG_SNIPPET_MAX));
            throw new DownloadException(describeFailure(output, result.code(), Files.exists(target)));
        }

        workspace.register(target);
        JsonNode info = readInfo(result.output());
        String title = info != null && info.hasNonNull("title") ? info.get("title").asText() : null;
        Double duration = info != null && info.path("duration").isNumber() ? info.get("duration").asDouble() : null;

        LOGGER.info("yt-dlp download OK target={} title={} duration={}s", target, title, duration);
        return new DownloadedMedia(target, title, duration);
    }

    protected ProcessRunner.Result runProcess(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return ProcessRunner.run(cmd, timeout, null);
    }

    /** Turns yt-dlp output into a cause a user can act on. */
    static String describeFailure(String output, int code, boolean audioPresent) {
        String normalized = output == null ? "" : output.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
        if (isAuthWall(normalized)) {
            return "Source requires sign-in; configure a cookies file to download it";
        }
        if (normalized.contains("private video") || normalized.contains("this video is private")) {
            return "Video is private";
        }
        if (normalized.contains("not available in your country") || normalized.contains("geo restrict")
                || normalized.contains("geo-restrict") || normalized.contains("blocked it in your country")) {
            return "Video is not available in this region";
        }
        if (normalized.contains("video unavailable") || normalized.contains("has been removed")
                || normalized.contains("no longer available") || normalized.contains("http error 404")
                || normalized.contains("does not exist")) {
            return "Video unavailable or removed";
        }
        if (normalized.contains("unsupported url")) {
            return "Unsupported URL";
        }
        if (normalized.contains("unable to download webpage") || normalized.contains("name or service not known")
                || normalized.contains("temporary failure in name resolution") || normalized.contains("network is unreachable")
                || normalized.contains("connection refused") || normalized.contains("connection reset")) {
            return "Network error while fetching media";
        }
        if (code == 0 && !audioPresent) {
            return "Downloader finished but produced no audio file";
        }
        String errorLine = lastErrorLine(output);
        return "yt-dlp exit=" + code + (errorLine != null ? ": " + errorLine : " log=" + ProcessRunner.truncate(output, LOG_SNIPPET_MAX));
    }

    private static boolean isAuthWall(String normalized) {
        return normalized.contains("sign in to confirm you're not a bot")
                || normalized.contains("sign in to confirm your age")
                || normalized.contains("--cookies-from-browser")
                || normalized.contains("use --cookies");
    }

    private static String lastErrorLine(String output) {
        if (output == null) {
            return null;
        }
        String[] lines = output.split("\\r?\\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (line.startsWith("ERROR:")) {
                return line.substring("ERROR:".length()).strip();
            }
        }
        return null;
    }

    private JsonNode readInfo(String output) {
        String json = YtDlp.lastJsonLine(output);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            LOGGER.warn("yt-dlp metadata not parseable: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String cleanupPartial(Path dir) {
        List<Path> partials = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> {
                String name = p.getFileName().toString();
                return name.endsWith(".part") || name.endsWith(".ytdl");
            }).forEach(partials::add);
        } catch (IOException e) {
            LOGGER.warn("Failed to list job dir for partial files dir={}", dir, e);
            return "";
        }
        for (Path partial : partials) {
            try {
                Files.deleteIfExists(partial);
            } catch (IOException e) {
                LOGGER.warn("Failed to delete yt-dlp partial file partial={}", partial, e);
            }
        }
        return partials.isEmpty() ? "" : " (partial download removed)";
    }
}
