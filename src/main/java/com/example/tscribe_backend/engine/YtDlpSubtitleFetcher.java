package com.example.tscribe_backend.engine;

import com.example.tscribe_backend.config.SubtitleProperties;
import com.example.tscribe_backend.dto.TranscriptSegment;
import com.example.tscribe_backend.engine.Interfaces.SubtitleFetcher;
import com.example.tscribe_backend.util.ProcessRunner;
import com.example.tscribe_backend.util.SubtitleParser;
import com.example.tscribe_backend.util.SubtitleTrackSelector;
import com.example.tscribe_backend.util.YtDlp;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Asks yt-dlp for media metadata only (no download), picks a caption track and downloads it.
 * Probe and transport failures become {@code TRANSPORT_ERROR}; a source without usable captions is
 * {@code NOT_AVAILABLE}. Either way the job falls through to download + transcription.
 */
@Component
public class YtDlpSubtitleFetcher implements SubtitleFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpSubtitleFetcher.class);
    private static final int LOG_SNIPPET_MAX = 4_000;

    private final WebClient client;
    private final SubtitleProperties props;
    private final ObjectMapper objectMapper;
    private final String ytdlp;
    private final String cookiesFile;

    public YtDlpSubtitleFetcher(@Qualifier("subtitleWebClient") WebClient client,
                                SubtitleProperties props,
                                ObjectMapper objectMapper,
                                @Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlp,
                                @Value("${downloader.cookies-file:#{null}}") String cookiesFile) {
        this.client = client;
        this.props = props;
        this.objectMapper = objectMapper;
        this.ytdlp = ytdlp;
        this.cookiesFile = cookiesFile;
    }

    @Override
    public SubtitleFetchResult fetch(String url, String requestedLanguage) {
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--skip-download",
                "--dump-single-json",
                "--no-playlist",
                "--no-warnings"
        ));
        YtDlp.appendCookies(cmd, cookiesFile);
        cmd.add(url);

        ProcessRunner.Result result;
        try {
            result = runProcess(cmd, props.getTimeout());
        } catch (IOException e) {
            return SubtitleFetchResult.transportError("metadata probe could not start: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SubtitleFetchResult.transportError("metadata probe interrupted");
        }
        if (result.timedOut()) {
            return SubtitleFetchResult.transportError("metadata probe timed out after " + props.getTimeout().toSeconds() + "s");
        }
        if (result.code() != 0) {
            return SubtitleFetchResult.transportError("metadata probe exit=" + result.code() + " log="
                    + ProcessRunner.truncate(result.output(), LOG_SNIPPET_MAX));
        }

        JsonNode info;
        try {
            String json = YtDlp.lastJsonLine(result.output());
            if (json == null) {
                return SubtitleFetchResult.transportError("metadata probe printed no JSON");
            }
            info = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return SubtitleFetchResult.transportError("malformed metadata: " + e.getOriginalMessage());
        }

        String title = info.hasNonNull("title") ? info.get("title").asText() : null;
        Double duration = info.path("duration").isNumber() ? info.get("duration").asDouble() : null;

        Optional<SubtitleTrackSelector.Selection> selection = SubtitleTrackSelector.select(
                info.path("subtitles"), info.path("automatic_captions"), requestedLanguage, props.getDefaultLanguages());
        if (selection.isEmpty()) {
            return SubtitleFetchResult.notAvailable("no caption tracks");
        }
        SubtitleTrackSelector.Selection sel = selection.get();

        Optional<SubtitleTrackSelector.Track> track = SubtitleTrackSelector.pickFormat(sel.formats());
        if (track.isEmpty()) {
            return SubtitleFetchResult.notAvailable("caption track '" + sel.language() + "' has no downloadable format");
        }
        LOGGER.info("Subtitle track selected lang={} auto={} ext={} url={}",
                sel.language(), sel.automatic(), track.get().ext(), url);

        URI trackUri;
        try {
            trackUri = URI.create(track.get().url());
        } catch (IllegalArgumentException e) {
            return SubtitleFetchResult.transportError("malformed caption URL: " + e.getMessage());
        }

        String body;
        try {
            body = downloadTrack(trackUri);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof WebClientException || cause instanceof TimeoutException || cause instanceof IOException) {
                return SubtitleFetchResult.transportError("caption download failed: " + cause.getMessage());
            }
            throw e;
        }

        List<TranscriptSegment> segments;
        if ("json3".equals(track.get().ext())) {
            try {
                segments = SubtitleParser.parseJson3(objectMapper.readTree(body == null ? "{}" : body));
            } catch (JsonProcessingException e) {
                return SubtitleFetchResult.transportError("malformed json3 track: " + e.getOriginalMessage());
            }
        } else {
            segments = SubtitleParser.parseVtt(body);
        }

        if (segments.isEmpty()) {
            return SubtitleFetchResult.notAvailable("caption track '" + sel.language() + "' is empty");
        }
        return SubtitleFetchResult.found(segments, sel.language(), title, duration);
    }

    protected ProcessRunner.Result runProcess(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return ProcessRunner.run(cmd, timeout, null);
    }

    protected String downloadTrack(URI trackUri) {
        return client.get()
                .uri(trackUri)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(props.getTimeout())
                .block();
    }
}
