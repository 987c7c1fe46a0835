package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.FwProperties;
import com.example.tscribe_backend.dto.FwVerboseResponse;
import com.example.tscribe_backend.exception.TranscriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;

@Component
public class FasterWhisperClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(FasterWhisperClient.class);

    private final WebClient client;
    private final String model;
    private final Duration timeout;

    public FasterWhisperClient(@Qualifier("fwWebClient") WebClient client, FwProperties props) {
        this.client = client;
        this.model = props.getModel();
        this.timeout = Duration.ofSeconds(props.getTimeoutSeconds());
    }

    public FwVerboseResponse transcribeFile(Path file, String language) {
        var mb = new LinkedMultiValueMap<String, Object>();
        mb.add("file", new FileSystemResource(file));
        if (model != null && !model.isBlank()) {
            mb.add("model", model);
        }
        if (language != null && !language.isBlank()) {
            mb.add("language", language);
        }
        mb.add("response_format", "verbose_json");

        long start = System.currentTimeMillis();
        return client.post()
                .uri("/v1/audio/transcriptions")
                .body(BodyInserters.fromMultipartData(mb))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new TranscriptionException("faster-whisper error " + resp.statusCode() + ": " + body)))
                .bodyToMono(FwVerboseResponse.class)
                .timeout(timeout)
                .doOnSuccess(r -> LOGGER.debug("FW {} processed in {} ms",
                        file.getFileName(), System.currentTimeMillis() - start))
                .block();
    }
}
