package com.example.tscribe_backend.config;

import com.example.tscribe_backend.engine.FasterWhisperTranscriptionEngine;
import com.example.tscribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.tscribe_backend.engine.WhisperLocalTranscriptionEngine;
import com.example.tscribe_backend.service.FasterWhisperClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** Exactly one speech-to-text engine, chosen by {@code engine.asr}. */
@Configuration
public class AsrEngineConfig {

    @Bean
    @ConditionalOnProperty(name = "engine.asr", havingValue = "faster-whisper", matchIfMissing = true)
    public TranscriptionEngine fasterWhisperEngine(FasterWhisperClient client) {
        return new FasterWhisperTranscriptionEngine(client);
    }

    @Bean
    @ConditionalOnProperty(name = "engine.asr", havingValue = "whisper-local")
    public TranscriptionEngine whisperLocalEngine(
            ObjectMapper objectMapper,
            @Value("${asr.whisper.cmd:whisper}") String whisperCmd,
            @Value("${asr.whisper.model:base}") String whisperModel,
            @Value("${asr.whisper.timeout:PT2H}") Duration timeout
    ) {
        return new WhisperLocalTranscriptionEngine(whisperCmd, whisperModel, timeout, objectMapper);
    }
}
