package com.example.tscribe_backend.config;

import com.example.tscribe_backend.repository.JobRepository;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.ProcessRunner;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

@Configuration
public class HealthConfig {
    private static final Duration TOOL_CHECK_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public HealthIndicator ytDlpHealth(@Value("${downloader.ytdlp.bin:yt-dlp}") String ytDlpBin) {
        return () -> toolHealth("yt-dlp", List.of(ytDlpBin, "--version"));
    }

    @Bean
    public HealthIndicator ffmpegHealth() {
        return () -> toolHealth("ffmpeg", List.of("ffmpeg", "-version"));
    }

    @Bean
    @ConditionalOnProperty(name = "engine.asr", havingValue = "faster-whisper", matchIfMissing = true)
    public HealthIndicator fasterWhisperHealth(@Qualifier("fwWebClient") WebClient fw) {
        return () -> {
            try {
                fw.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("fasterWhisper", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("fasterWhisper", "unreachable").build();
            }
        };
    }

    @Bean
    public HealthIndicator jobQueueHealth(WorkQueue queue, JobRepository jobRepository) {
        return () -> Health.up()
                .withDetail("durable", queue.isDurable())
                .withDetail("queued", jobRepository.countByStatus(JobStatus.QUEUED))
                .withDetail("downloading", jobRepository.countByStatus(JobStatus.DOWNLOADING))
                .withDetail("transcribing", jobRepository.countByStatus(JobStatus.TRANSCRIBING))
                .build();
    }

    private static Health toolHealth(String name, List<String> cmd) {
        try {
            ProcessRunner.Result result = ProcessRunner.run(cmd, TOOL_CHECK_TIMEOUT, null);
            if (result.ok()) {
                String version = result.output().lines().findFirst().orElse("").trim();
                return Health.up().withDetail(name, version.isEmpty() ? "ok" : version).build();
            }
            return Health.down().withDetail(name, "exit=" + result.code()).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.unknown().withDetail(name, "interrupted").build();
        } catch (Exception e) {
            return Health.down().withDetail(name, "missing").build();
        }
    }
}
