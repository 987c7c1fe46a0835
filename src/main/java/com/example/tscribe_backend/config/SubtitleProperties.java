package com.example.tscribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Caption fast path. {@code defaultLanguages} is tried after the requested language.
 */
@ConfigurationProperties(prefix = "subtitles")
public class SubtitleProperties {
    private boolean enabled = true;
    private List<String> defaultLanguages = new ArrayList<>(List.of("de", "en"));
    private Duration timeout = Duration.ofSeconds(60);
    private int maxTrackBytes = 8 * 1024 * 1024;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getDefaultLanguages() {
        return defaultLanguages;
    }

    public void setDefaultLanguages(List<String> defaultLanguages) {
        this.defaultLanguages = defaultLanguages;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxTrackBytes() {
        return maxTrackBytes;
    }

    public void setMaxTrackBytes(int maxTrackBytes) {
        this.maxTrackBytes = maxTrackBytes;
    }
}
