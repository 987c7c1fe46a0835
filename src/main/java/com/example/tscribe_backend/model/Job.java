package com.example.tscribe_backend.model;

import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptSource;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "job",
        indexes = {
                @Index(name = "idx_job_status_created", columnList = "status, created_at")
        }
)
public class Job {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "url", nullable = false, updatable = false, length = 2048)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "requested_language", updatable = false, length = 16)
    private String requestedLanguage;

    @Column(name = "detected_language", length = 16)
    private String detectedLanguage;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "progress", nullable = false)
    private int progress = 0;

    @Column(name = "result_text", columnDefinition = "text")
    private String resultText;

    // [{start,end,text}] in seconds, rendered into export formats on demand
    @Column(name = "result_segments_json", columnDefinition = "text")
    private String resultSegmentsJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 16)
    private TranscriptSource source;

    @Column(name = "error", columnDefinition = "text")
    private String error;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Job() {}

    public Job(String url, String requestedLanguage) {
        this.url = url;
        this.requestedLanguage = requestedLanguage;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getUrl() {
        return url;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getRequestedLanguage() {
        return requestedLanguage;
    }

    public String getDetectedLanguage() {
        return detectedLanguage;
    }

    public void setDetectedLanguage(String detectedLanguage) {
        this.detectedLanguage = detectedLanguage;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
    }

    public String getResultText() {
        return resultText;
    }

    public void setResultText(String resultText) {
        this.resultText = resultText;
    }

    public String getResultSegmentsJson() {
        return resultSegmentsJson;
    }

    public void setResultSegmentsJson(String resultSegmentsJson) {
        this.resultSegmentsJson = resultSegmentsJson;
    }

    public TranscriptSource getSource() {
        return source;
    }

    public void setSource(TranscriptSource source) {
        this.source = source;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = JobStatus.QUEUED;
    }
}
