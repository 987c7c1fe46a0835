package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.SubtitleProperties;
import com.example.tscribe_backend.engine.Interfaces.SubtitleFetcher;
import com.example.tscribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.tscribe_backend.engine.SubtitleFetchResult;
import com.example.tscribe_backend.exception.JobInterruptedException;
import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Drives one QUEUED job through its phases, strictly in order:
 * <ol>
 *     <li>captions from the platform; on success the job goes straight to DONE,</li>
 *     <li>DOWNLOADING: audio to the job workspace,</li>
 *     <li>TRANSCRIBING: speech-to-text with streamed progress,</li>
 *     <li>DONE with {@code source=whisper}.</li>
 * </ol>
 * Phase errors are thrown to the caller, which owns failure handling and the deadline. When a status
 * write is rejected the job was already finished elsewhere (deadline, shutdown) and the pipeline stops.
 *
 * @return the source that produced the result, or empty when the pipeline stopped without writing DONE
 */
@Component
public class TranscriptionPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionPipeline.class);

    private final SubtitleFetcher subtitleFetcher;
    private final MediaDownloader mediaDownloader;
    private final TranscriptionEngine transcriptionEngine;
    private final JobStateWriter stateWriter;
    private final ProgressPublisher progressPublisher;
    private final SubtitleProperties subtitleProperties;

    public TranscriptionPipeline(SubtitleFetcher subtitleFetcher,
                                 MediaDownloader mediaDownloader,
                                 TranscriptionEngine transcriptionEngine,
                                 JobStateWriter stateWriter,
                                 ProgressPublisher progressPublisher,
                                 SubtitleProperties subtitleProperties) {
        this.subtitleFetcher = subtitleFetcher;
        this.mediaDownloader = mediaDownloader;
        this.transcriptionEngine = transcriptionEngine;
        this.stateWriter = stateWriter;
        this.progressPublisher = progressPublisher;
        this.subtitleProperties = subtitleProperties;
    }

    public Optional<TranscriptSource> run(Job job, JobWorkspace workspace) {
        UUID id = job.getId();

        if (subtitleProperties.isEnabled()) {
            SubtitleFetchResult captions = subtitleFetcher.fetch(job.getUrl(), job.getRequestedLanguage());
            switch (captions.outcome()) {
                case FOUND -> {
                    LOGGER.info("Captions found jobId={} lang={} segments={}", id, captions.language(), captions.segments().size());
                    boolean written = stateWriter.markDone(id, JobStatus.QUEUED, captions.text(), captions.segments(),
                            TranscriptSource.SUBTITLES, captions.language(), captions.title(), captions.durationSeconds());
                    return written ? Optional.of(TranscriptSource.SUBTITLES) : rejected(id, JobStatus.DONE);
                }
                case NOT_AVAILABLE -> LOGGER.info("No captions, using speech-to-text jobId={} detail={}", id, captions.detail());
                case TRANSPORT_ERROR -> LOGGER.warn("Caption lookup failed, using speech-to-text jobId={} detail={}", id, captions.detail());
            }
        }

        checkNotCancelled();
        if (!stateWriter.markDownloading(id)) {
            return rejected(id, JobStatus.DOWNLOADING);
        }
        MediaDownloader.DownloadedMedia media = mediaDownloader.download(job.getUrl(), workspace);

        checkNotCancelled();
        if (!stateWriter.markTranscribing(id, media.title(), media.durationSeconds())) {
            return rejected(id, JobStatus.TRANSCRIBING);
        }

        TranscriptionEngine.Result result;
        try (ProgressPublisher.Channel progress = progressPublisher.open(id)) {
            result = transcriptionEngine.transcribe(
                    new TranscriptionEngine.Request(id, media.audio(), job.getRequestedLanguage(), media.durationSeconds()),
                    progress);
        }

        checkNotCancelled();
        boolean written = stateWriter.markDone(id, JobStatus.TRANSCRIBING, result.text(), result.segments(),
                TranscriptSource.WHISPER, result.lang(), media.title(), media.durationSeconds());
        return written ? Optional.of(TranscriptSource.WHISPER) : rejected(id, JobStatus.DONE);
    }

    private Optional<TranscriptSource> rejected(UUID id, JobStatus target) {
        LOGGER.info("Transition to {} rejected, job already finished elsewhere jobId={}", target, id);
        return Optional.empty();
    }

    private static void checkNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new JobInterruptedException("Pipeline cancelled");
        }
    }
}
