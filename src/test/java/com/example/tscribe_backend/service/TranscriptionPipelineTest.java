package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.SubtitleProperties;
import com.example.tscribe_backend.dto.TranscriptSegment;
import com.example.tscribe_backend.engine.Interfaces.SubtitleFetcher;
import com.example.tscribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.tscribe_backend.engine.SubtitleFetchResult;
import com.example.tscribe_backend.exception.DownloadException;
import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TranscriptionPipelineTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";

    @Mock
    private SubtitleFetcher subtitleFetcher;
    @Mock
    private MediaDownloader mediaDownloader;
    @Mock
    private TranscriptionEngine engine;
    @Mock
    private JobStateWriter stateWriter;

    @TempDir
    private Path tempDir;

    private TranscriptionPipeline pipeline;
    private Job job;
    private JobWorkspace workspace;

    @BeforeEach
    void setUp() {
        pipeline = new TranscriptionPipeline(subtitleFetcher, mediaDownloader, engine, stateWriter,
                new ProgressPublisher(stateWriter, new SyncTaskExecutor()), new SubtitleProperties());
        job = new Job(URL, "en");
        job.setId(UUID.randomUUID());
        workspace = new JobWorkspace(job.getId(), tempDir.resolve(job.getId().toString()), tempDir);
    }

    @Test
    void captionsFinishTheJobWithoutDownloading() {
        List<TranscriptSegment> segments = List.of(new TranscriptSegment(0, 1, "hi"));
        when(subtitleFetcher.fetch(URL, "en")).thenReturn(SubtitleFetchResult.found(segments, "en", "Title", 60.0));
        when(stateWriter.markDone(job.getId(), JobStatus.QUEUED, "hi", segments, TranscriptSource.SUBTITLES, "en", "Title", 60.0))
                .thenReturn(true);

        Optional<TranscriptSource> source = pipeline.run(job, workspace);

        assertThat(source).contains(TranscriptSource.SUBTITLES);
        verify(stateWriter, never()).markDownloading(any());
        verifyNoInteractions(mediaDownloader, engine);
    }

    @Test
    void missingCaptionsRunDownloadThenTranscription() {
        Path audio = tempDir.resolve("audio.wav");
        List<TranscriptSegment> segments = List.of(new TranscriptSegment(0, 2, "spoken"));
        when(subtitleFetcher.fetch(URL, "en")).thenReturn(SubtitleFetchResult.notAvailable("none"));
        when(stateWriter.markDownloading(job.getId())).thenReturn(true);
        when(mediaDownloader.download(URL, workspace)).thenReturn(new MediaDownloader.DownloadedMedia(audio, "Talk", 30.0));
        when(stateWriter.markTranscribing(job.getId(), "Talk", 30.0)).thenReturn(true);
        when(engine.transcribe(any(), any())).thenAnswer(inv -> {
            TranscriptionEngine.ProgressListener listener = inv.getArgument(1);
            listener.onProgress(20);
            listener.onProgress(70);
            return new TranscriptionEngine.Result("spoken", segments, "en", "test");
        });
        when(stateWriter.markDone(job.getId(), JobStatus.TRANSCRIBING, "spoken", segments, TranscriptSource.WHISPER, "en", "Talk", 30.0))
                .thenReturn(true);

        Optional<TranscriptSource> source = pipeline.run(job, workspace);

        assertThat(source).contains(TranscriptSource.WHISPER);
        InOrder order = inOrder(stateWriter, mediaDownloader, engine);
        order.verify(stateWriter).markDownloading(job.getId());
        order.verify(mediaDownloader).download(URL, workspace);
        order.verify(stateWriter).markTranscribing(job.getId(), "Talk", 30.0);
        order.verify(stateWriter).updateProgress(job.getId(), 20);
        order.verify(stateWriter).updateProgress(job.getId(), 70);
        order.verify(stateWriter).markDone(eq(job.getId()), eq(JobStatus.TRANSCRIBING), any(), any(), any(), any(), any(), any());
    }

    @Test
    void captionTransportErrorFallsThrough() {
        when(subtitleFetcher.fetch(URL, "en")).thenReturn(SubtitleFetchResult.transportError("probe exit=1"));
        when(stateWriter.markDownloading(job.getId())).thenReturn(true);
        when(mediaDownloader.download(URL, workspace)).thenThrow(new DownloadException("Video unavailable or removed"));

        assertThatThrownBy(() -> pipeline.run(job, workspace))
                .isInstanceOf(DownloadException.class)
                .hasMessage("Video unavailable or removed");
        verify(stateWriter, never()).markTranscribing(any(), any(), any());
        verifyNoInteractions(engine);
    }

    @Test
    void rejectedTransitionStopsThePipeline() {
        when(subtitleFetcher.fetch(URL, "en")).thenReturn(SubtitleFetchResult.notAvailable("none"));
        when(stateWriter.markDownloading(job.getId())).thenReturn(false);

        assertThat(pipeline.run(job, workspace)).isEmpty();
        verifyNoInteractions(mediaDownloader, engine);
    }

    @Test
    void disabledCaptionsSkipTheFetcher() {
        SubtitleProperties props = new SubtitleProperties();
        props.setEnabled(false);
        pipeline = new TranscriptionPipeline(subtitleFetcher, mediaDownloader, engine, stateWriter,
                new ProgressPublisher(stateWriter, new SyncTaskExecutor()), props);
        when(stateWriter.markDownloading(job.getId())).thenReturn(false);

        pipeline.run(job, workspace);

        verifyNoInteractions(subtitleFetcher);
        verify(stateWriter, never()).updateProgress(any(), anyInt());
    }
}
