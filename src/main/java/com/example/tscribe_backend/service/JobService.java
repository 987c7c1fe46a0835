package com.example.tscribe_backend.service;

import com.example.tscribe_backend.dto.JobListResponse;
import com.example.tscribe_backend.dto.JobResponse;
import com.example.tscribe_backend.dto.TranscriptExport;
import com.example.tscribe_backend.dto.TranscriptSegment;
import com.example.tscribe_backend.exception.UrlRejectedException;
import com.example.tscribe_backend.model.Job;
import com.example.tscribe_backend.repository.JobRepository;
import com.example.tscribe_backend.service.Interfaces.StorageService;
import com.example.tscribe_backend.service.Interfaces.UrlSafetyGate;
import com.example.tscribe_backend.service.Interfaces.WorkQueue;
import com.example.tscribe_backend.util.JobStatus;
import com.example.tscribe_backend.util.TranscriptFormat;
import com.example.tscribe_backend.util.TranscriptFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@Service
public class JobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final WorkQueue queue;
    private final StorageService storage;
    private final UrlSafetyGate urlSafetyGate;
    private final int listLimit;

    public JobService(JobRepository jobRepository,
                      WorkQueue queue,
                      StorageService storage,
                      UrlSafetyGate urlSafetyGate,
                      @Value("${jobs.list-limit:50}") int listLimit) {
        this.jobRepository = jobRepository;
        this.queue = queue;
        this.storage = storage;
        this.urlSafetyGate = urlSafetyGate;
        this.listLimit = Math.max(1, listLimit);
    }

    /**
     * Stores a QUEUED job and makes it visible to workers in the same transaction.
     *
     * @throws ResponseStatusException 400 when the URL is rejected; nothing is stored then
     */
    @Transactional
    public JobResponse create(String url, String language) {
        String trimmed = url == null ? null : url.trim();
        try {
            urlSafetyGate.validate(trimmed);
        } catch (UrlRejectedException e) {
            LOGGER.info("URL rejected url={} reason={}", trimmed, e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        String lang = language == null || language.isBlank() ? null : language.trim();
        Job job = jobRepository.save(new Job(trimmed, lang));
        queue.enqueue(job.getId());
        LOGGER.info("Job created jobId={} url={} language={}", job.getId(), trimmed, lang);
        return JobResponse.from(job);
    }

    @Transactional(readOnly = true)
    public JobResponse get(UUID id) {
        return JobResponse.from(load(id));
    }

    @Transactional(readOnly = true)
    public List<JobListResponse> list() {
        return jobRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, listLimit)).stream()
                .map(JobListResponse::from)
                .toList();
    }

    /**
     * Removes the record, its queue entry and its directory. Returns only once all three are gone;
     * an executor still running the job notices the missing record on its next write.
     */
    @Transactional
    public void delete(UUID id) {
        if (!jobRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
        }
        queue.remove(id);
        // bulk delete: a running executor may bump the version between the check and here
        if (jobRepository.deleteJobById(id) == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
        }
        storage.deleteJobArtifacts(id);
        LOGGER.info("Job deleted jobId={}", id);
    }

    @Transactional(readOnly = true)
    public TranscriptExport export(UUID id, String format) {
        TranscriptFormat fmt = TranscriptFormat.parse(format)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_FORMAT"));
        Job job = load(id);
        if (job.getStatus() != JobStatus.DONE) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_DONE");
        }
        List<TranscriptSegment> segments = TranscriptFormats.readSegments(job.getResultSegmentsJson());
        String body;
        if (!segments.isEmpty()) {
            body = TranscriptFormats.render(segments, fmt);
        } else if (fmt == TranscriptFormat.TXT) {
            body = job.getResultText() == null ? "" : job.getResultText();
        } else {
            double end = job.getDurationSeconds() == null ? 0 : job.getDurationSeconds();
            body = TranscriptFormats.render(List.of(new TranscriptSegment(0, end, job.getResultText())), fmt);
        }
        return new TranscriptExport(fmt.fileName(), fmt.contentType(), body);
    }

    private Job load(UUID id) {
        return jobRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }
}
