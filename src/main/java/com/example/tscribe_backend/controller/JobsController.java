package com.example.tscribe_backend.controller;

import com.example.tscribe_backend.dto.JobCreateRequest;
import com.example.tscribe_backend.dto.JobListResponse;
import com.example.tscribe_backend.dto.JobResponse;
import com.example.tscribe_backend.dto.TranscriptExport;
import com.example.tscribe_backend.service.JobService;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/jobs")
public class JobsController {
    private final JobService jobService;

    public JobsController(JobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JobResponse create(@Valid @RequestBody JobCreateRequest req) {
        return jobService.create(req.url(), req.language());
    }

    @GetMapping
    public List<JobListResponse> list() {
        return jobService.list();
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return jobService.get(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        jobService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/download/{format}")
    public ResponseEntity<byte[]> download(@PathVariable UUID id, @PathVariable String format) {
        TranscriptExport export = jobService.export(id, format);
        ContentDisposition disposition = ContentDisposition.attachment().filename(export.fileName()).build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(new MediaType(MediaType.parseMediaType(export.contentType()), StandardCharsets.UTF_8))
                .body(export.body().getBytes(StandardCharsets.UTF_8));
    }
}
