package com.example.tscribe_backend.service;

import com.example.tscribe_backend.exception.StorageException;
import com.example.tscribe_backend.service.Interfaces.StorageService;
import com.example.tscribe_backend.util.FileCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path jobsDir;

    public LocalStorageService(Path baseDir, String jobsPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.jobsDir = this.baseDir.resolve(jobsPrefix).normalize();

        try {
            Files.createDirectories(jobsDir);
            LOGGER.info("LocalStorageService ready. base={}, jobs={}", this.baseDir, this.jobsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path jobsRoot() {
        return jobsDir;
    }

    @Override
    public Path resolveJobDir(UUID jobId) {
        if (jobId == null) {
            throw new StorageException("jobId is null");
        }
        return safeResolve(jobsDir, jobId.toString());
    }

    @Override
    public JobWorkspace openWorkspace(UUID jobId) {
        Path dir = resolveJobDir(jobId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create job directory " + dir, e);
        }
        return new JobWorkspace(jobId, dir, jobsDir);
    }

    @Override
    public void deleteJobArtifacts(UUID jobId) {
        Path dir = resolveJobDir(jobId);
        if (!FileCleanup.deleteRecursively(dir)) {
            throw new StorageException("Job artifacts could not be removed: " + dir);
        }
        LOGGER.debug("Deleted job directory {}", dir);
    }

    private Path safeResolve(Path root, String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException("key is blank");
        }
        String normalizedKey = key.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new StorageException("Invalid key (path traversal?): " + key);
        }
        return p;
    }
}
