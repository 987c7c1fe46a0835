package com.example.tscribe_backend.service;

import com.example.tscribe_backend.util.FileCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The temporary files a job owns while one worker processes it: the per-job directory plus every
 * artifact registered inside it. Owned by exactly one executor; {@link #release()} is idempotent.
 */
public class JobWorkspace {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobWorkspace.class);

    private final UUID jobId;
    private final Path dir;
    private final Path root;
    private final Set<Path> artifacts = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean released = new AtomicBoolean();

    public JobWorkspace(UUID jobId, Path dir, Path root) {
        this.jobId = jobId;
        this.dir = dir;
        this.root = root;
    }

    public UUID jobId() {
        return jobId;
    }

    public Path dir() {
        return dir;
    }

    public Path register(Path artifact) {
        Path normalized = artifact.toAbsolutePath().normalize();
        if (!normalized.startsWith(dir)) {
            throw new IllegalArgumentException("Artifact outside job directory: " + artifact);
        }
        artifacts.add(normalized);
        return normalized;
    }

    public Set<Path> artifacts() {
        return Set.copyOf(artifacts);
    }

    public boolean isReleased() {
        return released.get();
    }

    /** Deletes registered artifacts, anything else left in the job directory, and empty parents up to the jobs root. */
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        artifacts.forEach(FileCleanup::safeDelete);
        FileCleanup.deleteRecursively(dir);
        FileCleanup.deletePathAndParents(dir, root);
        if (Files.exists(dir)) {
            LOGGER.warn("Workspace not fully removed jobId={} dir={}; periodic sweep will retry", jobId, dir);
        } else {
            LOGGER.debug("Workspace released jobId={} artifacts={}", jobId, artifacts.size());
        }
    }
}
