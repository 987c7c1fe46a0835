package com.example.tscribe_backend.service;

import com.example.tscribe_backend.config.CleanupProperties;
import com.example.tscribe_backend.service.Interfaces.StorageService;
import com.example.tscribe_backend.util.FileCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Periodic sweep of the jobs directory. Deletes files older than {@code cleanup.max-age} and the
 * directories they leave empty. Age is the only guard against touching a running job's files, so
 * the threshold must exceed the job timeout.
 */
@Service
public class ArtifactSweeper {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactSweeper.class);

    private final StorageService storage;
    private final CleanupProperties properties;
    private final Clock clock;

    public ArtifactSweeper(StorageService storage, CleanupProperties properties, Clock clock) {
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${cleanup.sweep-interval:PT1H}", initialDelayString = "${cleanup.sweep-interval:PT1H}")
    public void scheduledSweep() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            int removed = sweep();
            if (removed > 0) {
                LOGGER.info("Artifact sweep removed {} stale file(s)", removed);
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Artifact sweep failed: {}", e.toString());
        }
    }

    /** @return number of files deleted; emptied directories are not counted */
    public int sweep() {
        Path root = storage.jobsRoot().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(properties.getMaxAge());
        // Ages are read before anything is deleted; removing a child bumps its parent's mtime.
        List<Path> stale;
        try (Stream<Path> walk = Files.walk(root)) {
            stale = walk.filter(p -> !p.equals(root))
                    .filter(p -> p.normalize().startsWith(root))
                    .filter(p -> olderThan(p, cutoff))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (IOException e) {
            LOGGER.warn("Artifact sweep walk failed root={} err={}", root, e.toString());
            return 0;
        }

        int removed = 0;
        for (Path path : stale) {
            boolean directory = Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);
            if (directory && !FileCleanup.isDirectoryEmpty(path)) {
                continue;
            }
            if (FileCleanup.safeDelete(path) && !directory) {
                LOGGER.debug("Swept {}", path);
                removed++;
            }
        }
        return removed;
    }

    private static boolean olderThan(Path path, Instant cutoff) {
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            return modified.toInstant().isBefore(cutoff);
        } catch (IOException e) {
            return false;
        }
    }
}
