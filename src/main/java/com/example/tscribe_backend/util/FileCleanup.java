package com.example.tscribe_backend.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Lenient delete helpers shared by workspace release and the periodic sweep. Failures are logged,
 * never thrown; callers that need a hard guarantee check {@link Files#exists} afterwards.
 */
public final class FileCleanup {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileCleanup.class);

    private FileCleanup() {}

    /** Deletes {@code path}, then walks up removing parents that became empty, stopping at {@code root}. */
    public static void deletePathAndParents(Path path, Path root) {
        if (path == null) {
            return;
        }
        safeDelete(path);
        Path parent = path.getParent();
        while (parent != null && root != null && !parent.equals(root) && parent.startsWith(root)) {
            if (!isDirectoryEmpty(parent)) {
                break;
            }
            safeDelete(parent);
            parent = parent.getParent();
        }
    }

    /** Depth-first delete of a directory tree. Returns true when nothing is left. */
    public static boolean deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return true;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(FileCleanup::safeDelete);
        } catch (IOException e) {
            LOGGER.warn("Cleanup walk failed dir={} err={}", dir, e.toString());
        }
        return !Files.exists(dir);
    }

    public static boolean safeDelete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (Exception e) {
            LOGGER.warn("Cleanup delete failed path={} err={}", path, e.toString());
            return false;
        }
    }

    public static boolean isDirectoryEmpty(Path dir) {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.findFirst().isEmpty();
        } catch (Exception e) {
            return false;
        }
    }
}
