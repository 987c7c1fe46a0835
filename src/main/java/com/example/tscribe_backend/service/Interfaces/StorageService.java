package com.example.tscribe_backend.service.Interfaces;

import com.example.tscribe_backend.service.JobWorkspace;

import java.nio.file.Path;
import java.util.UUID;

public interface StorageService {
    /** Root of every per-job directory; the sweeper never leaves it. */
    Path jobsRoot();

    /** {@code <jobsRoot>/<jobId>}, not created. */
    Path resolveJobDir(UUID jobId);

    /** Creates the job directory and hands it to the executing worker. */
    JobWorkspace openWorkspace(UUID jobId);

    /** Removes everything stored for the job. Throws when files remain afterwards. */
    void deleteJobArtifacts(UUID jobId);
}
