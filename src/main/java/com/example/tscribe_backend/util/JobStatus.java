package com.example.tscribe_backend.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a transcription job.
 *
 * <pre>
 * QUEUED -> DONE (subtitles) | DOWNLOADING | FAILED
 * DOWNLOADING -> TRANSCRIBING | FAILED
 * TRANSCRIBING -> DONE (whisper) | FAILED
 * </pre>
 * DONE and FAILED are terminal.
 */
public enum JobStatus {
    QUEUED,
    DOWNLOADING,
    TRANSCRIBING,
    DONE,
    FAILED;

    public static final Set<JobStatus> NON_TERMINAL = EnumSet.of(QUEUED, DOWNLOADING, TRANSCRIBING);

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case QUEUED -> next == DONE || next == DOWNLOADING || next == FAILED;
            case DOWNLOADING -> next == TRANSCRIBING || next == FAILED;
            case TRANSCRIBING -> next == DONE || next == FAILED;
            default -> false;
        };
    }

    /** Source states from which {@code target} may be entered. */
    public static Set<JobStatus> sourcesOf(JobStatus target) {
        Set<JobStatus> sources = EnumSet.noneOf(JobStatus.class);
        for (JobStatus candidate : values()) {
            if (candidate.canTransitionTo(target)) {
                sources.add(candidate);
            }
        }
        return sources;
    }
}
