package com.example.tscribe_backend.service;

import com.example.tscribe_backend.engine.Interfaces.TranscriptionEngine;
import com.example.tscribe_backend.exception.JobRecordGoneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Moves engine progress callbacks off the engine thread. Each job gets a {@link Channel}: the engine
 * only records the highest value seen; a single drain task on {@code progressTaskExecutor} writes the
 * latest value, so bursts of callbacks collapse into one store write.
 */
@Component
public class ProgressPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressPublisher.class);

    private final JobStateWriter stateWriter;
    private final TaskExecutor executor;

    public ProgressPublisher(JobStateWriter stateWriter, @Qualifier("progressTaskExecutor") TaskExecutor executor) {
        this.stateWriter = stateWriter;
        this.executor = executor;
    }

    public Channel open(UUID jobId) {
        return new Channel(jobId);
    }

    public final class Channel implements TranscriptionEngine.ProgressListener, AutoCloseable {
        private static final int NONE = -1;

        private final UUID jobId;
        private final AtomicInteger highest = new AtomicInteger(NONE);
        private final AtomicInteger pending = new AtomicInteger(NONE);
        private final AtomicBoolean draining = new AtomicBoolean();
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile int lastWritten = NONE;

        private Channel(UUID jobId) {
            this.jobId = jobId;
        }

        @Override
        public void onProgress(int percent) {
            if (closed.get()) {
                return;
            }
            int p = Math.max(0, Math.min(100, percent));
            int prev = highest.getAndAccumulate(p, Math::max);
            if (p <= prev) {
                return;
            }
            pending.accumulateAndGet(p, Math::max);
            if (draining.compareAndSet(false, true)) {
                try {
                    executor.execute(this::drain);
                } catch (RuntimeException e) {
                    draining.set(false);
                    LOGGER.warn("Progress write not scheduled jobId={} err={}", jobId, e.toString());
                }
            }
        }

        private void drain() {
            try {
                int value;
                while (!closed.get() && (value = pending.getAndSet(NONE)) != NONE) {
                    if (value > lastWritten) {
                        write(value);
                    }
                }
            } finally {
                draining.set(false);
            }
            // a value may have arrived between the last poll and releasing the flag
            if (!closed.get() && pending.get() != NONE && draining.compareAndSet(false, true)) {
                try {
                    executor.execute(this::drain);
                } catch (RuntimeException e) {
                    draining.set(false);
                }
            }
        }

        private void write(int value) {
            try {
                stateWriter.updateProgress(jobId, value);
                lastWritten = value;
            } catch (JobRecordGoneException e) {
                LOGGER.info("Job record gone, progress updates stopped jobId={}", jobId);
                closed.set(true);
            } catch (RuntimeException e) {
                // best effort: the next value or the terminal write supersedes this one
                LOGGER.warn("Progress write failed jobId={} value={} err={}", jobId, value, e.toString());
            }
        }

        public int lastWritten() {
            return lastWritten;
        }

        /** Drops pending values; terminal writes pin progress themselves. */
        @Override
        public void close() {
            closed.set(true);
        }
    }
}
