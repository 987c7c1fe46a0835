package com.example.tscribe_backend.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs an external tool with merged stdout/stderr. Output lines are collected and optionally
 * streamed to a consumer while the process runs. On timeout or interruption of the calling thread
 * the whole process tree is killed.
 */
public final class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long REAP_SECONDS = 5;

    private ProcessRunner() {}

    public record Result(int code, String output, boolean timedOut) {
        public boolean ok() {
            return !timedOut && code == 0;
        }
    }

    public static Result run(List<String> cmd, Duration timeout, Consumer<String> onLine)
            throws IOException, InterruptedException {
        LOGGER.debug("exec: {}", String.join(" ", cmd));
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        StringBuffer out = new StringBuffer();
        Thread reader = new Thread(() -> pump(p, out, onLine), "proc-out-" + p.pid());
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOGGER.warn("Process timed out after {}s, killing pid={} cmd={}", timeout.toSeconds(), p.pid(), cmd.get(0));
                destroyTree(p);
                p.waitFor(REAP_SECONDS, TimeUnit.SECONDS);
            }
            reader.join(TimeUnit.SECONDS.toMillis(REAP_SECONDS));
            return new Result(finished ? p.exitValue() : -1, out.toString(), !finished);
        } catch (InterruptedException e) {
            LOGGER.info("Interrupted while waiting for pid={}, killing {}", p.pid(), cmd.get(0));
            destroyTree(p);
            throw e;
        }
    }

    public static String truncate(String output, int max) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= max) {
            return output;
        }
        // the tail carries the error in yt-dlp and whisper output
        return "..." + output.substring(output.length() - max);
    }

    private static void pump(Process p, StringBuffer out, Consumer<String> onLine) {
        try (BufferedReader in = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (out.length() > 0) out.append('\n');
                out.append(line);
                LOGGER.debug("[{}] {}", p.pid(), line);
                if (onLine != null) {
                    try {
                        onLine.accept(line);
                    } catch (RuntimeException e) {
                        LOGGER.warn("Output consumer failed on line, continuing: {}", e.toString());
                    }
                }
            }
        } catch (IOException e) {
            // stream closes when the process is destroyed; exit code decides the outcome
            LOGGER.debug("Output stream closed pid={}: {}", p.pid(), e.toString());
        }
    }

    private static void destroyTree(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
    }
}
