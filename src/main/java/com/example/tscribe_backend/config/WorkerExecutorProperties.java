package com.example.tscribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;

/**
 * Configures worker polling, job deadlines, shutdown and bookkeeping retries.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private boolean enabled = true;
    /** Owner tag written on claimed queue entries; defaults to host and pid. Must be unique per running process. */
    private String id;
    private long pollIntervalMs = 2000;
    private int concurrency = 1;
    private Duration jobTimeout = Duration.ofSeconds(7200);
    private Duration shutdownGrace = Duration.ofSeconds(30);
    /** How long the executor waits for a cancelled phase thread to unwind before cleaning up. */
    private Duration cancelGrace = Duration.ofSeconds(10);

    private StoreRetry storeRetry = new StoreRetry();
    private Recovery recovery = new Recovery();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public Duration getCancelGrace() {
        return cancelGrace;
    }

    public void setCancelGrace(Duration cancelGrace) {
        this.cancelGrace = cancelGrace;
    }

    public StoreRetry getStoreRetry() {
        return storeRetry;
    }

    public void setStoreRetry(StoreRetry storeRetry) {
        this.storeRetry = storeRetry;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public int effectiveConcurrency() {
        return Math.max(1, concurrency);
    }

    /**
     * {@link #getId()} when configured, otherwise {@code <host>:<pid>}. The host part stays the same
     * across restarts, which lets recovery recognise claims left behind by a dead process on this host.
     */
    public String resolvedId() {
        if (id != null && !id.isBlank()) {
            return id;
        }
        return localHost() + ":" + ProcessHandle.current().pid();
    }

    public static String localHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    public static class StoreRetry {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(200);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }
    }

    public static class Recovery {
        private boolean enabled = true;
        /** Fixed delay of the pass that fails jobs whose claim deadline has passed. */
        private Duration reapInterval = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getReapInterval() {
            return reapInterval;
        }

        public void setReapInterval(Duration reapInterval) {
            this.reapInterval = reapInterval;
        }
    }
}
