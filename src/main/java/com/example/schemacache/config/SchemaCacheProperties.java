package com.example.schemacache.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Schema cache settings.
 *
 * <p>
 * An empty {@code default-ttl} means entries written without an explicit TTL
 * never expire.
 */
@ConfigurationProperties(prefix = "schema-cache")
public class SchemaCacheProperties {

    /** TTL used when a lookup does not pass one. */
    private Duration defaultTtl = Duration.ofMinutes(1);

    /** Threads running blocking metadata loaders. */
    private int loaderThreads = 16;

    private final Sweep sweep = new Sweep();
    private final Backend backend = new Backend();

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public int getLoaderThreads() {
        return loaderThreads;
    }

    public void setLoaderThreads(int loaderThreads) {
        if (loaderThreads < 1) {
            throw new IllegalArgumentException("loader-threads must be at least 1, got: " + loaderThreads);
        }
        this.loaderThreads = loaderThreads;
    }

    public Sweep getSweep() {
        return sweep;
    }

    public Backend getBackend() {
        return backend;
    }

    public static class Sweep {

        /** Periodically drop expired entries to reclaim memory. */
        private boolean enabled = true;

        private Duration interval = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Backend {

        /** Simulated latency of one metadata query. */
        private Duration latency = Duration.ofMillis(500);

        public Duration getLatency() {
            return latency;
        }

        public void setLatency(Duration latency) {
            this.latency = latency;
        }
    }
}
