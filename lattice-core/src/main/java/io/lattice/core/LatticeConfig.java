package io.lattice.core;

import java.time.Duration;

/**
 * Configuration options for a Lattice environment.
 *
 * <p>Controls the thread pool used for asynchronous executor resolution, how often callers
 * waiting for the build lock re-check cancellation, and whether lifecycle events are logged.
 * Use the {@link Builder} for fluent configuration or construct directly with setters.
 *
 * <h3>Default Values</h3>
 *
 * <ul>
 *   <li>{@code threadPoolSize}: {@code 4}
 *   <li>{@code buildLockPollInterval}: {@code 25ms}
 *   <li>{@code logDiagnostics}: {@code true}
 * </ul>
 *
 * @implNote <b>Not thread-safe</b>. This is a mutable configuration object intended to be
 *     configured before passing to {@link LatticeFactory}. Do not modify after environment
 *     creation.
 * @see LatticeFactory#createEnvironment(LatticeConfig)
 * @see Builder
 */
public class LatticeConfig {
    private int threadPoolSize = 4;
    private Duration buildLockPollInterval = Duration.ofMillis(25);
    private boolean logDiagnostics = true;

    /** Creates a configuration with default values. */
    public LatticeConfig() {}

    /**
     * Returns the size of the pool running asynchronous executor builds.
     *
     * @return the fixed thread pool size
     */
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /**
     * Sets the size of the pool running asynchronous executor builds.
     *
     * @param threadPoolSize the number of threads in the fixed pool, must be positive
     * @throws IllegalArgumentException if {@code threadPoolSize} is not positive
     */
    public void setThreadPoolSize(int threadPoolSize) {
        if (threadPoolSize <= 0) {
            throw new IllegalArgumentException("threadPoolSize must be positive");
        }
        this.threadPoolSize = threadPoolSize;
    }

    /**
     * Returns how often a caller waiting for the build lock checks its cancellation token.
     *
     * @return poll interval, never null
     */
    public Duration getBuildLockPollInterval() {
        return buildLockPollInterval;
    }

    /**
     * Sets the build lock poll interval.
     *
     * @param buildLockPollInterval positive interval, not null
     * @throws IllegalArgumentException if the interval is zero or negative
     */
    public void setBuildLockPollInterval(Duration buildLockPollInterval) {
        if (buildLockPollInterval.isZero() || buildLockPollInterval.isNegative()) {
            throw new IllegalArgumentException("buildLockPollInterval must be positive");
        }
        this.buildLockPollInterval = buildLockPollInterval;
    }

    /**
     * Returns whether executor lifecycle events are written to the log.
     *
     * @return {@code true} if {@link io.lattice.core.diagnostics.LoggingDiagnosticEvents} is
     *     installed
     */
    public boolean isLogDiagnostics() {
        return logDiagnostics;
    }

    public void setLogDiagnostics(boolean logDiagnostics) {
        this.logDiagnostics = logDiagnostics;
    }

    /**
     * Creates a new builder for fluent configuration construction.
     *
     * @return a new builder instance, never null
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for constructing {@link LatticeConfig} instances.
     *
     * @implNote The builder mutates a single config instance and returns it on {@link
     *     #build()}.
     */
    public static class Builder {
        private final LatticeConfig config = new LatticeConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.setThreadPoolSize(threadPoolSize);
            return this;
        }

        public Builder buildLockPollInterval(Duration buildLockPollInterval) {
            config.setBuildLockPollInterval(buildLockPollInterval);
            return this;
        }

        public Builder logDiagnostics(boolean logDiagnostics) {
            config.logDiagnostics = logDiagnostics;
            return this;
        }

        public LatticeConfig build() {
            return config;
        }
    }
}
