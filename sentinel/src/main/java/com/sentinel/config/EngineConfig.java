package com.sentinel.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinel.util.Env;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for the job engine.
 *
 * Loaded from environment variables (or JVM system properties) at startup.
 * Checked by StartupConfigValidator before anything is started.
 */
public record EngineConfig(
    @JsonProperty("workers")
    int workers,                    // Worker threads pulling from the queue

    @JsonProperty("queueCapacity")
    int queueCapacity,              // 0 = unbounded

    @JsonProperty("progressThrottleMs")
    long progressThrottleMs,        // Minimum gap between throttled progress events

    @JsonProperty("retryInitialMs")
    long retryInitialMs,            // Backoff before the first retry

    @JsonProperty("retryMaxMs")
    long retryMaxMs,                // Backoff cap

    @JsonProperty("retryMultiplier")
    double retryMultiplier,         // Backoff growth per retry

    @JsonProperty("defaultMaxRetries")
    int defaultMaxRetries,          // Retry budget for scheduler-created jobs

    @JsonProperty("jobTimeoutMinutes")
    long jobTimeoutMinutes,         // Default handler timeout, 0 = none

    @JsonProperty("fallbackSyncMinutes")
    int fallbackSyncMinutes,        // Sync cadence when no market-state detector is wired

    @JsonProperty("maintenanceHour")
    int maintenanceHour,            // Anchor hour for the nightly cadences (0-23)

    @JsonProperty("deploymentCheckMinutes")
    int deploymentCheckMinutes,     // 0 = deployment checks disabled

    @JsonProperty("timezone")
    ZoneId timezone,                // Zone the calendar cadences are evaluated in

    @JsonProperty("httpEnabled")
    boolean httpEnabled,

    @JsonProperty("httpPort")
    int httpPort,

    @JsonProperty("drainTimeoutSeconds")
    long drainTimeoutSeconds,       // How long stop() waits for in-flight jobs

    @JsonProperty("historySize")
    int historySize,                // Terminal job outcomes kept for the status API

    @JsonProperty("jobFailureWindowMinutes")
    int jobFailureWindowMinutes,    // Sliding window for per-type failure counts

    @JsonProperty("jobFailureThreshold")
    int jobFailureThreshold         // Failures inside the window that mark a type unhealthy
) {
    /**
     * Default configuration.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(
            2,                      // 2 workers
            0,                      // Unbounded queue
            100,                    // 10 progress events/sec max per job
            5_000,                  // 5s first retry
            300_000,                // 5min cap
            2.0,                    // Double each retry
            3,                      // 3 retries
            0,                      // No handler timeout
            5,                      // Sync every 5 minutes without detector
            2,                      // Maintenance window starts 02:00
            5,                      // Deployment check every 5 minutes
            ZoneId.systemDefault(),
            true,
            8001,
            30,
            200,
            60,                     // Count failures over the last hour
            5                       // 5 failures = unhealthy
        );
    }

    /**
     * Load configuration from the environment, falling back to {@link #defaults()}.
     */
    public static EngineConfig fromEnv() {
        EngineConfig d = defaults();
        return new EngineConfig(
            Env.getInt("SENTINEL_WORKERS", d.workers()),
            Env.getInt("SENTINEL_QUEUE_CAPACITY", d.queueCapacity()),
            Env.getLong("SENTINEL_PROGRESS_THROTTLE_MS", d.progressThrottleMs()),
            Env.getLong("SENTINEL_RETRY_INITIAL_MS", d.retryInitialMs()),
            Env.getLong("SENTINEL_RETRY_MAX_MS", d.retryMaxMs()),
            Env.getDouble("SENTINEL_RETRY_MULTIPLIER", d.retryMultiplier()),
            Env.getInt("SENTINEL_DEFAULT_MAX_RETRIES", d.defaultMaxRetries()),
            Env.getLong("SENTINEL_JOB_TIMEOUT_MINUTES", d.jobTimeoutMinutes()),
            Env.getInt("SENTINEL_FALLBACK_SYNC_MINUTES", d.fallbackSyncMinutes()),
            Env.getInt("SENTINEL_MAINTENANCE_HOUR", d.maintenanceHour()),
            Env.getInt("SENTINEL_DEPLOYMENT_CHECK_MINUTES", d.deploymentCheckMinutes()),
            Env.getZone("SENTINEL_TIMEZONE", d.timezone()),
            Env.getBool("SENTINEL_HTTP_ENABLED", d.httpEnabled()),
            Env.getInt("SENTINEL_HTTP_PORT", d.httpPort()),
            Env.getLong("SENTINEL_DRAIN_TIMEOUT_SECONDS", d.drainTimeoutSeconds()),
            Env.getInt("SENTINEL_HISTORY_SIZE", d.historySize()),
            Env.getInt("SENTINEL_JOB_FAILURE_WINDOW_MINUTES", d.jobFailureWindowMinutes()),
            Env.getInt("SENTINEL_JOB_FAILURE_THRESHOLD", d.jobFailureThreshold())
        );
    }

    public Duration progressThrottle() {
        return Duration.ofMillis(progressThrottleMs);
    }

    public Duration jobTimeout() {
        return Duration.ofMinutes(jobTimeoutMinutes);
    }

    public Duration fallbackSyncInterval() {
        return Duration.ofMinutes(fallbackSyncMinutes);
    }

    public Duration drainTimeout() {
        return Duration.ofSeconds(drainTimeoutSeconds);
    }

    public Duration jobFailureWindow() {
        return Duration.ofMinutes(jobFailureWindowMinutes);
    }

    /**
     * Copy with a different worker count.
     */
    public EngineConfig withWorkers(int newWorkers) {
        return new EngineConfig(newWorkers, queueCapacity, progressThrottleMs, retryInitialMs, retryMaxMs,
            retryMultiplier, defaultMaxRetries, jobTimeoutMinutes, fallbackSyncMinutes, maintenanceHour,
            deploymentCheckMinutes, timezone, httpEnabled, httpPort, drainTimeoutSeconds, historySize,
            jobFailureWindowMinutes, jobFailureThreshold);
    }

    /**
     * Copy with different backoff settings.
     */
    public EngineConfig withRetryBackoff(long initialMs, long maxMs, double multiplier) {
        return new EngineConfig(workers, queueCapacity, progressThrottleMs, initialMs, maxMs,
            multiplier, defaultMaxRetries, jobTimeoutMinutes, fallbackSyncMinutes, maintenanceHour,
            deploymentCheckMinutes, timezone, httpEnabled, httpPort, drainTimeoutSeconds, historySize,
            jobFailureWindowMinutes, jobFailureThreshold);
    }

    /**
     * Copy with the HTTP surface toggled.
     */
    public EngineConfig withHttp(boolean enabled, int port) {
        return new EngineConfig(workers, queueCapacity, progressThrottleMs, retryInitialMs, retryMaxMs,
            retryMultiplier, defaultMaxRetries, jobTimeoutMinutes, fallbackSyncMinutes, maintenanceHour,
            deploymentCheckMinutes, timezone, enabled, port, drainTimeoutSeconds, historySize,
            jobFailureWindowMinutes, jobFailureThreshold);
    }
}
