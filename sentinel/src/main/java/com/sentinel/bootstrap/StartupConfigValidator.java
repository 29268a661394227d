package com.sentinel.bootstrap;

import com.sentinel.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything is constructed. Collects every problem, then throws a single
 * IllegalStateException listing them, so one restart fixes them all.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(EngineConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> errors = new ArrayList<>();

        if (config.workers() < 1) {
            errors.add("SENTINEL_WORKERS must be >= 1 (got " + config.workers() + ")");
        }
        if (config.queueCapacity() < 0) {
            errors.add("SENTINEL_QUEUE_CAPACITY must be >= 0, 0 = unbounded (got " + config.queueCapacity() + ")");
        }
        if (config.progressThrottleMs() < 0) {
            errors.add("SENTINEL_PROGRESS_THROTTLE_MS must be >= 0 (got " + config.progressThrottleMs() + ")");
        }
        if (config.retryInitialMs() < 0) {
            errors.add("SENTINEL_RETRY_INITIAL_MS must be >= 0 (got " + config.retryInitialMs() + ")");
        }
        if (config.retryMaxMs() < config.retryInitialMs()) {
            errors.add("SENTINEL_RETRY_MAX_MS must be >= SENTINEL_RETRY_INITIAL_MS (got "
                + config.retryMaxMs() + " < " + config.retryInitialMs() + ")");
        }
        if (config.retryMultiplier() < 1.0) {
            errors.add("SENTINEL_RETRY_MULTIPLIER must be >= 1.0 (got " + config.retryMultiplier() + ")");
        }
        if (config.defaultMaxRetries() < 0) {
            errors.add("SENTINEL_DEFAULT_MAX_RETRIES must be >= 0 (got " + config.defaultMaxRetries() + ")");
        }
        if (config.jobTimeoutMinutes() < 0) {
            errors.add("SENTINEL_JOB_TIMEOUT_MINUTES must be >= 0, 0 = none (got " + config.jobTimeoutMinutes() + ")");
        }
        if (config.fallbackSyncMinutes() < 1) {
            errors.add("SENTINEL_FALLBACK_SYNC_MINUTES must be >= 1 (got " + config.fallbackSyncMinutes() + ")");
        }
        if (config.maintenanceHour() < 0 || config.maintenanceHour() > 23) {
            errors.add("SENTINEL_MAINTENANCE_HOUR must be 0-23 (got " + config.maintenanceHour() + ")");
        }
        if (config.deploymentCheckMinutes() < 0) {
            errors.add("SENTINEL_DEPLOYMENT_CHECK_MINUTES must be >= 0, 0 = off (got "
                + config.deploymentCheckMinutes() + ")");
        }
        if (config.timezone() == null) {
            errors.add("SENTINEL_TIMEZONE is not a valid zone id");
        }
        if (config.httpEnabled() && (config.httpPort() < 1 || config.httpPort() > 65535)) {
            errors.add("SENTINEL_HTTP_PORT must be 1-65535 (got " + config.httpPort() + ")");
        }
        if (config.drainTimeoutSeconds() < 0) {
            errors.add("SENTINEL_DRAIN_TIMEOUT_SECONDS must be >= 0 (got " + config.drainTimeoutSeconds() + ")");
        }
        if (config.historySize() < 1) {
            errors.add("SENTINEL_HISTORY_SIZE must be >= 1 (got " + config.historySize() + ")");
        }
        if (config.jobFailureWindowMinutes() < 1) {
            errors.add("SENTINEL_JOB_FAILURE_WINDOW_MINUTES must be >= 1 (got " + config.jobFailureWindowMinutes() + ")");
        }
        if (config.jobFailureThreshold() < 1) {
            errors.add("SENTINEL_JOB_FAILURE_THRESHOLD must be >= 1 (got " + config.jobFailureThreshold() + ")");
        }

        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("❌ {}", e));
            throw new IllegalStateException(
                "❌ INVALID CONFIG: " + errors.size() + " problem(s)\n  - " + String.join("\n  - ", errors) +
                "\nSystem refuses to start.");
        }

        log.info("✓ Workers: {}, queue capacity: {}", config.workers(),
            config.queueCapacity() == 0 ? "unbounded" : config.queueCapacity());
        log.info("✓ Retry: {}ms → {}ms (x{}), default max retries {}",
            config.retryInitialMs(), config.retryMaxMs(), config.retryMultiplier(), config.defaultMaxRetries());
        log.info("✓ Failure alert: {} failure(s) in {}m", config.jobFailureThreshold(), config.jobFailureWindowMinutes());
        log.info("✓ Schedule zone: {}, maintenance hour: {}", config.timezone(), config.maintenanceHour());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
