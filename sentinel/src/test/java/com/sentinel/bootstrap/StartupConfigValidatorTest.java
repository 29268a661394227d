package com.sentinel.bootstrap;

import com.sentinel.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StartupConfigValidator.
 */
class StartupConfigValidatorTest {

    @Test
    void testDefaultsAreValid() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(EngineConfig.defaults()));
    }

    @Test
    void testHttpPortIgnoredWhenDisabled() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(EngineConfig.defaults().withHttp(false, 0)));
    }

    @Test
    void testReportsEveryProblemAtOnce() {
        EngineConfig bad = new EngineConfig(
            0, -1, 100, 5_000, 1_000, 0.5, 3, 0, 5, 24, 5,
            ZoneId.of("UTC"), true, 70_000, 30, 200, 60, 5);

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(bad));

        String message = e.getMessage();
        assertTrue(message.contains("6 problem(s)"), message);
        assertTrue(message.contains("SENTINEL_WORKERS"));
        assertTrue(message.contains("SENTINEL_QUEUE_CAPACITY"));
        assertTrue(message.contains("SENTINEL_RETRY_MAX_MS"));
        assertTrue(message.contains("SENTINEL_RETRY_MULTIPLIER"));
        assertTrue(message.contains("SENTINEL_MAINTENANCE_HOUR"));
        assertTrue(message.contains("SENTINEL_HTTP_PORT"));
    }

    @Test
    void testFailureTrackingSettings() {
        EngineConfig d = EngineConfig.defaults();
        EngineConfig bad = new EngineConfig(d.workers(), d.queueCapacity(), d.progressThrottleMs(),
            d.retryInitialMs(), d.retryMaxMs(), d.retryMultiplier(), d.defaultMaxRetries(), d.jobTimeoutMinutes(),
            d.fallbackSyncMinutes(), d.maintenanceHour(), d.deploymentCheckMinutes(), d.timezone(),
            d.httpEnabled(), d.httpPort(), d.drainTimeoutSeconds(), d.historySize(), 0, 0);

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(bad));

        assertTrue(e.getMessage().contains("2 problem(s)"), e.getMessage());
        assertTrue(e.getMessage().contains("SENTINEL_JOB_FAILURE_WINDOW_MINUTES"));
        assertTrue(e.getMessage().contains("SENTINEL_JOB_FAILURE_THRESHOLD"));
    }

    @Test
    void testMissingTimezone() {
        EngineConfig d = EngineConfig.defaults();
        EngineConfig noZone = new EngineConfig(d.workers(), d.queueCapacity(), d.progressThrottleMs(),
            d.retryInitialMs(), d.retryMaxMs(), d.retryMultiplier(), d.defaultMaxRetries(), d.jobTimeoutMinutes(),
            d.fallbackSyncMinutes(), d.maintenanceHour(), d.deploymentCheckMinutes(), null,
            d.httpEnabled(), d.httpPort(), d.drainTimeoutSeconds(), d.historySize(),
            d.jobFailureWindowMinutes(), d.jobFailureThreshold());

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(noZone));
        assertTrue(e.getMessage().contains("SENTINEL_TIMEZONE"));
    }
}
