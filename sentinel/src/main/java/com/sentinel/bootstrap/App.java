package com.sentinel.bootstrap;

import com.sentinel.application.port.input.JobModule;
import com.sentinel.config.EngineConfig;
import com.sentinel.infrastructure.market.MarketHoursDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Sentinel job engine starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        EngineConfig config = EngineConfig.fromEnv();
        StartupConfigValidator.validate(config);

        // ═══════════════════════════════════════════════════════════════
        // Engine + handler modules
        // ═══════════════════════════════════════════════════════════════
        SentinelEngine engine = new SentinelEngine(config, new MarketHoursDetector());
        int modules = engine.registerModules(ServiceLoader.load(JobModule.class));
        if (modules == 0) {
            log.warn("No JobModule found on the classpath: every job will fail as unknown type");
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            try {
                engine.stop();
            } finally {
                stopped.countDown();
            }
        }, "sentinel-shutdown"));

        engine.start();
        log.info("✓ Sentinel running (workers={}, http={})", config.workers(),
            config.httpEnabled() ? config.httpPort() : "off");

        // Worker and scheduler threads are daemons; keep the JVM alive until shutdown
        stopped.await();
    }

    private App() {}
}
