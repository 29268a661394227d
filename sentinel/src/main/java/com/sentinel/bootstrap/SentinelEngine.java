package com.sentinel.bootstrap;

import com.sentinel.application.port.input.JobModule;
import com.sentinel.application.port.output.MarketStateDetector;
import com.sentinel.config.EngineConfig;
import com.sentinel.domain.common.EventType;
import com.sentinel.infrastructure.metrics.PrometheusJobMetrics;
import com.sentinel.infrastructure.metrics.PrometheusMetricsHandler;
import com.sentinel.service.core.EventBus;
import com.sentinel.service.core.EventService;
import com.sentinel.service.history.JobFailureMonitor;
import com.sentinel.service.history.JobHistoryRecorder;
import com.sentinel.service.listener.JobEventListeners;
import com.sentinel.service.queue.JobManager;
import com.sentinel.service.queue.JobRegistry;
import com.sentinel.service.queue.RetryPolicy;
import com.sentinel.service.queue.WorkerPool;
import com.sentinel.service.scheduler.CadenceTable;
import com.sentinel.service.scheduler.TimeScheduler;
import com.sentinel.transport.http.JobApiHandlers;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the job engine together and owns its lifecycle.
 *
 * Start order: listeners → history / failure monitor → workers → scheduler → HTTP.
 * Stop order is the reverse, then the job manager is closed.
 */
public final class SentinelEngine {
    private static final Logger log = LoggerFactory.getLogger(SentinelEngine.class);

    private static final String MODULE = "engine";

    private final EngineConfig config;
    private final EventBus bus;
    private final EventService eventService;
    private final PrometheusJobMetrics metrics;
    private final JobManager jobManager;
    private final JobRegistry registry;
    private final JobEventListeners listeners;
    private final JobHistoryRecorder history;
    private final JobFailureMonitor failureMonitor;
    private final WorkerPool workers;
    private final TimeScheduler scheduler;
    private final JobApiHandlers api;

    private Undertow server;
    private boolean started = false;

    public SentinelEngine(EngineConfig config, MarketStateDetector detector) {
        this(config, detector, Clock.systemUTC(), new CollectorRegistry());
    }

    public SentinelEngine(EngineConfig config, MarketStateDetector detector, Clock clock, CollectorRegistry collectorRegistry) {
        this.config = config;

        // ═══════════════════════════════════════════════════════════════
        // Events & metrics
        // ═══════════════════════════════════════════════════════════════
        this.bus = new EventBus();
        this.eventService = new EventService(bus);
        this.metrics = new PrometheusJobMetrics(collectorRegistry);

        // ═══════════════════════════════════════════════════════════════
        // Queue, handlers, consumers
        // ═══════════════════════════════════════════════════════════════
        this.jobManager = new JobManager(clock, config.queueCapacity(), config.defaultMaxRetries(), metrics);
        this.registry = new JobRegistry();
        this.listeners = new JobEventListeners(jobManager);
        this.history = new JobHistoryRecorder(config.historySize());
        this.failureMonitor = new JobFailureMonitor(clock, config.jobFailureWindow(), config.jobFailureThreshold());

        RetryPolicy retryPolicy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(config.retryInitialMs()))
            .maxDelay(Duration.ofMillis(config.retryMaxMs()))
            .multiplier(config.retryMultiplier())
            .build();

        this.workers = WorkerPool.builder(jobManager, registry, eventService)
            .workers(config.workers())
            .retryPolicy(retryPolicy)
            .defaultTimeout(config.jobTimeout())
            .progressThrottle(config.progressThrottle())
            .drainTimeout(config.drainTimeout())
            .metrics(metrics)
            .build();

        // ═══════════════════════════════════════════════════════════════
        // Producers
        // ═══════════════════════════════════════════════════════════════
        this.scheduler = TimeScheduler.builder(jobManager)
            .marketStateDetector(detector)
            .cadences(CadenceTable.defaults(config.maintenanceHour()))
            .zone(config.timezone())
            .clock(clock)
            .fallbackSyncInterval(config.fallbackSyncInterval())
            .deploymentInterval(Duration.ofMinutes(config.deploymentCheckMinutes()))
            .build();

        this.api = new JobApiHandlers(jobManager, registry, history, failureMonitor, scheduler, workers);
    }

    /**
     * Let each module register its handlers. Call before {@link #start()}.
     *
     * @return number of modules registered
     */
    public int registerModules(Iterable<JobModule> modules) {
        int count = 0;
        for (JobModule module : modules) {
            module.register(registry);
            log.info("✓ Job module registered: {}", module.name());
            count++;
        }
        log.info("{} job module(s), {} handler(s) registered", count, registry.registeredTypes().size());
        return count;
    }

    public synchronized void start() {
        if (started) {
            log.warn("Engine already started");
            return;
        }

        listeners.register(bus);
        history.register(bus);
        failureMonitor.register(bus);
        workers.start();
        scheduler.start();

        if (config.httpEnabled()) {
            server = Undertow.builder()
                .addHttpListener(config.httpPort(), "0.0.0.0")
                .setHandler(routes())
                .build();
            server.start();
            log.info("✓ HTTP API started on http://localhost:{}/", config.httpPort());
        }

        started = true;

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("message", "Sentinel job engine started");
        status.put("workers", config.workers());
        status.put("handlers", registry.registeredTypes().size());
        eventService.emit(EventType.SYSTEM_STATUS, MODULE, status);
    }

    /**
     * Stop producers first, drain workers, then close the queue. Idempotent.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        log.info("Stopping Sentinel job engine...");

        if (server != null) {
            server.stop();
            server = null;
        }
        scheduler.stop();
        workers.stop();
        jobManager.close();
        listeners.unregister();
        history.unregister();
        failureMonitor.unregister();

        started = false;
        log.info("✓ Sentinel job engine stopped");
    }

    public synchronized boolean isStarted() {
        return started;
    }

    /**
     * HTTP routes: job API plus /metrics.
     */
    public RoutingHandler routes() {
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
        return Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/jobs/queue", api::queue)
            .get("/api/jobs/history", api::history)
            .get("/api/jobs/types", api::types)
            .post("/api/jobs/{type}/run", api::runJob)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Sentinel job engine\n\n" +
                    "API:     GET /api/health, /api/jobs/queue, /api/jobs/history, /api/jobs/types\n" +
                    "Trigger: POST /api/jobs/{type}/run\n" +
                    "Metrics: GET /metrics\n"
                );
            });
    }

    public EngineConfig getConfig() { return config; }
    public EventBus getBus() { return bus; }
    public EventService getEventService() { return eventService; }
    public PrometheusJobMetrics getMetrics() { return metrics; }
    public JobManager getJobManager() { return jobManager; }
    public JobRegistry getRegistry() { return registry; }
    public JobEventListeners getListeners() { return listeners; }
    public JobHistoryRecorder getHistory() { return history; }
    public JobFailureMonitor getFailureMonitor() { return failureMonitor; }
    public WorkerPool getWorkers() { return workers; }
    public TimeScheduler getScheduler() { return scheduler; }
}
