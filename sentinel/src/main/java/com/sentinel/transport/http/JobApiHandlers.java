package com.sentinel.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobCatalog;
import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;
import com.sentinel.service.history.JobFailureMonitor;
import com.sentinel.service.history.JobHistoryRecorder;
import com.sentinel.service.queue.JobManager;
import com.sentinel.service.queue.JobQueueException;
import com.sentinel.service.queue.JobRegistry;
import com.sentinel.service.queue.WorkerPool;
import com.sentinel.service.scheduler.TimeScheduler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * HTTP handlers for job status and manual triggering.
 *
 * Routes:
 * - GET  /api/health             liveness, scheduler / worker flags, unhealthy job types
 * - GET  /api/jobs/queue         pending jobs, counts per priority
 * - GET  /api/jobs/history       recent terminal outcomes, newest first (?limit=N)
 * - GET  /api/jobs/types         catalog, handler registration, recent failures
 * - POST /api/jobs/{type}/run    enqueue one job of that type now
 */
public final class JobApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(JobApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String CONTENT_JSON = "application/json; charset=utf-8";
    private static final int DEFAULT_HISTORY_LIMIT = 50;

    private final JobManager jobManager;
    private final JobRegistry registry;
    private final JobHistoryRecorder history;
    private final JobFailureMonitor failureMonitor;
    private final TimeScheduler scheduler;
    private final WorkerPool workers;

    public JobApiHandlers(JobManager jobManager, JobRegistry registry, JobHistoryRecorder history,
                          JobFailureMonitor failureMonitor, TimeScheduler scheduler, WorkerPool workers) {
        this.jobManager = jobManager;
        this.registry = registry;
        this.history = history;
        this.failureMonitor = failureMonitor;
        this.scheduler = scheduler;
        this.workers = workers;
    }

    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", jobManager.isClosed() ? "stopping" : "ok");
        health.put("ts", Instant.now().toString());
        health.put("schedulerRunning", scheduler.isRunning());
        health.put("workersRunning", workers.isRunning());
        health.put("workers", workers.getWorkerCount());
        health.put("queueSize", jobManager.size());
        ArrayNode unhealthy = health.putArray("unhealthyJobTypes");
        failureMonitor.status().forEach((type, state) -> {
            if (!state.healthy()) {
                unhealthy.add(type);
            }
        });
        sendJson(exchange, 200, health);
    }

    public void queue(HttpServerExchange exchange) {
        try {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("size", jobManager.size());
            body.put("capacity", jobManager.getCapacity());

            ObjectNode byPriority = body.putObject("byPriority");
            for (Map.Entry<JobPriority, Integer> e : jobManager.pendingByPriority().entrySet()) {
                byPriority.put(e.getKey().name(), e.getValue());
            }

            ArrayNode pending = body.putArray("pending");
            for (Job job : jobManager.pendingJobs()) {
                ObjectNode node = pending.addObject();
                node.put("id", job.getId());
                node.put("type", job.getType().id());
                node.put("description", JobCatalog.describe(job.getType()));
                node.put("priority", job.getPriority().name());
                node.put("createdAt", job.getCreatedAt().toString());
                node.put("availableAt", job.getAvailableAt().toString());
                node.put("retries", job.getRetries());
                node.put("maxRetries", job.getMaxRetries());
            }

            ArrayNode running = body.putArray("running");
            for (WorkerPool.InFlight inFlight : workers.getInFlight()) {
                running.add(MAPPER.valueToTree(inFlight));
            }

            sendJson(exchange, 200, body);
        } catch (Exception e) {
            log.error("Failed to render queue status", e);
            serverError(exchange, "Failed to read queue");
        }
    }

    public void history(HttpServerExchange exchange) {
        int limit = DEFAULT_HISTORY_LIMIT;
        Deque<String> limitQ = exchange.getQueryParameters().get("limit");
        if (limitQ != null && !limitQ.isEmpty()) {
            try {
                limit = Integer.parseInt(limitQ.getFirst());
            } catch (NumberFormatException e) {
                badRequest(exchange, "limit must be a number");
                return;
            }
            if (limit < 1) {
                badRequest(exchange, "limit must be >= 1");
                return;
            }
        }

        ArrayNode entries = MAPPER.createArrayNode();
        for (JobHistoryRecorder.Entry entry : history.recent(limit)) {
            ObjectNode node = entries.addObject();
            node.put("recordedAt", entry.recordedAt().toString());
            node.put("module", entry.module());
            node.set("job", MAPPER.valueToTree(entry.status()));
        }
        sendJson(exchange, 200, entries);
    }

    public void types(HttpServerExchange exchange) {
        Set<String> ids = new TreeSet<>();
        JobCatalog.knownTypes().forEach(t -> ids.add(t.id()));
        registry.registeredTypes().forEach(t -> ids.add(t.id()));

        ArrayNode types = MAPPER.createArrayNode();
        for (String id : ids) {
            JobType type = JobType.of(id);
            ObjectNode node = types.addObject();
            node.put("type", id);
            node.put("description", JobCatalog.describe(type));
            node.put("defaultPriority", JobCatalog.defaultPriority(type).name());
            node.put("registered", registry.isRegistered(type));
            node.put("pending", jobManager.isPending(type));
            node.put("recentFailures", failureMonitor.recentFailures(id));
            node.put("healthy", failureMonitor.isHealthy(id));
        }
        sendJson(exchange, 200, types);
    }

    public void runJob(HttpServerExchange exchange) {
        Deque<String> typeQ = exchange.getQueryParameters().get("type");
        if (typeQ == null || typeQ.isEmpty() || typeQ.getFirst().isBlank()) {
            badRequest(exchange, "job type is required");
            return;
        }

        JobType type = JobType.of(typeQ.getFirst());
        if (!registry.isRegistered(type)) {
            sendError(exchange, 404, "No handler registered for " + type.id());
            return;
        }

        Job job = Job.builder(type)
            .priority(JobCatalog.defaultPriority(type))
            .createdAt(jobManager.getClock().instant())
            .maxRetries(jobManager.getDefaultMaxRetries())
            .payload(Map.of("trigger", "manual"))
            .build();
        try {
            jobManager.enqueue(job);
        } catch (JobQueueException e) {
            log.warn("Manual trigger of {} rejected: {}", type, e.getMessage());
            sendError(exchange, 503, e.getMessage());
            return;
        }

        log.info("Manual trigger: enqueued {} [{}]", type, job.getId());
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", true);
        body.put("jobId", job.getId());
        body.put("type", type.id());
        body.put("priority", job.getPriority().name());
        sendJson(exchange, 202, body);
    }

    private void sendJson(HttpServerExchange exchange, int status, Object body) {
        try {
            String json = MAPPER.writeValueAsString(body);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_JSON);
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Failed to serialize response", e);
            serverError(exchange, "Failed to serialize response");
        }
    }

    private void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_JSON);
        exchange.getResponseSender().send(error.toString(), StandardCharsets.UTF_8);
    }

    private void badRequest(HttpServerExchange exchange, String message) {
        sendError(exchange, 400, message);
    }

    private void serverError(HttpServerExchange exchange, String message) {
        sendError(exchange, 500, message);
    }
}
