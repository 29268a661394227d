package com.sentinel.service.queue;

import com.sentinel.domain.job.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handler lookup by job type.
 * Handlers may be registered while workers are running.
 */
public final class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<JobType, Registration> handlers = new ConcurrentHashMap<>();

    /**
     * Registered handler plus its optional timeout.
     */
    public record Registration(JobType type, JobHandler handler, Duration timeout) {}

    public void register(JobType type, JobHandler handler) {
        register(type, handler, null);
    }

    /**
     * On timeout the handler thread is interrupted and the attempt fails. A handler that
     * ignores interrupts keeps running, possibly alongside its own retry, so long-running
     * handlers should check {@link Thread#isInterrupted()} between steps.
     *
     * @param timeout per-type handler timeout, null to use the pool default
     */
    public void register(JobType type, JobHandler handler, Duration timeout) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        Registration previous = handlers.put(type, new Registration(type, handler, timeout));
        if (previous != null) {
            log.warn("[REGISTRY] Replaced handler for {}", type);
        } else {
            log.debug("[REGISTRY] Registered handler for {}", type);
        }
    }

    /**
     * @throws UnknownJobTypeException if nothing is registered for the type
     */
    public Registration resolve(JobType type) {
        Registration registration = handlers.get(type);
        if (registration == null) {
            throw new UnknownJobTypeException(type);
        }
        return registration;
    }

    public Optional<Registration> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean isRegistered(JobType type) {
        return handlers.containsKey(type);
    }

    public Set<JobType> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
