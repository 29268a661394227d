package com.sentinel.domain.job;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A unit of deferred work.
 *
 * Priority, type and payload are fixed at creation; re-prioritizing means creating
 * a new job. Only the retry counter and the availability time move, and only the
 * worker that currently owns the job touches them.
 */
public final class Job {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String id;
    private final JobType type;
    private final JobPriority priority;
    private final Map<String, Object> payload;
    private final Instant createdAt;
    private final int maxRetries;
    private final long sequence;

    private volatile Instant availableAt;
    private volatile int retries;

    private Job(JobType type, JobPriority priority, Map<String, Object> payload,
                Instant createdAt, Instant availableAt, int maxRetries) {
        this.type = Objects.requireNonNull(type, "type");
        this.priority = Objects.requireNonNull(priority, "priority");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        Instant available = availableAt == null ? createdAt : availableAt;
        if (available.isBefore(createdAt)) {
            throw new IllegalArgumentException("availableAt " + available + " is before createdAt " + createdAt);
        }
        this.sequence = SEQUENCE.incrementAndGet();
        this.id = type.id() + "-" + epochNanos(createdAt) + "-" + sequence;
        this.payload = payload == null || payload.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.maxRetries = maxRetries;
        this.availableAt = available;
        this.retries = 0;
    }

    public static Builder builder(JobType type) {
        return new Builder(type);
    }

    private static long epochNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    public String getId() { return id; }
    public JobType getType() { return type; }
    public JobPriority getPriority() { return priority; }
    public Map<String, Object> getPayload() { return payload; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getAvailableAt() { return availableAt; }
    public int getRetries() { return retries; }
    public int getMaxRetries() { return maxRetries; }

    /**
     * Creation order across all jobs in this JVM; breaks createdAt ties.
     */
    public long getSequence() { return sequence; }

    public boolean isReady(Instant now) {
        return !now.isBefore(availableAt);
    }

    /**
     * Count a failed attempt.
     *
     * @return the new retry count
     */
    public int recordFailure() {
        return ++retries;
    }

    /**
     * True while the retry budget is not exhausted (retries <= maxRetries).
     */
    public boolean canRetry() {
        return retries <= maxRetries;
    }

    /**
     * Defer the next attempt. Never moves availability before creation.
     */
    public void deferUntil(Instant instant) {
        this.availableAt = instant.isBefore(createdAt) ? createdAt : instant;
    }

    @Override
    public String toString() {
        return String.format("Job{id=%s, type=%s, priority=%s, retries=%d/%d, availableAt=%s}",
            id, type, priority, retries, maxRetries, availableAt);
    }

    public static final class Builder {
        private final JobType type;
        private JobPriority priority = JobPriority.MEDIUM;
        private Map<String, Object> payload = Map.of();
        private Instant createdAt;
        private Instant availableAt;
        private Duration delay;
        private int maxRetries = 0;

        private Builder(JobType type) {
            this.type = type;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder availableAt(Instant availableAt) {
            this.availableAt = availableAt;
            return this;
        }

        /**
         * Make the job eligible only after the given delay from creation.
         */
        public Builder delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Job build() {
            Instant created = createdAt != null ? createdAt : Instant.now();
            Instant available = availableAt;
            if (available == null && delay != null) {
                available = created.plus(delay);
            }
            return new Job(type, priority, payload, created, available, maxRetries);
        }
    }
}
