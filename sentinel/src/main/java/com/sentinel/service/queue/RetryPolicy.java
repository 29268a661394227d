package com.sentinel.service.queue;

import java.time.Duration;

/**
 * Exponential backoff for failed job attempts.
 *
 * delay(n) = min(initialDelay * multiplier^(n-1), maxDelay) for the n-th retry.
 * The retry budget itself lives on the job (maxRetries); this only decides when
 * the next attempt becomes available.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(5))
 *     .maxDelay(Duration.ofMinutes(5))
 *     .multiplier(2.0)
 *     .build();
 *
 * job.deferUntil(now.plus(policy.delayFor(job.getRetries())));
 * </pre>
 */
public final class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    /**
     * Retry immediately, no backoff.
     */
    public static RetryPolicy immediate() {
        return new RetryPolicy(Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry, 2 for the second, ...
     */
    public Duration delayFor(int retry) {
        if (retry <= 0 || initialDelay.isZero()) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must be >= 0");
            }
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= initialDelay");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier);
        }
    }
}
