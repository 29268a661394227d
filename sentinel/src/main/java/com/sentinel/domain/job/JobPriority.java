package com.sentinel.domain.job;

/**
 * Dequeue precedence. Totally ordered: LOW < MEDIUM < HIGH < CRITICAL.
 */
public enum JobPriority {
    LOW(0),
    MEDIUM(1),
    HIGH(2),
    CRITICAL(3);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public boolean isHigherThan(JobPriority other) {
        return weight > other.weight;
    }
}
