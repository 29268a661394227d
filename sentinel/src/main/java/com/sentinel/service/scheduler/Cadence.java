package com.sentinel.service.scheduler;

import com.sentinel.domain.job.JobCatalog;
import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * One recurring schedule entry.
 *
 * Calendar cadences (daily / weekly / monthly) fire when the scheduler's minute tick
 * hits {@code at}; hourly cadences fire on every tick of the hourly loop. The guard is
 * the interval handed to JobManager.enqueueIfShouldRun, slightly shorter than the
 * period so a drifting tick is never skipped.
 */
public record Cadence(
    JobType jobType,
    Frequency frequency,
    LocalTime at,               // Null for HOURLY
    DayOfWeek dayOfWeek,        // WEEKLY only
    int dayOfMonth,             // MONTHLY only, 1-28
    JobPriority priority
) {

    public enum Frequency {
        HOURLY(Duration.ofMinutes(59)),
        DAILY(Duration.ofHours(23)),
        WEEKLY(Duration.ofDays(6)),
        MONTHLY(Duration.ofDays(27));

        private final Duration guard;

        Frequency(Duration guard) {
            this.guard = guard;
        }

        public Duration guard() {
            return guard;
        }
    }

    public Cadence {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(priority, "priority");
        if (frequency != Frequency.HOURLY && at == null) {
            throw new IllegalArgumentException(jobType + ": " + frequency + " cadence needs a time of day");
        }
        if (frequency == Frequency.WEEKLY && dayOfWeek == null) {
            throw new IllegalArgumentException(jobType + ": weekly cadence needs a day of week");
        }
        if (frequency == Frequency.MONTHLY && (dayOfMonth < 1 || dayOfMonth > 28)) {
            throw new IllegalArgumentException(jobType + ": day of month must be 1-28, got " + dayOfMonth);
        }
    }

    public static Cadence hourly(JobType type) {
        return new Cadence(type, Frequency.HOURLY, null, null, 0, JobCatalog.defaultPriority(type));
    }

    public static Cadence daily(JobType type, LocalTime at) {
        return new Cadence(type, Frequency.DAILY, at, null, 0, JobCatalog.defaultPriority(type));
    }

    public static Cadence weekly(JobType type, DayOfWeek day, LocalTime at) {
        return new Cadence(type, Frequency.WEEKLY, at, day, 0, JobCatalog.defaultPriority(type));
    }

    public static Cadence monthly(JobType type, int dayOfMonth, LocalTime at) {
        return new Cadence(type, Frequency.MONTHLY, at, null, dayOfMonth, JobCatalog.defaultPriority(type));
    }

    public boolean isHourly() {
        return frequency == Frequency.HOURLY;
    }

    /**
     * True when a calendar cadence is due in the minute containing {@code now}.
     * Always false for hourly cadences.
     */
    public boolean matches(ZonedDateTime now) {
        if (isHourly()) {
            return false;
        }
        if (now.getHour() != at.getHour() || now.getMinute() != at.getMinute()) {
            return false;
        }
        return switch (frequency) {
            case WEEKLY -> now.getDayOfWeek() == dayOfWeek;
            case MONTHLY -> now.getDayOfMonth() == dayOfMonth;
            default -> true;
        };
    }

    public Duration guard() {
        return frequency.guard();
    }
}
