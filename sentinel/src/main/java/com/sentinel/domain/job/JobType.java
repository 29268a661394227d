package com.sentinel.domain.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Job kind. An open string tag: the engine only uses it as a key for handler
 * lookup, default priority and description.
 */
public record JobType(String id) {

    // Sync
    public static final JobType SYNC_CYCLE = new JobType("sync_cycle");

    // Planning & trading
    public static final JobType PLANNER_BATCH = new JobType("planner_batch");
    public static final JobType EVENT_BASED_TRADING = new JobType("event_based_trading");
    public static final JobType TAG_UPDATE = new JobType("tag_update");
    public static final JobType ADAPTIVE_MARKET_CHECK = new JobType("adaptive_market_check");
    public static final JobType FORMULA_DISCOVERY = new JobType("formula_discovery");

    // Dividends
    public static final JobType DIVIDEND_REINVESTMENT = new JobType("dividend_reinvestment");

    // Cleanup
    public static final JobType HISTORY_CLEANUP = new JobType("history_cleanup");
    public static final JobType RECOMMENDATION_GC = new JobType("recommendation_gc");
    public static final JobType CLIENT_DATA_CLEANUP = new JobType("client_data_cleanup");

    // Backup & maintenance
    public static final JobType HOURLY_BACKUP = new JobType("hourly_backup");
    public static final JobType DAILY_BACKUP = new JobType("daily_backup");
    public static final JobType DAILY_MAINTENANCE = new JobType("daily_maintenance");
    public static final JobType WEEKLY_BACKUP = new JobType("weekly_backup");
    public static final JobType WEEKLY_MAINTENANCE = new JobType("weekly_maintenance");
    public static final JobType MONTHLY_BACKUP = new JobType("monthly_backup");
    public static final JobType MONTHLY_MAINTENANCE = new JobType("monthly_maintenance");

    // System
    public static final JobType DEPLOYMENT = new JobType("deployment");
    public static final JobType HEALTH_CHECK = new JobType("health_check");

    public JobType {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Job type id must not be blank");
        }
    }

    @JsonCreator
    public static JobType of(String id) {
        return new JobType(id);
    }

    @JsonValue
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
