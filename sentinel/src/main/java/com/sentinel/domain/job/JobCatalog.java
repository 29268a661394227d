package com.sentinel.domain.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Human-readable descriptions and default priorities per job type.
 * Unknown types fall back to their id and MEDIUM.
 */
public final class JobCatalog {

    private record Entry(String description, JobPriority priority) {}

    private static final Map<JobType, Entry> ENTRIES;

    static {
        Map<JobType, Entry> m = new LinkedHashMap<>();
        m.put(JobType.SYNC_CYCLE, new Entry("Syncing all data from broker", JobPriority.HIGH));
        m.put(JobType.PLANNER_BATCH, new Entry("Generating trading recommendations", JobPriority.CRITICAL));
        m.put(JobType.EVENT_BASED_TRADING, new Entry("Executing recommended trades", JobPriority.CRITICAL));
        m.put(JobType.DIVIDEND_REINVESTMENT, new Entry("Reinvesting dividends", JobPriority.HIGH));
        m.put(JobType.TAG_UPDATE, new Entry("Updating security tags", JobPriority.MEDIUM));
        m.put(JobType.ADAPTIVE_MARKET_CHECK, new Entry("Checking market regime", JobPriority.MEDIUM));
        m.put(JobType.FORMULA_DISCOVERY, new Entry("Discovering scoring formulas", JobPriority.LOW));
        m.put(JobType.HISTORY_CLEANUP, new Entry("Cleaning up price history", JobPriority.LOW));
        m.put(JobType.RECOMMENDATION_GC, new Entry("Removing stale recommendations", JobPriority.LOW));
        m.put(JobType.CLIENT_DATA_CLEANUP, new Entry("Removing expired API cache entries", JobPriority.LOW));
        m.put(JobType.HOURLY_BACKUP, new Entry("Creating hourly backup", JobPriority.MEDIUM));
        m.put(JobType.DAILY_BACKUP, new Entry("Creating daily backup", JobPriority.MEDIUM));
        m.put(JobType.DAILY_MAINTENANCE, new Entry("Running daily database maintenance", JobPriority.MEDIUM));
        m.put(JobType.WEEKLY_BACKUP, new Entry("Creating weekly backup", JobPriority.MEDIUM));
        m.put(JobType.WEEKLY_MAINTENANCE, new Entry("Running weekly database maintenance", JobPriority.LOW));
        m.put(JobType.MONTHLY_BACKUP, new Entry("Creating monthly backup", JobPriority.MEDIUM));
        m.put(JobType.MONTHLY_MAINTENANCE, new Entry("Running monthly database maintenance", JobPriority.LOW));
        m.put(JobType.DEPLOYMENT, new Entry("Checking for deployments", JobPriority.MEDIUM));
        m.put(JobType.HEALTH_CHECK, new Entry("Checking database health", JobPriority.HIGH));
        ENTRIES = Collections.unmodifiableMap(m);
    }

    public static String describe(JobType type) {
        Entry entry = ENTRIES.get(type);
        return entry != null ? entry.description() : type.id();
    }

    public static JobPriority defaultPriority(JobType type) {
        Entry entry = ENTRIES.get(type);
        return entry != null ? entry.priority() : JobPriority.MEDIUM;
    }

    public static boolean isKnown(JobType type) {
        return ENTRIES.containsKey(type);
    }

    /**
     * All catalogued types, in declaration order.
     */
    public static Iterable<JobType> knownTypes() {
        return ENTRIES.keySet();
    }

    private JobCatalog() {}
}
