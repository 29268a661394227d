package com.sentinel.service.scheduler;

import com.sentinel.domain.job.JobType;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

/**
 * Default schedule.
 *
 * Nightly work is anchored on the maintenance hour M so that backups run before
 * maintenance and cleanups run after it:
 * <pre>
 *   M:00      daily_backup           (M+1):45  weekly_backup (Sun)
 *   M:30      daily_maintenance      (M+2):00  weekly_maintenance (Sun)
 *   (M+1):00  history_cleanup        (M+2):30  monthly_backup (1st)
 *   (M+1):15  recommendation_gc      (M+3):00  monthly_maintenance (1st)
 *   (M+1):30  client_data_cleanup    (M+3):30  formula_discovery (15th)
 *   06:00     tag_update
 * </pre>
 * Every hour: hourly_backup, adaptive_market_check, health_check.
 */
public final class CadenceTable {

    public static final LocalTime TAG_UPDATE_TIME = LocalTime.of(6, 0);

    public static List<Cadence> defaults(int maintenanceHour) {
        if (maintenanceHour < 0 || maintenanceHour > 23) {
            throw new IllegalArgumentException("maintenanceHour must be 0-23, got " + maintenanceHour);
        }
        int m = maintenanceHour;
        return List.of(
            Cadence.hourly(JobType.HOURLY_BACKUP),
            Cadence.hourly(JobType.ADAPTIVE_MARKET_CHECK),
            Cadence.hourly(JobType.HEALTH_CHECK),

            Cadence.daily(JobType.DAILY_BACKUP, at(m, 0)),
            Cadence.daily(JobType.DAILY_MAINTENANCE, at(m, 30)),
            Cadence.daily(JobType.HISTORY_CLEANUP, at(m + 1, 0)),
            Cadence.daily(JobType.RECOMMENDATION_GC, at(m + 1, 15)),
            Cadence.daily(JobType.CLIENT_DATA_CLEANUP, at(m + 1, 30)),
            Cadence.daily(JobType.TAG_UPDATE, TAG_UPDATE_TIME),

            Cadence.weekly(JobType.WEEKLY_BACKUP, DayOfWeek.SUNDAY, at(m + 1, 45)),
            Cadence.weekly(JobType.WEEKLY_MAINTENANCE, DayOfWeek.SUNDAY, at(m + 2, 0)),

            Cadence.monthly(JobType.MONTHLY_BACKUP, 1, at(m + 2, 30)),
            Cadence.monthly(JobType.MONTHLY_MAINTENANCE, 1, at(m + 3, 0)),
            Cadence.monthly(JobType.FORMULA_DISCOVERY, 15, at(m + 3, 30))
        );
    }

    // Hours past midnight wrap onto the same calendar day
    private static LocalTime at(int hour, int minute) {
        return LocalTime.of(hour % 24, minute);
    }

    private CadenceTable() {}
}
