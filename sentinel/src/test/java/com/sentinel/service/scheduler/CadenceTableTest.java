package com.sentinel.service.scheduler;

import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Cadence and CadenceTable.
 */
class CadenceTableTest {

    private static Cadence find(List<Cadence> cadences, JobType type) {
        return cadences.stream().filter(c -> c.jobType().equals(type)).findFirst().orElseThrow();
    }

    @Test
    void testDefaultTableAnchoredOnMaintenanceHour() {
        List<Cadence> table = CadenceTable.defaults(2);

        assertEquals(14, table.size());
        assertEquals(3, table.stream().filter(Cadence::isHourly).count());
        assertEquals(LocalTime.of(2, 0), find(table, JobType.DAILY_BACKUP).at());
        assertEquals(LocalTime.of(2, 30), find(table, JobType.DAILY_MAINTENANCE).at());
        assertEquals(LocalTime.of(3, 0), find(table, JobType.HISTORY_CLEANUP).at());
        assertEquals(LocalTime.of(6, 0), find(table, JobType.TAG_UPDATE).at());
        assertEquals(DayOfWeek.SUNDAY, find(table, JobType.WEEKLY_MAINTENANCE).dayOfWeek());
        assertEquals(15, find(table, JobType.FORMULA_DISCOVERY).dayOfMonth());
        assertEquals(JobPriority.HIGH, find(table, JobType.HEALTH_CHECK).priority());
    }

    @Test
    void testHoursWrapPastMidnight() {
        List<Cadence> table = CadenceTable.defaults(23);

        assertEquals(LocalTime.of(23, 0), find(table, JobType.DAILY_BACKUP).at());
        assertEquals(LocalTime.of(0, 0), find(table, JobType.HISTORY_CLEANUP).at());
        assertEquals(LocalTime.of(2, 0), find(table, JobType.MONTHLY_MAINTENANCE).at());
        assertEquals(CadenceTable.TAG_UPDATE_TIME, find(table, JobType.TAG_UPDATE).at(), "Tag update is not anchored");
    }

    @Test
    void testInvalidMaintenanceHour() {
        assertThrows(IllegalArgumentException.class, () -> CadenceTable.defaults(24));
        assertThrows(IllegalArgumentException.class, () -> CadenceTable.defaults(-1));
    }

    @Test
    void testMatches() {
        Cadence weekly = Cadence.weekly(JobType.WEEKLY_BACKUP, DayOfWeek.SUNDAY, LocalTime.of(3, 45));
        ZonedDateTime sunday = ZonedDateTime.of(2025, 6, 1, 3, 45, 30, 0, ZoneOffset.UTC);

        assertTrue(weekly.matches(sunday), "Any second within the minute matches");
        assertFalse(weekly.matches(sunday.plusMinutes(1)));
        assertFalse(weekly.matches(sunday.plusDays(1)), "Monday");
        assertFalse(Cadence.hourly(JobType.HEALTH_CHECK).matches(sunday), "Hourly cadences never match a minute tick");
    }

    @Test
    void testGuardsShorterThanPeriod() {
        assertTrue(Cadence.Frequency.HOURLY.guard().toMinutes() < 60);
        assertTrue(Cadence.Frequency.DAILY.guard().toHours() < 24);
        assertTrue(Cadence.Frequency.WEEKLY.guard().toDays() < 7);
        assertTrue(Cadence.Frequency.MONTHLY.guard().toDays() < 28);
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> Cadence.monthly(JobType.MONTHLY_BACKUP, 31, LocalTime.NOON));
        assertThrows(IllegalArgumentException.class, () -> Cadence.daily(JobType.DAILY_BACKUP, null));
        assertThrows(IllegalArgumentException.class, () -> Cadence.weekly(JobType.WEEKLY_BACKUP, null, LocalTime.NOON));
    }
}
