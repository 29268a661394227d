package com.sentinel.service.scheduler;

import com.sentinel.application.port.output.MarketStateDetector;
import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;
import com.sentinel.service.queue.JobManager;
import com.sentinel.service.queue.QueueFullException;
import com.sentinel.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TimeScheduler.
 *
 * Tests:
 * - Market-aware sync alignment and the same-minute guard
 * - Closed markets and fallback interval
 * - Calendar cadences (daily / weekly / monthly) and hourly loop
 * - Enqueue failures never escape a tick
 * - Start / stop lifecycle
 */
@ExtendWith(MockitoExtension.class)
class TimeSchedulerTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Berlin");
    // Sunday 2025-06-01
    private static final ZonedDateTime SUNDAY = ZonedDateTime.of(2025, 6, 1, 0, 0, 0, 0, ZONE);

    @Mock
    MarketStateDetector detector;

    @Mock
    JobManager jobManager;

    private TimeScheduler scheduler;

    @BeforeEach
    void setUp() {
        lenient().when(jobManager.getClock()).thenReturn(Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    private TimeScheduler.Builder builder() {
        return TimeScheduler.builder(jobManager)
            .zone(ZONE)
            .deploymentInterval(Duration.ZERO);
    }

    private static ZonedDateTime at(int hour, int minute) {
        return ZonedDateTime.of(2025, 6, 2, hour, minute, 0, 0, ZONE);  // Monday
    }

    @Test
    void testMarketSyncAlignsToDetectorInterval() {
        when(detector.getSyncInterval(any())).thenReturn(Duration.ofMinutes(5));
        scheduler = builder().marketStateDetector(detector).build();

        assertTrue(scheduler.tickMarketSync(at(15, 10)), "Minute 10 is aligned to 5");
        for (int minute = 11; minute <= 14; minute++) {
            assertFalse(scheduler.tickMarketSync(at(15, minute)), "Minute " + minute + " is not aligned");
        }
        assertTrue(scheduler.tickMarketSync(at(15, 15)), "Minute 15 is aligned again");

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(jobManager, times(2)).enqueue(captor.capture());
        assertTrue(captor.getAllValues().stream().allMatch(j -> j.getType().equals(JobType.SYNC_CYCLE)));
        assertEquals(JobPriority.HIGH, captor.getValue().getPriority());
    }

    @Test
    void testSameMinuteNeverSyncsTwice() {
        when(detector.getSyncInterval(any()))
            .thenReturn(Duration.ofMinutes(5))
            .thenReturn(Duration.ofMinutes(10));
        scheduler = builder().marketStateDetector(detector).build();

        assertTrue(scheduler.tickMarketSync(at(9, 30)));
        assertFalse(scheduler.tickMarketSync(at(9, 30).plusSeconds(20)),
            "Interval change within the same minute must not double-fire");

        verify(jobManager, times(1)).enqueue(any());
    }

    @Test
    void testClosedMarketsNeverSync() {
        when(detector.getSyncInterval(any())).thenReturn(Duration.ZERO);
        scheduler = builder().marketStateDetector(detector).build();

        for (int minute = 0; minute < 60; minute++) {
            assertFalse(scheduler.tickMarketSync(at(3, minute)));
        }
        verify(jobManager, never()).enqueue(any());
    }

    @Test
    void testFallbackIntervalWithoutDetector() {
        scheduler = builder().fallbackSyncInterval(Duration.ofMinutes(15)).build();

        assertTrue(scheduler.tickMarketSync(at(12, 0)));
        assertFalse(scheduler.tickMarketSync(at(12, 5)));
        assertTrue(scheduler.tickMarketSync(at(12, 15)));
    }

    @Test
    void testDetectorFailureSkipsTick() {
        when(detector.getSyncInterval(any())).thenThrow(new IllegalStateException("calendar unavailable"));
        scheduler = builder().marketStateDetector(detector).build();

        assertFalse(scheduler.tickMarketSync(at(10, 0)));
        verify(jobManager, never()).enqueue(any());
    }

    @Test
    void testSyncEnqueueFailureIsSwallowedAndRetriable() {
        when(detector.getSyncInterval(any())).thenReturn(Duration.ofMinutes(5));
        Job rejected = Job.builder(JobType.SYNC_CYCLE).build();
        doThrow(new QueueFullException(rejected, 1)).doNothing().when(jobManager).enqueue(any());
        scheduler = builder().marketStateDetector(detector).build();

        boolean synced = scheduler.tickMarketSync(at(10, 0));
        assertFalse(synced, "Rejected enqueue is logged, not thrown");
        assertTrue(scheduler.tickMarketSync(at(10, 0)), "Failed minute is not marked as synced");
    }

    @Test
    void testDailyCadenceFiresAtItsMinuteOnly() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(CadenceTable.defaults(2)).build();

        assertEquals(1, scheduler.tickFast(at(2, 0)));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.DAILY_BACKUP), eq(JobPriority.MEDIUM),
            eq(Duration.ofHours(23)), anyMap());

        assertEquals(0, scheduler.tickFast(at(2, 1)));
        assertEquals(1, scheduler.tickFast(at(3, 15)));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.RECOMMENDATION_GC), any(), eq(Duration.ofHours(23)), anyMap());
        assertEquals(1, scheduler.tickFast(at(6, 0)));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.TAG_UPDATE), any(), any(), anyMap());
    }

    @Test
    void testSameSlotFiresOnce() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(CadenceTable.defaults(2)).build();

        scheduler.tickFast(at(2, 30));
        scheduler.tickFast(at(2, 30).plusSeconds(30));

        verify(jobManager, times(1)).enqueueIfShouldRun(eq(JobType.DAILY_MAINTENANCE), any(), any(), anyMap());
    }

    @Test
    void testWeeklyCadenceOnlyOnSunday() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(CadenceTable.defaults(2)).build();

        scheduler.tickFast(at(3, 45));
        verify(jobManager, never()).enqueueIfShouldRun(eq(JobType.WEEKLY_BACKUP), any(), any(), anyMap());

        scheduler.tickFast(SUNDAY.withHour(3).withMinute(45));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.WEEKLY_BACKUP), any(), eq(Duration.ofDays(6)), anyMap());
    }

    @Test
    void testMonthlyCadences() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(CadenceTable.defaults(2)).build();

        ZonedDateTime firstOfMonth = SUNDAY;  // 2025-06-01
        scheduler.tickFast(firstOfMonth.withHour(4).withMinute(30));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.MONTHLY_BACKUP), any(), eq(Duration.ofDays(27)), anyMap());

        scheduler.tickFast(firstOfMonth.withHour(5).withMinute(30));
        verify(jobManager, never()).enqueueIfShouldRun(eq(JobType.FORMULA_DISCOVERY), any(), any(), anyMap());

        scheduler.tickFast(firstOfMonth.withDayOfMonth(15).withHour(5).withMinute(30));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.FORMULA_DISCOVERY), any(), any(), anyMap());
    }

    @Test
    void testCadencesEvaluatedInConfiguredZone() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(CadenceTable.defaults(2)).build();

        // 00:00 UTC on 2 June is 02:00 in Berlin (CEST)
        ZonedDateTime utc = ZonedDateTime.of(2025, 6, 2, 0, 0, 0, 0, ZoneId.of("UTC"));
        assertEquals(1, scheduler.tickFast(utc));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.DAILY_BACKUP), any(), any(), anyMap());
    }

    @Test
    void testDeploymentCheckUsesInterval() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(List.of()).deploymentInterval(Duration.ofMinutes(5)).build();

        assertEquals(1, scheduler.tickFast(at(10, 1)));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.DEPLOYMENT), any(), eq(Duration.ofMinutes(5)), eq(Map.of()));
    }

    @Test
    void testHourlyTickUsesHourlyGuard() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(CadenceTable.defaults(2)).build();

        assertEquals(3, scheduler.tickHourly(at(10, 0)));
        verify(jobManager).enqueueIfShouldRun(eq(JobType.HOURLY_BACKUP), any(), eq(Duration.ofMinutes(59)), anyMap());
        verify(jobManager).enqueueIfShouldRun(eq(JobType.ADAPTIVE_MARKET_CHECK), any(), any(), anyMap());
        verify(jobManager).enqueueIfShouldRun(eq(JobType.HEALTH_CHECK), eq(JobPriority.HIGH), any(), anyMap());
    }

    @Test
    void testCadenceEnqueueFailureDoesNotStopTick() {
        Job rejected = Job.builder(JobType.DAILY_BACKUP).build();
        when(jobManager.enqueueIfShouldRun(eq(JobType.HOURLY_BACKUP), any(), any(), anyMap()))
            .thenThrow(new QueueFullException(rejected, 1));
        when(jobManager.enqueueIfShouldRun(eq(JobType.ADAPTIVE_MARKET_CHECK), any(), any(), anyMap())).thenReturn(true);
        when(jobManager.enqueueIfShouldRun(eq(JobType.HEALTH_CHECK), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(CadenceTable.defaults(2)).build();

        int enqueued = scheduler.tickHourly(at(10, 0));
        assertEquals(2, enqueued, "Remaining hourly cadences still run");
    }

    @Test
    void testStartFiresHourlyLoopImmediatelyAndStopHaltsEnqueues() throws InterruptedException {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder()
            .cadences(List.of(Cadence.hourly(JobType.HEALTH_CHECK)))
            .clock(new MutableClock(at(10, 0).toInstant()))
            .build();

        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());

        verify(jobManager, timeout(2000)).enqueueIfShouldRun(eq(JobType.HEALTH_CHECK), any(), any(), anyMap());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
        clearInvocations(jobManager);

        Thread.sleep(300);
        verifyNoInteractions(jobManager);
        assertDoesNotThrow(scheduler::stop, "Second stop is a no-op");
    }

    @Test
    void testRestartAfterStop() {
        when(jobManager.enqueueIfShouldRun(any(), any(), any(), anyMap())).thenReturn(true);
        scheduler = builder().cadences(List.of(Cadence.hourly(JobType.HOURLY_BACKUP))).build();

        scheduler.start();
        scheduler.stop();
        clearInvocations(jobManager);
        scheduler.start();

        verify(jobManager, timeout(2000)).enqueueIfShouldRun(eq(JobType.HOURLY_BACKUP), any(), any(), anyMap());
    }

    /**
     * Real job manager on a test clock: jobs must be stamped from the manager's clock.
     */
    @Nested
    class WithManagerClock {

        private final MutableClock clock = new MutableClock(Instant.parse("2025-06-02T10:00:00Z"));
        private final JobManager manager = new JobManager(clock, 0, 3, null);

        @AfterEach
        void closeManager() {
            manager.close();
        }

        private TimeScheduler schedulerOnManager() {
            return TimeScheduler.builder(manager)
                .zone(ZONE)
                .cadences(List.of())
                .deploymentInterval(Duration.ZERO)
                .fallbackSyncInterval(Duration.ofMinutes(1))
                .build();
        }

        @Test
        void testSyncJobIsReadyWhenManagerClockIsBehindWallClock() {
            assertTrue(schedulerOnManager().tickMarketSync(ZonedDateTime.now(clock)));

            Job job = manager.tryDequeue().orElseThrow(() -> new AssertionError("Sync job parked as delayed"));
            assertEquals(JobType.SYNC_CYCLE, job.getType());
            assertEquals(clock.instant(), job.getCreatedAt());
            assertEquals(clock.instant(), job.getAvailableAt());
        }

        @Test
        void testEqualPriorityJobsKeepFifoWhenManagerClockIsAhead() {
            clock.set(Instant.now().plus(Duration.ofHours(1)));

            assertTrue(manager.enqueueIfShouldRun(JobType.HEALTH_CHECK, JobPriority.HIGH, Duration.ofMinutes(59), Map.of()));
            assertTrue(schedulerOnManager().tickMarketSync(ZonedDateTime.now(clock)));

            assertEquals(JobType.HEALTH_CHECK, manager.tryDequeue().orElseThrow().getType());
            assertEquals(JobType.SYNC_CYCLE, manager.tryDequeue().orElseThrow().getType());
        }
    }
}
