package com.sentinel.service.listener;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.DividendDetectedData;
import com.sentinel.domain.event.Event;
import com.sentinel.domain.event.PortfolioChangedData;
import com.sentinel.domain.event.RecommendationsReadyData;
import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;
import com.sentinel.service.core.EventBus;
import com.sentinel.service.core.EventService;
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

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JobEventListeners.
 *
 * Tests:
 * - Default event → job mappings (type, priority, retries)
 * - Payload carries event data and trigger
 * - Bursts collapse into one pending job
 * - Rejected enqueue is logged, not thrown
 */
class JobEventListenersTest {

    private EventBus bus;
    private EventService events;
    private JobManager jobManager;
    private JobEventListeners listeners;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        events = new EventService(bus);
        jobManager = new JobManager(Clock.systemUTC(), 0, 3, null);
        listeners = new JobEventListeners(jobManager);
        listeners.register(bus);
    }

    @AfterEach
    void tearDown() {
        listeners.unregister();
        jobManager.close();
    }

    @Test
    void testStateChangedEnqueuesCriticalPlannerBatch() {
        events.emit(EventType.STATE_CHANGED, "sync", new PortfolioChangedData(true, "abc123"));

        Job job = jobManager.tryDequeue().orElseThrow();
        assertEquals(JobType.PLANNER_BATCH, job.getType());
        assertEquals(JobPriority.CRITICAL, job.getPriority());
        assertEquals(2, job.getMaxRetries());
        assertEquals("abc123", job.getPayload().get("portfolio_hash"));
        assertEquals("STATE_CHANGED", job.getPayload().get(JobEventListeners.PAYLOAD_TRIGGER));
        assertEquals("sync", job.getPayload().get(JobEventListeners.PAYLOAD_SOURCE));
    }

    @Test
    void testRecommendationsReadyEnqueuesTrading() {
        events.emit(EventType.RECOMMENDATIONS_READY, "planner", new RecommendationsReadyData("abc123", 4));

        Job job = jobManager.tryDequeue().orElseThrow();
        assertEquals(JobType.EVENT_BASED_TRADING, job.getType());
        assertEquals(JobPriority.CRITICAL, job.getPriority());
        assertEquals(4, job.getPayload().get("count"));
    }

    @Test
    void testDividendDetectedEnqueuesHighPriorityReinvestment() {
        events.emit(EventType.DIVIDEND_DETECTED, "dividends",
            new DividendDetectedData("AAPL", new BigDecimal("12.50"), "USD"));

        Job job = jobManager.tryDequeue().orElseThrow();
        assertEquals(JobType.DIVIDEND_REINVESTMENT, job.getType());
        assertEquals(JobPriority.HIGH, job.getPriority());
        assertEquals("AAPL", job.getPayload().get("symbol"));
    }

    @Test
    void testGenericPayloadIsCopied() {
        events.emit(EventType.STATE_CHANGED, "ui", Map.of("reason", "manual refresh"));

        Job job = jobManager.tryDequeue().orElseThrow();
        assertEquals("manual refresh", job.getPayload().get("reason"));
    }

    @Test
    void testBurstCollapsesIntoOnePendingJob() {
        for (int i = 0; i < 5; i++) {
            events.emit(EventType.STATE_CHANGED, "sync", new PortfolioChangedData(true, "h" + i));
        }

        assertEquals(1, jobManager.size());
        assertEquals(1, listeners.getEnqueuedCount());
        assertEquals(4, listeners.getCollapsedCount());
    }

    @Test
    void testUnmappedEventsAreIgnored() {
        events.emit(EventType.PRICE_UPDATED, "prices", Map.of("symbol", "AAPL"));
        events.emit(EventType.JOB_COMPLETED, "queue", Map.of());

        assertEquals(0, jobManager.size());
    }

    @Test
    void testRegisterTwiceDoesNotDoubleSubscribe() {
        listeners.register(bus);
        assertEquals(1, bus.subscriberCount(EventType.STATE_CHANGED));
    }

    @Test
    void testUnregisterStopsTranslation() {
        listeners.unregister();
        events.emit(EventType.STATE_CHANGED, "sync", new PortfolioChangedData(true, "x"));
        assertEquals(0, jobManager.size());
    }

    @Test
    void testClosedQueueIsLoggedNotThrown() {
        jobManager.close();

        assertDoesNotThrow(() ->
            events.emit(EventType.DIVIDEND_DETECTED, "dividends", Map.of("symbol", "MSFT")));
        assertEquals(1, listeners.getDroppedCount());
        assertEquals(0, bus.getSubscriberFailures(), "Listener handled the rejection itself");
    }

    @Test
    void testJobStampedFromManagerClock() {
        MutableClock clock = new MutableClock(Instant.parse("2025-06-02T10:00:00Z"));
        JobManager clocked = new JobManager(clock, 0, 3, null);
        EventBus localBus = new EventBus();
        new JobEventListeners(clocked).register(localBus);

        new EventService(localBus).emit(EventType.STATE_CHANGED, "sync", new PortfolioChangedData(true, "h"));

        Job job = clocked.tryDequeue().orElseThrow(() -> new AssertionError("Listener job parked as delayed"));
        assertEquals(clock.instant(), job.getCreatedAt());
        clocked.close();
    }

    @Test
    void testMappingValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            new JobEventListeners.Mapping(EventType.STATE_CHANGED, JobType.PLANNER_BATCH, JobPriority.HIGH, -1));
        assertEquals(3, JobEventListeners.defaultMappings().size());
    }

    /**
     * Queue rejection through a mocked manager.
     */
    @ExtendWith(MockitoExtension.class)
    @Nested
    class WithMockedManager {

        @Mock
        JobManager mockManager;

        @Test
        void testFullQueueDropsJob() {
            Job rejected = Job.builder(JobType.PLANNER_BATCH).build();
            when(mockManager.getClock()).thenReturn(Clock.systemUTC());
            when(mockManager.enqueueIfNotPending(any())).thenThrow(new QueueFullException(rejected, 10));

            JobEventListeners mocked = new JobEventListeners(mockManager, List.of(
                new JobEventListeners.Mapping(EventType.STATE_CHANGED, JobType.PLANNER_BATCH, JobPriority.CRITICAL, 0)));
            EventBus localBus = new EventBus();
            mocked.register(localBus);

            localBus.publish(Event.of(EventType.STATE_CHANGED, "sync", null));

            ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
            verify(mockManager).enqueueIfNotPending(captor.capture());
            assertEquals(JobPriority.CRITICAL, captor.getValue().getPriority());
            assertEquals(1, mocked.getDroppedCount());
        }
    }
}
