package com.sentinel.application.port.output;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * MarketStateDetector - recommended broker sync cadence for a point in time.
 *
 * Contract:
 * - Duration.ZERO means all relevant markets are closed: skip syncing
 * - Otherwise the sync job should run on minutes divisible by the returned interval
 *
 * Implementations must be thread-safe and cheap; the scheduler calls this once a minute.
 */
public interface MarketStateDetector {

    /**
     * @param now current time (any zone; implementations convert to exchange zones)
     * @return recommended sync interval, or Duration.ZERO when closed
     */
    Duration getSyncInterval(ZonedDateTime now);
}
