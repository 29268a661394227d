package com.sentinel.infrastructure.market;

import com.sentinel.application.port.output.MarketStateDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Market Hours Detector - maps wall-clock time to a broker sync interval.
 *
 * Regular sessions only, evaluated in each exchange's own zone:
 * - Primary market open, or within 30 minutes of its open: 5 minutes
 * - Only a secondary market open: 10 minutes
 * - Everything closed (nights, weekends, lunch breaks): zero
 *
 * Exchange holidays and early closes are not modelled; on those days the detector
 * reports the market as open and the sync simply finds nothing new.
 */
public final class MarketHoursDetector implements MarketStateDetector {
    private static final Logger log = LoggerFactory.getLogger(MarketHoursDetector.class);

    public static final Duration PRIMARY_INTERVAL = Duration.ofMinutes(5);
    public static final Duration SECONDARY_INTERVAL = Duration.ofMinutes(10);
    public static final Duration PRE_MARKET_WINDOW = Duration.ofMinutes(30);

    /**
     * Trading calendar of one exchange.
     *
     * @param lunchStart start of the midday break, or null if the exchange trades through
     */
    public record Exchange(String code, ZoneId zone, LocalTime open, LocalTime close,
                           LocalTime lunchStart, LocalTime lunchEnd) {

        public Exchange {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(zone, "zone");
            if (!open.isBefore(close)) {
                throw new IllegalArgumentException(code + ": open must be before close");
            }
            if ((lunchStart == null) != (lunchEnd == null)) {
                throw new IllegalArgumentException(code + ": lunch break needs both start and end");
            }
        }

        public static Exchange of(String code, String zone, LocalTime open, LocalTime close) {
            return new Exchange(code, ZoneId.of(zone), open, close, null, null);
        }

        public static Exchange withLunch(String code, String zone, LocalTime open, LocalTime close,
                                         LocalTime lunchStart, LocalTime lunchEnd) {
            return new Exchange(code, ZoneId.of(zone), open, close, lunchStart, lunchEnd);
        }

        public boolean isOpen(ZonedDateTime now) {
            ZonedDateTime local = now.withZoneSameInstant(zone);
            if (isWeekend(local.getDayOfWeek())) {
                return false;
            }
            LocalTime t = local.toLocalTime();
            if (t.isBefore(open) || !t.isBefore(close)) {
                return false;
            }
            return lunchStart == null || t.isBefore(lunchStart) || !t.isBefore(lunchEnd);
        }

        public boolean isPreMarket(ZonedDateTime now, Duration window) {
            ZonedDateTime local = now.withZoneSameInstant(zone);
            if (isWeekend(local.getDayOfWeek())) {
                return false;
            }
            LocalTime t = local.toLocalTime();
            LocalTime preOpen = open.minus(window);
            return !t.isBefore(preOpen) && t.isBefore(open);
        }
    }

    public static final List<Exchange> PRIMARY_MARKETS = List.of(
        Exchange.of("NYSE", "America/New_York", LocalTime.of(9, 30), LocalTime.of(16, 0)),
        Exchange.of("NASDAQ", "America/New_York", LocalTime.of(9, 30), LocalTime.of(16, 0)),
        Exchange.of("XETRA", "Europe/Berlin", LocalTime.of(9, 0), LocalTime.of(17, 30)),
        Exchange.of("LSE", "Europe/London", LocalTime.of(8, 0), LocalTime.of(16, 30)),
        Exchange.of("EURONEXT", "Europe/Paris", LocalTime.of(9, 0), LocalTime.of(17, 30))
    );

    public static final List<Exchange> SECONDARY_MARKETS = List.of(
        Exchange.withLunch("HKEX", "Asia/Hong_Kong", LocalTime.of(9, 30), LocalTime.of(16, 0),
            LocalTime.of(12, 0), LocalTime.of(13, 0)),
        Exchange.withLunch("TSE", "Asia/Tokyo", LocalTime.of(9, 0), LocalTime.of(15, 30),
            LocalTime.of(11, 30), LocalTime.of(12, 30)),
        Exchange.of("ASX", "Australia/Sydney", LocalTime.of(10, 0), LocalTime.of(16, 0)),
        Exchange.withLunch("SSE", "Asia/Shanghai", LocalTime.of(9, 30), LocalTime.of(15, 0),
            LocalTime.of(11, 30), LocalTime.of(13, 0))
    );

    private final List<Exchange> primary;
    private final List<Exchange> secondary;
    private final Duration preMarketWindow;

    public MarketHoursDetector() {
        this(PRIMARY_MARKETS, SECONDARY_MARKETS, PRE_MARKET_WINDOW);
    }

    public MarketHoursDetector(List<Exchange> primary, List<Exchange> secondary, Duration preMarketWindow) {
        this.primary = List.copyOf(primary);
        this.secondary = List.copyOf(secondary);
        this.preMarketWindow = preMarketWindow;
    }

    @Override
    public Duration getSyncInterval(ZonedDateTime now) {
        for (Exchange exchange : primary) {
            if (exchange.isOpen(now) || exchange.isPreMarket(now, preMarketWindow)) {
                log.debug("Primary market {} active at {}", exchange.code(), now);
                return PRIMARY_INTERVAL;
            }
        }
        for (Exchange exchange : secondary) {
            if (exchange.isOpen(now)) {
                log.debug("Secondary market {} open at {}", exchange.code(), now);
                return SECONDARY_INTERVAL;
            }
        }
        return Duration.ZERO;
    }

    /**
     * Codes of the exchanges open at the given time.
     */
    public List<String> openExchanges(ZonedDateTime now) {
        return Stream.concat(primary.stream(), secondary.stream())
            .filter(e -> e.isOpen(now))
            .map(Exchange::code)
            .toList();
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
