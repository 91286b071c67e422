package com.chaincollector.calendar;

import com.chaincollector.domain.enums.MarketPhase;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Market hours awareness and holiday detection for the collection gate.
 *
 * <p>Collection runs only in the NORMAL session (09:15-15:30 exchange time) on trading days.
 * Weekends are always closed; configured full holidays are closed; a Muhurat day is a trading
 * day for expiry arithmetic but outside the regular session.
 *
 * <p>The last observed phase is remembered so transitions are logged once.
 */
@Service
public class TradingCalendarService {

    private static final Logger log = LoggerFactory.getLogger(TradingCalendarService.class);

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final Clock clock;
    private final AtomicReference<MarketPhase> lastPhase = new AtomicReference<>();

    public TradingCalendarService(HolidayCalendarConfig holidayCalendarConfig, Clock clock) {
        this.holidayCalendarConfig = holidayCalendarConfig;
        this.clock = clock;
    }

    /** Current exchange-local date. */
    public LocalDate today() {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone()).toLocalDate();
    }

    public MarketPhase currentPhase() {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone());
        MarketPhase phase = calculatePhase(now.toLocalDate(), now.toLocalTime());
        MarketPhase previous = lastPhase.getAndSet(phase);
        if (previous != null && previous != phase) {
            log.info("Market phase transition: {} -> {}", previous, phase);
        }
        return phase;
    }

    /** Returns true only during the NORMAL session on a trading day. */
    public boolean isMarketOpen() {
        return currentPhase() == MarketPhase.NORMAL;
    }

    /**
     * Testable version: open check for an explicit instant.
     */
    public boolean isMarketOpen(ZonedDateTime at) {
        ZonedDateTime local = at.withZoneSameInstant(zone());
        return calculatePhase(local.toLocalDate(), local.toLocalTime()) == MarketPhase.NORMAL;
    }

    /**
     * Checks if a date is a non-trading day (weekend or full holiday).
     */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.FULL_HOLIDAY);
    }

    public boolean isMuhuratTrading(LocalDate date) {
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.MUHURAT_TRADING);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date) || isMuhuratTrading(date);
    }

    public LocalDate getPreviousTradingDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isTradingDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    /**
     * Determines the market phase for a given exchange-local date and time.
     */
    public MarketPhase calculatePhase(LocalDate date, LocalTime time) {
        if (isHoliday(date) || isMuhuratTrading(date)) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(MarketPhase.PRE_OPEN.getStartTime())) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(MarketPhase.PRE_OPEN_ORDER_MATCHING.getStartTime())) {
            return MarketPhase.PRE_OPEN;
        }
        if (time.isBefore(MarketPhase.NORMAL.getStartTime())) {
            return MarketPhase.PRE_OPEN_ORDER_MATCHING;
        }
        if (time.isBefore(MarketPhase.CLOSING.getStartTime())) {
            return MarketPhase.NORMAL;
        }
        if (time.isBefore(MarketPhase.POST_CLOSE.getStartTime())) {
            return MarketPhase.CLOSING;
        }
        if (time.isBefore(MarketPhase.POST_CLOSE.getEndTime())) {
            return MarketPhase.POST_CLOSE;
        }
        return MarketPhase.CLOSED;
    }

    public ZoneId zone() {
        return ZoneId.of(holidayCalendarConfig.getTimezone());
    }
}
