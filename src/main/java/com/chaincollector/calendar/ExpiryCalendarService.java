package com.chaincollector.calendar;

import com.chaincollector.domain.enums.ExpiryRule;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Rule-based expiry calendar, used when no instrument universe is available to derive expiries
 * from.
 *
 * <p>Current exchange schedule:
 * <ul>
 *   <li>Weekly contracts: NIFTY on Tuesday, SENSEX on Thursday. Other indices have none, so
 *       weekly rules resolve to empty for them.</li>
 *   <li>Monthly contracts: last Tuesday for NIFTY, BANKNIFTY, FINNIFTY and MIDCPNIFTY; last
 *       Thursday for SENSEX and BANKEX.</li>
 * </ul>
 *
 * <p>An expiry falling on a holiday moves to the previous trading day. A monthly expiry already
 * passed rolls to the following month.
 */
@Service
public class ExpiryCalendarService {

    private static final Map<String, DayOfWeek> WEEKLY_EXPIRY_DAY =
            Map.of("NIFTY", DayOfWeek.TUESDAY, "SENSEX", DayOfWeek.THURSDAY);

    private static final Map<String, DayOfWeek> MONTHLY_EXPIRY_DAY = Map.of(
            "NIFTY", DayOfWeek.TUESDAY,
            "BANKNIFTY", DayOfWeek.TUESDAY,
            "FINNIFTY", DayOfWeek.TUESDAY,
            "MIDCPNIFTY", DayOfWeek.TUESDAY,
            "SENSEX", DayOfWeek.THURSDAY,
            "BANKEX", DayOfWeek.THURSDAY);

    private final TradingCalendarService tradingCalendarService;

    public ExpiryCalendarService(TradingCalendarService tradingCalendarService) {
        this.tradingCalendarService = tradingCalendarService;
    }

    /**
     * Resolves an expiry rule for an index relative to {@code referenceDate}.
     *
     * @return empty when the index has no contract of that cadence
     */
    public Optional<LocalDate> expiryFor(String index, ExpiryRule rule, LocalDate referenceDate) {
        String symbol = index.toUpperCase();
        switch (rule) {
            case THIS_WEEK:
                return weeklyDay(symbol).map(day -> currentWeekly(day, referenceDate));
            case NEXT_WEEK:
                return weeklyDay(symbol).map(day -> nextWeekly(day, referenceDate));
            case THIS_MONTH:
                return monthlyDay(symbol).map(day -> currentMonthly(day, referenceDate));
            case NEXT_MONTH:
                return monthlyDay(symbol).map(day -> nextMonthly(day, referenceDate));
            default:
                return Optional.empty();
        }
    }

    public boolean hasWeeklyContracts(String index) {
        return WEEKLY_EXPIRY_DAY.containsKey(index.toUpperCase());
    }

    /** Calendar days from {@code from} to {@code expiry}; negative if already past. */
    public long daysToExpiry(LocalDate from, LocalDate expiry) {
        return ChronoUnit.DAYS.between(from, expiry);
    }

    public int getTradingDaysToExpiry(LocalDate from, LocalDate expiry) {
        LocalDate current = from;
        int tradingDays = 0;
        while (current.isBefore(expiry)) {
            current = current.plusDays(1);
            if (tradingCalendarService.isTradingDay(current)) {
                tradingDays++;
            }
        }
        return tradingDays;
    }

    // ---- Private helpers ----

    private Optional<DayOfWeek> weeklyDay(String symbol) {
        return Optional.ofNullable(WEEKLY_EXPIRY_DAY.get(symbol));
    }

    private Optional<DayOfWeek> monthlyDay(String symbol) {
        DayOfWeek day = MONTHLY_EXPIRY_DAY.get(symbol);
        return Optional.ofNullable(day != null ? day : WEEKLY_EXPIRY_DAY.get(symbol));
    }

    private LocalDate currentWeekly(DayOfWeek day, LocalDate referenceDate) {
        return adjustForHoliday(weeklyCandidate(day, referenceDate));
    }

    private LocalDate nextWeekly(DayOfWeek day, LocalDate referenceDate) {
        return adjustForHoliday(weeklyCandidate(day, referenceDate).plusWeeks(1));
    }

    /** Unadjusted expiry weekday on or after the reference date whose holiday roll is not behind it. */
    private LocalDate weeklyCandidate(DayOfWeek day, LocalDate referenceDate) {
        LocalDate candidate = referenceDate.with(TemporalAdjusters.nextOrSame(day));
        if (adjustForHoliday(candidate).isBefore(referenceDate)) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate;
    }

    private LocalDate currentMonthly(DayOfWeek day, LocalDate referenceDate) {
        LocalDate expiry = adjustForHoliday(referenceDate.with(TemporalAdjusters.lastInMonth(day)));
        if (referenceDate.isAfter(expiry)) {
            expiry = adjustForHoliday(referenceDate
                    .plusMonths(1)
                    .with(TemporalAdjusters.firstDayOfMonth())
                    .with(TemporalAdjusters.lastInMonth(day)));
        }
        return expiry;
    }

    private LocalDate nextMonthly(DayOfWeek day, LocalDate referenceDate) {
        LocalDate current = currentMonthly(day, referenceDate);
        return adjustForHoliday(current.plusMonths(1)
                .with(TemporalAdjusters.firstDayOfMonth())
                .with(TemporalAdjusters.lastInMonth(day)));
    }

    private LocalDate adjustForHoliday(LocalDate date) {
        LocalDate adjusted = date;
        while (tradingCalendarService.isHoliday(adjusted)) {
            adjusted = adjusted.minusDays(1);
        }
        return adjusted;
    }
}
