package com.chaincollector.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.chaincollector.calendar.HolidayCalendarConfig;
import com.chaincollector.calendar.HolidayType;
import com.chaincollector.calendar.TradingCalendarService;
import com.chaincollector.domain.enums.MarketPhase;
import com.chaincollector.unit.support.MutableClock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for TradingCalendarService covering the collection window, holiday handling and
 * the exchange-local date.
 */
class TradingCalendarServiceTest {

    private final LocalDate wednesday = LocalDate.of(2025, 6, 11);

    private HolidayCalendarConfig holidayCalendarConfig;
    private MutableClock clock;
    private TradingCalendarService tradingCalendarService;

    @BeforeEach
    void setUp() {
        holidayCalendarConfig = new HolidayCalendarConfig();
        holidayCalendarConfig.setExchange("NSE");
        holidayCalendarConfig.setTimezone("Asia/Kolkata");
        holidayCalendarConfig.setHolidays(new ArrayList<>());

        clock = MutableClock.atIst(2025, 6, 11, 10, 0);
        tradingCalendarService = new TradingCalendarService(holidayCalendarConfig, clock);
    }

    private void addHoliday(LocalDate date, HolidayType type) {
        holidayCalendarConfig.getHolidays().add(new HolidayCalendarConfig.Holiday(date, "test", type));
    }

    @Nested
    @DisplayName("Phase Detection at Boundary Times")
    class PhaseDetection {

        @ParameterizedTest(name = "{0} is {1}")
        @CsvSource({
            "08:59:59, CLOSED",
            "09:00, PRE_OPEN",
            "09:08, PRE_OPEN_ORDER_MATCHING",
            "09:14, PRE_OPEN_ORDER_MATCHING",
            "09:15, NORMAL",
            "15:29, NORMAL",
            "15:30, CLOSING",
            "15:40, POST_CLOSE",
            "16:00, CLOSED"
        })
        void boundaries(LocalTime time, MarketPhase expected) {
            assertThat(tradingCalendarService.calculatePhase(wednesday, time)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Weekends are CLOSED at any time")
        void weekend() {
            assertThat(tradingCalendarService.calculatePhase(LocalDate.of(2025, 6, 14), LocalTime.of(10, 0)))
                    .isEqualTo(MarketPhase.CLOSED);
            assertThat(tradingCalendarService.calculatePhase(LocalDate.of(2025, 6, 15), LocalTime.of(10, 0)))
                    .isEqualTo(MarketPhase.CLOSED);
        }
    }

    @Nested
    @DisplayName("Collection Window")
    class CollectionWindow {

        @Test
        @DisplayName("Open at 10:00 IST on a weekday")
        void openDuringSession() {
            assertThat(tradingCalendarService.isMarketOpen()).isTrue();
        }

        @Test
        @DisplayName("Instants are judged in exchange time whatever their zone")
        void zoneIndependent() {
            ZonedDateTime utc = ZonedDateTime.of(2025, 6, 11, 4, 0, 0, 0, ZoneOffset.UTC);

            assertThat(tradingCalendarService.isMarketOpen(utc)).isTrue();
            assertThat(tradingCalendarService.isMarketOpen(utc.plusHours(7))).isFalse();
        }

        @Test
        @DisplayName("A full holiday closes the session")
        void holidayClosed() {
            addHoliday(wednesday, HolidayType.FULL_HOLIDAY);

            assertThat(tradingCalendarService.isMarketOpen()).isFalse();
        }

        @Test
        @DisplayName("A Muhurat day is a trading day but outside the regular session")
        void muhurat() {
            LocalDate diwali = LocalDate.of(2025, 10, 21);
            addHoliday(diwali, HolidayType.MUHURAT_TRADING);

            assertThat(tradingCalendarService.isHoliday(diwali)).isFalse();
            assertThat(tradingCalendarService.isTradingDay(diwali)).isTrue();
            assertThat(tradingCalendarService.calculatePhase(diwali, LocalTime.of(10, 0)))
                    .isEqualTo(MarketPhase.CLOSED);
        }
    }

    @Nested
    @DisplayName("Trading Days")
    class TradingDays {

        @Test
        @DisplayName("Previous trading day skips the weekend and holidays")
        void previousTradingDay() {
            addHoliday(LocalDate.of(2025, 6, 13), HolidayType.FULL_HOLIDAY);

            assertThat(tradingCalendarService.getPreviousTradingDay(LocalDate.of(2025, 6, 16)))
                    .isEqualTo(LocalDate.of(2025, 6, 12));
        }

        @Test
        @DisplayName("today() is the exchange-local date")
        void todayInExchangeZone() {
            clock.set(Instant.parse("2025-06-10T20:00:00Z"));

            assertThat(tradingCalendarService.today()).isEqualTo(wednesday);
            assertThat(tradingCalendarService.zone().getId()).isEqualTo("Asia/Kolkata");
        }

        @Test
        @DisplayName("Holiday list is read live from the config")
        void liveConfig() {
            holidayCalendarConfig.setHolidays(new ArrayList<>(List.of(
                    new HolidayCalendarConfig.Holiday(LocalDate.of(2025, 8, 15), "Independence Day",
                            HolidayType.FULL_HOLIDAY))));

            assertThat(tradingCalendarService.isHoliday(LocalDate.of(2025, 8, 15))).isTrue();
        }
    }
}
