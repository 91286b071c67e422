package com.chaincollector.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exchange holiday list, bound from the {@code trading-calendar} prefix in application.yml.
 *
 * <p>Used by {@link TradingCalendarService} for the market-hours gate and by
 * {@link ExpiryCalendarService} to roll holiday expiries back to the previous trading day.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "NSE";
    private String timezone = "Asia/Kolkata";
    private List<Holiday> holidays = new ArrayList<>();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    public static class Holiday {

        private LocalDate date;
        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;

        public Holiday() {}

        public Holiday(LocalDate date, String name, HolidayType type) {
            this.date = date;
            this.name = name;
            this.type = type;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }
    }
}
