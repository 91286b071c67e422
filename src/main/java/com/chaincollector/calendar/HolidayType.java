package com.chaincollector.calendar;

/**
 * Kind of entry on the trading calendar.
 *
 * <p>MUHURAT_TRADING (Diwali) is a short evening session: the day counts as a trading day for
 * expiry arithmetic, but the regular 09:15-15:30 collection window is closed.
 */
public enum HolidayType {
    FULL_HOLIDAY,
    MUHURAT_TRADING
}
