package com.fundfeed.calendar;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import org.springframework.stereotype.Service;

/**
 * Exchange calendar awareness for NAV settlement.
 *
 * <p>Open-end funds publish one NAV per trading day, in the evening. An intraday estimate is
 * superseded once the NAV for the date it refers to is out; this service answers which NAV
 * date should already be published at a given moment.
 *
 * <p>Holiday data is loaded from YAML configuration via {@link HolidayCalendarConfig}.
 */
@Service
public class TradingCalendarService {

    private final HolidayCalendarConfig holidayCalendarConfig;

    public TradingCalendarService(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidayCalendarConfig = holidayCalendarConfig;
    }

    public ZoneId zone() {
        return ZoneId.of(holidayCalendarConfig.getTimezone());
    }

    /**
     * Checks if a date is a non-trading day (weekend or listed closure).
     * Weekends (Saturday/Sunday) are always holidays.
     */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> h.getDate() != null && h.getDate().equals(date));
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    /** Returns the previous trading day before the given date. */
    public LocalDate getPreviousTradingDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isTradingDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    /** Returns the given date if it is a trading day, otherwise the closest earlier one. */
    public LocalDate getLatestTradingDayOnOrBefore(LocalDate date) {
        return isTradingDay(date) ? date : getPreviousTradingDay(date);
    }

    public LocalDate expectedLatestSettledDate(Instant now) {
        return expectedLatestSettledDate(LocalDateTime.ofInstant(now, zone()));
    }

    /**
     * Testable version: the newest NAV date that should be published at the given exchange-local
     * time.
     * <ul>
     *   <li>non-trading day: the latest trading day before it</li>
     *   <li>trading day at or after the NAV publish time: that day</li>
     *   <li>trading day before the NAV publish time: the previous trading day</li>
     * </ul>
     */
    public LocalDate expectedLatestSettledDate(LocalDateTime localNow) {
        LocalDate today = localNow.toLocalDate();
        if (!isTradingDay(today)) {
            return getLatestTradingDayOnOrBefore(today);
        }
        if (!localNow.toLocalTime().isBefore(holidayCalendarConfig.getNavPublishTime())) {
            return today;
        }
        return getPreviousTradingDay(today);
    }

    /** True when the NAV dated {@code navDate} is the newest one expected at {@code now}. */
    public boolean isSettled(LocalDate navDate, Instant now) {
        return navDate != null && !navDate.isBefore(expectedLatestSettledDate(now));
    }
}
