package com.fundfeed.calendar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the exchange trading calendar, loaded from application.yml
 * via the {@code trading-calendar} prefix.
 *
 * <p>The holiday list is updated annually from the SSE published closure schedule. Weekends
 * are always closed and need not be listed; make-up working weekends do not reopen the
 * exchange.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "SSE";
    private String timezone = "Asia/Shanghai";

    /** Local time after which fund companies have published the day's NAV. */
    private LocalTime navPublishTime = LocalTime.of(20, 0);

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

    public LocalTime getNavPublishTime() {
        return navPublishTime;
    }

    public void setNavPublishTime(LocalTime navPublishTime) {
        this.navPublishTime = navPublishTime;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /**
     * A single exchange closure on the trading calendar.
     */
    public static class Holiday {

        private LocalDate date;
        private String name;

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
    }
}
