package com.gamepanel.scheduler.cron;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parsed form of a supported cron expression: a fixed minute and hour, optionally restricted to a set of
 * weekdays. An empty weekday set means every day.
 */
public record CronSchedule(int minute, int hour, Set<DayOfWeek> daysOfWeek) {

    public CronSchedule {
        daysOfWeek = daysOfWeek == null || daysOfWeek.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
    }

    public boolean anyDayOfWeek() {
        return daysOfWeek.isEmpty();
    }
}
