package com.gamepanel.scheduler.cron;

import org.springframework.scheduling.support.CronExpression;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates the five-field cron expressions used by schedules
 * ({@code minute hour day-of-month month day-of-week}).
 *
 * <p>Supported subset:</p>
 * <ul>
 *   <li>minute: literal {@code 0-59}</li>
 *   <li>hour: literal {@code 0-23}</li>
 *   <li>day-of-month and month: {@code *} only</li>
 *   <li>day-of-week: {@code *} or a comma list of {@code 0-6}, 0 being Sunday</li>
 * </ul>
 *
 * <p>Parsing is strict and limited to that subset; fire times are computed by Spring's {@link CronExpression}.
 * All methods are pure.</p>
 */
public final class CronEvaluator {

    private static final int FIELD_COUNT = 5;
    private static final String WILDCARD = "*";

    private CronEvaluator() {
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new CronParseException(String.valueOf(expression), "expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw new CronParseException(expression,
                    "expected " + FIELD_COUNT + " fields but found " + fields.length);
        }

        int minute = parseLiteral(expression, "minute", fields[0], 0, 59);
        int hour = parseLiteral(expression, "hour", fields[1], 0, 23);
        requireWildcard(expression, "day-of-month", fields[2]);
        requireWildcard(expression, "month", fields[3]);
        Set<DayOfWeek> days = parseDaysOfWeek(expression, fields[4]);

        return new CronSchedule(minute, hour, days);
    }

    /**
     * Earliest instant strictly after {@code after} matching the expression, with fields read in UTC.
     */
    public static Instant nextFireTime(String expression, Instant after) {
        return nextFireTime(parse(expression), after, ZoneOffset.UTC);
    }

    public static Instant nextFireTime(String expression, Instant after, ZoneId zone) {
        return nextFireTime(parse(expression), after, zone);
    }

    public static Instant nextFireTime(CronSchedule schedule, Instant after, ZoneId zone) {
        ZonedDateTime next = toCronExpression(schedule).next(after.atZone(zone));
        if (next == null) {
            throw new IllegalStateException("No fire time found for " + schedule + " after " + after);
        }
        return next.toInstant();
    }

    /**
     * Six-field Spring form of the schedule, seconds pinned to zero. Weekdays use ISO numbering (Sunday = 7).
     */
    static CronExpression toCronExpression(CronSchedule schedule) {
        String daysOfWeek = schedule.anyDayOfWeek()
                ? WILDCARD
                : schedule.daysOfWeek().stream()
                        .map(day -> String.valueOf(day.getValue()))
                        .collect(Collectors.joining(","));
        return CronExpression.parse("0 " + schedule.minute() + " " + schedule.hour() + " * * " + daysOfWeek);
    }

    private static int parseLiteral(String expression, String field, String value, int min, int max) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new CronParseException(expression, field + " must be a number but was '" + value + "'", e);
        }
        if (parsed < min || parsed > max) {
            throw new CronParseException(expression,
                    field + " must be between " + min + " and " + max + " but was " + parsed);
        }
        return parsed;
    }

    private static void requireWildcard(String expression, String field, String value) {
        if (!WILDCARD.equals(value)) {
            throw new CronParseException(expression, field + " only supports '*' but was '" + value + "'");
        }
    }

    private static Set<DayOfWeek> parseDaysOfWeek(String expression, String value) {
        if (WILDCARD.equals(value)) {
            return EnumSet.noneOf(DayOfWeek.class);
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String part : value.split(",", -1)) {
            int cronDay = parseLiteral(expression, "day-of-week", part.trim(), 0, 6);
            // cron counts from Sunday = 0, java.time from Monday = 1
            days.add(cronDay == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(cronDay));
        }
        return days;
    }
}
