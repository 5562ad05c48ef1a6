package org.gc.contentscheduler.service;

import org.gc.contentscheduler.domain.BlogSchedule;
import org.gc.contentscheduler.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Computes the next fire time of a schedule. Pure: the result depends only on
 * the schedule's timing fields and {@code now}.
 * <p>
 * Monthly schedules clip the day to 28 so every month has the configured day;
 * a schedule set for the 31st therefore runs on the 28th. Weekly schedules
 * never run on the same weekday they are computed on; a zero offset rolls to
 * the following week.
 */
@Component
public class NextRunCalculator {

    static final int MAX_MONTHLY_DAY = 28;
    private static final int DEFAULT_WEEKDAY = 0;

    public Instant calculateNextRun(BlogSchedule schedule, Instant now) {
        ZoneId zone = zoneOf(schedule);
        ZonedDateTime localNow = now.atZone(zone);

        BlogSchedule.Frequency frequency = schedule.getFrequency();
        if (frequency == null) {
            throw new InvalidScheduleException("Schedule " + schedule.getId() + " has no frequency");
        }

        return switch (frequency) {
            case DAILY -> nextDaily(localNow, timeOf(schedule));
            case WEEKLY -> nextWeekly(localNow, timeOf(schedule), schedule.getDayOfWeek());
            case MONTHLY -> nextMonthly(localNow, timeOf(schedule), schedule.getDayOfMonth());
            case CUSTOM_CRON -> nextCron(localNow, schedule.getCustomCron());
        };
    }

    private Instant nextDaily(ZonedDateTime localNow, LocalTime time) {
        ZonedDateTime candidate = localNow.toLocalDate().atTime(time).atZone(localNow.getZone());
        if (!candidate.toInstant().isAfter(localNow.toInstant())) {
            candidate = localNow.toLocalDate().plusDays(1).atTime(time).atZone(localNow.getZone());
        }
        return candidate.toInstant();
    }

    private Instant nextWeekly(ZonedDateTime localNow, LocalTime time, Integer dayOfWeek) {
        int target = dayOfWeek != null ? dayOfWeek : DEFAULT_WEEKDAY;
        if (target < 0 || target > 6) {
            throw new InvalidScheduleException("Day of week must be between 0 and 6, got " + target);
        }

        int today = localNow.getDayOfWeek().getValue() - 1;
        int offset = target - today;
        if (offset <= 0) {
            offset += 7;
        }

        LocalDate date = localNow.toLocalDate().plusDays(offset);
        return date.atTime(time).atZone(localNow.getZone()).toInstant();
    }

    private Instant nextMonthly(ZonedDateTime localNow, LocalTime time, Integer dayOfMonth) {
        int requested = dayOfMonth != null ? dayOfMonth : 1;
        if (requested < 1 || requested > 31) {
            throw new InvalidScheduleException("Day of month must be between 1 and 31, got " + requested);
        }
        int day = Math.min(requested, MAX_MONTHLY_DAY);

        LocalDate thisMonth = localNow.toLocalDate().withDayOfMonth(day);
        ZonedDateTime candidate = thisMonth.atTime(time).atZone(localNow.getZone());
        if (!candidate.toInstant().isAfter(localNow.toInstant())) {
            // plusMonths rolls December over into January of the next year
            candidate = thisMonth.plusMonths(1).atTime(time).atZone(localNow.getZone());
        }
        return candidate.toInstant();
    }

    private Instant nextCron(ZonedDateTime localNow, String customCron) {
        if (customCron == null || customCron.isBlank()) {
            throw new InvalidScheduleException("Custom cron schedule has no cron expression");
        }

        CronExpression expression;
        try {
            expression = CronExpression.parse(toSpringCron(customCron));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + customCron + "': " + e.getMessage(), e);
        }

        ZonedDateTime next = expression.next(localNow);
        if (next == null) {
            throw new InvalidScheduleException("Cron expression '" + customCron + "' never fires again");
        }
        return next.toInstant();
    }

    /**
     * Spring cron expressions carry a leading seconds field; plain crontab input
     * gets one pinned to zero.
     */
    static String toSpringCron(String cron) {
        String trimmed = cron.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    static ZoneId zoneOf(BlogSchedule schedule) {
        String timezone = schedule.getTimezone();
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone '" + timezone + "'", e);
        }
    }

    private static LocalTime timeOf(BlogSchedule schedule) {
        String timeOfDay = schedule.getTimeOfDay();
        if (timeOfDay == null || timeOfDay.isBlank()) {
            throw new InvalidScheduleException("Schedule " + schedule.getId() + " has no time of day");
        }
        try {
            return LocalTime.parse(timeOfDay.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleException("Invalid time of day '" + timeOfDay + "', expected HH:mm", e);
        }
    }
}
