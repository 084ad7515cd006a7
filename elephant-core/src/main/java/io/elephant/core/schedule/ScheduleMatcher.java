package io.elephant.core.schedule;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Decides whether a schedule fires at a minute.
 */
public class ScheduleMatcher
{
    public boolean matches(Schedule schedule, Instant instant)
    {
        switch (schedule.getType()) {
        case CRONTAB:
            return matchesCrontab((CrontabSchedule) schedule, instant);
        case TIMESTAMPS:
            return matchesTimestamps((TimestampSchedule) schedule, instant);
        default:
            throw new AssertionError("Unknown schedule type: " + schedule.getType());
        }
    }

    private static boolean matchesCrontab(CrontabSchedule schedule, Instant instant)
    {
        ZonedDateTime time = instant.atZone(ZoneOffset.UTC);
        int dayOfWeek = time.getDayOfWeek().getValue() % 7;  // Sunday is 0
        return schedule.getMinutes().contains(time.getMinute())
            && schedule.getHours().contains(time.getHour())
            && schedule.getMonths().contains(time.getMonthValue())
            && (schedule.getDaysOfMonth().contains(time.getDayOfMonth())
                    || schedule.getDaysOfWeek().contains(dayOfWeek));
    }

    private static boolean matchesTimestamps(TimestampSchedule schedule, Instant instant)
    {
        return schedule.getTimestamps().contains(instant.truncatedTo(ChronoUnit.MINUTES));
    }
}
