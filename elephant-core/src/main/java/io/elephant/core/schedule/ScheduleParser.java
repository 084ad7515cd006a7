package io.elephant.core.schedule;

import com.google.common.base.Optional;
import com.google.inject.Inject;

/**
 * Parses schedule text as a crontab line first, then as timestamps.
 *
 * A text that is a valid crontab is never read as timestamps.
 */
public class ScheduleParser
{
    private final CronScheduleParser cronParser;
    private final TimestampScheduleParser timestampParser;

    @Inject
    public ScheduleParser(CronScheduleParser cronParser, TimestampScheduleParser timestampParser)
    {
        this.cronParser = cronParser;
        this.timestampParser = timestampParser;
    }

    public Optional<Schedule> tryParse(String text)
    {
        Optional<CrontabSchedule> crontab = cronParser.tryParse(text);
        if (crontab.isPresent()) {
            return Optional.of(crontab.get());
        }
        Optional<TimestampSchedule> timestamps = timestampParser.parse(text);
        if (timestamps.isPresent()) {
            return Optional.of(timestamps.get());
        }
        return Optional.absent();
    }

    public Schedule parse(String text)
        throws InvalidScheduleException
    {
        Optional<Schedule> schedule = tryParse(text);
        if (!schedule.isPresent()) {
            throw new InvalidScheduleException(text);
        }
        return schedule.get();
    }
}
