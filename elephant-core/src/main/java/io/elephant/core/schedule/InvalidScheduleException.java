package io.elephant.core.schedule;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.elephant.core.repository.ModelValidationException;

/**
 * An exception thrown when a schedule is neither a crontab line nor a list of timestamps.
 */
public class InvalidScheduleException
        extends ModelValidationException
{
    private final String schedule;
    private final Optional<String> hint;

    public InvalidScheduleException(String schedule)
    {
        this(schedule, "is not a valid schedule", Optional.absent(), null);
    }

    public InvalidScheduleException(String schedule, String reason, Optional<String> hint, Throwable cause)
    {
        super("schedule", ImmutableList.of(Failure.of("schedule", schedule, reason)));
        this.schedule = schedule;
        this.hint = hint;
        if (cause != null) {
            initCause(cause);
        }
    }

    public String getSchedule()
    {
        return schedule;
    }

    public Optional<String> getHint()
    {
        return hint;
    }
}
