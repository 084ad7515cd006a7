package io.elephant.core.schedule;

/**
 * A parsed and normalized schedule of a job.
 *
 * Instances are immutable. Parsing {@link #getText()} again with
 * {@link ScheduleParser} yields an equal schedule.
 */
public abstract class Schedule
{
    public abstract ScheduleType getType();

    /**
     * Text stored in the job row: the crontab line as written, or the
     * canonical array literal of a timestamp schedule.
     */
    public abstract String getText();
}
