package io.elephant.core.job;

import java.time.Duration;
import com.google.common.base.Optional;
import io.elephant.core.schedule.Schedule;
import org.immutables.value.Value;

/**
 * A validated job definition ready to be written to {@link JobStore}.
 */
@Value.Immutable
public abstract class Job
{
    public abstract String getDatabaseName();

    public abstract String getPrincipalName();

    public abstract Optional<Schedule> getSchedule();

    public abstract boolean getEnabled();

    public abstract boolean getParallel();

    public abstract String getCommand();

    public abstract Optional<String> getDescription();

    public abstract Duration getTimeout();

    /**
     * Text persisted in the schedule column.
     */
    public Optional<String> getScheduleText()
    {
        return getSchedule().transform(Schedule::getText);
    }

    public static ImmutableJob.Builder builder()
    {
        return ImmutableJob.builder();
    }
}
