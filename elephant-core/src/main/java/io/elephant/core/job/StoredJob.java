package io.elephant.core.job;

import java.time.Duration;
import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredJob.class)
@JsonDeserialize(as = ImmutableStoredJob.class)
public abstract class StoredJob
{
    public abstract int getId();

    public abstract String getDatabaseName();

    public abstract String getPrincipalName();

    // schedule column as stored. Crontab source or canonical timestamps.
    public abstract Optional<String> getSchedule();

    public abstract boolean getEnabled();

    // failures since the last success
    public abstract int getFailureCount();

    public abstract int getSuccessCount();

    public abstract boolean getParallel();

    public abstract String getCommand();

    public abstract Optional<String> getDescription();

    public abstract Duration getTimeout();

    // last time a run of this job was admitted
    public abstract Optional<Instant> getLastExecuted();

    public abstract int getActiveRuns();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();

    public static ImmutableStoredJob.Builder builder()
    {
        return ImmutableStoredJob.builder();
    }
}
