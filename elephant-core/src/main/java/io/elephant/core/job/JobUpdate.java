package io.elephant.core.job;

import java.time.Duration;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Changes to an existing job. An absent field leaves the stored value unchanged.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableJobUpdate.class)
@JsonDeserialize(as = ImmutableJobUpdate.class)
public interface JobUpdate
{
    Optional<String> getDatabaseName();

    Optional<String> getCommand();

    Optional<String> getPrincipalName();

    Optional<String> getSchedule();

    Optional<String> getDescription();

    Optional<Boolean> getEnabled();

    Optional<Boolean> getParallel();

    Optional<Duration> getTimeout();

    default JobRequest mergeInto(StoredJob job)
    {
        return JobRequest.builder()
            .databaseName(getDatabaseName().or(job.getDatabaseName()))
            .command(getCommand().or(job.getCommand()))
            .principalName(getPrincipalName().or(job.getPrincipalName()))
            .schedule(getSchedule().or(job.getSchedule()))
            .description(getDescription().or(job.getDescription()))
            .enabled(getEnabled().or(job.getEnabled()))
            .parallel(getParallel().or(job.getParallel()))
            .timeout(getTimeout().or(job.getTimeout()))
            .build();
    }

    static ImmutableJobUpdate.Builder builder()
    {
        return ImmutableJobUpdate.builder();
    }
}
