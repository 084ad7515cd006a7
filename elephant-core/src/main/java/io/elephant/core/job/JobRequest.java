package io.elephant.core.job;

import java.time.Duration;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Definition of a new job as given by a caller.
 *
 * The schedule is the text as written. It is validated and normalized by
 * {@link JobLifecycleValidator} before it is stored.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableJobRequest.class)
@JsonDeserialize(as = ImmutableJobRequest.class)
public interface JobRequest
{
    Duration DEFAULT_TIMEOUT = Duration.ofHours(6);

    String getDatabaseName();

    String getCommand();

    // defaults to the acting caller
    Optional<String> getPrincipalName();

    // absent means the job never fires automatically
    Optional<String> getSchedule();

    Optional<String> getDescription();

    @Value.Default
    default boolean getEnabled()
    {
        return true;
    }

    @Value.Default
    default boolean getParallel()
    {
        return false;
    }

    @Value.Default
    default Duration getTimeout()
    {
        return DEFAULT_TIMEOUT;
    }

    static ImmutableJobRequest.Builder builder()
    {
        return ImmutableJobRequest.builder();
    }
}
