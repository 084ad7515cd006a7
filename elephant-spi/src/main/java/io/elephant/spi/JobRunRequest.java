package io.elephant.spi;

import java.time.Duration;
import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobRunRequest.class)
@JsonDeserialize(as = ImmutableJobRunRequest.class)
public interface JobRunRequest
{
    int getJobId();

    String getDatabaseName();

    String getPrincipalName();

    String getCommand();

    /**
     * Upper bound of the run time. The runner enforces it; the scheduler only passes it through.
     */
    Duration getTimeout();

    /**
     * The minute this run was scheduled for.
     */
    Instant getScheduledTime();

    static ImmutableJobRunRequest.Builder builder()
    {
        return ImmutableJobRunRequest.builder();
    }
}
