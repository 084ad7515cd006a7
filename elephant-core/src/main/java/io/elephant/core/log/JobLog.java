package io.elephant.core.log;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.elephant.spi.ErrorState;
import org.immutables.value.Value;

/**
 * Outcome of one run of a job.
 *
 * Principal and database names are copied from the job so that the log stays
 * readable after the job is changed or deleted. There is no reference to the
 * job row.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableJobLog.class)
@JsonDeserialize(as = ImmutableJobLog.class)
public abstract class JobLog
{
    public abstract int getJobId();

    public abstract String getPrincipalName();

    public abstract String getDatabaseName();

    public abstract Instant getStartedAt();

    public abstract Instant getFinishedAt();

    public abstract String getCommand();

    // absent on success
    public abstract Optional<ErrorState> getError();
}
