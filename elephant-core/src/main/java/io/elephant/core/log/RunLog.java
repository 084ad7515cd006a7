package io.elephant.core.log;

import java.time.Instant;
import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.elephant.spi.ErrorState;
import org.immutables.value.Value;

/**
 * Audit record of one call of a job-management operation.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRunLog.class)
@JsonDeserialize(as = ImmutableRunLog.class)
public abstract class RunLog
{
    // nulled when the job is deleted
    public abstract Optional<Integer> getJobId();

    public abstract String getActorName();

    public abstract String getFunctionSignature();

    public abstract List<String> getArguments();

    public abstract Instant getStartedAt();

    public abstract Instant getFinishedAt();

    public abstract Optional<Long> getRowsReturned();

    public abstract Optional<ErrorState> getError();
}
