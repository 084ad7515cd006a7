package io.elephant.core.scheduler;

import com.google.common.base.Optional;
import io.elephant.core.log.ErrorStates;
import io.elephant.spi.ErrorState;
import io.elephant.spi.JobRunRequest;
import io.elephant.spi.JobRunResult;
import io.elephant.spi.JobRunner;

/**
 * JobRunner bound until an application overrides it. Every run fails.
 */
public class UnconfiguredJobRunner
        implements JobRunner
{
    @Override
    public JobRunResult run(JobRunRequest request)
    {
        return JobRunResult.failure(ErrorState.of(
                    ErrorStates.FEATURE_NOT_SUPPORTED,
                    "No job runner is configured",
                    Optional.of("job id=" + request.getJobId()),
                    Optional.of("Bind an implementation of io.elephant.spi.JobRunner")));
    }
}
