package io.elephant.core.log;

import java.time.Duration;
import java.time.Instant;
import io.elephant.spi.ErrorState;
import io.elephant.spi.JobRunRequest;
import io.elephant.spi.JobRunResult;
import io.elephant.spi.RunRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Slf4jRunRecorder
        implements RunRecorder
{
    private static final Logger logger = LoggerFactory.getLogger(Slf4jRunRecorder.class);

    @Override
    public void runStarted(JobRunRequest request, Instant startedAt)
    {
        logger.info("Starting job id={} as {} on {} scheduled at {}",
                request.getJobId(), request.getPrincipalName(), request.getDatabaseName(), request.getScheduledTime());
    }

    @Override
    public void runFinished(JobRunRequest request, Instant startedAt, Instant finishedAt, JobRunResult result)
    {
        long millis = Duration.between(startedAt, finishedAt).toMillis();
        if (result.isSuccess()) {
            logger.info("Job id={} finished in {} ms", request.getJobId(), millis);
        }
        else {
            ErrorState error = result.getError().get();
            logger.warn("Job id={} failed in {} ms with {}: {}",
                    request.getJobId(), millis, error.getCode(), error.getMessage());
        }
    }
}
