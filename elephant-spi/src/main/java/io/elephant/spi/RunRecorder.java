package io.elephant.spi;

import java.time.Instant;

/**
 * Receives start and finish events of scheduled runs.
 *
 * Events of different runs may arrive concurrently and in any order.
 */
public interface RunRecorder
{
    void runStarted(JobRunRequest request, Instant startedAt);

    void runFinished(JobRunRequest request, Instant startedAt, Instant finishedAt, JobRunResult result);
}
