package io.elephant.spi;

/**
 * Executes the command of a job against its target database.
 *
 * Implementations block until the command finishes or its timeout expires.
 * A failure of the command is returned as {@link JobRunResult#failure(ErrorState)};
 * a RuntimeException is treated the same way by the caller.
 */
public interface JobRunner
{
    JobRunResult run(JobRunRequest request);
}
