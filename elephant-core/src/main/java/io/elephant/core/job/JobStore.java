package io.elephant.core.job;

import java.time.Instant;
import java.util.List;
import io.elephant.core.repository.ResourceConflictException;
import io.elephant.core.repository.ResourceNotFoundException;

/**
 * Persistence of jobs. Methods must be called inside
 * {@link io.elephant.core.database.TransactionManager#begin} or
 * {@link io.elephant.core.database.TransactionManager#autoCommit}.
 */
public interface JobStore
{
    StoredJob insertJob(Job job, Instant now)
        throws ResourceConflictException;

    StoredJob getJobById(int jobId)
        throws ResourceNotFoundException;

    // locks the row until the current transaction ends
    StoredJob lockJobById(int jobId)
        throws ResourceNotFoundException;

    List<StoredJob> getJobs();

    StoredJob updateJob(int jobId, Job job, Instant now)
        throws ResourceNotFoundException, ResourceConflictException;

    StoredJob deleteJob(int jobId)
        throws ResourceNotFoundException;

    /**
     * Returns enabled jobs whose schedule fires at the minute of the given instant.
     */
    List<StoredJob> getJobsScheduledAt(Instant instant);

    /**
     * Increments the active run count of a job if it is parallel or has no active
     * runs, and sets last_executed. A claim of a non-parallel job that has not been
     * released by its expiresAt is taken over by the next claim.
     *
     * Returns false if the job is busy or deleted.
     */
    boolean tryClaim(int jobId, Instant startedAt, Instant expiresAt);

    // does nothing if the claim made at claimedAt was taken over
    void releaseClaim(int jobId, Instant claimedAt);

    // resets failure_count and increments success_count
    void recordSuccess(int jobId);

    void recordFailure(int jobId);
}
