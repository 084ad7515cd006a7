package io.elephant.core.job;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.elephant.core.database.LocalLockMap;
import io.elephant.core.database.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a run of a job may start now.
 *
 * A non-parallel job has at most one run in flight. The claim is a conditional
 * update of jobs.active_runs so that it holds across processes sharing the
 * database. Within a process, the claim update of a job is serialized with
 * {@link LocalLockMap}.
 *
 * A claim of a non-parallel job expires when the timeout of the job has passed
 * since the claim. An expired claim that was never released, for example because
 * the process died during the run, is taken over by the next admission.
 */
public class JobAdmissionController
{
    private static final Logger logger = LoggerFactory.getLogger(JobAdmissionController.class);

    private final TransactionManager tm;
    private final JobStore jobStore;
    private final LocalLockMap lockMap = new LocalLockMap();

    @Inject
    public JobAdmissionController(TransactionManager tm, JobStore jobStore)
    {
        this.tm = tm;
        this.jobStore = jobStore;
    }

    public Optional<JobClaim> tryAdmit(StoredJob job, Instant startedAt)
    {
        int jobId = job.getId();
        if (job.getParallel()) {
            return claim(job, startedAt);
        }

        boolean locked;
        try {
            locked = lockMap.tryLock(jobId, 0);
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while admitting job id={}", jobId);
            return Optional.absent();
        }
        if (!locked) {
            logger.debug("Job id={} is being admitted by another thread", jobId);
            return Optional.absent();
        }
        try {
            return claim(job, startedAt);
        }
        finally {
            lockMap.unlock(jobId);
        }
    }

    private Optional<JobClaim> claim(StoredJob job, Instant startedAt)
    {
        // release matches the claim by last_executed. Keep the precision the database stores.
        Instant claimedAt = startedAt.truncatedTo(ChronoUnit.MILLIS);
        Instant expiresAt = claimedAt.plus(job.getTimeout());
        boolean claimed = tm.autoCommit(() -> jobStore.tryClaim(job.getId(), claimedAt, expiresAt));
        if (!claimed) {
            logger.debug("Job id={} is already running or was deleted. Skipping", job.getId());
            return Optional.absent();
        }
        return Optional.of(JobClaim.of(job.getId(), job.getParallel(), claimedAt));
    }

    public void release(JobClaim claim)
    {
        tm.autoCommit(() -> {
            jobStore.releaseClaim(claim.getJobId(), claim.getClaimedAt());
            return null;
        });
    }
}
