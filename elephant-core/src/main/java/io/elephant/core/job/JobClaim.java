package io.elephant.core.job;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * Admission of one run of a job. Held until the run finishes and is released
 * through {@link JobAdmissionController#release(JobClaim)}.
 */
@Value.Immutable
public interface JobClaim
{
    int getJobId();

    boolean getParallel();

    Instant getClaimedAt();

    static JobClaim of(int jobId, boolean parallel, Instant claimedAt)
    {
        return ImmutableJobClaim.builder()
            .jobId(jobId)
            .parallel(parallel)
            .claimedAt(claimedAt)
            .build();
    }
}
