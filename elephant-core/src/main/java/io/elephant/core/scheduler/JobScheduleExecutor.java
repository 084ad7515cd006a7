package io.elephant.core.scheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.elephant.core.database.TransactionManager;
import io.elephant.core.job.JobAdmissionController;
import io.elephant.core.job.JobClaim;
import io.elephant.core.job.JobStore;
import io.elephant.core.job.StoredJob;
import io.elephant.core.log.ErrorStates;
import io.elephant.core.log.ImmutableJobLog;
import io.elephant.core.log.JobLog;
import io.elephant.core.log.JobLogStore;
import io.elephant.spi.JobRunRequest;
import io.elephant.spi.JobRunResult;
import io.elephant.spi.JobRunner;
import io.elephant.spi.RunRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires due jobs once per UTC minute.
 *
 * A single daemon thread polls the clock. When a new minute is reached, the
 * jobs scheduled at the minute are admitted and handed to a pool of worker
 * threads. A run is recorded in job_logs and the counters of the job when it
 * finishes.
 */
public class JobScheduleExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(JobScheduleExecutor.class);

    private final TransactionManager tm;
    private final JobStore jobStore;
    private final JobLogStore jobLogStore;
    private final JobAdmissionController admission;
    private final JobRunner runner;
    private final RunRecorder recorder;
    private final ScheduleConfig scheduleConfig;
    private final Clock clock;

    private ScheduledExecutorService executor;
    private ExecutorService workers;

    // guarded by this
    private Instant lastEvaluatedMinute;

    @Inject
    public JobScheduleExecutor(
            TransactionManager tm,
            JobStore jobStore,
            JobLogStore jobLogStore,
            JobAdmissionController admission,
            JobRunner runner,
            RunRecorder recorder,
            ScheduleConfig scheduleConfig,
            Clock clock)
    {
        this.tm = tm;
        this.jobStore = jobStore;
        this.jobLogStore = jobLogStore;
        this.admission = admission;
        this.runner = runner;
        this.recorder = recorder;
        this.scheduleConfig = scheduleConfig;
        this.clock = clock;
    }

    @VisibleForTesting
    synchronized boolean isStarted()
    {
        return executor != null;
    }

    public synchronized void start()
    {
        if (scheduleConfig.getEnabled()) {
            if (executor == null) {
                workers = Executors.newFixedThreadPool(scheduleConfig.getMaxWorkers(),
                        new ThreadFactoryBuilder()
                        .setDaemon(true)
                        .setNameFormat("job-runner-%d")
                        .build()
                        );
                executor = Executors.newScheduledThreadPool(1,
                        new ThreadFactoryBuilder()
                        .setDaemon(true)
                        .setNameFormat("scheduler-%d")
                        .build()
                        );
                executor.scheduleWithFixedDelay(() -> runSchedules(),
                        1, scheduleConfig.getPollInterval(), TimeUnit.SECONDS);
                logger.info("Started scheduler with {} workers polling every {} seconds",
                        scheduleConfig.getMaxWorkers(), scheduleConfig.getPollInterval());
            }
        }
        else {
            logger.debug("Scheduler is disabled.");
        }
    }

    public synchronized void shutdown()
    {
        if (executor != null) {
            executor.shutdown();
            executor = null;
        }
        if (workers != null) {
            // running jobs are not interrupted. They finish and record their results.
            workers.shutdown();
            workers = null;
        }
    }

    private void runSchedules()
    {
        try {
            runSchedulesUntil(clock.instant().truncatedTo(ChronoUnit.MINUTES));
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Scheduling will be retried.", t);
        }
    }

    /**
     * Evaluates the minutes that are not evaluated yet up to currentMinute in order.
     *
     * A minute is marked as evaluated only after its jobs are admitted. If a minute
     * fails, it and the following minutes are evaluated again at the next poll.
     */
    @VisibleForTesting
    void runSchedulesUntil(Instant currentMinute)
    {
        for (Instant minute : nextMinutes(currentMinute)) {
            runScheduleOnce(minute);
            markEvaluated(minute);
        }
    }

    /**
     * Returns minutes that are not evaluated yet up to currentMinute.
     */
    @VisibleForTesting
    synchronized List<Instant> nextMinutes(Instant currentMinute)
    {
        if (lastEvaluatedMinute == null) {
            return ImmutableList.of(currentMinute);
        }
        if (!currentMinute.isAfter(lastEvaluatedMinute)) {
            return ImmutableList.of();
        }

        Instant first = lastEvaluatedMinute.plus(1, ChronoUnit.MINUTES);
        Instant earliest = currentMinute.minus(scheduleConfig.getMaxCatchUpMinutes(), ChronoUnit.MINUTES);
        if (first.isBefore(earliest)) {
            logger.warn("Scheduler was paused. Skipping minutes from {} to {}",
                    first, earliest.minus(1, ChronoUnit.MINUTES));
            first = earliest;
        }

        ImmutableList.Builder<Instant> minutes = ImmutableList.builder();
        for (Instant minute = first; !minute.isAfter(currentMinute); minute = minute.plus(1, ChronoUnit.MINUTES)) {
            minutes.add(minute);
        }
        return minutes.build();
    }

    @VisibleForTesting
    synchronized void markEvaluated(Instant minute)
    {
        if (lastEvaluatedMinute == null || minute.isAfter(lastEvaluatedMinute)) {
            lastEvaluatedMinute = minute;
        }
    }

    /**
     * Admits the jobs scheduled at the minute and submits their runs.
     *
     * Runs are executed on the calling thread if the executor is not started.
     *
     * @return number of submitted runs
     */
    @VisibleForTesting
    int runScheduleOnce(Instant minute)
    {
        List<StoredJob> dueJobs = tm.autoCommit(() -> jobStore.getJobsScheduledAt(minute));
        logger.debug("{} jobs are scheduled at {}", dueJobs.size(), minute);

        Executor target = workerExecutor();
        int count = 0;
        for (StoredJob job : dueJobs) {
            Optional<JobClaim> claim = admission.tryAdmit(job, clock.instant());
            if (!claim.isPresent()) {
                continue;
            }
            try {
                target.execute(() -> runJob(job, claim.get(), minute));
                count++;
            }
            catch (RejectedExecutionException ex) {
                logger.warn("Scheduler is shutting down. Job id={} scheduled at {} is not started", job.getId(), minute);
                admission.release(claim.get());
            }
        }
        return count;
    }

    private synchronized Executor workerExecutor()
    {
        if (workers != null) {
            return workers;
        }
        return MoreExecutors.directExecutor();
    }

    @VisibleForTesting
    void runJob(StoredJob job, JobClaim claim, Instant scheduledTime)
    {
        try {
            runClaimedJob(job, claim, scheduledTime);
        }
        catch (RuntimeException ex) {
            logger.error("Failed to record a run of job id={} scheduled at {}", job.getId(), scheduledTime, ex);
        }
        finally {
            releaseClaim(claim);
        }
    }

    private void releaseClaim(JobClaim claim)
    {
        try {
            admission.release(claim);
        }
        catch (RuntimeException ex) {
            // the claim expires after the timeout of the job
            logger.error("Failed to release a claim of job id={} started at {}",
                    claim.getJobId(), claim.getClaimedAt(), ex);
        }
    }

    private void runClaimedJob(StoredJob job, JobClaim claim, Instant scheduledTime)
    {
        JobRunRequest request = JobRunRequest.builder()
            .jobId(job.getId())
            .databaseName(job.getDatabaseName())
            .principalName(job.getPrincipalName())
            .command(job.getCommand())
            .timeout(job.getTimeout())
            .scheduledTime(scheduledTime)
            .build();
        Instant startedAt = claim.getClaimedAt();

        JobRunResult result;
        try {
            recorder.runStarted(request, startedAt);
            result = runner.run(request);
        }
        catch (Throwable ex) {
            logger.warn("Job id={} failed with an exception", job.getId(), ex);
            result = JobRunResult.failure(ErrorStates.internalError(ex));
        }
        Instant finishedAt = clock.instant();

        JobLog log = ImmutableJobLog.builder()
            .jobId(job.getId())
            .principalName(job.getPrincipalName())
            .databaseName(job.getDatabaseName())
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .command(job.getCommand())
            .error(result.getError())
            .build();
        boolean success = result.isSuccess();
        tm.autoCommit(() -> {
            jobLogStore.addJobLog(log);
            if (success) {
                jobStore.recordSuccess(job.getId());
            }
            else {
                jobStore.recordFailure(job.getId());
            }
            return null;
        });

        recorder.runFinished(request, startedAt, finishedAt, result);
    }
}
