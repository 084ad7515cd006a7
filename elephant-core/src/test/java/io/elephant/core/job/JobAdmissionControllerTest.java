package io.elephant.core.job;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import com.google.common.base.Optional;
import io.elephant.core.database.DatabaseFactory;
import io.elephant.core.database.DatabaseJobStore;
import io.elephant.core.schedule.CronScheduleParser;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.elephant.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class JobAdmissionControllerTest
{
    private static final Instant NOW = Instant.parse("2030-03-01T10:15:00Z");

    private DatabaseFactory factory;
    private DatabaseJobStore store;
    private JobAdmissionController admission;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        store = factory.getJobStore();
        admission = new JobAdmissionController(factory.get(), store);
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    private StoredJob insertJob(String command, boolean parallel)
            throws Exception
    {
        return insertJob(command, parallel, JobRequest.DEFAULT_TIMEOUT);
    }

    private StoredJob insertJob(String command, boolean parallel, Duration timeout)
            throws Exception
    {
        Job job = Job.builder()
            .databaseName("postgres")
            .principalName("alice")
            .schedule(new CronScheduleParser().parse("* * * * *"))
            .enabled(true)
            .parallel(parallel)
            .command(command)
            .timeout(timeout)
            .build();
        return factory.begin(() -> store.insertJob(job, NOW));
    }

    private int activeRuns(StoredJob job)
            throws Exception
    {
        return factory.autoCommit(() -> store.getJobById(job.getId())).getActiveRuns();
    }

    @Test
    public void exclusiveJobIsAdmittedOnce()
            throws Exception
    {
        StoredJob job = insertJob("select 1", false);

        Optional<JobClaim> claim = admission.tryAdmit(job, NOW);
        assertThat(claim.isPresent(), is(true));
        assertThat(claim.get().getJobId(), is(job.getId()));
        assertThat(claim.get().getClaimedAt(), is(NOW));
        assertThat(activeRuns(job), is(1));

        assertThat(admission.tryAdmit(job, NOW.plusSeconds(60)).isPresent(), is(false));
        assertThat(activeRuns(job), is(1));

        admission.release(claim.get());
        assertThat(activeRuns(job), is(0));

        Optional<JobClaim> next = admission.tryAdmit(job, NOW.plusSeconds(60));
        assertThat(next.isPresent(), is(true));
        admission.release(next.get());
    }

    @Test
    public void parallelJobIsAdmittedRepeatedly()
            throws Exception
    {
        StoredJob job = insertJob("select 1", true);

        Optional<JobClaim> first = admission.tryAdmit(job, NOW);
        Optional<JobClaim> second = admission.tryAdmit(job, NOW);
        assertThat(first.isPresent(), is(true));
        assertThat(second.isPresent(), is(true));
        assertThat(second.get().getParallel(), is(true));
        assertThat(activeRuns(job), is(2));

        admission.release(first.get());
        admission.release(second.get());
        assertThat(activeRuns(job), is(0));

        // release never goes below zero
        admission.release(first.get());
        assertThat(activeRuns(job), is(0));
    }

    @Test
    public void deletedJobIsNotAdmitted()
            throws Exception
    {
        StoredJob job = insertJob("select 1", false);
        factory.begin(() -> store.deleteJob(job.getId()));

        assertThat(admission.tryAdmit(job, NOW).isPresent(), is(false));
    }

    @Test
    public void concurrentAdmissionsOfExclusiveJob()
            throws Exception
    {
        StoredJob job = insertJob("select 1", false);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch ready = new CountDownLatch(1);
            List<Future<Optional<JobClaim>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Optional<JobClaim>> task = () -> {
                    ready.await();
                    return admission.tryAdmit(job, NOW);
                };
                futures.add(executor.submit(task));
            }
            ready.countDown();

            int admitted = 0;
            for (Future<Optional<JobClaim>> future : futures) {
                if (future.get().isPresent()) {
                    admitted++;
                }
            }
            assertThat(admitted, is(1));
            assertThat(activeRuns(job), is(1));
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void concurrentAdmissionsOfParallelJob()
            throws Exception
    {
        StoredJob job = insertJob("select 1", true);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch ready = new CountDownLatch(1);
            List<Future<Optional<JobClaim>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Optional<JobClaim>> task = () -> {
                    ready.await();
                    return admission.tryAdmit(job, NOW);
                };
                futures.add(executor.submit(task));
            }
            ready.countDown();

            List<JobClaim> claims = new ArrayList<>();
            for (Future<Optional<JobClaim>> future : futures) {
                claims.add(future.get().get());
            }
            assertThat(activeRuns(job), is(threads));

            for (JobClaim claim : claims) {
                admission.release(claim);
            }
            assertThat(activeRuns(job), is(0));
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void expiredClaimIsTakenOver()
            throws Exception
    {
        StoredJob job = insertJob("select 1", false, Duration.ofMinutes(5));

        Optional<JobClaim> lost = admission.tryAdmit(job, NOW);
        assertThat(lost.isPresent(), is(true));

        assertThat(admission.tryAdmit(job, NOW.plusSeconds(299)).isPresent(), is(false));

        Optional<JobClaim> next = admission.tryAdmit(job, NOW.plusSeconds(301));
        assertThat(next.isPresent(), is(true));
        assertThat(activeRuns(job), is(1));

        // the lost run finishing late doesn't release the new claim
        admission.release(lost.get());
        assertThat(activeRuns(job), is(1));
        assertThat(admission.tryAdmit(job, NOW.plusSeconds(360)).isPresent(), is(false));

        admission.release(next.get());
        assertThat(activeRuns(job), is(0));
    }

    @Test
    public void claimTimeIsTruncatedToMillis()
            throws Exception
    {
        StoredJob job = insertJob("select 1", false);
        Instant startedAt = NOW.plusNanos(123456789);

        Optional<JobClaim> claim = admission.tryAdmit(job, startedAt);
        assertThat(claim.get().getClaimedAt(), is(NOW.plusMillis(123)));

        admission.release(claim.get());
        assertThat(activeRuns(job), is(0));
    }
}
