package io.elephant.core.database;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import io.elephant.core.job.ImmutableJob;
import io.elephant.core.job.Job;
import io.elephant.core.job.StoredJob;
import io.elephant.core.repository.ResourceConflictException;
import io.elephant.core.repository.ResourceNotFoundException;
import io.elephant.core.schedule.CronScheduleParser;
import io.elephant.core.schedule.Schedule;
import io.elephant.core.schedule.ScheduleMatcher;
import io.elephant.core.schedule.ScheduleParser;
import io.elephant.core.schedule.TimestampScheduleParser;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.elephant.core.database.DatabaseTestingUtils.assertConflict;
import static io.elephant.core.database.DatabaseTestingUtils.assertNotFound;
import static io.elephant.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DatabaseJobStoreTest
{
    private static final Instant NOW = Instant.parse("2030-03-01T10:15:00Z");

    private final ScheduleParser scheduleParser = new ScheduleParser(new CronScheduleParser(), new TimestampScheduleParser());
    private final ScheduleMatcher matcher = new ScheduleMatcher();

    private DatabaseFactory factory;
    private DatabaseJobStore store;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        store = factory.getJobStore();
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    @Test
    public void insertAndGet()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", "5,35 */6 * * *"), NOW));

        StoredJob got = factory.autoCommit(() -> store.getJobById(stored.getId()));
        assertThat(got, is(stored));
        assertThat(got.getDatabaseName(), is("postgres"));
        assertThat(got.getPrincipalName(), is("alice"));
        assertThat(got.getSchedule(), is(Optional.of("5,35 */6 * * *")));
        assertThat(got.getEnabled(), is(true));
        assertThat(got.getParallel(), is(false));
        assertThat(got.getFailureCount(), is(0));
        assertThat(got.getSuccessCount(), is(0));
        assertThat(got.getActiveRuns(), is(0));
        assertThat(got.getTimeout(), is(Duration.ofHours(6)));
        assertThat(got.getLastExecuted(), is(Optional.absent()));
        assertThat(got.getCreatedAt(), is(NOW));
        assertThat(got.getUpdatedAt(), is(NOW));

        assertThat(factory.autoCommit(() -> store.getJobs()), contains(stored));
    }

    @Test
    public void jobWithoutSchedule()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", null), NOW));
        assertThat(stored.getSchedule(), is(Optional.absent()));
    }

    @Test
    public void duplicatedDefinitionConflicts()
            throws Exception
    {
        factory.begin(() -> store.insertJob(job("select 1", "@daily"), NOW));

        assertConflict(() -> factory.get().begin(() -> store.insertJob(job("select 1", "@daily"), NOW),
                    ResourceConflictException.class));

        // different schedule text, command or principal makes a different job
        factory.begin(() -> store.insertJob(job("select 1", "0 0 * * *"), NOW));
        factory.begin(() -> store.insertJob(job("select 2", "@daily"), NOW));
        factory.begin(() -> store.insertJob(jobBuilder("select 1", "@daily").principalName("bob").build(), NOW));
        factory.begin(() -> store.insertJob(job("select 1", null), NOW));

        assertThat(factory.autoCommit(() -> store.getJobs()).size(), is(5));
    }

    @Test
    public void getMissingJob()
            throws Exception
    {
        assertNotFound(() -> factory.get().autoCommit(() -> store.getJobById(999), ResourceNotFoundException.class));
        assertNotFound(() -> factory.get().begin(() -> store.deleteJob(999), ResourceNotFoundException.class));
    }

    @Test
    public void updateRewritesScheduleIndex()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", "15 10 * * *"), NOW));
        assertThat(ids(NOW), contains(stored.getId()));

        Instant later = NOW.plus(1, ChronoUnit.HOURS);
        StoredJob updated = factory.begin(() -> store.updateJob(stored.getId(), job("select 1", "30 11 * * *"), later));
        assertThat(updated.getSchedule(), is(Optional.of("30 11 * * *")));
        assertThat(updated.getCreatedAt(), is(NOW));
        assertThat(updated.getUpdatedAt(), is(later));

        assertThat(ids(NOW), is(empty()));
        assertThat(ids(Instant.parse("2030-03-01T11:30:00Z")), contains(stored.getId()));

        // crontab to timestamps
        factory.begin(() -> store.updateJob(stored.getId(), job("select 1", "{\"2030-03-05 00:00+00\"}"), later));
        assertThat(ids(Instant.parse("2030-03-01T11:30:00Z")), is(empty()));
        assertThat(ids(Instant.parse("2030-03-05T00:00:00Z")), contains(stored.getId()));
    }

    @Test
    public void updateToDuplicateConflicts()
            throws Exception
    {
        factory.begin(() -> store.insertJob(job("select 1", "@daily"), NOW));
        StoredJob other = factory.begin(() -> store.insertJob(job("select 2", "@daily"), NOW));

        assertConflict(() -> factory.get().<StoredJob, ResourceNotFoundException, ResourceConflictException>begin(() -> store.updateJob(other.getId(), job("select 1", "@daily"), NOW),
                    ResourceNotFoundException.class,
                    ResourceConflictException.class));
    }

    @Test
    public void deleteRemovesJobAndIndex()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", "* * * * *"), NOW));
        assertThat(ids(NOW), contains(stored.getId()));

        StoredJob deleted = factory.begin(() -> store.deleteJob(stored.getId()));
        assertThat(deleted.getId(), is(stored.getId()));

        assertThat(ids(NOW), is(empty()));
        assertNotFound(() -> factory.get().autoCommit(() -> store.getJobById(stored.getId()), ResourceNotFoundException.class));
        long indexRows = factory.autoCommit(() ->
                factory.get().getHandle().createQuery("select count(*) from job_schedule_fields").mapTo(Long.class).one());
        assertThat(indexRows, is(0L));
    }

    @Test
    public void dueQueryAgreesWithMatcher()
            throws Exception
    {
        String[] schedules = {
            "* * * * *",
            "15 10 * * *",
            "*/20 * * * *",
            "0 0 1 * *",
            "0 0 * * 5",
            "15 10 2 * 5",
            "0-30/15 9-11 * 3 1-5",
            "@hourly",
            "@weekly",
            "0 0 * * 7",
            "{\"2030-03-01 10:15+00\",\"2030-03-02 00:00+00\"}",
            "2030-03-03 23:45 +00",
        };
        List<Schedule> parsed = new ArrayList<>();
        List<StoredJob> jobs = new ArrayList<>();
        for (String text : schedules) {
            Job job = job("select '" + text + "'", text);
            parsed.add(job.getSchedule().get());
            jobs.add(factory.begin(() -> store.insertJob(job, NOW)));
        }
        // disabled jobs never match
        factory.begin(() -> store.insertJob(jobBuilder("select 'disabled'", "* * * * *").enabled(false).build(), NOW));

        List<Instant> instants = new ArrayList<>();
        Instant start = Instant.parse("2030-02-28T23:45:00Z");
        for (int i = 0; i < 96; i++) {
            instants.add(start.plus(i * 53L, ChronoUnit.MINUTES));
        }
        instants.add(Instant.parse("2030-03-01T10:15:00Z"));
        instants.add(Instant.parse("2030-03-02T00:00:00Z"));
        instants.add(Instant.parse("2030-03-03T23:45:00Z"));
        instants.add(Instant.parse("2030-03-08T00:00:00Z"));
        instants.add(Instant.parse("2030-04-01T00:00:00Z"));

        for (Instant instant : instants) {
            ImmutableSet.Builder<Integer> expected = ImmutableSet.builder();
            for (int i = 0; i < jobs.size(); i++) {
                if (matcher.matches(parsed.get(i), instant)) {
                    expected.add(jobs.get(i).getId());
                }
            }
            assertThat(instant.toString(), ImmutableSet.copyOf(ids(instant)), is(expected.build()));
        }
    }

    @Test
    public void claimNonParallelJob()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", "@daily"), NOW));
        int id = stored.getId();

        assertTrue(factory.autoCommit(() -> store.tryClaim(id, NOW, NOW.plusSeconds(3600))));
        assertFalse(factory.autoCommit(() -> store.tryClaim(id, NOW.plusSeconds(60), NOW.plusSeconds(3660))));

        StoredJob claimed = factory.autoCommit(() -> store.getJobById(id));
        assertThat(claimed.getActiveRuns(), is(1));
        assertThat(claimed.getLastExecuted(), is(Optional.of(NOW)));

        factory.autoCommit(() -> {
            store.releaseClaim(id, NOW);
            return null;
        });
        assertTrue(factory.autoCommit(() -> store.tryClaim(id, NOW.plusSeconds(120), NOW.plusSeconds(3720))));
    }

    @Test
    public void claimParallelJob()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(jobBuilder("select 1", "@daily").parallel(true).build(), NOW));
        int id = stored.getId();

        assertTrue(factory.autoCommit(() -> store.tryClaim(id, NOW, NOW.plusSeconds(3600))));
        assertTrue(factory.autoCommit(() -> store.tryClaim(id, NOW, NOW.plusSeconds(3600))));
        assertThat(factory.autoCommit(() -> store.getJobById(id)).getActiveRuns(), is(2));
    }

    @Test
    public void releaseNeverGoesNegative()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", "@daily"), NOW));
        factory.autoCommit(() -> {
            store.releaseClaim(stored.getId(), NOW);
            return null;
        });
        assertThat(factory.autoCommit(() -> store.getJobById(stored.getId())).getActiveRuns(), is(0));
    }

    @Test
    public void expiredClaimIsTakenOver()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", "@daily"), NOW));
        int id = stored.getId();

        assertTrue(factory.autoCommit(() -> store.tryClaim(id, NOW, NOW.plusSeconds(600))));
        assertFalse(factory.autoCommit(() -> store.tryClaim(id, NOW.plusSeconds(600), NOW.plusSeconds(1200))));

        // the first run never released its claim
        Instant later = NOW.plusSeconds(601);
        assertTrue(factory.autoCommit(() -> store.tryClaim(id, later, later.plusSeconds(600))));
        StoredJob claimed = factory.autoCommit(() -> store.getJobById(id));
        assertThat(claimed.getActiveRuns(), is(1));
        assertThat(claimed.getLastExecuted(), is(Optional.of(later)));

        // a late release of the first run doesn't free the second
        factory.autoCommit(() -> {
            store.releaseClaim(id, NOW);
            return null;
        });
        assertThat(factory.autoCommit(() -> store.getJobById(id)).getActiveRuns(), is(1));

        factory.autoCommit(() -> {
            store.releaseClaim(id, later);
            return null;
        });
        assertThat(factory.autoCommit(() -> store.getJobById(id)).getActiveRuns(), is(0));
    }

    @Test
    public void claimDeletedJob()
            throws Exception
    {
        assertFalse(factory.autoCommit(() -> store.tryClaim(12345, NOW, NOW.plusSeconds(3600))));
    }

    @Test
    public void successResetsFailureCount()
            throws Exception
    {
        StoredJob stored = factory.begin(() -> store.insertJob(job("select 1", "@daily"), NOW));
        int id = stored.getId();

        factory.autoCommit(() -> {
            store.recordFailure(id);
            store.recordFailure(id);
            return null;
        });
        StoredJob failed = factory.autoCommit(() -> store.getJobById(id));
        assertThat(failed.getFailureCount(), is(2));
        assertThat(failed.getSuccessCount(), is(0));

        factory.autoCommit(() -> {
            store.recordSuccess(id);
            return null;
        });
        StoredJob succeeded = factory.autoCommit(() -> store.getJobById(id));
        assertThat(succeeded.getFailureCount(), is(0));
        assertThat(succeeded.getSuccessCount(), is(1));
    }

    private List<Integer> ids(Instant instant)
            throws Exception
    {
        return factory.autoCommit(() -> store.getJobsScheduledAt(instant)).stream()
            .map(StoredJob::getId)
            .collect(Collectors.toList());
    }

    private Job job(String command, String schedule)
    {
        return jobBuilder(command, schedule).build();
    }

    private ImmutableJob.Builder jobBuilder(String command, String schedule)
    {
        Optional<Schedule> parsed = schedule == null
            ? Optional.absent()
            : Optional.of(scheduleParser.parse(schedule));
        return Job.builder()
            .databaseName("postgres")
            .principalName("alice")
            .schedule(parsed)
            .enabled(true)
            .parallel(false)
            .command(command)
            .timeout(Duration.ofHours(6));
    }
}
