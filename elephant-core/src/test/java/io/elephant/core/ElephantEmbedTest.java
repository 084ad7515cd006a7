package io.elephant.core;

import java.time.Instant;
import java.util.Properties;
import com.google.common.base.Optional;
import io.elephant.core.job.JobManager;
import io.elephant.core.job.JobRequest;
import io.elephant.core.job.StoredJob;
import io.elephant.core.scheduler.ScheduleConfig;
import io.elephant.spi.JobRunRequest;
import io.elephant.spi.JobRunResult;
import io.elephant.spi.JobRunner;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class ElephantEmbedTest
{
    private static Properties systemProperties()
    {
        Properties props = new Properties();
        props.setProperty("database.type", "memory");
        props.setProperty("principal.etl.members", "alice");
        props.setProperty("schedule.max_workers", "2");
        return props;
    }

    @Test
    public void initializeAndManageJobs()
            throws Exception
    {
        try (ElephantEmbed embed = new ElephantEmbed.Bootstrap()
                .setSystemProperties(systemProperties())
                .withScheduleExecutor(false)
                .initialize()) {
            JobManager manager = embed.getJobManager();
            StoredJob job = manager.insertJob("alice", JobRequest.builder()
                    .databaseName("postgres")
                    .principalName("etl")
                    .command("vacuum analyze")
                    .schedule("@hourly")
                    .build());

            assertThat(job.getSchedule(), is(Optional.of("0 * * * *")));
            assertThat(manager.getJob("alice", job.getId()).getCommand(), is("vacuum analyze"));
            assertThat(manager.listJobs("alice").get(0).getId(), is(job.getId()));
            assertThat(manager.listJobs("bob"), is(empty()));
            assertThat(embed.getInjector().getInstance(ScheduleConfig.class).getMaxWorkers(), is(2));
        }
    }

    @Test
    public void overrideJobRunner()
    {
        JobRunner runner = request -> JobRunResult.success();
        try (ElephantEmbed embed = new ElephantEmbed.Bootstrap()
                .setSystemProperties(systemProperties())
                .overrideModulesWith(binder -> binder.bind(JobRunner.class).toInstance(runner))
                .initialize()) {
            assertThat(embed.getInjector().getInstance(JobRunner.class), is(runner));
        }
    }

    @Test
    public void defaultJobRunnerFails()
    {
        try (ElephantEmbed embed = new ElephantEmbed.Bootstrap()
                .setSystemProperties(systemProperties())
                .withScheduleExecutor(false)
                .initialize()) {
            JobRunner runner = embed.getInjector().getInstance(JobRunner.class);
            JobRunResult result = runner.run(JobRunRequest.builder()
                    .jobId(1)
                    .databaseName("postgres")
                    .principalName("alice")
                    .command("select 1")
                    .timeout(JobRequest.DEFAULT_TIMEOUT)
                    .scheduledTime(Instant.parse("2030-03-01T00:00:00Z"))
                    .build());
            assertThat(result.isSuccess(), is(false));
            assertThat(result.getError().get().getCode(), is("0A000"));
        }
    }
}
