package io.elephant.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Optional;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.inject.Inject;
import io.elephant.core.job.Job;
import io.elephant.core.job.JobStore;
import io.elephant.core.job.StoredJob;
import io.elephant.core.repository.ResourceConflictException;
import io.elephant.core.repository.ResourceNotFoundException;
import io.elephant.core.schedule.CronFieldKind;
import io.elephant.core.schedule.CrontabSchedule;
import io.elephant.core.schedule.Schedule;
import io.elephant.core.schedule.TimestampSchedule;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import static java.nio.charset.StandardCharsets.UTF_8;

public class DatabaseJobStore
        extends BasicDatabaseStoreManager<DatabaseJobStore.Dao>
        implements JobStore
{
    @Inject
    public DatabaseJobStore(TransactionManager transactionManager, DatabaseConfig config)
    {
        super(config.getType(), Dao.class, transactionManager);
    }

    @Override
    public StoredJob insertJob(Job job, Instant now)
        throws ResourceConflictException
    {
        return transaction((handle, dao) -> {
            int jobId = catchConflict(() ->
                    dao.insertJob(
                        job.getDatabaseName(),
                        job.getPrincipalName(),
                        job.getScheduleText().orNull(),
                        definitionDigest(job),
                        job.getEnabled(),
                        job.getParallel(),
                        job.getCommand(),
                        job.getDescription().orNull(),
                        job.getTimeout().getSeconds(),
                        now),
                    "job database=%s principal=%s schedule=%s", job.getDatabaseName(), job.getPrincipalName(), job.getScheduleText().or(""));
            insertScheduleIndex(dao, jobId, job.getSchedule());
            return dao.getJobById(jobId);
        }, ResourceConflictException.class);
    }

    @Override
    public StoredJob getJobById(int jobId)
        throws ResourceNotFoundException
    {
        return requiredResource(
                (handle, dao) -> dao.getJobById(jobId),
                "job id=%d", jobId);
    }

    @Override
    public StoredJob lockJobById(int jobId)
        throws ResourceNotFoundException
    {
        // SELECT FOR UPDATE holds the row lock until the transaction ends
        StoredJob job = transaction((handle, dao) -> dao.lockJobById(jobId));
        return requiredResource(job, "job id=%d", jobId);
    }

    @Override
    public List<StoredJob> getJobs()
    {
        return autoCommit((handle, dao) -> dao.getJobs());
    }

    @Override
    public StoredJob updateJob(int jobId, Job job, Instant now)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return this.<StoredJob, ResourceNotFoundException, ResourceConflictException>transaction((handle, dao) -> {
            int n = catchConflict(() ->
                    dao.updateJob(
                        jobId,
                        job.getDatabaseName(),
                        job.getPrincipalName(),
                        job.getScheduleText().orNull(),
                        definitionDigest(job),
                        job.getEnabled(),
                        job.getParallel(),
                        job.getCommand(),
                        job.getDescription().orNull(),
                        job.getTimeout().getSeconds(),
                        now),
                    "job database=%s principal=%s schedule=%s", job.getDatabaseName(), job.getPrincipalName(), job.getScheduleText().or(""));
            if (n <= 0) {
                throw new ResourceNotFoundException("job id=" + jobId);
            }
            dao.deleteScheduleFields(jobId);
            dao.deleteScheduleTimestamps(jobId);
            insertScheduleIndex(dao, jobId, job.getSchedule());
            return dao.getJobById(jobId);
        }, ResourceNotFoundException.class, ResourceConflictException.class);
    }

    @Override
    public StoredJob deleteJob(int jobId)
        throws ResourceNotFoundException
    {
        return transaction((handle, dao) -> {
            StoredJob job = requiredResource(
                    dao.lockJobById(jobId),
                    "job id=%d", jobId);
            // schedule index rows are deleted by cascade. run_logs.job_id is set to null.
            dao.deleteJob(jobId);
            return job;
        }, ResourceNotFoundException.class);
    }

    @Override
    public List<StoredJob> getJobsScheduledAt(Instant instant)
    {
        ZonedDateTime time = instant.atZone(ZoneOffset.UTC);
        return autoCommit((handle, dao) ->
                dao.getJobsScheduledAt(
                    time.getMinute(),
                    time.getHour(),
                    time.getDayOfMonth(),
                    time.getMonthValue(),
                    time.getDayOfWeek().getValue() % 7,
                    TimestampSchedule.formatTimestamp(instant)));
    }

    @Override
    public boolean tryClaim(int jobId, Instant startedAt, Instant expiresAt)
    {
        return autoCommit((handle, dao) -> dao.claimJob(jobId, startedAt, expiresAt)) > 0;
    }

    @Override
    public void releaseClaim(int jobId, Instant claimedAt)
    {
        autoCommit((handle, dao) -> dao.releaseJob(jobId, claimedAt));
    }

    @Override
    public void recordSuccess(int jobId)
    {
        autoCommit((handle, dao) -> dao.incrementSuccessCount(jobId));
    }

    @Override
    public void recordFailure(int jobId)
    {
        autoCommit((handle, dao) -> dao.incrementFailureCount(jobId));
    }

    private static void insertScheduleIndex(Dao dao, int jobId, Optional<Schedule> schedule)
    {
        if (!schedule.isPresent()) {
            return;
        }
        switch (schedule.get().getType()) {
        case CRONTAB:
            {
                CrontabSchedule crontab = (CrontabSchedule) schedule.get();
                List<Integer> kinds = new ArrayList<>();
                List<Integer> values = new ArrayList<>();
                for (CronFieldKind kind : CronFieldKind.values()) {
                    for (int value : crontab.getField(kind)) {
                        kinds.add(kind.getCode());
                        values.add(value);
                    }
                }
                dao.insertScheduleFields(jobId, kinds, values);
            }
            break;
        case TIMESTAMPS:
            dao.insertScheduleTimestamps(jobId, ((TimestampSchedule) schedule.get()).getCanonicalTimestamps());
            break;
        default:
            throw new AssertionError("Unknown schedule type: " + schedule.get().getType());
        }
    }

    // unique key of a job definition. Indexing the digest avoids a unique index on text columns.
    static String definitionDigest(Job job)
    {
        Hasher hasher = Hashing.sha256().newHasher();
        putField(hasher, job.getDatabaseName());
        putField(hasher, job.getPrincipalName());
        putField(hasher, job.getScheduleText().or(""));
        putField(hasher, job.getCommand());
        return hasher.hash().toString();
    }

    private static void putField(Hasher hasher, String value)
    {
        hasher.putInt(value.length());
        hasher.putString(value, UTF_8);
    }

    public interface Dao
    {
        @SqlQuery("select * from jobs where id = :id")
        StoredJob getJobById(@Bind("id") int id);

        @SqlQuery("select * from jobs where id = :id for update")
        StoredJob lockJobById(@Bind("id") int id);

        @SqlQuery("select * from jobs order by id asc")
        List<StoredJob> getJobs();

        @SqlQuery("select j.* from jobs j" +
                " where j.enabled = true" +
                " and (" +
                    "(exists (select 1 from job_schedule_fields f where f.job_id = j.id and f.field_kind = 0 and f.field_value = :minute)" +
                    " and exists (select 1 from job_schedule_fields f where f.job_id = j.id and f.field_kind = 1 and f.field_value = :hour)" +
                    " and exists (select 1 from job_schedule_fields f where f.job_id = j.id and f.field_kind = 3 and f.field_value = :month)" +
                    " and (exists (select 1 from job_schedule_fields f where f.job_id = j.id and f.field_kind = 2 and f.field_value = :dayOfMonth)" +
                        " or exists (select 1 from job_schedule_fields f where f.job_id = j.id and f.field_kind = 4 and f.field_value = :dayOfWeek)))" +
                    " or exists (select 1 from job_schedule_timestamps t where t.job_id = j.id and t.scheduled_at = :timestamp)" +
                ")" +
                " order by j.id asc")
        List<StoredJob> getJobsScheduledAt(
                @Bind("minute") int minute,
                @Bind("hour") int hour,
                @Bind("dayOfMonth") int dayOfMonth,
                @Bind("month") int month,
                @Bind("dayOfWeek") int dayOfWeek,
                @Bind("timestamp") String timestamp);

        @SqlUpdate("insert into jobs" +
                " (database_name, principal_name, schedule, definition_digest, enabled, parallel, command, description, timeout_seconds, created_at, updated_at)" +
                " values (:databaseName, :principalName, :schedule, :digest, :enabled, :parallel, :command, :description, :timeoutSeconds, :now, :now)")
        @GetGeneratedKeys("id")
        int insertJob(
                @Bind("databaseName") String databaseName,
                @Bind("principalName") String principalName,
                @Bind("schedule") String schedule,
                @Bind("digest") String digest,
                @Bind("enabled") boolean enabled,
                @Bind("parallel") boolean parallel,
                @Bind("command") String command,
                @Bind("description") String description,
                @Bind("timeoutSeconds") long timeoutSeconds,
                @Bind("now") Instant now);

        @SqlUpdate("update jobs set" +
                " database_name = :databaseName," +
                " principal_name = :principalName," +
                " schedule = :schedule," +
                " definition_digest = :digest," +
                " enabled = :enabled," +
                " parallel = :parallel," +
                " command = :command," +
                " description = :description," +
                " timeout_seconds = :timeoutSeconds," +
                " updated_at = :now" +
                " where id = :id")
        int updateJob(
                @Bind("id") int id,
                @Bind("databaseName") String databaseName,
                @Bind("principalName") String principalName,
                @Bind("schedule") String schedule,
                @Bind("digest") String digest,
                @Bind("enabled") boolean enabled,
                @Bind("parallel") boolean parallel,
                @Bind("command") String command,
                @Bind("description") String description,
                @Bind("timeoutSeconds") long timeoutSeconds,
                @Bind("now") Instant now);

        @SqlUpdate("delete from jobs where id = :id")
        int deleteJob(@Bind("id") int id);

        @SqlBatch("insert into job_schedule_fields (job_id, field_kind, field_value) values (:jobId, :kind, :value)")
        void insertScheduleFields(@Bind("jobId") int jobId, @Bind("kind") List<Integer> kinds, @Bind("value") List<Integer> values);

        @SqlBatch("insert into job_schedule_timestamps (job_id, scheduled_at) values (:jobId, :scheduledAt)")
        void insertScheduleTimestamps(@Bind("jobId") int jobId, @Bind("scheduledAt") List<String> scheduledAt);

        @SqlUpdate("delete from job_schedule_fields where job_id = :jobId")
        int deleteScheduleFields(@Bind("jobId") int jobId);

        @SqlUpdate("delete from job_schedule_timestamps where job_id = :jobId")
        int deleteScheduleTimestamps(@Bind("jobId") int jobId);

        // an expired claim of a non-parallel job is taken over. active_runs restarts from 1.
        @SqlUpdate("update jobs" +
                " set active_runs = case when parallel = true then active_runs + 1 else 1 end," +
                " last_executed = :startedAt," +
                " claim_expires_at = :expiresAt" +
                " where id = :id" +
                " and (parallel = true or active_runs = 0 or claim_expires_at < :startedAt)")
        int claimJob(@Bind("id") int id, @Bind("startedAt") Instant startedAt, @Bind("expiresAt") Instant expiresAt);

        // a release of a taken-over claim doesn't match last_executed and does nothing
        @SqlUpdate("update jobs" +
                " set active_runs = active_runs - 1" +
                " where id = :id" +
                " and active_runs > 0" +
                " and (parallel = true or last_executed = :claimedAt)")
        int releaseJob(@Bind("id") int id, @Bind("claimedAt") Instant claimedAt);

        @SqlUpdate("update jobs" +
                " set success_count = success_count + 1, failure_count = 0" +
                " where id = :id")
        int incrementSuccessCount(@Bind("id") int id);

        @SqlUpdate("update jobs" +
                " set failure_count = failure_count + 1" +
                " where id = :id")
        int incrementFailureCount(@Bind("id") int id);
    }

    static class StoredJobMapper
            implements RowMapper<StoredJob>
    {
        @Override
        public StoredJob map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return StoredJob.builder()
                .id(r.getInt("id"))
                .databaseName(r.getString("database_name"))
                .principalName(r.getString("principal_name"))
                .schedule(getOptionalString(r, "schedule"))
                .enabled(r.getBoolean("enabled"))
                .failureCount(r.getInt("failure_count"))
                .successCount(r.getInt("success_count"))
                .parallel(r.getBoolean("parallel"))
                .command(r.getString("command"))
                .description(getOptionalString(r, "description"))
                .timeout(Duration.ofSeconds(r.getLong("timeout_seconds")))
                .lastExecuted(getOptionalTimestampInstant(r, "last_executed"))
                .activeRuns(r.getInt("active_runs"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .build();
        }
    }
}
