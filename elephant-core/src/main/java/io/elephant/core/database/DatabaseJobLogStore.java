package io.elephant.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.elephant.core.log.JobLog;
import io.elephant.core.log.JobLogStore;
import io.elephant.core.log.StoredJobLog;
import io.elephant.core.log.ImmutableStoredJobLog;
import io.elephant.spi.ErrorState;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public class DatabaseJobLogStore
        extends BasicDatabaseStoreManager<DatabaseJobLogStore.Dao>
        implements JobLogStore
{
    @Inject
    public DatabaseJobLogStore(TransactionManager transactionManager, DatabaseConfig config)
    {
        super(config.getType(), Dao.class, transactionManager);
    }

    @Override
    public StoredJobLog addJobLog(JobLog log)
    {
        Optional<ErrorState> error = log.getError();
        return autoCommit((handle, dao) -> {
            long id = dao.insertJobLog(
                    log.getJobId(),
                    log.getPrincipalName(),
                    log.getDatabaseName(),
                    log.getStartedAt(),
                    log.getFinishedAt(),
                    log.getCommand(),
                    error.transform(ErrorState::getCode).orNull(),
                    error.transform(ErrorState::getMessage).orNull(),
                    error.isPresent() ? error.get().getDetail().orNull() : null,
                    error.isPresent() ? error.get().getHint().orNull() : null);
            return dao.getJobLogById(id);
        });
    }

    @Override
    public List<StoredJobLog> getJobLogsByJobId(int jobId)
    {
        return autoCommit((handle, dao) -> dao.getJobLogsByJobId(jobId));
    }

    @Override
    public List<StoredJobLog> getJobLogs(int pageSize, Optional<Long> lastId)
    {
        return autoCommit((handle, dao) -> dao.getJobLogs(pageSize, lastId.or(0L)));
    }

    public interface Dao
    {
        @SqlUpdate("insert into job_logs" +
                " (job_id, principal_name, database_name, started_at, finished_at, command, sqlstate, error_message, error_detail, error_hint)" +
                " values (:jobId, :principalName, :databaseName, :startedAt, :finishedAt, :command, :sqlstate, :errorMessage, :errorDetail, :errorHint)")
        @GetGeneratedKeys("id")
        long insertJobLog(
                @Bind("jobId") int jobId,
                @Bind("principalName") String principalName,
                @Bind("databaseName") String databaseName,
                @Bind("startedAt") Instant startedAt,
                @Bind("finishedAt") Instant finishedAt,
                @Bind("command") String command,
                @Bind("sqlstate") String sqlstate,
                @Bind("errorMessage") String errorMessage,
                @Bind("errorDetail") String errorDetail,
                @Bind("errorHint") String errorHint);

        @SqlQuery("select * from job_logs where id = :id")
        StoredJobLog getJobLogById(@Bind("id") long id);

        @SqlQuery("select * from job_logs where job_id = :jobId order by id asc")
        List<StoredJobLog> getJobLogsByJobId(@Bind("jobId") int jobId);

        @SqlQuery("select * from job_logs" +
                " where id > :lastId" +
                " order by id asc" +
                " limit :limit")
        List<StoredJobLog> getJobLogs(@Bind("limit") int limit, @Bind("lastId") long lastId);
    }

    static class StoredJobLogMapper
            implements RowMapper<StoredJobLog>
    {
        @Override
        public StoredJobLog map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredJobLog.builder()
                .id(r.getLong("id"))
                .jobId(r.getInt("job_id"))
                .principalName(r.getString("principal_name"))
                .databaseName(r.getString("database_name"))
                .startedAt(getTimestampInstant(r, "started_at"))
                .finishedAt(getTimestampInstant(r, "finished_at"))
                .command(r.getString("command"))
                .error(getOptionalErrorState(r))
                .build();
        }
    }
}
