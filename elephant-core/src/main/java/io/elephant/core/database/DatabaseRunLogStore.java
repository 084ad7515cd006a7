package io.elephant.core.database;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.elephant.core.log.ImmutableStoredRunLog;
import io.elephant.core.log.RunLog;
import io.elephant.core.log.RunLogStore;
import io.elephant.core.log.StoredRunLog;
import io.elephant.spi.ErrorState;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public class DatabaseRunLogStore
        extends BasicDatabaseStoreManager<DatabaseRunLogStore.Dao>
        implements RunLogStore
{
    private static final TypeReference<List<String>> ARGUMENTS_TYPE = new TypeReference<List<String>>() { };

    private final ObjectMapper objectMapper;

    @Inject
    public DatabaseRunLogStore(TransactionManager transactionManager, DatabaseConfig config, ObjectMapper objectMapper)
    {
        super(config.getType(), Dao.class, transactionManager);
        this.objectMapper = objectMapper;
    }

    @Override
    public StoredRunLog addRunLog(RunLog log)
    {
        String arguments;
        try {
            arguments = objectMapper.writeValueAsString(log.getArguments());
        }
        catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
        Optional<ErrorState> error = log.getError();
        return autoCommit((handle, dao) -> {
            long id = dao.insertRunLog(
                    log.getJobId().orNull(),
                    log.getActorName(),
                    log.getFunctionSignature(),
                    arguments,
                    log.getStartedAt(),
                    log.getFinishedAt(),
                    log.getRowsReturned().orNull(),
                    error.transform(ErrorState::getCode).orNull(),
                    error.transform(ErrorState::getMessage).orNull(),
                    error.isPresent() ? error.get().getDetail().orNull() : null,
                    error.isPresent() ? error.get().getHint().orNull() : null);
            return dao.getRunLogById(id);
        });
    }

    @Override
    public List<StoredRunLog> getRunLogsByJobId(int jobId)
    {
        return autoCommit((handle, dao) -> dao.getRunLogsByJobId(jobId));
    }

    @Override
    public List<StoredRunLog> getRunLogs(int pageSize, Optional<Long> lastId)
    {
        return autoCommit((handle, dao) -> dao.getRunLogs(pageSize, lastId.or(0L)));
    }

    public interface Dao
    {
        // job_id is stored as null if the job doesn't exist, e.g. the call failed before inserting it
        @SqlUpdate("insert into run_logs" +
                " (job_id, actor_name, function_signature, function_arguments, started_at, finished_at, rows_returned, sqlstate, error_message, error_detail, error_hint)" +
                " values ((select id from jobs where id = :jobId), :actorName, :functionSignature, :arguments, :startedAt, :finishedAt, :rowsReturned, :sqlstate, :errorMessage, :errorDetail, :errorHint)")
        @GetGeneratedKeys("id")
        long insertRunLog(
                @Bind("jobId") Integer jobId,
                @Bind("actorName") String actorName,
                @Bind("functionSignature") String functionSignature,
                @Bind("arguments") String arguments,
                @Bind("startedAt") Instant startedAt,
                @Bind("finishedAt") Instant finishedAt,
                @Bind("rowsReturned") Long rowsReturned,
                @Bind("sqlstate") String sqlstate,
                @Bind("errorMessage") String errorMessage,
                @Bind("errorDetail") String errorDetail,
                @Bind("errorHint") String errorHint);

        @SqlQuery("select * from run_logs where id = :id")
        StoredRunLog getRunLogById(@Bind("id") long id);

        @SqlQuery("select * from run_logs where job_id = :jobId order by id asc")
        List<StoredRunLog> getRunLogsByJobId(@Bind("jobId") int jobId);

        @SqlQuery("select * from run_logs" +
                " where id > :lastId" +
                " order by id asc" +
                " limit :limit")
        List<StoredRunLog> getRunLogs(@Bind("limit") int limit, @Bind("lastId") long lastId);
    }

    static class StoredRunLogMapper
            implements RowMapper<StoredRunLog>
    {
        private final ObjectMapper objectMapper;

        StoredRunLogMapper(ObjectMapper objectMapper)
        {
            this.objectMapper = objectMapper;
        }

        @Override
        public StoredRunLog map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            List<String> arguments;
            try {
                arguments = objectMapper.readValue(r.getString("function_arguments"), ARGUMENTS_TYPE);
            }
            catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            return ImmutableStoredRunLog.builder()
                .id(r.getLong("id"))
                .jobId(getOptionalInt(r, "job_id"))
                .actorName(r.getString("actor_name"))
                .functionSignature(r.getString("function_signature"))
                .arguments(arguments)
                .startedAt(getTimestampInstant(r, "started_at"))
                .finishedAt(getTimestampInstant(r, "finished_at"))
                .rowsReturned(getOptionalLong(r, "rows_returned"))
                .error(getOptionalErrorState(r))
                .build();
        }
    }
}
