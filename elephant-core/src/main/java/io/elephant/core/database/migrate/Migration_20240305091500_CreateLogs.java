package io.elephant.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240305091500_CreateLogs
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // job_logs doesn't reference jobs. Logs outlive deleted jobs and may be imported from elsewhere.
        handle.execute(
                context.newCreateTableBuilder("job_logs")
                .addLongId("id")
                .addInt("job_id", "not null")
                .addString("principal_name", "not null")
                .addString("database_name", "not null")
                .addTimestamp("started_at", "not null")
                .addTimestamp("finished_at", "not null")
                .addMediumText("command", "not null")
                .addSqlState("sqlstate", "")
                .addMediumText("error_message", "")
                .addMediumText("error_detail", "")
                .addMediumText("error_hint", "")
                .build());
        handle.execute("create index job_logs_on_job_id on job_logs (job_id, id)");

        handle.execute(
                context.newCreateTableBuilder("run_logs")
                .addLongId("id")
                .addInt("job_id", "references jobs (id) on delete set null")
                .addString("actor_name", "not null")
                .addMediumText("function_signature", "not null")
                .addMediumText("function_arguments", "not null")  // JSON array of strings
                .addTimestamp("started_at", "not null")
                .addTimestamp("finished_at", "not null")
                .addLong("rows_returned", "")
                .addSqlState("sqlstate", "")
                .addMediumText("error_message", "")
                .addMediumText("error_detail", "")
                .addMediumText("error_hint", "")
                .build());
        handle.execute("create index run_logs_on_job_id on run_logs (job_id, id)");
    }
}
