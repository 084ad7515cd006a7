package io.elephant.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240301103000_CreateJobs
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("jobs")
                .addIntId("id")
                .addString("database_name", "not null")
                .addString("principal_name", "not null")
                .addMediumText("schedule", "")  // null means the job never fires automatically
                .addString("definition_digest", "not null")  // sha256 of database_name, principal_name, schedule and command
                .addBoolean("enabled", "not null default true")
                .addInt("failure_count", "not null default 0 check (failure_count >= 0)")
                .addInt("success_count", "not null default 0 check (success_count >= 0)")
                .addBoolean("parallel", "not null default false")
                .addMediumText("command", "not null")
                .addMediumText("description", "")
                .addLong("timeout_seconds", "not null check (timeout_seconds > 0)")
                .addTimestamp("last_executed", "")
                .addInt("active_runs", "not null default 0 check (active_runs >= 0)")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create unique index jobs_on_definition_digest on jobs (definition_digest)");
        handle.execute("create index jobs_on_principal_name on jobs (principal_name)");
    }
}
