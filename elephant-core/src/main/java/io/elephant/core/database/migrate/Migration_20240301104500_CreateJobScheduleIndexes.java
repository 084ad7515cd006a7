package io.elephant.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240301104500_CreateJobScheduleIndexes
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // one row per value of each crontab field of a job
        handle.execute(
                context.newCreateTableBuilder("job_schedule_fields")
                .addInt("job_id", "not null references jobs (id) on delete cascade")
                .addShort("field_kind", "not null")
                .addShort("field_value", "not null")
                .build());
        handle.execute("create unique index job_schedule_fields_on_kind_and_value_and_job_id on job_schedule_fields (field_kind, field_value, job_id)");
        handle.execute("create index job_schedule_fields_on_job_id on job_schedule_fields (job_id)");

        // one row per canonical timestamp such as "2042-12-05 13:37+00"
        handle.execute(
                context.newCreateTableBuilder("job_schedule_timestamps")
                .addInt("job_id", "not null references jobs (id) on delete cascade")
                .add("scheduled_at", "varchar(32) not null")
                .build());
        handle.execute("create unique index job_schedule_timestamps_on_scheduled_at_and_job_id on job_schedule_timestamps (scheduled_at, job_id)");
        handle.execute("create index job_schedule_timestamps_on_job_id on job_schedule_timestamps (job_id)");
    }
}
