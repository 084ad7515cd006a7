package io.elephant.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240312080000_AddJobClaimExpiration
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // a claim older than this is taken over by the next admission.
        // null while no run has been admitted.
        if (context.isPostgres()) {
            handle.execute("alter table jobs add column claim_expires_at timestamp with time zone");
        }
        else {
            handle.execute("alter table jobs add column claim_expires_at timestamp");
        }
    }
}
