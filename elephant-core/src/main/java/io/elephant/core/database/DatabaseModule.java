package io.elephant.core.database;

import javax.sql.DataSource;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.elephant.core.job.JobStore;
import io.elephant.core.log.JobLogStore;
import io.elephant.core.log.RunLogStore;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        // DataSourceProvider is a singleton so that ElephantEmbed.close can close the pool it created
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseMigrator.class).in(Scopes.SINGLETON);
        binder.bind(JobStore.class).to(DatabaseJobStore.class).in(Scopes.SINGLETON);
        binder.bind(JobLogStore.class).to(DatabaseJobLogStore.class).in(Scopes.SINGLETON);
        binder.bind(RunLogStore.class).to(DatabaseRunLogStore.class).in(Scopes.SINGLETON);
    }
}
