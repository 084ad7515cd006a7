package io.elephant.core.database;

import com.google.inject.Provider;
import io.elephant.core.ThrowablesUtil;
import io.elephant.core.config.ObjectMappers;

public class DatabaseFactory
        implements AutoCloseable, Provider<TransactionManager>
{
    private final TransactionManager tm;
    private final AutoCloseable closeable;
    private final DatabaseConfig config;

    public DatabaseFactory(TransactionManager tm, AutoCloseable closeable, DatabaseConfig config)
    {
        this.tm = tm;
        this.closeable = closeable;
        this.config = config;
    }

    @Override
    public TransactionManager get()
    {
        return tm;
    }

    public <T> T begin(TransactionManager.SupplierInTransaction<T, Exception, RuntimeException, RuntimeException> func)
            throws Exception
    {
        return tm.begin(func, Exception.class);
    }

    public <T> T autoCommit(TransactionManager.SupplierInTransaction<T, Exception, RuntimeException, RuntimeException> func)
            throws Exception
    {
        return tm.autoCommit(func, Exception.class);
    }

    public DatabaseConfig getConfig()
    {
        return config;
    }

    public DatabaseJobStore getJobStore()
    {
        return new DatabaseJobStore(tm, config);
    }

    public DatabaseJobLogStore getJobLogStore()
    {
        return new DatabaseJobLogStore(tm, config);
    }

    public DatabaseRunLogStore getRunLogStore()
    {
        return new DatabaseRunLogStore(tm, config, ObjectMappers.objectMapper());
    }

    @Override
    public void close()
    {
        try {
            closeable.close();
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }
}
