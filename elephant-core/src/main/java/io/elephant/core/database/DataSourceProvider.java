package io.elephant.core.database;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.elephant.core.ThrowablesUtil;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the DataSource lazily and closes it with the embedding process.
 *
 * PostgreSQL is accessed through a HikariCP pool. H2 is opened without a
 * pool.
 */
public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DataSourceProvider.class);

    private final DatabaseConfig config;

    // guarded by this
    private DataSource ds;
    private AutoCloseable closer;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            String url = DatabaseConfig.buildJdbcUrl(config);
            if (config.getType().equals("h2")) {
                openH2(url);
            }
            else {
                openPool(url);
            }
        }
        return ds;
    }

    private void openH2(String url)
    {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");

        // an in-memory database disappears with its last connection. This one
        // stays open until close().
        Connection keeper;
        try {
            keeper = h2.getConnection();
        }
        catch (SQLException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        logger.debug("Opened h2 database {}", url);

        this.ds = h2;
        this.closer = keeper;
    }

    private void openPool(String url)
    {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("elephant");
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName(DatabaseMigrator.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));
        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());
        hikari.setLeakDetectionThreshold(config.getLeakDetectionThreshold());
        // no connectionTestQuery. ThreadLocalTransactionManager relies on
        // Connection.isValid to detect a connection broken during a transaction.

        HikariDataSource pool = new HikariDataSource(hikari);
        logger.info("Connected to {} with up to {} connections", url, config.getMaximumPoolSize());

        this.ds = pool;
        this.closer = pool;
    }

    @Override
    public synchronized void close()
    {
        if (closer == null) {
            return;
        }
        try {
            closer.close();
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        finally {
            ds = null;
            closer = null;
        }
    }
}
