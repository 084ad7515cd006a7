package io.elephant.core.database;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Properties;
import com.google.common.collect.Lists;
import io.elephant.core.config.Config;
import io.elephant.core.config.ConfigFactory;
import io.elephant.core.config.ObjectMappers;
import io.elephant.core.job.ImmutableJobRequest;
import io.elephant.core.job.JobRequest;
import io.elephant.core.repository.ResourceConflictException;
import io.elephant.core.repository.ResourceNotFoundException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import static org.junit.Assert.fail;

public class DatabaseTestingUtils
{
    private DatabaseTestingUtils() { }

    public static DatabaseConfig getEnvironmentDatabaseConfig()
    {
        Config config = createConfig();
        String pg = System.getenv("ELEPHANT_TEST_POSTGRESQL");
        if (pg != null && !pg.isEmpty()) {
            Properties props = new Properties();
            try (StringReader reader = new StringReader(pg)) {
                props.load(reader);
            }
            catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
            for (String key : props.stringPropertyNames()) {
                config.set("database." + key, props.getProperty(key));
            }
            config.set("database.type", "postgresql");
        }
        else {
            config.set("database.type", "memory");
        }
        return DatabaseConfig.convertFrom(config);
    }

    public static DatabaseFactory setupDatabase()
    {
        DatabaseConfig config = getEnvironmentDatabaseConfig();
        DataSourceProvider dsp = new DataSourceProvider(config);

        TransactionManager tm = new ThreadLocalTransactionManager(dsp.get(), ObjectMappers.objectMapper());
        new DatabaseMigrator(dsp.get(), config).migrate();

        cleanDatabase(config.getType(), JdbiHelper.createJdbi(dsp.get()));

        return new DatabaseFactory(tm, dsp, config);
    }

    public static final String[] ALL_TABLES = new String[] {
        "jobs",
        "job_schedule_fields",
        "job_schedule_timestamps",
        "job_logs",
        "run_logs",
    };

    public static void cleanDatabase(String databaseType, Jdbi dbi)
    {
        try (Handle handle = dbi.open()) {
            switch (databaseType) {
            case "h2":
                // h2 database can't truncate tables with references if REFERENTIAL_INTEGRITY is true (default)
                handle.execute("SET REFERENTIAL_INTEGRITY FALSE");
                for (String name : Lists.reverse(Arrays.asList(ALL_TABLES))) {
                    handle.execute("TRUNCATE TABLE " + name);
                }
                handle.execute("SET REFERENTIAL_INTEGRITY TRUE");
                break;
            default:
                // postgresql needs "CASCADE" option to TRUNCATE
                for (String name : Lists.reverse(Arrays.asList(ALL_TABLES))) {
                    handle.execute("TRUNCATE " + name + " CASCADE");
                }
                break;
            }
        }
    }

    public static ConfigFactory createConfigFactory()
    {
        return new ConfigFactory(ObjectMappers.objectMapper());
    }

    public static Config createConfig()
    {
        return createConfigFactory().create();
    }

    public static ImmutableJobRequest.Builder jobRequest(String command)
    {
        return JobRequest.builder()
            .databaseName("postgres")
            .command(command);
    }

    public interface MayConflict
    {
        void run() throws ResourceConflictException, ResourceNotFoundException;
    }

    public interface MayNotFound
    {
        void run() throws ResourceNotFoundException;
    }

    public static void assertNotFound(MayNotFound r)
    {
        try {
            r.run();
            fail();
        }
        catch (ResourceNotFoundException ex) {
            // expected
        }
    }

    public static void assertConflict(MayConflict r)
            throws ResourceNotFoundException
    {
        try {
            r.run();
            fail();
        }
        catch (ResourceConflictException ex) {
            // expected
        }
    }
}
