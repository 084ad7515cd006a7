package io.elephant.core.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.elephant.core.config.Config;
import io.elephant.core.config.ConfigException;
import org.immutables.value.Value;

/**
 * Settings of the database that holds jobs and logs.
 *
 * <pre>
 * database.type = memory | h2 | postgresql
 * database.path = /var/lib/elephant        (h2)
 * database.host, port, database, user, password, sslmode   (postgresql)
 * database.opts.* = extra JDBC properties
 * database.migrate = true
 * </pre>
 */
@Value.Immutable
public interface DatabaseConfig
{
    String DEFAULT_APPLICATION_NAME = "elephant-worker";

    // h2 or postgresql. "memory" is converted to h2 without a path.
    String getType();

    // directory of an h2 database file. absent means in-memory.
    Optional<String> getPath();

    Optional<RemoteDatabaseConfig> getRemoteDatabaseConfig();

    Map<String, String> getOptions();

    boolean getAutoMigrate();

    // pool settings. Times are in seconds except leakDetectionThreshold.

    int getConnectionTimeout();

    int getIdleTimeout();

    int getValidationTimeout();

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    long getLeakDetectionThreshold();  // milliseconds. 0 disables it.

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        return convertFrom(config, "database.");
    }

    static DatabaseConfig convertFrom(Config config, String prefix)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        String type = config.get(prefix + "type", String.class, "memory");
        if (type.equals("memory")) {
            builder.type("h2");
        }
        else if (type.equals("h2")) {
            builder.type("h2").path(config.get(prefix + "path", String.class));
        }
        else if (type.equals("postgresql")) {
            builder.type("postgresql").remoteDatabaseConfig(RemoteDatabaseConfig.builder()
                    .host(config.get(prefix + "host", String.class))
                    .port(config.getOptional(prefix + "port", Integer.class))
                    .database(config.get(prefix + "database", String.class))
                    .user(config.get(prefix + "user", String.class))
                    .password(config.get(prefix + "password", String.class, ""))
                    .loginTimeout(config.get(prefix + "loginTimeout", int.class, 30))
                    .socketTimeout(config.get(prefix + "socketTimeout", int.class, 1800))
                    .sslmode(config.getOptional(prefix + "sslmode", String.class))
                    .build());
        }
        else {
            throw new ConfigException("Unknown database.type: " + type);
        }

        // scheduler workers and job-management callers share the pool
        int maximumPoolSize = config.get(prefix + "maximumPoolSize", int.class, 16);
        builder
            .connectionTimeout(config.get(prefix + "connectionTimeout", int.class, 30))
            .idleTimeout(config.get(prefix + "idleTimeout", int.class, 600))
            .validationTimeout(config.get(prefix + "validationTimeout", int.class, 5))
            .maximumPoolSize(maximumPoolSize)
            .minimumPoolSize(config.get(prefix + "minimumPoolSize", int.class, maximumPoolSize))
            .leakDetectionThreshold(config.get(prefix + "leakDetectionThreshold", long.class, 0L))
            .autoMigrate(config.get(prefix + "migrate", boolean.class, true));

        String optionPrefix = prefix + "opts.";
        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        for (String key : config.getKeys()) {
            if (key.startsWith(optionPrefix)) {
                options.put(key.substring(optionPrefix.length()), config.get(key, String.class));
            }
        }
        builder.options(options.build());

        return builder.build();
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        if (config.getType().equals("postgresql")) {
            return config.getRemoteDatabaseConfig().get().getJdbcUrl();
        }
        if (!config.getPath().isPresent()) {
            // unique per DataSourceProvider so that embedded instances don't share data
            return "jdbc:h2:mem:elephant-" + UUID.randomUUID();
        }
        Path dir = Paths.get(config.getPath().get()).toAbsolutePath();  // h2 requires absolute path
        try {
            Files.createDirectories(dir);
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
        return "jdbc:h2:" + dir.resolve("elephant");
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        if (config.getRemoteDatabaseConfig().isPresent()) {
            RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
            props.setProperty("user", remote.getUser());
            props.setProperty("password", remote.getPassword());
            props.setProperty("loginTimeout", Integer.toString(remote.getLoginTimeout()));
            props.setProperty("socketTimeout", Integer.toString(remote.getSocketTimeout()));
            props.setProperty("tcpKeepAlive", "true");
            props.setProperty("ApplicationName", DEFAULT_APPLICATION_NAME);
            if (remote.getSslmode().isPresent()) {
                props.setProperty("sslmode", remote.getSslmode().get());
            }
        }
        // database.opts.* overwrite the above
        props.putAll(config.getOptions());
        return props;
    }
}
