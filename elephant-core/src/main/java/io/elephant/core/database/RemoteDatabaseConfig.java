package io.elephant.core.database;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Connection settings of a PostgreSQL server.
 */
@Value.Immutable
public interface RemoteDatabaseConfig
{
    String getHost();

    Optional<Integer> getPort();

    String getDatabase();

    String getUser();

    String getPassword();

    int getLoginTimeout();  // seconds

    // long enough for the longest job-management call. Job commands don't run on this pool.
    int getSocketTimeout();  // seconds

    // disable, require, verify-full, ...
    Optional<String> getSslmode();

    default String getJdbcUrl()
    {
        if (getPort().isPresent()) {
            return "jdbc:postgresql://" + getHost() + ":" + getPort().get() + "/" + getDatabase();
        }
        else {
            return "jdbc:postgresql://" + getHost() + "/" + getDatabase();
        }
    }

    static ImmutableRemoteDatabaseConfig.Builder builder()
    {
        return ImmutableRemoteDatabaseConfig.builder();
    }
}
