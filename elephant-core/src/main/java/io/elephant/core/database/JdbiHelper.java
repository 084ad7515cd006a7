package io.elephant.core.database;

import javax.sql.DataSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

public class JdbiHelper
{
    private JdbiHelper()
    { }

    public static Jdbi createJdbi(DataSource ds)
    {
        Jdbi jdbi = Jdbi.create(ds);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.installPlugin(new PostgresPlugin());
        jdbi.installPlugin(new H2DatabasePlugin());
        return jdbi;
    }

    public static Jdbi createJdbiWithMappers(DataSource ds, ObjectMapper objectMapper)
    {
        Jdbi jdbi = createJdbi(ds);
        jdbi.registerRowMapper(new DatabaseJobStore.StoredJobMapper());
        jdbi.registerRowMapper(new DatabaseJobLogStore.StoredJobLogMapper());
        jdbi.registerRowMapper(new DatabaseRunLogStore.StoredRunLogMapper(objectMapper));
        return jdbi;
    }
}
