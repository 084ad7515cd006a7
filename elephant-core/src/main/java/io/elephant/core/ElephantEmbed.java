package io.elephant.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import io.elephant.core.ac.AccessControlModule;
import io.elephant.core.config.Config;
import io.elephant.core.config.ConfigFactory;
import io.elephant.core.config.ConfigModule;
import io.elephant.core.config.ObjectMappers;
import io.elephant.core.config.PropertyUtils;
import io.elephant.core.database.DataSourceProvider;
import io.elephant.core.database.DatabaseConfig;
import io.elephant.core.database.DatabaseMigrator;
import io.elephant.core.database.DatabaseModule;
import io.elephant.core.job.JobManager;
import io.elephant.core.job.JobModule;
import io.elephant.core.schedule.ScheduleModule;
import io.elephant.core.scheduler.JobScheduleExecutor;
import io.elephant.core.scheduler.ScheduleExecutorModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the scheduling core in the current process.
 *
 * <pre>
 * try (ElephantEmbed embed = new ElephantEmbed.Bootstrap()
 *         .setSystemProperties(props)
 *         .overrideModulesWith(binder -&gt; binder.bind(JobRunner.class).to(MyRunner.class))
 *         .initialize()) {
 *     embed.getJobManager().insertJob("alice", request);
 * }
 * </pre>
 */
public class ElephantEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(ElephantEmbed.class);

    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private Config systemConfig = newConfigFactory().create();
        private boolean withScheduleExecutor = true;

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(Config systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public Bootstrap setSystemProperties(Properties props)
        {
            return setSystemConfig(PropertyUtils.toConfig(newConfigFactory(), props));
        }

        public Bootstrap withScheduleExecutor(boolean v)
        {
            this.withScheduleExecutor = v;
            return this;
        }

        public ElephantEmbed initialize()
        {
            List<Module> modules = standardModules(systemConfig);
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(modules);

            ElephantEmbed embed = new ElephantEmbed(injector, withScheduleExecutor);
            try {
                embed.start();
            }
            catch (RuntimeException ex) {
                try {
                    embed.close();
                }
                catch (RuntimeException closeError) {
                    ex.addSuppressed(closeError);
                }
                throw ex;
            }
            return embed;
        }

        private static List<Module> standardModules(Config systemConfig)
        {
            return ImmutableList.of(
                    new ConfigModule(systemConfig),
                    new DatabaseModule(),
                    new ScheduleModule(),
                    new AccessControlModule(),
                    new JobModule(),
                    new ScheduleExecutorModule());
        }

        private static ConfigFactory newConfigFactory()
        {
            return new ConfigFactory(ObjectMappers.objectMapper());
        }
    }

    private final Injector injector;
    private final boolean withScheduleExecutor;

    ElephantEmbed(Injector injector, boolean withScheduleExecutor)
    {
        this.injector = injector;
        this.withScheduleExecutor = withScheduleExecutor;
    }

    private void start()
    {
        if (injector.getInstance(DatabaseConfig.class).getAutoMigrate()) {
            injector.getInstance(DatabaseMigrator.class).migrate();
        }
        else {
            logger.debug("Database migration is disabled");
        }
        if (withScheduleExecutor) {
            injector.getInstance(JobScheduleExecutor.class).start();
        }
    }

    public Injector getInjector()
    {
        return injector;
    }

    public JobManager getJobManager()
    {
        return injector.getInstance(JobManager.class);
    }

    @Override
    public void close()
    {
        if (withScheduleExecutor) {
            injector.getInstance(JobScheduleExecutor.class).shutdown();
        }
        injector.getInstance(DataSourceProvider.class).close();
    }
}
