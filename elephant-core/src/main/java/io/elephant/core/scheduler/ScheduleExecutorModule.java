package io.elephant.core.scheduler;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.elephant.core.log.Slf4jRunRecorder;
import io.elephant.spi.JobRunner;
import io.elephant.spi.RunRecorder;

public class ScheduleExecutorModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleConfig.class).toProvider(ScheduleConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(JobRunner.class).to(UnconfiguredJobRunner.class).in(Scopes.SINGLETON);
        binder.bind(RunRecorder.class).to(Slf4jRunRecorder.class).in(Scopes.SINGLETON);
        binder.bind(JobScheduleExecutor.class).in(Scopes.SINGLETON);
    }
}
