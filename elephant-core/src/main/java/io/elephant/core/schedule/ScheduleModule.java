package io.elephant.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(CronFieldParser.class).in(Scopes.SINGLETON);
        binder.bind(CronScheduleParser.class).in(Scopes.SINGLETON);
        binder.bind(TimestampScheduleParser.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleParser.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleMatcher.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleFormatter.class).in(Scopes.SINGLETON);
    }
}
