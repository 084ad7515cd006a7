package io.elephant.core.config;

import java.time.Clock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ConfigModule
        implements Module
{
    private final Config systemConfig;

    public ConfigModule(Config systemConfig)
    {
        this.systemConfig = systemConfig;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(ObjectMapper.class).toInstance(ObjectMappers.objectMapper());
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(Config.class).toInstance(systemConfig);
        binder.bind(Clock.class).toInstance(Clock.systemUTC());
    }
}
