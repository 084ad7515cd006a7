package io.elephant.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;

public class ConfigFactory
{
    private final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }
}
