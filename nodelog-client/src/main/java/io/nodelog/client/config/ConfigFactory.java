package io.nodelog.client.config;

import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

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
