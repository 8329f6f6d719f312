package io.nodelog.core.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.io.IOException;
import io.nodelog.client.ObjectMappers;
import io.nodelog.client.config.Config;
import io.nodelog.client.config.ConfigFactory;
import io.nodelog.client.config.ConfigElement;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    // values stay strings; Config converts them on get
    public static ConfigElement toConfigElement(Properties props)
    {
        Config builder = new ConfigFactory(ObjectMappers.objectMapper()).create();
        for (String key : props.stringPropertyNames()) {
            builder.set(key, props.getProperty(key));
        }
        return ConfigElement.copyOf(builder);
    }
}
