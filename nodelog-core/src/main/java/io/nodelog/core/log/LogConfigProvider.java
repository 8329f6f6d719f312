package io.nodelog.core.log;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.nodelog.client.config.Config;

public class LogConfigProvider
    implements Provider<LogConfig>
{
    private final LogConfig config;

    @Inject
    public LogConfigProvider(Config systemConfig)
    {
        this.config = LogConfig.convertFrom(systemConfig);
    }

    @Override
    public LogConfig get()
    {
        return config;
    }
}
