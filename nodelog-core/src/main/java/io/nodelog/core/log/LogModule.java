package io.nodelog.core.log;

import com.google.inject.Module;
import com.google.inject.Binder;
import com.google.inject.Scopes;

public class LogModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(LogConfig.class).toProvider(LogConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(RemoteCallExecutor.class).in(Scopes.SINGLETON);
        binder.bind(NodeLivenessGate.class).in(Scopes.SINGLETON);
        binder.bind(LogLister.class).in(Scopes.SINGLETON);
        binder.bind(WorkerFileMatcher.class).in(Scopes.SINGLETON);
        binder.bind(FilenameResolver.class).in(Scopes.SINGLETON);
        binder.bind(LogStreamer.class).in(Scopes.SINGLETON);
        binder.bind(LogsManager.class).in(Scopes.SINGLETON);
    }
}
