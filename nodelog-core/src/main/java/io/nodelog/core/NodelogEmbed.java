package io.nodelog.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.util.Modules;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import io.nodelog.client.config.Config;
import io.nodelog.client.config.ConfigElement;
import io.nodelog.client.config.ConfigFactory;
import io.nodelog.core.log.LogModule;
import io.nodelog.core.log.LogsManager;
import io.nodelog.core.log.RemoteCallExecutor;

/**
 * Builds the injector of the log service.
 *
 * The cluster collaborators ({@link io.nodelog.spi.NodeRegistry},
 * {@link io.nodelog.spi.NodeAgentClient}, {@link io.nodelog.spi.ActorRegistry},
 * {@link io.nodelog.spi.TaskEventStore} and {@link io.nodelog.spi.JobRegistry})
 * are not bound here and must be added with {@link Bootstrap#addModules}.
 */
public class NodelogEmbed
        implements AutoCloseable
{
    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();

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

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public NodelogEmbed initialize()
        {
            List<Module> modules = standardModules(systemConfig);
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(ImmutableList.<Module>builder()
                    .add(binder -> binder.requireExplicitBindings())
                    .addAll(modules)
                    .build());
            return new NodelogEmbed(injector);
        }

        private List<Module> standardModules(ConfigElement systemConfig)
        {
            return ImmutableList.of(
                    new ObjectMapperModule()
                        .registerModule(new GuavaModule()),
                    new LogModule(),
                    (binder) -> {
                        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
                        binder.bind(ConfigElement.class).toInstance(systemConfig);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class);
                    });
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;

    NodelogEmbed(Injector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public LogsManager getLogsManager()
    {
        return injector.getInstance(LogsManager.class);
    }

    @Override
    public void close()
    {
        injector.getInstance(RemoteCallExecutor.class).close();
    }
}
