package io.nodelog.server;

import java.util.Set;
import javax.ws.rs.core.Application;
import com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import io.nodelog.server.rs.LogResource;

/**
 * The log API as a JAX-RS application, for deployment in a JAX-RS container.
 */
public class LogApplication
        extends Application
{
    private final Set<Object> singletons;

    @Inject
    public LogApplication(LogResource logResource, JacksonJsonProvider jsonProvider)
    {
        this.singletons = ImmutableSet.builder()
            .add(logResource)
            .add(jsonProvider)
            .addAll(ServerModule.exceptionHandlers())
            .build();
    }

    @Override
    public Set<Object> getSingletons()
    {
        return singletons;
    }
}
