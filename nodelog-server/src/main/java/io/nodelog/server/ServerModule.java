package io.nodelog.server;

import java.util.List;
import javax.ws.rs.core.Response;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;
import com.google.common.collect.ImmutableList;
import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.nodelog.client.config.ConfigException;
import io.nodelog.core.log.InvalidLogRequestException;
import io.nodelog.core.log.LogFileNotFoundException;
import io.nodelog.server.rs.LogResource;
import io.nodelog.spi.NodeUnavailableException;
import io.nodelog.spi.RemoteTimeoutException;

public class ServerModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(LogResource.class).in(Scopes.SINGLETON);
        binder.bind(JacksonJsonProvider.class).toProvider(JsonProviderProvider.class).in(Scopes.SINGLETON);
        binder.bind(LogApplication.class).in(Scopes.SINGLETON);
    }

    public static List<GenericJsonExceptionHandler<?>> exceptionHandlers()
    {
        return ImmutableList.of(
                new GenericJsonExceptionHandler<InvalidLogRequestException>(Response.Status.BAD_REQUEST) { },
                new GenericJsonExceptionHandler<LogFileNotFoundException>(Response.Status.NOT_FOUND) { },
                new GenericJsonExceptionHandler<NodeUnavailableException>(Response.Status.SERVICE_UNAVAILABLE) { },
                new GenericJsonExceptionHandler<RemoteTimeoutException>(Response.Status.GATEWAY_TIMEOUT) { },
                new GenericJsonExceptionHandler<ConfigException>(Response.Status.BAD_REQUEST) { });
    }

    public static class JsonProviderProvider
            implements com.google.inject.Provider<JacksonJsonProvider>
    {
        private final ObjectMapper mapper;

        @Inject
        public JsonProviderProvider(ObjectMapper mapper)
        {
            this.mapper = mapper.copy();
            this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }

        @Override
        public JacksonJsonProvider get()
        {
            return new JacksonJsonProvider(mapper);
        }
    }
}
