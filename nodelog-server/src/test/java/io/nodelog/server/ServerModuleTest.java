package io.nodelog.server;

import com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;
import io.nodelog.core.NodelogEmbed;
import io.nodelog.server.rs.LogResource;
import io.nodelog.spi.ActorRegistry;
import io.nodelog.spi.JobRegistry;
import io.nodelog.spi.NodeAgentClient;
import io.nodelog.spi.NodeRegistry;
import io.nodelog.spi.TaskEventStore;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class ServerModuleTest
{
    @Test
    public void buildApplication()
    {
        try (NodelogEmbed embed = new NodelogEmbed.Bootstrap()
                .addModules(
                    new ServerModule(),
                    (binder) -> {
                        binder.bind(NodeRegistry.class).toInstance(mock(NodeRegistry.class));
                        binder.bind(NodeAgentClient.class).toInstance(mock(NodeAgentClient.class));
                        binder.bind(ActorRegistry.class).toInstance(mock(ActorRegistry.class));
                        binder.bind(TaskEventStore.class).toInstance(mock(TaskEventStore.class));
                        binder.bind(JobRegistry.class).toInstance(mock(JobRegistry.class));
                    })
                .initialize()) {
            LogApplication application = embed.getInjector().getInstance(LogApplication.class);
            LogResource resource = embed.getInjector().getInstance(LogResource.class);

            assertThat(application.getSingletons(), hasItem(resource));
            assertThat(application.getSingletons(), hasItem(instanceOf(JacksonJsonProvider.class)));
            assertThat(application.getSingletons().size(), is(2 + ServerModule.exceptionHandlers().size()));
        }
    }
}
