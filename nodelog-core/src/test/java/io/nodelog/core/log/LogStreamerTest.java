package io.nodelog.core.log;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import io.nodelog.spi.LogChunkSource;
import io.nodelog.spi.NodeAgentClient;
import io.nodelog.spi.NodeId;
import io.nodelog.spi.NodeRegistry;
import io.nodelog.spi.NodeUnavailableException;
import io.nodelog.spi.RemoteTimeoutException;
import io.nodelog.spi.StreamLogRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.lenient;

@RunWith(MockitoJUnitRunner.class)
public class LogStreamerTest
{
    private static final NodeId NODE = NodeId.of("node-1");
    private static final ResolvedLog LOG = ResolvedLog.of(NODE, "worker-abc123-def456-4821.out");

    @Mock NodeRegistry nodeRegistry;

    private LogConfig config;
    private FakeNodeAgentClient agent;
    private RemoteCallExecutor remoteCalls;
    private LogStreamer streamer;

    @Before
    public void setUp()
    {
        lenient().when(nodeRegistry.getAliveAgentIds()).thenReturn(ImmutableSet.of(NODE));
        config = LogConfig.defaultBuilder()
            .rpcTimeout(Duration.ofSeconds(1))
            .build();
        agent = new FakeNodeAgentClient();
        remoteCalls = new RemoteCallExecutor(config);
        streamer = newStreamer(agent);
    }

    @After
    public void tearDown()
    {
        remoteCalls.close();
    }

    private LogStreamer newStreamer(NodeAgentClient client)
    {
        return new LogStreamer(new NodeLivenessGate(nodeRegistry), client, remoteCalls, config);
    }

    private static LogRequest request(Duration timeout)
    {
        return LogRequest.builder()
            .identifier(LogIdentifier.ofFilename(LOG.getFileName()))
            .nodeId(NODE)
            .timeout(timeout)
            .build();
    }

    private static List<String> readAll(LogStream stream)
    {
        List<String> chunks = new ArrayList<>();
        while (stream.hasNext()) {
            chunks.add(new String(stream.next(), UTF_8));
        }
        return chunks;
    }

    @Test
    public void boundedStreamReadsUntilEnd()
        throws Exception
    {
        LogStream stream = streamer.stream(LOG, request(Duration.ofSeconds(5)), false);
        FakeNodeAgentClient.FakeSource source = agent.lastSource();
        source.push("line 1\n");
        source.push("line 2\n");
        source.end();

        assertThat(readAll(stream), contains("line 1\n", "line 2\n"));
        assertThat(stream.isClosed(), is(true));
        assertThat(source.isClosed(), is(true));

        StreamLogRequest sent = agent.getOpenRequests().get(0);
        assertThat(sent.getFileName(), is(LOG.getFileName()));
        assertThat(sent.getFollow(), is(false));
        assertThat(sent.getTimeout(), is(Optional.of(Duration.ofSeconds(5))));
    }

    @Test
    public void boundedStreamTimesOutAgainstSilentAgent()
        throws Exception
    {
        LogStream stream = streamer.stream(LOG, request(Duration.ofSeconds(1)), false);
        FakeNodeAgentClient.FakeSource source = agent.lastSource();

        long start = System.nanoTime();
        try {
            stream.hasNext();
            fail();
        }
        catch (RemoteTimeoutException ex) {
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(elapsedMillis, lessThan(3000L));
        }
        assertThat(stream.isClosed(), is(true));
        assertThat(source.isClosed(), is(true));
    }

    @Test
    public void boundedStreamUsesConfiguredTimeoutByDefault()
        throws Exception
    {
        LogRequest noTimeout = LogRequest.builder()
            .identifier(LogIdentifier.ofFilename(LOG.getFileName()))
            .nodeId(NODE)
            .build();
        LogStream stream = streamer.stream(LOG, noTimeout, false);

        assertThat(agent.getOpenRequests().get(0).getTimeout(), is(Optional.of(Duration.ofSeconds(1))));
        try {
            stream.hasNext();
            fail();
        }
        catch (RemoteTimeoutException ex) {
            assertThat(stream.isClosed(), is(true));
        }
    }

    @Test
    public void followStreamOutlivesTimeout()
        throws Exception
    {
        LogStream stream = streamer.stream(LOG, request(Duration.ofSeconds(1)), true);
        FakeNodeAgentClient.FakeSource source = agent.lastSource();

        StreamLogRequest sent = agent.getOpenRequests().get(0);
        assertThat(sent.getFollow(), is(true));
        assertThat(sent.getTimeout().isPresent(), is(false));

        long start = System.nanoTime();
        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(1500);
            }
            catch (InterruptedException ex) {
                return;
            }
            source.push("late line\n");
        });
        writer.start();

        assertThat(stream.hasNext(), is(true));
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), greaterThanOrEqualTo(1000L));
        assertThat(new String(stream.next(), UTF_8), is("late line\n"));
        writer.join();

        stream.close();
        assertThat(source.isClosed(), is(true));
        assertThat(stream.hasNext(), is(false));
    }

    @Test
    public void closeUnblocksPendingFollowRead()
        throws Exception
    {
        LogStream stream = streamer.stream(LOG, request(Duration.ofSeconds(1)), true);
        FakeNodeAgentClient.FakeSource source = agent.lastSource();

        CountDownLatch reading = new CountDownLatch(1);
        AtomicReference<Boolean> result = new AtomicReference<>();
        Thread reader = new Thread(() -> {
            reading.countDown();
            result.set(stream.hasNext());
        });
        reader.start();
        reading.await();
        Thread.sleep(100);

        stream.close();
        stream.close();
        reader.join(5000);

        assertThat(reader.isAlive(), is(false));
        assertThat(result.get(), is(false));
        assertThat(source.getCloseCalls(), is(1));
    }

    @Test
    public void readErrorClosesStream()
        throws Exception
    {
        AtomicBoolean closed = new AtomicBoolean(false);
        NodeAgentClient failing = new FakeNodeAgentClient()
        {
            @Override
            public LogChunkSource openStream(NodeId nodeId, StreamLogRequest request)
            {
                return new LogChunkSource()
                {
                    @Override
                    public Optional<byte[]> read()
                        throws IOException
                    {
                        throw new IOException("connection reset");
                    }

                    @Override
                    public void close()
                    {
                        closed.set(true);
                    }
                };
            }
        };

        LogStream stream = newStreamer(failing).stream(LOG, request(Duration.ofSeconds(5)), false);
        try {
            stream.hasNext();
            fail();
        }
        catch (LogStreamException ex) {
            assertThat(ex.getCause(), instanceOf(IOException.class));
        }
        assertThat(closed.get(), is(true));
        assertThat(stream.hasNext(), is(false));
    }

    @Test
    public void openTimesOut()
        throws Exception
    {
        NodeAgentClient slow = new FakeNodeAgentClient()
        {
            @Override
            public LogChunkSource openStream(NodeId nodeId, StreamLogRequest request)
            {
                try {
                    Thread.sleep(10000);
                }
                catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return super.openStream(nodeId, request);
            }
        };

        long start = System.nanoTime();
        try {
            newStreamer(slow).stream(LOG, request(Duration.ofSeconds(1)), false);
            fail();
        }
        catch (RemoteTimeoutException ex) {
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), lessThan(3000L));
        }
    }

    @Test
    public void sourceOpenedAfterCallerInterruptedIsClosed()
        throws Exception
    {
        AtomicReference<FakeNodeAgentClient.FakeSource> opened = new AtomicReference<>();
        NodeAgentClient uninterruptible = new FakeNodeAgentClient()
        {
            @Override
            public LogChunkSource openStream(NodeId nodeId, StreamLogRequest request)
            {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
                long remaining;
                while ((remaining = until - System.nanoTime()) > 0) {
                    try {
                        TimeUnit.NANOSECONDS.sleep(remaining);
                    }
                    catch (InterruptedException ignored) {
                        // keeps opening
                    }
                }
                FakeSource source = (FakeSource) super.openStream(nodeId, request);
                opened.set(source);
                return source;
            }
        };
        LogStreamer slowStreamer = newStreamer(uninterruptible);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                slowStreamer.stream(LOG, request(Duration.ofSeconds(5)), false).close();
            }
            catch (Throwable ex) {
                failure.set(ex);
            }
        });
        caller.start();
        Thread.sleep(100);
        caller.interrupt();
        caller.join(5000);

        assertThat(caller.isAlive(), is(false));
        assertThat(failure.get(), instanceOf(RuntimeException.class));
        assertThat(failure.get().getCause(), instanceOf(InterruptedException.class));

        long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while ((opened.get() == null || !opened.get().isClosed()) && System.nanoTime() < until) {
            Thread.sleep(10);
        }
        assertThat(opened.get().isClosed(), is(true));
    }

    @Test
    public void passTaskAttemptAndOptions()
        throws Exception
    {
        LogRequest taskRequest = LogRequest.builder()
            .identifier(LogIdentifier.ofTask("task-1", 2))
            .lines(100)
            .interval(Duration.ofMillis(500))
            .build();
        LogStream stream = streamer.stream(LOG, taskRequest, true);

        StreamLogRequest sent = agent.getOpenRequests().get(0);
        assertThat(sent.getTaskId(), is(Optional.of("task-1")));
        assertThat(sent.getAttemptNumber(), is(Optional.of(2)));
        assertThat(sent.getLines(), is(Optional.of(100)));
        assertThat(sent.getInterval(), is(Optional.of(Duration.ofMillis(500))));
        stream.close();
    }

    @Test(expected = NodeUnavailableException.class)
    public void deadNode()
        throws Exception
    {
        streamer.stream(ResolvedLog.of(NodeId.of("node-9"), "raylet.out"), request(Duration.ofSeconds(1)), false);
    }
}
