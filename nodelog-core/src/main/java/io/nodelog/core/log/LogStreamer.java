package io.nodelog.core.log;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Future;
import com.google.inject.Inject;
import io.nodelog.spi.LogChunkSource;
import io.nodelog.spi.NodeAgentClient;
import io.nodelog.spi.RemoteTimeoutException;
import io.nodelog.spi.ImmutableStreamLogRequest;
import io.nodelog.spi.StreamLogRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens streams of resolved log files.
 *
 * A following stream tails the file and has no deadline; it ends only when
 * the agent or the caller closes it. Any other stream must be opened and
 * fully read before the request timeout.
 */
public class LogStreamer
{
    private static final Logger logger = LoggerFactory.getLogger(LogStreamer.class);

    private final NodeLivenessGate livenessGate;
    private final NodeAgentClient agentClient;
    private final RemoteCallExecutor remoteCalls;
    private final LogConfig config;

    @Inject
    public LogStreamer(
            NodeLivenessGate livenessGate,
            NodeAgentClient agentClient,
            RemoteCallExecutor remoteCalls,
            LogConfig config)
    {
        this.livenessGate = livenessGate;
        this.agentClient = agentClient;
        this.remoteCalls = remoteCalls;
        this.config = config;
    }

    /**
     * @throws io.nodelog.spi.NodeUnavailableException if the node is not alive
     * @throws RemoteTimeoutException if the agent does not open the stream before the timeout
     */
    public LogStream stream(ResolvedLog log, LogRequest request, boolean follow)
        throws IOException
    {
        livenessGate.verify(log.getNodeId());

        Duration timeout = request.getTimeout().or(config.getRpcTimeout());
        StreamLogRequest streamRequest = buildStreamRequest(log, request, follow, timeout);

        logger.debug("Opening {} log stream of {} on node {}",
                follow ? "following" : "bounded", log.getFileName(), log.getNodeId());

        if (follow) {
            return LogStream.following(log, agentClient.openStream(log.getNodeId(), streamRequest));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        PendingOpen pending = new PendingOpen();
        Future<LogChunkSource> opening = remoteCalls.submit(() -> {
            LogChunkSource source = agentClient.openStream(log.getNodeId(), streamRequest);
            pending.offer(source);
            return source;
        });
        LogChunkSource source = null;
        try {
            source = remoteCalls.await(opening, deadline - System.nanoTime(),
                    "Opening " + log.getFileName() + " on node " + log.getNodeId());
        }
        finally {
            // timed out, interrupted or failed
            if (source == null) {
                pending.abandon();
            }
        }
        return LogStream.bounded(log, source, remoteCalls, deadline);
    }

    private static StreamLogRequest buildStreamRequest(ResolvedLog log, LogRequest request, boolean follow, Duration timeout)
    {
        ImmutableStreamLogRequest.Builder builder = StreamLogRequest.builder()
            .fileName(log.getFileName())
            .follow(follow)
            .lines(request.getLines())
            .interval(request.getInterval())
            .taskId(request.getIdentifier().getTaskId())
            .attemptNumber(request.getIdentifier().getAttemptNumber());
        if (!follow) {
            builder.timeout(timeout);
        }
        return builder.build();
    }

    // a source opened after its caller stopped waiting is closed here, whatever stopped the wait
    private static class PendingOpen
    {
        private LogChunkSource source;
        private boolean abandoned;

        synchronized void offer(LogChunkSource source)
            throws IOException
        {
            if (abandoned) {
                source.close();
            }
            else {
                this.source = source;
            }
        }

        synchronized void abandon()
        {
            abandoned = true;
            if (source != null) {
                try {
                    source.close();
                }
                catch (IOException ex) {
                    logger.warn("Failed to close a log stream opened after timeout", ex);
                }
                source = null;
            }
        }
    }
}
