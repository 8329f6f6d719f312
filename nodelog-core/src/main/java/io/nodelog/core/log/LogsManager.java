package io.nodelog.core.log;

import java.io.IOException;
import java.time.Duration;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nodelog.spi.NodeId;
import io.nodelog.spi.NodeRegistry;

/**
 * Entry point for listing, resolving and streaming log files of cluster nodes.
 */
public class LogsManager
{
    private final NodeRegistry nodeRegistry;
    private final LogLister lister;
    private final FilenameResolver resolver;
    private final LogStreamer streamer;
    private final LogConfig config;

    @Inject
    public LogsManager(
            NodeRegistry nodeRegistry,
            LogLister lister,
            FilenameResolver resolver,
            LogStreamer streamer,
            LogConfig config)
    {
        this.nodeRegistry = nodeRegistry;
        this.lister = lister;
        this.resolver = resolver;
        this.streamer = streamer;
        this.config = config;
    }

    public LogConfig getConfig()
    {
        return config;
    }

    public LogCategoryIndex listLogs(NodeId nodeId, Optional<Duration> timeout, Optional<String> glob)
        throws IOException
    {
        return lister.listLogs(nodeId,
                glob.or(LogLister.DEFAULT_GLOB),
                timeout.or(config.getRpcTimeout()));
    }

    public ResolvedLog resolveFilename(LogRequest request)
        throws LogFileNotFoundException, IOException
    {
        return resolver.resolve(withNodeId(request));
    }

    /**
     * Resolves the requested file and opens a stream of it. The caller must
     * close the returned stream.
     */
    public LogStream streamLogs(LogRequest request)
        throws LogFileNotFoundException, IOException
    {
        LogRequest resolvedRequest = withNodeId(request);
        ResolvedLog log = resolver.resolve(resolvedRequest);
        return streamer.stream(log, resolvedRequest, resolvedRequest.getFollow());
    }

    /**
     * Returns the id of the alive node that has the given address.
     */
    public Optional<NodeId> ipToNodeId(String nodeIp)
    {
        return nodeRegistry.ipToNodeId(nodeIp);
    }

    /**
     * Returns the node id if given, otherwise looks it up by the node ip.
     */
    public Optional<NodeId> resolveNodeId(Optional<NodeId> nodeId, Optional<String> nodeIp)
    {
        if (nodeId.isPresent()) {
            return nodeId;
        }
        if (nodeIp.isPresent() && !nodeIp.get().isEmpty()) {
            return ipToNodeId(nodeIp.get());
        }
        return Optional.absent();
    }

    private LogRequest withNodeId(LogRequest request)
    {
        if (request.getNodeId().isPresent() || !request.getNodeIp().isPresent()) {
            return request;
        }
        Optional<NodeId> nodeId = resolveNodeId(request.getNodeId(), request.getNodeIp());
        if (!nodeId.isPresent()) {
            return request;
        }
        return ImmutableLogRequest.builder()
            .from(request)
            .nodeId(nodeId.get())
            .build();
    }
}
