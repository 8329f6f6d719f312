package io.nodelog.core.log;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import com.google.inject.Inject;
import io.nodelog.spi.NodeAgentClient;
import io.nodelog.spi.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LogLister
{
    private static final Logger logger = LoggerFactory.getLogger(LogLister.class);

    public static final String DEFAULT_GLOB = "*";

    private final NodeLivenessGate livenessGate;
    private final NodeAgentClient agentClient;
    private final RemoteCallExecutor remoteCalls;

    @Inject
    public LogLister(NodeLivenessGate livenessGate, NodeAgentClient agentClient, RemoteCallExecutor remoteCalls)
    {
        this.livenessGate = livenessGate;
        this.agentClient = agentClient;
        this.remoteCalls = remoteCalls;
    }

    /**
     * Lists the log files on a node that match a glob, grouped by category.
     *
     * @throws io.nodelog.spi.NodeUnavailableException if the node is not alive
     * @throws io.nodelog.spi.RemoteTimeoutException if the agent does not answer within timeout
     */
    public LogCategoryIndex listLogs(NodeId nodeId, String glob, Duration timeout)
        throws IOException
    {
        livenessGate.verify(nodeId);

        logger.debug("Listing log files on node {} matching {}", nodeId, glob);
        List<String> fileNames = remoteCalls.call(
                () -> agentClient.listFiles(nodeId, glob, timeout),
                timeout,
                "Listing log files on node " + nodeId);

        return LogFiles.categorize(fileNames);
    }
}
