package io.nodelog.spi;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Calls to the log agent that runs on each node.
 */
public interface NodeAgentClient
{
    /**
     * Lists names of the log files on a node that match a glob pattern.
     * Implementations should give up after timeout; callers enforce the timeout as well.
     */
    List<String> listFiles(NodeId nodeId, String glob, Duration timeout)
        throws IOException;

    /**
     * Opens a stream of the contents of a log file.
     * The returned source holds a connection to the agent until it is closed.
     */
    LogChunkSource openStream(NodeId nodeId, StreamLogRequest request)
        throws IOException;
}
