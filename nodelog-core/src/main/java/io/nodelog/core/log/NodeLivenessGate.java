package io.nodelog.core.log;

import com.google.inject.Inject;
import io.nodelog.spi.NodeId;
import io.nodelog.spi.NodeRegistry;
import io.nodelog.spi.NodeUnavailableException;

public class NodeLivenessGate
{
    private final NodeRegistry nodeRegistry;

    @Inject
    public NodeLivenessGate(NodeRegistry nodeRegistry)
    {
        this.nodeRegistry = nodeRegistry;
    }

    /**
     * Ensures that the agent of a node is registered and alive before it is called.
     *
     * @throws NodeUnavailableException if the node is not in the registry
     */
    public void verify(NodeId nodeId)
    {
        if (!nodeRegistry.getAliveAgentIds().contains(nodeId)) {
            throw new NodeUnavailableException(
                    "Given node id " + nodeId + " is not available. " +
                    "Either the node is dead or it is not registered yet. " +
                    "List the nodes of the cluster to check the node status. " +
                    "If the node is registered, this is likely a transient issue; try again.");
        }
    }
}
