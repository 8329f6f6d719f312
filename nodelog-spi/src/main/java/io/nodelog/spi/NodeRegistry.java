package io.nodelog.spi;

import java.util.Set;
import com.google.common.base.Optional;

public interface NodeRegistry
{
    /**
     * Returns ids of the nodes whose agent is currently registered and alive.
     * The result reflects the registry at call time.
     */
    Set<NodeId> getAliveAgentIds();

    /**
     * Returns the id of the alive node that listens on the given address, if any.
     */
    Optional<NodeId> ipToNodeId(String nodeIp);
}
