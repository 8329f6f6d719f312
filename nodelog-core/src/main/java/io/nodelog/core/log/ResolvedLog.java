package io.nodelog.core.log;

import io.nodelog.spi.NodeId;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
public interface ResolvedLog
{
    NodeId getNodeId();

    String getFileName();

    @Value.Check
    default void check()
    {
        checkState(!getFileName().isEmpty(), "file name must not be empty");
    }

    static ResolvedLog of(NodeId nodeId, String fileName)
    {
        return ImmutableResolvedLog.builder()
            .nodeId(nodeId)
            .fileName(fileName)
            .build();
    }
}
