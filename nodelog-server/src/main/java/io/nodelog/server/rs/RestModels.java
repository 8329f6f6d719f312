package io.nodelog.server.rs;

import io.nodelog.client.api.RestLogCategoryIndex;
import io.nodelog.core.log.LogCategoryIndex;
import io.nodelog.spi.NodeId;

public final class RestModels
{
    private RestModels()
    { }

    public static RestLogCategoryIndex logCategoryIndex(NodeId nodeId, LogCategoryIndex index)
    {
        return RestLogCategoryIndex.builder()
            .nodeId(nodeId.toString())
            .categories(index.toNameMap())
            .build();
    }
}
