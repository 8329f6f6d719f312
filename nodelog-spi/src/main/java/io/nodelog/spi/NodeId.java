package io.nodelog.spi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static com.google.common.base.Preconditions.checkArgument;

public class NodeId
{
    @JsonCreator
    public static NodeId of(String id)
    {
        return new NodeId(id);
    }

    private final String id;

    private NodeId(String id)
    {
        checkArgument(id != null && !id.isEmpty(), "node id must not be empty");
        this.id = id;
    }

    @JsonValue
    @Override
    public String toString()
    {
        return id;
    }

    @Override
    public int hashCode()
    {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj)
    {
        if (!(obj instanceof NodeId)) {
            return false;
        }
        NodeId o = (NodeId) obj;
        return id.equals(o.id);
    }
}
