package io.nodelog.spi;

import java.io.Closeable;
import java.io.IOException;
import com.google.common.base.Optional;

public interface LogChunkSource
        extends Closeable
{
    /**
     * Blocks until the next chunk is available. Returns absent when the agent
     * closed the stream. Chunks are returned in the order the file was written.
     * A concurrent {@link #close()} must unblock a pending read.
     */
    Optional<byte[]> read()
        throws IOException;

    /**
     * Releases the agent connection. Must be idempotent.
     */
    @Override
    void close()
        throws IOException;
}
