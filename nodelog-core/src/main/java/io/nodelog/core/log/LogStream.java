package io.nodelog.core.log;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import com.google.common.base.Optional;
import io.nodelog.spi.LogChunkSource;
import io.nodelog.spi.RemoteTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chunks of one log file pulled from a node agent.
 *
 * Each call to {@link #hasNext()} blocks until the agent sends the next chunk
 * or closes the stream. When the stream has a deadline, every pull waits only
 * for the time remaining until the deadline and fails with
 * {@link RemoteTimeoutException} after it. Closing the stream releases the
 * agent connection and ends iteration; closing twice is a no-op.
 */
public class LogStream
        implements Iterator<byte[]>, Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(LogStream.class);

    private final ResolvedLog log;
    private final LogChunkSource source;
    private final Optional<RemoteCallExecutor> remoteCalls;
    private final long deadlineNanos;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private byte[] next;
    private boolean finished;

    static LogStream following(ResolvedLog log, LogChunkSource source)
    {
        return new LogStream(log, source, Optional.absent(), 0L);
    }

    static LogStream bounded(ResolvedLog log, LogChunkSource source, RemoteCallExecutor remoteCalls, long deadlineNanos)
    {
        return new LogStream(log, source, Optional.of(remoteCalls), deadlineNanos);
    }

    private LogStream(ResolvedLog log, LogChunkSource source, Optional<RemoteCallExecutor> remoteCalls, long deadlineNanos)
    {
        this.log = log;
        this.source = source;
        this.remoteCalls = remoteCalls;
        this.deadlineNanos = deadlineNanos;
    }

    public ResolvedLog getLog()
    {
        return log;
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    @Override
    public boolean hasNext()
    {
        if (next != null) {
            return true;
        }
        if (finished || closed.get()) {
            return false;
        }

        Optional<byte[]> chunk;
        try {
            chunk = pull();
        }
        catch (IOException ex) {
            if (closed.get()) {
                // closed by another thread while reading
                finished = true;
                return false;
            }
            closeQuietly();
            throw new LogStreamException("Failed to read " + log.getFileName() + " on node " + log.getNodeId(), ex);
        }
        catch (RuntimeException ex) {
            closeQuietly();
            throw ex;
        }

        if (!chunk.isPresent()) {
            finished = true;
            close();
            return false;
        }
        next = chunk.get();
        return true;
    }

    @Override
    public byte[] next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        byte[] chunk = next;
        next = null;
        return chunk;
    }

    private Optional<byte[]> pull()
        throws IOException
    {
        if (!remoteCalls.isPresent()) {
            return source.read();
        }
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new RemoteTimeoutException("Streaming " + log.getFileName() + " on node " + log.getNodeId() + " exceeded its deadline");
        }
        Future<Optional<byte[]>> read = remoteCalls.get().submit(source::read);
        return remoteCalls.get().await(read, remaining,
                "Streaming " + log.getFileName() + " on node " + log.getNodeId());
    }

    private void closeQuietly()
    {
        if (closed.compareAndSet(false, true)) {
            closeSource();
        }
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Closing log stream of {} on node {}", log.getFileName(), log.getNodeId());
            closeSource();
        }
    }

    private void closeSource()
    {
        try {
            source.close();
        }
        catch (IOException ex) {
            logger.warn("Failed to close log stream of {} on node {}", log.getFileName(), log.getNodeId(), ex);
        }
    }
}
