package io.nodelog.core.log;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.nodelog.commons.guava.ThrowablesUtil;
import io.nodelog.spi.RemoteTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Runs calls to remote collaborators on a daemon thread pool so that the
 * caller can stop waiting at a deadline.
 *
 * A call that misses its deadline is cancelled with interruption and
 * reported as {@link RemoteTimeoutException}.
 */
public class RemoteCallExecutor
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(RemoteCallExecutor.class);

    private final ExecutorService executor;

    @Inject
    public RemoteCallExecutor(LogConfig config)
    {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("remote-log-call-%d")
                .build();
        if (config.getRemoteCallThreads() > 0) {
            this.executor = Executors.newFixedThreadPool(config.getRemoteCallThreads(), threadFactory);
        }
        else {
            this.executor = Executors.newCachedThreadPool(threadFactory);
        }
    }

    public <T> Future<T> submit(Callable<T> call)
    {
        return executor.submit(call);
    }

    public <T> T call(Callable<T> call, Duration timeout, String description)
        throws IOException
    {
        return await(submit(call), timeout.toNanos(), description);
    }

    /**
     * Waits for the result of a submitted call.
     *
     * @throws RemoteTimeoutException if the call does not finish within timeoutNanos
     * @throws IOException if the call failed with an IOException
     */
    public <T> T await(Future<T> future, long timeoutNanos, String description)
        throws IOException
    {
        try {
            return future.get(Math.max(timeoutNanos, 0L), NANOSECONDS);
        }
        catch (TimeoutException ex) {
            future.cancel(true);
            throw new RemoteTimeoutException(description + " did not finish within "
                    + Duration.ofNanos(timeoutNanos).toMillis() + " ms");
        }
        catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ThrowablesUtil.propagate(ex);
        }
        catch (CancellationException ex) {
            throw new RemoteTimeoutException(description + " was cancelled", ex);
        }
        catch (ExecutionException ex) {
            Throwable cause = ThrowablesUtil.unwrap(ex);
            ThrowablesUtil.propagateIfInstanceOf(cause, IOException.class);
            throw ThrowablesUtil.propagate(cause);
        }
    }

    @Override
    public void close()
    {
        logger.debug("Shutting down remote call executor");
        executor.shutdownNow();
    }
}
