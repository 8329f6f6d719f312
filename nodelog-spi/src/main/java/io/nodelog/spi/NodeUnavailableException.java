package io.nodelog.spi;

/**
 * A node is not registered or not alive, so its agent cannot be called.
 *
 * This exception is usually transient.
 */
public class NodeUnavailableException
        extends RuntimeException
{
    public NodeUnavailableException(String message)
    {
        super(message);
    }
}
