package io.nodelog.spi;

public class RemoteTimeoutException
        extends RuntimeException
{
    public RemoteTimeoutException(String message)
    {
        super(message);
    }

    public RemoteTimeoutException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
