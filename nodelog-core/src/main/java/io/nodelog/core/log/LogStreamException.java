package io.nodelog.core.log;

public class LogStreamException
        extends RuntimeException
{
    public LogStreamException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
