package io.nodelog.core.log;

/**
 * A well-formed log request could not be resolved to any log file.
 */
public class LogFileNotFoundException
        extends Exception
{
    public LogFileNotFoundException(String message)
    {
        super(message);
    }
}
