package io.nodelog.core.log;

/**
 * A log request is malformed or its fields contradict each other, or the
 * records it points to are in a state that cannot have produced a log file.
 *
 * This exception is deterministic.
 */
public class InvalidLogRequestException
        extends RuntimeException
{
    public InvalidLogRequestException(String message)
    {
        super(message);
    }
}
