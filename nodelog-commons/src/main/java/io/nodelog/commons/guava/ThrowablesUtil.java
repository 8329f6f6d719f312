package io.nodelog.commons.guava;

import com.google.common.base.Throwables;

import java.util.concurrent.ExecutionException;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows an unchecked throwable as is, or wraps a checked one in a RuntimeException.
     * Declared to return RuntimeException so that callers can write {@code throw propagate(ex)}.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }

    /**
     * Returns the exception thrown by the task of a failed future.
     * Falls back to the ExecutionException itself if it carries no cause.
     */
    public static Throwable unwrap(ExecutionException ex)
    {
        return ex.getCause() != null ? ex.getCause() : ex;
    }
}
