package io.nodelog.commons.guava;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class ThrowablesUtilTest
{
    @Test
    public void propagateRethrowsUncheckedAsIs()
    {
        IllegalStateException cause = new IllegalStateException("test");
        IllegalStateException thrown = Assert.assertThrows(IllegalStateException.class, () -> ThrowablesUtil.propagate(cause));
        assertThat(thrown, is(sameInstance(cause)));

        Assert.assertThrows(AssertionError.class, () -> ThrowablesUtil.propagate(new AssertionError("test")));
        Assert.assertThrows(NullPointerException.class, () -> ThrowablesUtil.propagate(null));
    }

    @Test
    public void propagateWrapsChecked()
    {
        IOException cause = new IOException("test");
        RuntimeException thrown = Assert.assertThrows(RuntimeException.class, () -> ThrowablesUtil.propagate(cause));
        assertThat(thrown.getCause(), is(sameInstance(cause)));
    }

    @Test
    public void propagateIfInstanceOf()
    {
        // null and unrelated types are ignored
        ThrowablesUtil.propagateIfInstanceOf(null, RuntimeException.class);
        ThrowablesUtil.propagateIfInstanceOf(new NullPointerException("test"), Error.class);

        Assert.assertThrows(NullPointerException.class, () -> ThrowablesUtil.propagateIfInstanceOf(new NullPointerException("test"), RuntimeException.class));
    }

    @Test
    public void unwrapReturnsCause()
    {
        IOException cause = new IOException("test");
        assertThat(ThrowablesUtil.unwrap(new ExecutionException(cause)), is(sameInstance(cause)));

        ExecutionException noCause = new ExecutionException("no cause", null);
        assertThat(ThrowablesUtil.unwrap(noCause), instanceOf(ExecutionException.class));
    }
}
