package io.nodelog.spi;

import java.time.Duration;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface StreamLogRequest
{
    String getFileName();

    // keep the stream open and tail new lines
    boolean getFollow();

    // last N lines only
    Optional<Integer> getLines();

    // polling interval of the agent while following
    Optional<Duration> getInterval();

    // absent when following
    Optional<Duration> getTimeout();

    Optional<String> getTaskId();

    Optional<Integer> getAttemptNumber();

    static ImmutableStreamLogRequest.Builder builder()
    {
        return ImmutableStreamLogRequest.builder();
    }
}
