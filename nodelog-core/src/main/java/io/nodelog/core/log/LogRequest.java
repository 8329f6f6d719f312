package io.nodelog.core.log;

import java.time.Duration;
import com.google.common.base.Optional;
import io.nodelog.spi.NodeId;
import org.immutables.value.Value;

/**
 * A request to resolve, and optionally stream, one log file.
 */
@Value.Immutable
public interface LogRequest
{
    LogIdentifier getIdentifier();

    Optional<NodeId> getNodeId();

    // used to look up the node id when getNodeId() is absent
    Optional<String> getNodeIp();

    // extension of worker log files to match; the configured default applies when absent
    Optional<String> getSuffix();

    Optional<Integer> getLines();

    Optional<Duration> getInterval();

    Optional<Duration> getTimeout();

    @Value.Default
    default boolean getFollow()
    {
        return false;
    }

    static ImmutableLogRequest.Builder builder()
    {
        return ImmutableLogRequest.builder();
    }
}
