package io.nodelog.spi;

import com.google.common.base.Optional;
import org.immutables.value.Value;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@Value.Immutable
@JsonSerialize(as = ImmutableTaskAttemptEvent.class)
@JsonDeserialize(as = ImmutableTaskAttemptEvent.class)
public interface TaskAttemptEvent
{
    String getTaskId();

    int getAttemptNumber();

    Optional<String> getWorkerId();

    Optional<NodeId> getNodeId();

    static ImmutableTaskAttemptEvent.Builder builder()
    {
        return ImmutableTaskAttemptEvent.builder();
    }
}
