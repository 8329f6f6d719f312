package io.nodelog.spi;

import com.google.common.base.Optional;
import org.immutables.value.Value;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Where an actor currently runs. Both fields are absent until the actor is scheduled.
 * Only the latest worker is known; workers of earlier restarts are not tracked.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableActorPlacement.class)
@JsonDeserialize(as = ImmutableActorPlacement.class)
public interface ActorPlacement
{
    Optional<String> getWorkerId();

    Optional<NodeId> getNodeId();

    static ImmutableActorPlacement.Builder builder()
    {
        return ImmutableActorPlacement.builder();
    }
}
