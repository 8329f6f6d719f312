package io.nodelog.spi;

import com.google.common.base.Optional;

public interface ActorRegistry
{
    Optional<ActorPlacement> getActor(String actorId);
}
