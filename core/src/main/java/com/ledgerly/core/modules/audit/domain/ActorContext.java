package com.ledgerly.core.modules.audit.domain;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * The identity a write is attributed to.
 */
public interface ActorContext {

    Optional<UUID> actorId();

    Optional<String> actorName();

    Optional<String> actorEmail();

    boolean isAuthenticated();

    CompletableFuture<Boolean> hasRole(String roleName);

    static ActorContext anonymous() {
        return ResolvedActor.ANONYMOUS;
    }

    static ActorContext of(UUID actorId) {
        return new ResolvedActor(actorId, null, null, Set.of());
    }
}
