package com.ledgerly.core.modules.audit.domain;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

public record ResolvedActor(UUID userId, String name, String email, Set<String> roles) implements ActorContext {

    static final ResolvedActor ANONYMOUS = new ResolvedActor(null, null, null, Set.of());

    public ResolvedActor {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    @Override
    public Optional<UUID> actorId() {
        return Optional.ofNullable(userId);
    }

    @Override
    public Optional<String> actorName() {
        return Optional.ofNullable(name);
    }

    @Override
    public Optional<String> actorEmail() {
        return Optional.ofNullable(email);
    }

    @Override
    public boolean isAuthenticated() {
        return userId != null;
    }

    @Override
    public CompletableFuture<Boolean> hasRole(String roleName) {
        return CompletableFuture.completedFuture(roleName != null && roles.contains(roleName));
    }
}
