package com.ledgerly.core.modules.lifecycle.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Capability of entities scoped to an owning actor. A {@code null} owner marks the entity as global.
 */
public interface UserOwned {

    UUID getOwnerId();

    void setOwnerId(UUID ownerId);

    /**
     * @return {@code true} when the entity is global or owned by {@code actorId}; a {@code null} actor only
     * matches global entities
     */
    default boolean isOwnedBy(UUID actorId) {
        UUID ownerId = getOwnerId();
        return ownerId == null || Objects.equals(ownerId, actorId);
    }

    default boolean isGlobal() {
        return getOwnerId() == null;
    }
}
