package com.ledgerly.core.modules.lifecycle.domain;

/**
 * Capability of entities whose deletion is recorded as a {@link EntityState#TERMINATED} state instead of a removal.
 */
public interface SoftDeletable {

    EntityState getState();

    void setState(EntityState state);

    default boolean isActive() {
        return getState() == EntityState.ACTIVE;
    }

    default boolean isInactive() {
        return getState() == EntityState.INACTIVE;
    }

    default boolean isTerminated() {
        return getState() == EntityState.TERMINATED;
    }
}
