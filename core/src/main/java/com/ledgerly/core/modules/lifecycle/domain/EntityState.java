package com.ledgerly.core.modules.lifecycle.domain;

import java.util.Optional;

/**
 * Lifecycle states shared by every lifecycle-aware entity.
 * The integer tag documents the conventional ordering only; nothing compares tags.
 */
public enum EntityState {
    CREATED(0, "Created but not yet active"),
    INACTIVE(1, "Temporarily inactive"),
    ACTIVE(2, "Active and available"),
    EFFECTIVE(3, "Effective and operational"),
    TERMINATED(4, "Soft deleted/terminated");

    private final int tag;
    private final String description;

    EntityState(int tag, String description) {
        this.tag = tag;
        this.description = description;
    }

    public int tag() {
        return tag;
    }

    public String description() {
        return description;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    public boolean isTerminated() {
        return this == TERMINATED;
    }

    public static Optional<EntityState> fromTag(int tag) {
        for (EntityState state : values()) {
            if (state.tag == tag) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
