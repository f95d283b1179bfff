package com.ledgerly.core.modules.audit.domain;

/**
 * One pending write inside a {@link ChangeSet}.
 */
public interface TrackedChange {

    Object entity();

    ChangeKind kind();

    /**
     * Cancels a pending physical delete and schedules the entity as an update instead.
     */
    void markModified();

    /**
     * Keeps {@code property} out of the write issued for this commit.
     */
    void excludeFromPersistence(String property);

    /**
     * Whether the change set recorded the value {@code property} had when the entity was registered.
     */
    boolean hasOriginalValue(String property);

    /**
     * Recorded value of {@code property}, possibly {@code null}; only meaningful when
     * {@link #hasOriginalValue(String)} is {@code true}.
     */
    Object originalValue(String property);
}
