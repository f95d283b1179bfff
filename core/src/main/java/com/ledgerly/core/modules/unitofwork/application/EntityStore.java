package com.ledgerly.core.modules.unitofwork.application;

import java.util.Set;

/**
 * Physical write operations the unit of work delegates to.
 */
public interface EntityStore {

    void persist(Object entity);

    /**
     * Writes the entity's state, leaving the stored values of {@code excludedProperties} unchanged.
     */
    void merge(Object entity, Set<String> excludedProperties);

    void remove(Object entity);

    /**
     * Pushes pending writes to the store so that constraint failures surface before the commit returns.
     */
    void flush();
}
