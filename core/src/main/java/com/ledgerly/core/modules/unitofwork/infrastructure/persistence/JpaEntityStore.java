package com.ledgerly.core.modules.unitofwork.infrastructure.persistence;

import java.util.Set;

import com.ledgerly.core.modules.unitofwork.application.EntityStore;

import jakarta.persistence.EntityManager;
import jakarta.persistence.metamodel.ManagedType;

import org.hibernate.engine.spi.EntityEntry;
import org.hibernate.engine.spi.SessionImplementor;
import org.springframework.beans.PropertyAccessor;
import org.springframework.beans.PropertyAccessorFactory;

/**
 * {@link EntityStore} over a Jakarta Persistence {@link EntityManager}. Callers provide the transaction.
 * <p>
 * Excluded properties are reset to the state Hibernate loaded for the managed instance, so dirty checking
 * writes no new value for them whatever the column mapping allows.
 */
public class JpaEntityStore implements EntityStore {

    private final EntityManager entityManager;

    public JpaEntityStore(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    @Override
    public void persist(Object entity) {
        entityManager.persist(entity);
    }

    @Override
    public void merge(Object entity, Set<String> excludedProperties) {
        Object managed = entityManager.contains(entity) ? entity : entityManager.merge(entity);
        if (!excludedProperties.isEmpty()) {
            restoreLoadedValues(managed, excludedProperties);
        }
    }

    @Override
    public void remove(Object entity) {
        Object managed = entityManager.contains(entity) ? entity : entityManager.merge(entity);
        entityManager.remove(managed);
    }

    @Override
    public void flush() {
        entityManager.flush();
    }

    private void restoreLoadedValues(Object managed, Set<String> properties) {
        EntityEntry entry = entityManager.unwrap(SessionImplementor.class)
                .getPersistenceContextInternal()
                .getEntry(managed);
        if (entry == null || entry.getLoadedState() == null) {
            return;
        }
        ManagedType<?> type = entityManager.getMetamodel().managedType(managed.getClass());
        PropertyAccessor accessor = PropertyAccessorFactory.forDirectFieldAccess(managed);
        for (String property : properties) {
            if (type.getAttributes().stream().anyMatch(attribute -> attribute.getName().equals(property))) {
                accessor.setPropertyValue(property, entry.getLoadedValue(property));
            }
        }
    }
}
