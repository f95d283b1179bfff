package com.ledgerly.core.modules.unitofwork.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.ledgerly.core.modules.audit.domain.ChangeKind;
import com.ledgerly.core.modules.audit.domain.ChangeSet;

/**
 * Ordered, identity-based set of pending writes. Not thread-safe; one unit of work belongs to one writer.
 * <p>
 * Forged {@code createdAt} and {@code createdBy} values are reverted at commit time from the entity's
 * {@link com.ledgerly.core.modules.lifecycle.domain.CommittedCreation} snapshot. Entities without one fall back to
 * the values seen when they were registered.
 * <p>
 * Re-registering the same instance:
 * <ul>
 *     <li>new, then modified: stays new</li>
 *     <li>new, then deleted: dropped, nothing was ever written</li>
 *     <li>modified, then deleted: deleted</li>
 *     <li>deleted, then modified: stays deleted</li>
 * </ul>
 */
public class UnitOfWork implements ChangeSet {

    private final List<UnitOfWorkEntry> entries = new ArrayList<>();

    public void registerNew(Object entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        Optional<UnitOfWorkEntry> existing = find(entity);
        if (existing.isPresent()) {
            if (existing.get().kind() != ChangeKind.INSERT) {
                throw new IllegalStateException("Entity is already tracked as " + existing.get().kind());
            }
            return;
        }
        entries.add(new UnitOfWorkEntry(entity, ChangeKind.INSERT));
    }

    public void registerModified(Object entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        if (find(entity).isPresent()) {
            return;
        }
        entries.add(new UnitOfWorkEntry(entity, ChangeKind.UPDATE));
    }

    public void registerDeleted(Object entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        Optional<UnitOfWorkEntry> existing = find(entity);
        if (existing.isEmpty()) {
            entries.add(new UnitOfWorkEntry(entity, ChangeKind.DELETE));
            return;
        }
        UnitOfWorkEntry entry = existing.get();
        if (entry.kind() == ChangeKind.INSERT) {
            entries.remove(entry);
        } else {
            entry.changeKind(ChangeKind.DELETE);
        }
    }

    @Override
    public List<UnitOfWorkEntry> changes() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private Optional<UnitOfWorkEntry> find(Object entity) {
        for (UnitOfWorkEntry entry : entries) {
            if (entry.entity() == entity) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
