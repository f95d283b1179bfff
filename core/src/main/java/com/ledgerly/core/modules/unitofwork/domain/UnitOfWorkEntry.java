package com.ledgerly.core.modules.unitofwork.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.ledgerly.core.modules.audit.domain.ChangeKind;
import com.ledgerly.core.modules.audit.domain.TrackedChange;
import com.ledgerly.core.modules.lifecycle.domain.Auditable;
import com.ledgerly.core.modules.lifecycle.domain.CommittedCreation;
import com.ledgerly.core.modules.lifecycle.domain.UserTracked;

public class UnitOfWorkEntry implements TrackedChange {

    private final Object entity;
    private final Map<String, Object> originals = new HashMap<>();
    private final Set<String> excludedProperties = new LinkedHashSet<>();
    private ChangeKind kind;
    private boolean convertedFromDelete;

    UnitOfWorkEntry(Object entity, ChangeKind kind) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (kind != ChangeKind.INSERT) {
            snapshotCreationFields();
        }
    }

    @Override
    public Object entity() {
        return entity;
    }

    @Override
    public ChangeKind kind() {
        return kind;
    }

    @Override
    public void markModified() {
        if (kind == ChangeKind.DELETE) {
            convertedFromDelete = true;
        }
        kind = ChangeKind.UPDATE;
    }

    @Override
    public void excludeFromPersistence(String property) {
        excludedProperties.add(property);
    }

    /**
     * True when the entity carries a committed snapshot of {@code property} or one was taken at registration.
     */
    @Override
    public boolean hasOriginalValue(String property) {
        return committedValues().containsKey(property) || originals.containsKey(property);
    }

    @Override
    public Object originalValue(String property) {
        Map<String, Object> committed = committedValues();
        return committed.containsKey(property) ? committed.get(property) : originals.get(property);
    }

    public boolean isConvertedFromDelete() {
        return convertedFromDelete;
    }

    public Set<String> excludedProperties() {
        return Collections.unmodifiableSet(excludedProperties);
    }

    void changeKind(ChangeKind kind) {
        if (this.kind == ChangeKind.INSERT && kind != ChangeKind.INSERT) {
            snapshotCreationFields();
        }
        this.kind = kind;
    }

    private Map<String, Object> committedValues() {
        if (!(entity instanceof CommittedCreation committed) || !committed.hasCommittedCreation()) {
            return Map.of();
        }
        Map<String, Object> values = new HashMap<>();
        if (entity instanceof Auditable) {
            values.put(Auditable.CREATED_AT, committed.getCommittedCreatedAt());
        }
        if (entity instanceof UserTracked) {
            values.put(UserTracked.CREATED_BY, committed.getCommittedCreatedBy());
        }
        return values;
    }

    private void snapshotCreationFields() {
        if (entity instanceof Auditable auditable) {
            originals.putIfAbsent(Auditable.CREATED_AT, auditable.getCreatedAt());
        }
        if (entity instanceof UserTracked tracked) {
            originals.putIfAbsent(UserTracked.CREATED_BY, tracked.getCreatedBy());
        }
    }
}
