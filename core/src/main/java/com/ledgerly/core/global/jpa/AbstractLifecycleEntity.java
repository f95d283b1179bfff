package com.ledgerly.core.global.jpa;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.ledgerly.core.global.common.time.UtcTimestamps;
import com.ledgerly.core.global.error.Result;
import com.ledgerly.core.modules.lifecycle.domain.Auditable;
import com.ledgerly.core.modules.lifecycle.domain.CommittedCreation;
import com.ledgerly.core.modules.lifecycle.domain.EntityLifecycle;
import com.ledgerly.core.modules.lifecycle.domain.EntityState;
import com.ledgerly.core.modules.lifecycle.domain.Identifiable;
import com.ledgerly.core.modules.lifecycle.domain.LifecycleEvent;
import com.ledgerly.core.modules.lifecycle.domain.SoftDeletable;
import com.ledgerly.core.modules.lifecycle.domain.StateTransition;
import com.ledgerly.core.modules.lifecycle.domain.UserTracked;

import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;

/**
 * 식별자, 생성/수정 시각, 작성자/수정자, 수명 주기 상태를 공통으로 제공하는 추상 엔터티.
 * <p>
 * The id is assigned on construction and {@code createdAt == updatedAt} until the first commit, when
 * {@link com.ledgerly.core.modules.audit.application.AuditEnforcementPolicy} stamps them. New instances start
 * {@link EntityState#ACTIVE}. {@code created_at} and {@code created_by} are mapped non-updatable; the values loaded or inserted last are
 * kept as the committed creation snapshot.
 */
@MappedSuperclass
public abstract class AbstractLifecycleEntity implements Identifiable, Auditable, UserTracked, SoftDeletable,
        CommittedCreation {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private EntityState state = EntityState.ACTIVE;

    @Column(name = "created_by", updatable = false, columnDefinition = "uuid")
    private UUID createdBy;

    @Column(name = "updated_by", columnDefinition = "uuid")
    private UUID updatedBy;

    @Transient
    private boolean creationCommitted;

    @Transient
    private OffsetDateTime committedCreatedAt;

    @Transient
    private UUID committedCreatedBy;

    protected AbstractLifecycleEntity() {
        this(Clock.systemUTC());
    }

    protected AbstractLifecycleEntity(Clock clock) {
        OffsetDateTime now = UtcTimestamps.now(clock);
        this.id = UUID.randomUUID();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    @Override
    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public EntityState getState() {
        return state;
    }

    @Override
    public void setState(EntityState state) {
        this.state = state;
    }

    @Override
    public UUID getCreatedBy() {
        return createdBy;
    }

    @Override
    public void setCreatedBy(UUID createdBy) {
        this.createdBy = createdBy;
    }

    @Override
    public UUID getUpdatedBy() {
        return updatedBy;
    }

    @Override
    public void setUpdatedBy(UUID updatedBy) {
        this.updatedBy = updatedBy;
    }

    @Override
    public boolean hasCommittedCreation() {
        return creationCommitted;
    }

    @Override
    public OffsetDateTime getCommittedCreatedAt() {
        return committedCreatedAt;
    }

    @Override
    public UUID getCommittedCreatedBy() {
        return committedCreatedBy;
    }

    @Override
    public void recordCommittedCreation(OffsetDateTime createdAt, UUID createdBy) {
        this.committedCreatedAt = createdAt;
        this.committedCreatedBy = createdBy;
        this.creationCommitted = true;
    }

    @PostLoad
    @PostPersist
    protected void captureCommittedCreation() {
        recordCommittedCreation(createdAt, createdBy);
    }

    public void softDelete() {
        softDelete(Clock.systemUTC());
    }

    public void softDelete(Clock clock) {
        EntityLifecycle.softDelete(this, clock);
    }

    public void restore() {
        restore(Clock.systemUTC());
    }

    public void restore(Clock clock) {
        EntityLifecycle.restore(this, clock);
    }

    public void activate() {
        activate(Clock.systemUTC());
    }

    public void activate(Clock clock) {
        EntityLifecycle.activate(this, clock);
    }

    public void deactivate() {
        deactivate(Clock.systemUTC());
    }

    public void deactivate(Clock clock) {
        EntityLifecycle.deactivate(this, clock);
    }

    public Result<StateTransition> apply(LifecycleEvent event) {
        return apply(event, Clock.systemUTC());
    }

    public Result<StateTransition> apply(LifecycleEvent event, Clock clock) {
        return EntityLifecycle.apply(this, event, clock);
    }
}
