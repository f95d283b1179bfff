package com.ledgerly.core.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.ledgerly.core.global.common.time.UtcTimestamps;
import com.ledgerly.core.global.config.LedgerlyAuditProperties;
import com.ledgerly.core.global.config.LedgerlyAuditProperties.ActorResolutionFailure;
import com.ledgerly.core.modules.audit.domain.ActorContext;
import com.ledgerly.core.modules.audit.domain.AuditAction;
import com.ledgerly.core.modules.audit.domain.AuditReport;
import com.ledgerly.core.modules.audit.domain.AuditedChange;
import com.ledgerly.core.modules.audit.domain.ChangeKind;
import com.ledgerly.core.modules.audit.domain.ChangeSet;
import com.ledgerly.core.modules.audit.domain.TrackedChange;
import com.ledgerly.core.modules.lifecycle.domain.Auditable;
import com.ledgerly.core.modules.lifecycle.domain.CommittedCreation;
import com.ledgerly.core.modules.lifecycle.domain.EntityState;
import com.ledgerly.core.modules.lifecycle.domain.SoftDeletable;
import com.ledgerly.core.modules.lifecycle.domain.UserTracked;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stamps audit fields on every pending write of a change set and turns deletes of soft-deletable entities into
 * {@link EntityState#TERMINATED} updates. Must run exactly once before each physical commit.
 * <ul>
 *     <li>INSERT: {@code createdAt = updatedAt = now}, and {@code createdBy = updatedBy = actor} when known. The
 *     stamped values become the {@link CommittedCreation} snapshot.</li>
 *     <li>UPDATE: {@code updatedAt = now}, {@code updatedBy = actor} when known; {@code createdAt} and
 *     {@code createdBy} are restored to their originals and excluded from the write. Originals come from the
 *     entity's committed snapshot, or from the values seen at registration when it has none.</li>
 *     <li>DELETE of a {@link SoftDeletable}: converted to an UPDATE with state {@code TERMINATED}. Other deletes
 *     pass through untouched.</li>
 * </ul>
 * Assignments are unconditional, so running the policy again on a retried change set yields the same fields
 * apart from the timestamp.
 */
public class AuditEnforcementPolicy {

    private static final Logger log = LoggerFactory.getLogger(AuditEnforcementPolicy.class);

    private final Clock clock;
    private final LedgerlyAuditProperties properties;

    public AuditEnforcementPolicy(Clock clock, LedgerlyAuditProperties properties) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public AuditReport enforce(ChangeSet changeSet, ActorContext actor) {
        Objects.requireNonNull(changeSet, "changeSet must not be null");
        UUID actorId = resolveActorId(actor).orElse(null);
        OffsetDateTime now = UtcTimestamps.now(clock);

        List<AuditedChange> audited = new ArrayList<>();
        for (TrackedChange change : changeSet.changes()) {
            ChangeKind requested = change.kind();
            AuditAction action = switch (requested) {
                case INSERT -> stampCreation(change.entity(), actorId, now);
                case UPDATE -> stampModification(change, actorId, now);
                case DELETE -> redirectDelete(change, actorId, now);
            };
            log.debug("audit {} {} -> {}", requested, change.entity().getClass().getSimpleName(), action);
            audited.add(new AuditedChange(change.entity(), requested, action));
        }
        return new AuditReport(actorId, now, audited);
    }

    private Optional<UUID> resolveActorId(ActorContext actor) {
        if (actor == null) {
            return Optional.empty();
        }
        try {
            Optional<UUID> actorId = actor.actorId();
            return actorId == null ? Optional.empty() : actorId;
        } catch (RuntimeException ex) {
            if (properties.actorResolutionFailure() == ActorResolutionFailure.PROPAGATE) {
                throw ex;
            }
            log.warn("Actor resolution failed, auditing without an actor: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private AuditAction stampCreation(Object entity, UUID actorId, OffsetDateTime now) {
        boolean stamped = false;
        if (entity instanceof Auditable auditable) {
            auditable.setCreatedAt(now);
            auditable.setUpdatedAt(now);
            stamped = true;
        }
        if (entity instanceof UserTracked tracked) {
            if (actorId != null) {
                tracked.setCreatedBy(actorId);
                tracked.setUpdatedBy(actorId);
            }
            stamped = true;
        }
        if (entity instanceof CommittedCreation committed) {
            committed.recordCommittedCreation(
                    entity instanceof Auditable auditable ? auditable.getCreatedAt() : null,
                    entity instanceof UserTracked tracked ? tracked.getCreatedBy() : null);
        }
        return stamped ? AuditAction.STAMPED_CREATION : AuditAction.SKIPPED;
    }

    private AuditAction stampModification(TrackedChange change, UUID actorId, OffsetDateTime now) {
        Object entity = change.entity();
        boolean stamped = false;
        if (entity instanceof Auditable auditable) {
            auditable.setUpdatedAt(now);
            if (change.hasOriginalValue(Auditable.CREATED_AT)) {
                auditable.setCreatedAt((OffsetDateTime) change.originalValue(Auditable.CREATED_AT));
            }
            change.excludeFromPersistence(Auditable.CREATED_AT);
            stamped = true;
        }
        if (entity instanceof UserTracked tracked) {
            if (actorId != null) {
                tracked.setUpdatedBy(actorId);
            }
            if (change.hasOriginalValue(UserTracked.CREATED_BY)) {
                tracked.setCreatedBy((UUID) change.originalValue(UserTracked.CREATED_BY));
            }
            change.excludeFromPersistence(UserTracked.CREATED_BY);
            stamped = true;
        }
        return stamped ? AuditAction.STAMPED_MODIFICATION : AuditAction.SKIPPED;
    }

    private AuditAction redirectDelete(TrackedChange change, UUID actorId, OffsetDateTime now) {
        if (!properties.softDeleteEnabled() || !(change.entity() instanceof SoftDeletable softDeletable)) {
            return AuditAction.HARD_DELETE;
        }
        change.markModified();
        softDeletable.setState(EntityState.TERMINATED);
        stampModification(change, actorId, now);
        return AuditAction.SOFT_DELETED;
    }
}
