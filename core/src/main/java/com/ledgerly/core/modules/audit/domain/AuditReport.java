package com.ledgerly.core.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * What the audit policy did to one change set.
 *
 * @param actorId   actor the writes were attributed to, {@code null} when none was known
 * @param auditedAt timestamp written to every stamped entity
 * @param changes   one entry per change, in change-set order
 */
public record AuditReport(UUID actorId, OffsetDateTime auditedAt, List<AuditedChange> changes) {

    public AuditReport {
        changes = List.copyOf(changes);
    }

    public Optional<UUID> actor() {
        return Optional.ofNullable(actorId);
    }

    public long count(AuditAction action) {
        return changes.stream().filter(change -> change.action() == action).count();
    }
}
