package com.ledgerly.core.modules.audit.domain;

public record AuditedChange(Object entity, ChangeKind requestedKind, AuditAction action) {
}
