package com.ledgerly.core.modules.audit.domain;

public enum AuditAction {
    STAMPED_CREATION,
    STAMPED_MODIFICATION,
    SOFT_DELETED,
    HARD_DELETE,
    SKIPPED
}
