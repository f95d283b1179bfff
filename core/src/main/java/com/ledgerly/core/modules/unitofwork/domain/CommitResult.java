package com.ledgerly.core.modules.unitofwork.domain;

import com.ledgerly.core.modules.audit.domain.AuditReport;

public record CommitResult(AuditReport auditReport, int persisted, int merged, int removed) {

    public int total() {
        return persisted + merged + removed;
    }
}
