package com.ledgerly.core.modules.audit.domain;

public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE
}
