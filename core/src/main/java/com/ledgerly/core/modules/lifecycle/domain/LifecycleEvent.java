package com.ledgerly.core.modules.lifecycle.domain;

public enum LifecycleEvent {
    ACTIVATE,
    DEACTIVATE,
    REACTIVATE,
    PROMOTE,
    DEMOTE,
    SOFT_DELETE,
    RESTORE
}
