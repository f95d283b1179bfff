package com.ledgerly.core.modules.lifecycle.domain;

public enum EntityCapability {
    IDENTITY(Identifiable.class),
    SOFT_DELETE(SoftDeletable.class),
    AUDIT(Auditable.class),
    USER_TRACKING(UserTracked.class),
    OWNERSHIP(UserOwned.class);

    private final Class<?> contract;

    EntityCapability(Class<?> contract) {
        this.contract = contract;
    }

    public Class<?> contract() {
        return contract;
    }

    public boolean isSupportedBy(Object entity) {
        return contract.isInstance(entity);
    }
}
