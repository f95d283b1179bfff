package com.ledgerly.core.global.jpa;

import java.time.Clock;
import java.util.UUID;

import com.ledgerly.core.modules.lifecycle.domain.UserOwned;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * 특정 사용자에게 속하는 엔터티. 소유자가 없으면 전역(공유) 엔터티로 취급한다.
 */
@MappedSuperclass
public abstract class AbstractOwnedEntity extends AbstractLifecycleEntity implements UserOwned {

    @Column(name = "owner_id", columnDefinition = "uuid")
    private UUID ownerId;

    protected AbstractOwnedEntity() {
        super();
    }

    protected AbstractOwnedEntity(Clock clock) {
        super(clock);
    }

    @Override
    public UUID getOwnerId() {
        return ownerId;
    }

    @Override
    public void setOwnerId(UUID ownerId) {
        this.ownerId = ownerId;
    }
}
