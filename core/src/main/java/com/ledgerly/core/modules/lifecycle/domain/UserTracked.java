package com.ledgerly.core.modules.lifecycle.domain;

import java.util.UUID;

/**
 * Capability of entities attributing their creation and last modification to an actor.
 */
public interface UserTracked {

    String CREATED_BY = "createdBy";
    String UPDATED_BY = "updatedBy";

    UUID getCreatedBy();

    void setCreatedBy(UUID createdBy);

    UUID getUpdatedBy();

    void setUpdatedBy(UUID updatedBy);
}
