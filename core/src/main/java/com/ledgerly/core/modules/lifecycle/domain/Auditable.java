package com.ledgerly.core.modules.lifecycle.domain;

import java.time.OffsetDateTime;

/**
 * Capability of entities carrying UTC creation and modification timestamps.
 */
public interface Auditable {

    String CREATED_AT = "createdAt";
    String UPDATED_AT = "updatedAt";

    OffsetDateTime getCreatedAt();

    void setCreatedAt(OffsetDateTime createdAt);

    OffsetDateTime getUpdatedAt();

    void setUpdatedAt(OffsetDateTime updatedAt);
}
