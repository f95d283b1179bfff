package com.ledgerly.core.modules.lifecycle.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Keeps the creation fields as they were last read from or stamped for the store. An update restores
 * {@code createdAt} and {@code createdBy} from here, so overwriting them before the change is registered has no
 * effect.
 */
public interface CommittedCreation {

    boolean hasCommittedCreation();

    OffsetDateTime getCommittedCreatedAt();

    UUID getCommittedCreatedBy();

    void recordCommittedCreation(OffsetDateTime createdAt, UUID createdBy);
}
