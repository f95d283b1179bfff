package com.ledgerly.core.modules.audit.domain;

import java.util.List;

/**
 * Pending writes of one commit attempt, in a stable order.
 */
public interface ChangeSet {

    List<? extends TrackedChange> changes();
}
