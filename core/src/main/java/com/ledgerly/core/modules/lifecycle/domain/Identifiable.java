package com.ledgerly.core.modules.lifecycle.domain;

import java.util.UUID;

public interface Identifiable {

    UUID getId();
}
