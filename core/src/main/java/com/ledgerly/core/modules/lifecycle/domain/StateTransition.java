package com.ledgerly.core.modules.lifecycle.domain;

public record StateTransition(EntityState from, LifecycleEvent event, EntityState to) {
}
