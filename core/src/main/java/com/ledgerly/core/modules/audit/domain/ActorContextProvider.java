package com.ledgerly.core.modules.audit.domain;

@FunctionalInterface
public interface ActorContextProvider {

    ActorContext currentActor();
}
