package com.ledgerly.core.global.security;

import java.util.List;
import java.util.UUID;

/**
 * Principal that host applications place in the security context so writes can be attributed.
 */
public record ActorPrincipal(UUID userId, String loginId, String email, List<String> roles) {

    public ActorPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
