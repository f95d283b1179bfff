package com.ledgerly.core.global.security;

import java.security.Principal;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.ledgerly.core.modules.audit.domain.ActorContext;
import com.ledgerly.core.modules.audit.domain.ActorContextProvider;
import com.ledgerly.core.modules.audit.domain.ResolvedActor;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the current actor from Spring Security's context.
 * Falls back to {@link ActorContext#anonymous()} when no authenticated principal is available.
 */
public class SecurityContextActorProvider implements ActorContextProvider {

    private static final String ROLE_PREFIX = "ROLE_";

    @Override
    public ActorContext currentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return ActorContext.anonymous();
        }

        Object principal = authentication.getPrincipal();
        if (principal instanceof ActorPrincipal actorPrincipal) {
            Set<String> roles = new LinkedHashSet<>(actorPrincipal.roles());
            roles.addAll(authorityRoles(authentication));
            return new ResolvedActor(actorPrincipal.userId(), actorPrincipal.loginId(), actorPrincipal.email(), roles);
        }

        if (principal instanceof Principal standardPrincipal) {
            return new ResolvedActor(parseUserId(standardPrincipal.getName()), standardPrincipal.getName(), null,
                    authorityRoles(authentication));
        }

        return new ResolvedActor(parseUserId(authentication.getName()), authentication.getName(), null,
                authorityRoles(authentication));
    }

    private static UUID parseUserId(String name) {
        if (name == null) {
            return null;
        }
        try {
            return UUID.fromString(name);
        } catch (IllegalArgumentException ignored) {
            return null;
        }
    }

    private static Set<String> authorityRoles(Authentication authentication) {
        Set<String> roles = new LinkedHashSet<>();
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            String value = authority.getAuthority();
            if (value == null) {
                continue;
            }
            roles.add(value.startsWith(ROLE_PREFIX) ? value.substring(ROLE_PREFIX.length()) : value);
        }
        return roles;
    }
}
