package dev.reviewgate.controller;

import dev.reviewgate.domain.enums.Role;
import dev.reviewgate.domain.valueobject.Actor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

/**
 * Turns the authenticated principal into the {@link Actor} the workflow core works with.
 * The principal name (JWT subject) is the actor id.
 */
@Component
public class ActorResolver {

    static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    public Actor resolve(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new IllegalStateException("No authenticated principal");
        }
        boolean admin = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(ADMIN_AUTHORITY::equals);
        return new Actor(authentication.getName(), admin ? Role.ADMIN : Role.MEMBER);
    }
}
