package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.Role;

/**
 * Authenticated principal as supplied by the identity provider.
 */
public record Actor(String id, Role role) {
    public Actor {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("actor id required");
        if (role == null) role = Role.MEMBER;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
