package dev.reviewgate.domain.enums;

import dev.reviewgate.domain.valueobject.Actor;

/**
 * Who may perform a catalog transition.
 */
public enum RoleRequirement {
    OWNER,
    OWNER_OR_ADMIN,
    ADMIN_ONLY;

    public boolean isSatisfiedBy(Actor actor, String ownerId) {
        boolean owner = actor.id().equals(ownerId);
        return switch (this) {
            case OWNER -> owner;
            case OWNER_OR_ADMIN -> owner || actor.isAdmin();
            case ADMIN_ONLY -> actor.isAdmin();
        };
    }
}
