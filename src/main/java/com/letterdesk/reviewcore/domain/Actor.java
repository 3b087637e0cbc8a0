package com.letterdesk.reviewcore.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * The authenticated caller of a workflow operation.
 */
public record Actor(UUID userId, Role role) {

    public Actor {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
    }

    public boolean can(Capability capability) {
        return role.can(capability);
    }

    public boolean isSuperAdmin() {
        return role == Role.SUPER_ADMIN;
    }
}
