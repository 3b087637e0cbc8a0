package com.letterdesk.reviewcore.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of account roles. Authorization inside the review workflow is decided by
 * {@link #can(Capability)}, never by comparing role names.
 */
public enum Role {
    SUBSCRIBER(EnumSet.noneOf(Capability.class)),
    ATTORNEY_ADMIN(EnumSet.of(Capability.CLAIM, Capability.APPROVE, Capability.REJECT)),
    SUPER_ADMIN(EnumSet.allOf(Capability.class));

    private final Set<Capability> capabilities;

    Role(Set<Capability> capabilities) {
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    public boolean can(Capability capability) {
        return capabilities.contains(capability);
    }

    public boolean isReviewer() {
        return can(Capability.CLAIM);
    }

    /**
     * Picks the most privileged role from a set of role names, e.g. the roles claim of a token.
     * Unknown names are ignored; no known name means {@link #SUBSCRIBER}.
     */
    public static Role highestOf(Collection<String> names) {
        Role best = SUBSCRIBER;
        for (String name : names) {
            String normalized = name.startsWith("ROLE_") ? name.substring(5) : name;
            for (Role role : values()) {
                if (role.name().equalsIgnoreCase(normalized) && role.ordinal() > best.ordinal()) {
                    best = role;
                }
            }
        }
        return best;
    }
}
