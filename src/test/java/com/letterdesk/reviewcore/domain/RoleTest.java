package com.letterdesk.reviewcore.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoleTest {

    @Test
    void attorneyAdminReviewsButCannotOverride() {
        Role role = Role.ATTORNEY_ADMIN;

        assertThat(role.can(Capability.CLAIM)).isTrue();
        assertThat(role.can(Capability.APPROVE)).isTrue();
        assertThat(role.can(Capability.REJECT)).isTrue();
        assertThat(role.can(Capability.FREE_TEXT_REJECTION)).isFalse();
        assertThat(role.can(Capability.BULK_OPERATIONS)).isFalse();
        assertThat(role.can(Capability.REASSIGN)).isFalse();
    }

    @Test
    void superAdminHasEverything() {
        for (Capability c : Capability.values()) {
            assertThat(Role.SUPER_ADMIN.can(c)).as(c.name()).isTrue();
        }
    }

    @Test
    void subscriberHasNoReviewCapability() {
        assertThat(Role.SUBSCRIBER.capabilities()).isEmpty();
        assertThat(Role.SUBSCRIBER.isReviewer()).isFalse();
    }

    @Test
    void highestRoleWinsAndPrefixIsIgnored() {
        assertThat(Role.highestOf(List.of("ROLE_SUBSCRIBER", "ROLE_ATTORNEY_ADMIN"))).isEqualTo(Role.ATTORNEY_ADMIN);
        assertThat(Role.highestOf(List.of("super_admin", "SUBSCRIBER"))).isEqualTo(Role.SUPER_ADMIN);
        assertThat(Role.highestOf(List.of("AUDITOR"))).isEqualTo(Role.SUBSCRIBER);
        assertThat(Role.highestOf(List.of())).isEqualTo(Role.SUBSCRIBER);
    }
}
