package com.letterdesk.reviewcore.domain.ports;

import com.letterdesk.reviewcore.domain.Role;

import java.util.Optional;
import java.util.UUID;

public interface UserDirectory {

    Optional<Role> findRole(UUID userId);
}
