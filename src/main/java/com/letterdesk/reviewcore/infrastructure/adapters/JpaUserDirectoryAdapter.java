package com.letterdesk.reviewcore.infrastructure.adapters;

import com.letterdesk.reviewcore.domain.Role;
import com.letterdesk.reviewcore.domain.ports.UserDirectory;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringUserRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaUserDirectoryAdapter implements UserDirectory {

    private final SpringUserRepository users;

    public JpaUserDirectoryAdapter(SpringUserRepository users) {
        this.users = users;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Role> findRole(UUID userId) {
        return users.findById(userId).map(u -> Role.highestOf(u.getRoles()));
    }
}
