package com.letterdesk.reviewcore.config;

import com.letterdesk.reviewcore.domain.Actor;
import com.letterdesk.reviewcore.domain.Role;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resolves the workflow {@link Actor} from the authentication set by {@link JwtAuthFilter}.
 */
@Component
public class CurrentActor {

    public Actor get() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || auth.getName() == null) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated user");
        }
        UUID userId;
        try {
            userId = UUID.fromString(auth.getName());
        } catch (IllegalArgumentException e) {
            throw new AuthenticationCredentialsNotFoundException("Principal is not a user id: " + auth.getName());
        }
        Role role = Role.highestOf(auth.getAuthorities().stream().map(GrantedAuthority::getAuthority).toList());
        return new Actor(userId, role);
    }
}
