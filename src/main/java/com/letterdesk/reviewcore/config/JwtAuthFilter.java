package com.letterdesk.reviewcore.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a valid Bearer token into an authentication whose principal is the user id. Requests without
 * a usable token pass through unauthenticated and are rejected by the security chain.
 */
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
    private final JwtService jwt;

    public JwtAuthFilter(JwtService jwt) {
        this.jwt = jwt;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();
        return "OPTIONS".equalsIgnoreCase(req.getMethod())
                || path.equals("/auth/login")
                || path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui") || path.equals("/swagger-ui.html")
                || path.equals("/actuator/health") || path.equals("/actuator/info");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        final String path = request.getRequestURI();
        final String method = request.getMethod();

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
            log.debug("JwtAuthFilter: No Bearer token for: {} {}", method, path);
            chain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(7).trim();
        Optional<UUID> userId = StringUtils.hasText(token) ? jwt.getUserId(token) : Optional.empty();
        if (userId.isEmpty()) {
            log.warn("JwtAuthFilter: Invalid or expired token for: {} {}", method, path);
            SecurityContextHolder.clearContext();
            chain.doFilter(request, response);
            return;
        }

        Set<SimpleGrantedAuthority> authorities = jwt.getRoles(token).stream()
                .map(role -> role.startsWith("ROLE_") ? role : "ROLE_" + role)
                .map(SimpleGrantedAuthority::new)
                .collect(Collectors.toSet());

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(userId.get().toString(), null, authorities);
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("JwtAuthFilter: Authenticated {} with authorities {} for {} {}", userId.get(), authorities, method, path);

        chain.doFilter(request, response);
    }
}
