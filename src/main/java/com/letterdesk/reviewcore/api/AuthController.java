package com.letterdesk.reviewcore.api;

import com.letterdesk.reviewcore.config.JwtService;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringUserRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.UserEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Email and password login")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final SpringUserRepository users;
    private final PasswordEncoder encoder;
    private final JwtService jwt;

    public AuthController(SpringUserRepository users, PasswordEncoder encoder, JwtService jwt) {
        this.users = users;
        this.encoder = encoder;
        this.jwt = jwt;
    }

    @PostMapping("/login")
    @Operation(summary = "Authenticate with email and password", description = "Returns a Bearer token whose subject is the user id")
    public ResponseEntity<?> login(@RequestBody @Valid LoginRequest req) {
        log.info("Login attempt for user: {}", req.email());

        UserEntity user = users.findByEmail(req.email().toLowerCase()).orElse(null);
        if (user == null || !encoder.matches(req.password(), user.getPasswordHash())) {
            log.warn("Invalid credentials for user: {}", req.email());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of(
                            "error", "Invalid credentials",
                            "message", "Email or password is incorrect"
                    ));
        }

        String token = jwt.generateToken(user.getId(), user.getEmail(), user.getRoles());
        log.info("User {} logged in with roles {}", user.getEmail(), user.getRoles());
        return ResponseEntity.ok(new LoginResponse(token, "Bearer", jwt.getTtlSeconds(),
                new UserInfo(user.getId(), user.getEmail(), user.getRoles())));
    }

    @Schema(description = "User login request")
    public record LoginRequest(
            @Schema(description = "User email address", example = "reviewer@letterdesk.example")
            @Email @NotBlank String email,

            @Schema(description = "User password", example = "secure-password")
            @NotBlank String password
    ) {}

    @Schema(description = "Successful login response")
    public record LoginResponse(
            @Schema(description = "JWT access token")
            String accessToken,

            @Schema(description = "Token type", example = "Bearer")
            String tokenType,

            @Schema(description = "Token expiration time in seconds", example = "3600")
            long expiresInSeconds,

            UserInfo user
    ) {}

    public record UserInfo(UUID id, String email, Set<String> roles) {}
}
