package com.letterdesk.reviewcore.api;

import com.letterdesk.reviewcore.application.AllowanceService;
import com.letterdesk.reviewcore.config.JwtService;
import com.letterdesk.reviewcore.domain.IntakeData;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringUserRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.UserEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LetterApiTest {

    private static final String INTAKE = """
            {"letterType":"demand_letter","intakeData":{"senderName":"Alice","recipientName":"Bob",
             "issueDescription":"Invoice 42 unpaid","desiredOutcome":"Payment within 14 days"}}
            """;

    @Autowired
    private MockMvc mvc;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private AllowanceService allowanceService;

    @Autowired
    private LetterRepository letterRepository;

    @Autowired
    private SpringUserRepository userRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    private String bearer(UUID userId, String role) {
        return "Bearer " + jwtService.generateToken(userId, role.toLowerCase() + "@letterdesk.test", Set.of(role));
    }

    private Letter pendingLetter(UUID ownerId) {
        OffsetDateTime now = OffsetDateTime.now();
        return letterRepository.insert(Letter.builder()
                .id(UUID.randomUUID())
                .userId(ownerId)
                .letterType("demand_letter")
                .title("demand_letter - api")
                .intakeData(IntakeData.minimal("Alice", "Bob", "Invoice unpaid", "Payment"))
                .status(LetterStatus.PENDING_REVIEW)
                .aiDraftContent("Dear Bob, please pay.")
                .createdAt(now)
                .updatedAt(now)
                .build());
    }

    @Test
    void requestsWithoutTokenAreUnauthorized() throws Exception {
        mvc.perform(get("/letters"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));
    }

    @Test
    void subscribersCannotReachAdminEndpoints() throws Exception {
        mvc.perform(get("/admin/letters").header(HttpHeaders.AUTHORIZATION, bearer(UUID.randomUUID(), "SUBSCRIBER")))
                .andExpect(status().isForbidden());
    }

    @Test
    void attorneysCannotRunBulkOperations() throws Exception {
        mvc.perform(post("/admin/letters/bulk-approve")
                        .header(HttpHeaders.AUTHORIZATION, bearer(UUID.randomUUID(), "ATTORNEY_ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"letterIds\":[\"" + UUID.randomUUID() + "\"]}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void exhaustedAllowanceReturns402() throws Exception {
        UUID userId = UUID.randomUUID();
        OffsetDateTime start = OffsetDateTime.now();
        allowanceService.openAccount(userId, 0, start, start.plusMonths(1));

        mvc.perform(post("/letters/generate")
                        .header(HttpHeaders.AUTHORIZATION, bearer(userId, "SUBSCRIBER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(INTAKE))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("Allowance exhausted"))
                .andExpect(jsonPath("$.needsSubscription").value(true));
    }

    @Test
    void invalidIntakeReturns400WithEveryError() throws Exception {
        mvc.perform(post("/letters/generate")
                        .header(HttpHeaders.AUTHORIZATION, bearer(UUID.randomUUID(), "SUBSCRIBER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"letterType\":\"demand_letter\",\"intakeData\":{\"senderName\":\"Alice\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasSize(3)));
    }

    @Test
    void generationWithoutProvidersReturns502AndRefunds() throws Exception {
        UUID userId = UUID.randomUUID();
        OffsetDateTime start = OffsetDateTime.now();
        allowanceService.openAccount(userId, 2, start, start.plusMonths(1));

        mvc.perform(post("/letters/generate")
                        .header(HttpHeaders.AUTHORIZATION, bearer(userId, "SUBSCRIBER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(INTAKE))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.details.creditRefunded").value(true))
                .andExpect(jsonPath("$.details.letterId").isNotEmpty());

        mvc.perform(get("/allowance").header(HttpHeaders.AUTHORIZATION, bearer(userId, "SUBSCRIBER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remaining").value(2));
    }

    @Test
    void claimConflictReturns409() throws Exception {
        Letter letter = pendingLetter(UUID.randomUUID());
        UUID first = UUID.randomUUID();

        mvc.perform(post("/admin/letters/{id}/claim", letter.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(first, "ATTORNEY_ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("under_review"));

        mvc.perform(post("/admin/letters/{id}/claim", letter.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(UUID.randomUUID(), "ATTORNEY_ADMIN")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Claim conflict"));
    }

    @Test
    void ownerCannotDeleteLetterInReview() throws Exception {
        UUID ownerId = UUID.randomUUID();
        Letter letter = pendingLetter(ownerId);

        mvc.perform(delete("/letters/{id}", letter.getId()).header(HttpHeaders.AUTHORIZATION, bearer(ownerId, "SUBSCRIBER")))
                .andExpect(status().isConflict());
        mvc.perform(get("/letters/{id}", UUID.randomUUID()).header(HttpHeaders.AUTHORIZATION, bearer(ownerId, "SUBSCRIBER")))
                .andExpect(status().isNotFound());
    }

    @Test
    void rejectionReasonsAreListed() throws Exception {
        mvc.perform(get("/admin/rejection-reasons").header(HttpHeaders.AUTHORIZATION, bearer(UUID.randomUUID(), "ATTORNEY_ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(7)))
                .andExpect(jsonPath("$[6].code").value("other"))
                .andExpect(jsonPath("$[6].requiresDetail").value(true));
    }

    @Test
    void loginIssuesBearerToken() throws Exception {
        UserEntity user = new UserEntity();
        user.setId(UUID.randomUUID());
        user.setEmail("login-" + user.getId() + "@letterdesk.test");
        user.setPasswordHash(passwordEncoder.encode("correct horse"));
        user.setRoles(Set.of("ATTORNEY_ADMIN"));
        userRepository.save(user);

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + user.getEmail() + "\",\"password\":\"correct horse\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken", not(emptyString())))
                .andExpect(jsonPath("$.tokenType").value("Bearer"));

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + user.getEmail() + "\",\"password\":\"wrong\"}"))
                .andExpect(status().isUnauthorized());
    }
}
