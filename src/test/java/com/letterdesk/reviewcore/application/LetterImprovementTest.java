package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.Actor;
import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.AuditEntry;
import com.letterdesk.reviewcore.domain.IntakeData;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.Role;
import com.letterdesk.reviewcore.domain.generation.FailureClass;
import com.letterdesk.reviewcore.domain.generation.ImprovementRequest;
import com.letterdesk.reviewcore.domain.generation.ProviderResponse;
import com.letterdesk.reviewcore.domain.ports.GenerationProvider;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.exception.ClaimConflictException;
import com.letterdesk.reviewcore.exception.InvalidTransitionException;
import com.letterdesk.reviewcore.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
class LetterImprovementTest {

    private static final String DRAFT = "Dear Bob, please pay the invoice.";
    private static final String IMPROVED = "Dear Bob, invoice 42 of 3 March remains unpaid. Please pay it within 14 days.";

    @MockBean(name = "primaryGenerationProvider")
    private GenerationProvider primary;

    @MockBean(name = "fallbackGenerationProvider")
    private GenerationProvider fallback;

    @Autowired
    private ReviewStateMachine stateMachine;

    @Autowired
    private LetterRepository letterRepository;

    @Autowired
    private AuditTrailService auditTrail;

    private Actor owner;
    private Actor reviewer;

    @BeforeEach
    void setUp() {
        when(primary.id()).thenReturn("primary");
        when(fallback.id()).thenReturn("fallback");
        when(fallback.isConfigured()).thenReturn(true);
        owner = new Actor(UUID.randomUUID(), Role.SUBSCRIBER);
        reviewer = new Actor(UUID.randomUUID(), Role.ATTORNEY_ADMIN);
    }

    private Letter letterUnderReview() {
        OffsetDateTime now = OffsetDateTime.now();
        return letterRepository.insert(Letter.builder()
                .id(UUID.randomUUID())
                .userId(owner.userId())
                .letterType("demand_letter")
                .title("demand_letter - improve")
                .intakeData(IntakeData.minimal("Alice", "Bob", "Invoice unpaid", "Payment"))
                .status(LetterStatus.UNDER_REVIEW)
                .assignedReviewer(reviewer.userId())
                .aiDraftContent(DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build());
    }

    @Test
    void improvedDraftReplacesTheOldOneAndIsAudited() {
        Letter letter = letterUnderReview();
        when(fallback.improve(any(ImprovementRequest.class))).thenReturn(new ProviderResponse(IMPROVED, false, null));

        Letter improved = stateMachine.improve(letter.getId(), reviewer, "Mention the invoice date");

        ArgumentCaptor<ImprovementRequest> sent = ArgumentCaptor.forClass(ImprovementRequest.class);
        verify(fallback).improve(sent.capture());
        assertThat(sent.getValue().originalContent()).isEqualTo(DRAFT);
        assertThat(sent.getValue().notes()).isEqualTo("Mention the invoice date");
        assertThat(sent.getValue().letterType()).isEqualTo("demand_letter");
        verify(primary, never()).improve(any());

        assertThat(improved.getStatus()).isEqualTo(LetterStatus.UNDER_REVIEW);
        Letter stored = letterRepository.findById(letter.getId()).orElseThrow();
        assertThat(stored.getAiDraftContent()).isEqualTo(IMPROVED);
        assertThat(stored.getAssignedReviewer()).isEqualTo(reviewer.userId());

        List<AuditEntry> history = auditTrail.history(letter.getId());
        assertThat(history).extracting(AuditEntry::action).containsExactly(AuditAction.IMPROVED);
        assertThat(history.get(0).oldStatus()).isEqualTo(LetterStatus.UNDER_REVIEW);
        assertThat(history.get(0).newStatus()).isEqualTo(LetterStatus.UNDER_REVIEW);
        assertThat(history.get(0).notes()).isEqualTo("Mention the invoice date");
        assertThat(history.get(0).metadata()).containsEntry("improvedLength", IMPROVED.length());
    }

    @Test
    void onlyTheAssignedReviewerCanImproveALetterUnderReview() {
        Letter letter = letterUnderReview();
        Actor otherReviewer = new Actor(UUID.randomUUID(), Role.ATTORNEY_ADMIN);
        Letter pending = letterRepository.insert(letter.toBuilder()
                .id(UUID.randomUUID())
                .status(LetterStatus.PENDING_REVIEW)
                .assignedReviewer(null)
                .build());

        assertThatThrownBy(() -> stateMachine.improve(letter.getId(), otherReviewer, null))
                .isInstanceOf(ClaimConflictException.class);
        assertThatThrownBy(() -> stateMachine.improve(pending.getId(), reviewer, null))
                .isInstanceOf(InvalidTransitionException.class);
        verify(fallback, never()).improve(any());
    }

    @Test
    void providerFailureLeavesTheDraftAlone() {
        Letter letter = letterUnderReview();
        when(fallback.improve(any(ImprovementRequest.class)))
                .thenThrow(new ProviderException("fallback", FailureClass.EMPTY_CONTENT, "AI returned empty content"));

        assertThatThrownBy(() -> stateMachine.improve(letter.getId(), reviewer, null))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getFailureClass()).isEqualTo(FailureClass.EMPTY_CONTENT));

        assertThat(letterRepository.findById(letter.getId()).orElseThrow().getAiDraftContent()).isEqualTo(DRAFT);
        assertThat(auditTrail.history(letter.getId())).isEmpty();
    }

    @Test
    void missingCompletionProviderIsReported() {
        Letter letter = letterUnderReview();
        when(fallback.isConfigured()).thenReturn(false);

        assertThatThrownBy(() -> stateMachine.improve(letter.getId(), reviewer, "Shorter"))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getFailureClass()).isEqualTo(FailureClass.NOT_CONFIGURED));
        verify(fallback, never()).improve(any());
    }
}
