package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.Actor;
import com.letterdesk.reviewcore.domain.IntakeData;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.LetterTransition;
import com.letterdesk.reviewcore.domain.Role;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.exception.ClaimConflictException;
import com.letterdesk.reviewcore.exception.InvalidTransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Every action attempted from a status its transition does not start from must be refused without
 * touching the stored letter. Arguments are deliberately invalid too (blank content, no rejection
 * reason) so that the status check has to come first.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReviewTransitionClosureTest {

    private static final Actor OWNER = new Actor(UUID.randomUUID(), Role.SUBSCRIBER);
    private static final Actor REVIEWER = new Actor(UUID.randomUUID(), Role.ATTORNEY_ADMIN);
    private static final Actor SUPER_ADMIN = new Actor(UUID.randomUUID(), Role.SUPER_ADMIN);

    enum Action {
        SUBMIT(LetterTransition.SUBMIT),
        CLAIM(LetterTransition.CLAIM),
        APPROVE(LetterTransition.APPROVE),
        REJECT(LetterTransition.REJECT),
        RESUBMIT(LetterTransition.RESUBMIT),
        COMPLETE(LetterTransition.COMPLETE),
        RETRY(LetterTransition.RETRY);

        final LetterTransition transition;

        Action(LetterTransition transition) {
            this.transition = transition;
        }

        void run(ReviewStateMachine stateMachine, UUID letterId) {
            switch (this) {
                case SUBMIT -> stateMachine.submit(letterId, OWNER);
                case CLAIM -> stateMachine.claim(letterId, REVIEWER);
                case APPROVE -> stateMachine.approve(letterId, REVIEWER, " ", null);
                case REJECT -> stateMachine.reject(letterId, REVIEWER, null, null, null);
                case RESUBMIT -> stateMachine.resubmit(letterId, OWNER, " ");
                case COMPLETE -> stateMachine.complete(letterId, SUPER_ADMIN);
                case RETRY -> stateMachine.retry(letterId, OWNER);
            }
        }
    }

    @Autowired
    private ReviewStateMachine stateMachine;

    @Autowired
    private LetterRepository letterRepository;

    @Autowired
    private AuditTrailService auditTrail;

    static Stream<Arguments> illegalPairs() {
        return Arrays.stream(LetterStatus.values())
                .flatMap(status -> Arrays.stream(Action.values())
                        .filter(action -> !action.transition.isAllowedFrom(status))
                        // claiming a letter that is already under review is a conflict, covered below
                        .filter(action -> !(action == Action.CLAIM && status == LetterStatus.UNDER_REVIEW))
                        .map(action -> Arguments.of(status, action)));
    }

    private Letter letterIn(LetterStatus status) {
        OffsetDateTime now = OffsetDateTime.now();
        return letterRepository.insert(Letter.builder()
                .id(UUID.randomUUID())
                .userId(OWNER.userId())
                .letterType("demand_letter")
                .title("demand_letter - closure")
                .intakeData(IntakeData.minimal("Alice", "Bob", "Invoice unpaid", "Payment"))
                .status(status)
                .aiDraftContent("Dear Bob, please pay the invoice.")
                .assignedReviewer(status == LetterStatus.UNDER_REVIEW ? REVIEWER.userId() : null)
                .createdAt(now)
                .updatedAt(now)
                .build());
    }

    @ParameterizedTest(name = "{1} from {0}")
    @MethodSource("illegalPairs")
    void actionOutsideTheTableIsRefusedAndChangesNothing(LetterStatus status, Action action) {
        Letter letter = letterIn(status);

        assertThatThrownBy(() -> action.run(stateMachine, letter.getId()))
                .isInstanceOf(InvalidTransitionException.class);

        Letter stored = letterRepository.findById(letter.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(status);
        assertThat(stored.getAssignedReviewer()).isEqualTo(letter.getAssignedReviewer());
        assertThat(stored.getAiDraftContent()).isEqualTo(letter.getAiDraftContent());
        assertThat(auditTrail.history(letter.getId())).isEmpty();
    }

    @Test
    void claimingALetterUnderReviewNeverMovesIt() {
        Letter letter = letterIn(LetterStatus.UNDER_REVIEW);
        Actor otherReviewer = new Actor(UUID.randomUUID(), Role.ATTORNEY_ADMIN);

        assertThatThrownBy(() -> stateMachine.claim(letter.getId(), otherReviewer))
                .isInstanceOf(ClaimConflictException.class);
        assertThat(stateMachine.claim(letter.getId(), REVIEWER).getAssignedReviewer()).isEqualTo(REVIEWER.userId());

        Letter stored = letterRepository.findById(letter.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(LetterStatus.UNDER_REVIEW);
        assertThat(stored.getAssignedReviewer()).isEqualTo(REVIEWER.userId());
        assertThat(auditTrail.history(letter.getId())).isEmpty();
    }
}
