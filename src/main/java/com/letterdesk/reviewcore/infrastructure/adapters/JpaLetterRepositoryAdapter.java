package com.letterdesk.reviewcore.infrastructure.adapters;

import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.LetterEntity;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringLetterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaLetterRepositoryAdapter implements LetterRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaLetterRepositoryAdapter.class);

    private final SpringLetterRepository letters;

    public JpaLetterRepositoryAdapter(SpringLetterRepository letters) {
        this.letters = letters;
    }

    @Override
    @Transactional
    public Letter insert(Letter letter) {
        LetterEntity e = new LetterEntity();
        copy(letter, e);
        letters.saveAndFlush(e);
        return letter;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Letter> findById(UUID letterId) {
        return letters.findById(letterId).map(JpaLetterRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Letter> findByOwner(UUID userId) {
        return letters.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(JpaLetterRepositoryAdapter::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Letter> findByStatus(LetterStatus status) {
        return letters.findByStatusOrderByCreatedAtAsc(status.wireValue()).stream()
                .map(JpaLetterRepositoryAdapter::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Letter> findByStatusCreatedBefore(LetterStatus status, OffsetDateTime cutoff) {
        return letters.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(status.wireValue(), cutoff).stream()
                .map(JpaLetterRepositoryAdapter::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByOwner(UUID userId) {
        return letters.countByUserId(userId);
    }

    @Override
    @Transactional
    public int claim(UUID letterId, UUID reviewerId, OffsetDateTime at) {
        // Serialize competing claimants on the row, then let the guarded update pick the winner
        if (letters.findByIdForUpdate(letterId).isEmpty()) {
            return 0;
        }
        int updated = letters.claim(letterId, reviewerId, at,
                LetterStatus.PENDING_REVIEW.wireValue(), LetterStatus.UNDER_REVIEW.wireValue());
        log.debug("Claim on letter {} by reviewer {} affected {} row(s)", letterId, reviewerId, updated);
        return updated;
    }

    @Override
    @Transactional
    public boolean updateIfUnchanged(Letter updated, LetterStatus expectedStatus, UUID expectedReviewer) {
        LetterEntity e = letters.findByIdForUpdate(updated.getId()).orElse(null);
        if (e == null) {
            return false;
        }
        if (!expectedStatus.wireValue().equals(e.getStatus()) || !Objects.equals(expectedReviewer, e.getAssignedReviewer())) {
            log.info("Stale write rejected for letter {} - expected {}/{}, found {}/{}",
                    updated.getId(), expectedStatus.wireValue(), expectedReviewer, e.getStatus(), e.getAssignedReviewer());
            return false;
        }
        copy(updated, e);
        letters.save(e);
        return true;
    }

    @Override
    @Transactional
    public boolean deleteIfStatus(UUID letterId, LetterStatus expectedStatus) {
        return letters.deleteByIdAndStatus(letterId, expectedStatus.wireValue()) == 1;
    }

    private static void copy(Letter l, LetterEntity e) {
        e.setId(l.getId());
        e.setUserId(l.getUserId());
        e.setLetterType(l.getLetterType());
        e.setTitle(l.getTitle());
        e.setIntakeData(l.getIntakeData());
        e.setStatus(l.getStatus().wireValue());
        e.setAiDraftContent(l.getAiDraftContent());
        e.setFinalContent(l.getFinalContent());
        e.setAssignedReviewer(l.getAssignedReviewer());
        e.setReviewedBy(l.getReviewedBy());
        e.setRejectionReason(l.getRejectionReason());
        e.setReviewNotes(l.getReviewNotes());
        e.setGenerationError(l.getGenerationError());
        e.setCreatedAt(l.getCreatedAt());
        e.setUpdatedAt(l.getUpdatedAt());
        e.setSubmittedAt(l.getSubmittedAt());
        e.setReviewStartedAt(l.getReviewStartedAt());
        e.setApprovedAt(l.getApprovedAt());
        e.setRejectedAt(l.getRejectedAt());
        e.setCompletedAt(l.getCompletedAt());
    }

    static Letter toDomain(LetterEntity e) {
        return Letter.builder()
                .id(e.getId())
                .userId(e.getUserId())
                .letterType(e.getLetterType())
                .title(e.getTitle())
                .intakeData(e.getIntakeData())
                .status(LetterStatus.fromWire(e.getStatus()))
                .aiDraftContent(e.getAiDraftContent())
                .finalContent(e.getFinalContent())
                .assignedReviewer(e.getAssignedReviewer())
                .reviewedBy(e.getReviewedBy())
                .rejectionReason(e.getRejectionReason())
                .reviewNotes(e.getReviewNotes())
                .generationError(e.getGenerationError())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .submittedAt(e.getSubmittedAt())
                .reviewStartedAt(e.getReviewStartedAt())
                .approvedAt(e.getApprovedAt())
                .rejectedAt(e.getRejectedAt())
                .completedAt(e.getCompletedAt())
                .build();
    }
}
