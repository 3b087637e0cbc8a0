package com.letterdesk.reviewcore.domain.ports;

import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LetterRepository {

    Letter insert(Letter letter);

    Optional<Letter> findById(UUID letterId);

    List<Letter> findByOwner(UUID userId);

    List<Letter> findByStatus(LetterStatus status);

    List<Letter> findByStatusCreatedBefore(LetterStatus status, OffsetDateTime cutoff);

    long countByOwner(UUID userId);

    /**
     * Compare-and-swap claim: moves the letter to under_review for {@code reviewerId} only if it is
     * still pending_review and unassigned.
     *
     * @return affected row count, 1 for the winner and 0 for everybody else
     */
    int claim(UUID letterId, UUID reviewerId, OffsetDateTime at);

    /**
     * Writes {@code updated} only if the stored row still has {@code expectedStatus} and
     * {@code expectedReviewer}. The row is locked for the duration of the check.
     *
     * @return true when the write happened
     */
    boolean updateIfUnchanged(Letter updated, LetterStatus expectedStatus, UUID expectedReviewer);

    /**
     * Deletes the letter only if it is still in {@code expectedStatus}.
     */
    boolean deleteIfStatus(UUID letterId, LetterStatus expectedStatus);
}
