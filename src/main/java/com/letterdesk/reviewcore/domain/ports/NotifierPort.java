package com.letterdesk.reviewcore.domain.ports;

import com.letterdesk.reviewcore.domain.Letter;

import java.util.Map;

/**
 * Outbound notifications. Implementations enqueue and return; delivery happens asynchronously.
 */
public interface NotifierPort {

    void letterGenerated(Letter letter, Map<String, Object> details);

    void generationFailed(Letter letter, String reason);

    void letterSubmitted(Letter letter);

    void reviewStarted(Letter letter);

    void letterApproved(Letter letter);

    void letterRejected(Letter letter);

    void letterCompleted(Letter letter);

    void operationalAlert(String subject, Map<String, Object> details);
}
