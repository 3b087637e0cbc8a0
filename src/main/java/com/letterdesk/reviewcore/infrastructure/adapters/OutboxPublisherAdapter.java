package com.letterdesk.reviewcore.infrastructure.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.ports.NotifierPort;
import com.letterdesk.reviewcore.infrastructure.jpa.OutboxEventEntity;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Enqueues notifications in the outbox table. Delivery is done later by the outbox dispatcher.
 */
@Component
public class OutboxPublisherAdapter implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger(OutboxPublisherAdapter.class);

    public static final String GENERATION_COMPLETED = "letter.generation.completed";
    public static final String GENERATION_FAILED = "letter.generation.failed";
    public static final String SUBMITTED = "letter.submitted";
    public static final String REVIEW_STARTED = "letter.review.started";
    public static final String APPROVED = "letter.approved";
    public static final String REJECTED = "letter.rejected";
    public static final String COMPLETED = "letter.completed";
    public static final String OPS_ALERT = "ops.alert";

    private final SpringOutboxRepository outbox;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxPublisherAdapter(SpringOutboxRepository outbox, ObjectMapper objectMapper, Clock clock) {
        this.outbox = outbox;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void letterGenerated(Letter letter, Map<String, Object> details) {
        Map<String, Object> payload = letterPayload(letter);
        payload.put("details", details != null ? details : Map.of());
        publish(letter.getId(), GENERATION_COMPLETED, payload);
    }

    @Override
    public void generationFailed(Letter letter, String reason) {
        Map<String, Object> payload = letterPayload(letter);
        payload.put("reason", reason != null ? reason : "unknown");
        publish(letter.getId(), GENERATION_FAILED, payload);
    }

    @Override
    public void letterSubmitted(Letter letter) {
        publish(letter.getId(), SUBMITTED, letterPayload(letter));
    }

    @Override
    public void reviewStarted(Letter letter) {
        Map<String, Object> payload = letterPayload(letter);
        payload.put("reviewerId", String.valueOf(letter.getAssignedReviewer()));
        publish(letter.getId(), REVIEW_STARTED, payload);
    }

    @Override
    public void letterApproved(Letter letter) {
        Map<String, Object> payload = letterPayload(letter);
        payload.put("reviewerId", String.valueOf(letter.getReviewedBy()));
        publish(letter.getId(), APPROVED, payload);
    }

    @Override
    public void letterRejected(Letter letter) {
        Map<String, Object> payload = letterPayload(letter);
        payload.put("reviewerId", String.valueOf(letter.getReviewedBy()));
        payload.put("reason", letter.getRejectionReason() != null ? letter.getRejectionReason() : "No reason provided");
        publish(letter.getId(), REJECTED, payload);
    }

    @Override
    public void letterCompleted(Letter letter) {
        publish(letter.getId(), COMPLETED, letterPayload(letter));
    }

    @Override
    public void operationalAlert(String subject, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subject", subject);
        payload.put("details", details != null ? details : Map.of());
        payload.put("timestamp", OffsetDateTime.now(clock).toString());
        publish(null, OPS_ALERT, payload);
    }

    public void publish(UUID aggregateId, String type, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(payload);
            OutboxEventEntity saved = outbox.save(new OutboxEventEntity(
                    UUID.randomUUID(), aggregateId, type, json, OffsetDateTime.now(clock)));
            log.info("Queued outbox event - ID: {}, Type: {}, Letter: {}", saved.getEventId(), type, aggregateId);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + type + " payload", e);
        } catch (RuntimeException e) {
            log.error("Failed to queue outbox event - Type: {}, Letter: {}, Error: {}", type, aggregateId, e.getMessage(), e);
            throw e;
        }
    }

    private Map<String, Object> letterPayload(Letter letter) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("letterId", letter.getId().toString());
        payload.put("userId", letter.getUserId().toString());
        payload.put("letterType", letter.getLetterType());
        payload.put("title", letter.getTitle());
        payload.put("status", letter.getStatus().wireValue());
        payload.put("eventTime", OffsetDateTime.now(clock).toString());
        return payload;
    }
}
