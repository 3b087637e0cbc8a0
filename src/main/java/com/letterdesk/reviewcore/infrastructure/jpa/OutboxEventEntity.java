package com.letterdesk.reviewcore.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "outbox")
public class OutboxEventEntity {
    @Id
    @Column(name = "event_id")
    private UUID eventId;

    // Letter the event is about; null for operational alerts
    @Column(name = "aggregate_id")
    private UUID aggregateId;

    @Column(nullable = false, length = 64)
    private String type;

    @Column(name = "payload_json", nullable = false, columnDefinition = "text")
    private String payloadJson;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    public OutboxEventEntity() {}

    public OutboxEventEntity(UUID eventId, UUID aggregateId, String type, String payloadJson, OffsetDateTime occurredAt) {
        this.eventId = eventId;
        this.aggregateId = aggregateId;
        this.type = type;
        this.payloadJson = payloadJson;
        this.occurredAt = occurredAt;
    }

    public UUID getEventId() { return eventId; }
    public void setEventId(UUID eventId) { this.eventId = eventId; }

    public UUID getAggregateId() { return aggregateId; }
    public void setAggregateId(UUID aggregateId) { this.aggregateId = aggregateId; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getPayloadJson() { return payloadJson; }
    public void setPayloadJson(String payloadJson) { this.payloadJson = payloadJson; }

    public OffsetDateTime getOccurredAt() { return occurredAt; }
    public void setOccurredAt(OffsetDateTime occurredAt) { this.occurredAt = occurredAt; }

    public OffsetDateTime getProcessedAt() { return processedAt; }
    public void setProcessedAt(OffsetDateTime processedAt) { this.processedAt = processedAt; }

    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public boolean isProcessed() {
        return processedAt != null;
    }

    public void markAsProcessed(OffsetDateTime at) {
        this.processedAt = at;
        this.lastError = null;
    }

    public void markAttemptFailed(String error) {
        this.attempts++;
        this.lastError = error;
    }

    @Override
    public String toString() {
        return "OutboxEventEntity{" +
                "eventId=" + eventId +
                ", aggregateId=" + aggregateId +
                ", type='" + type + '\'' +
                ", attempts=" + attempts +
                ", occurredAt=" + occurredAt +
                ", processedAt=" + processedAt +
                '}';
    }
}
