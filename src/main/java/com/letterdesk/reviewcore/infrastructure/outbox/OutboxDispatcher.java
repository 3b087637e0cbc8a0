package com.letterdesk.reviewcore.infrastructure.outbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.letterdesk.reviewcore.config.AppProperties;
import com.letterdesk.reviewcore.infrastructure.jpa.OutboxEventEntity;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringOutboxRepository;
import com.letterdesk.reviewcore.infrastructure.notify.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Component
public class OutboxDispatcher {
  private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);
  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final SpringOutboxRepository repo;
  private final ObjectMapper objectMapper;
  private final NotificationChannel channel;
  private final Clock clock;
  private final boolean enableDispatch;
  private final int batchSize;
  private final int maxAttempts;

  public OutboxDispatcher(
          SpringOutboxRepository repo,
          ObjectMapper objectMapper,
          NotificationChannel channel,
          Clock clock,
          AppProperties properties) {
    this.repo = repo;
    this.objectMapper = objectMapper;
    this.channel = channel;
    this.clock = clock;
    this.enableDispatch = properties.getOutbox().isEnabled();
    this.batchSize = properties.getOutbox().getBatchSize();
    this.maxAttempts = properties.getOutbox().getMaxAttempts();

    log.info("OutboxDispatcher initialized - enabled: {}, batchSize: {}, maxAttempts: {}",
            enableDispatch, batchSize, maxAttempts);
  }

  @Scheduled(fixedDelayString = "${app.outbox.poll-ms:5000}")
  public void scheduledDispatch() {
    if (!enableDispatch) {
      log.trace("Outbox dispatch is disabled");
      return;
    }
    dispatch();
  }

  /**
   * Delivers one batch of pending events. Failed events stay pending with their attempt count
   * raised until they reach the attempt limit.
   *
   * @return number of events delivered
   */
  @Transactional
  public int dispatch() {
    List<OutboxEventEntity> batch = repo.findPending(maxAttempts, PageRequest.of(0, batchSize));
    if (batch.isEmpty()) {
      log.trace("No outbox events to process");
      return 0;
    }

    log.info("Processing {} outbox events", batch.size());
    int delivered = 0;
    for (OutboxEventEntity event : batch) {
      try {
        Map<String, Object> payload = objectMapper.readValue(event.getPayloadJson(), PAYLOAD_TYPE);
        channel.deliver(event.getType(), event.getAggregateId(), payload);
        event.markAsProcessed(OffsetDateTime.now(clock));
        delivered++;
        log.debug("Delivered outbox event: {}", event.getEventId());
      } catch (Exception e) {
        event.markAttemptFailed(e.getMessage());
        log.error("Failed to deliver outbox event {} (attempt {}/{}): {}",
                event.getEventId(), event.getAttempts(), maxAttempts, e.getMessage(), e);
        if (event.getAttempts() >= maxAttempts) {
          log.error("Outbox event {} parked after {} attempts", event.getEventId(), event.getAttempts());
        }
      }
      repo.save(event);
    }
    return delivered;
  }

  public OutboxStats getStats() {
    long pending = repo.countByProcessedAtIsNull();
    long processed = repo.countByProcessedAtIsNotNull();
    long parked = repo.countParked(maxAttempts);

    return new OutboxStats(pending, processed, parked, enableDispatch);
  }

  public record OutboxStats(long pendingEvents, long processedEvents, long parkedEvents, boolean dispatchEnabled) {}
}
