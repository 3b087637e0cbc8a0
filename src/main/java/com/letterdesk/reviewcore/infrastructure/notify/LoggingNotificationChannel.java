package com.letterdesk.reviewcore.infrastructure.notify;

import org.slf4j.Logger; import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

@Component
public class LoggingNotificationChannel implements NotificationChannel {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);
  @Override public void deliver(String eventType, UUID letterId, Map<String, Object> payload) {
    if (eventType.startsWith("ops.")) {
      log.warn("OPERATIONS ALERT {}: {}", payload.get("subject"), payload.get("details"));
      return;
    }
    log.info("Notification {} for letter {}: {}", eventType, letterId, payload);
  }
}
