package com.letterdesk.reviewcore.infrastructure.notify;

import java.util.Map;
import java.util.UUID;

/**
 * Final hop for an outbox event: email, chat webhook, pager and so on.
 */
public interface NotificationChannel {

    void deliver(String eventType, UUID letterId, Map<String, Object> payload) throws Exception;
}
