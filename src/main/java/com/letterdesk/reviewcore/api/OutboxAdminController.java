package com.letterdesk.reviewcore.api;

import com.letterdesk.reviewcore.infrastructure.jpa.SpringOutboxRepository;
import com.letterdesk.reviewcore.infrastructure.outbox.OutboxDispatcher;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/admin/outbox")
@Tag(name = "Outbox", description = "Notification outbox inspection")
public class OutboxAdminController {

    private final OutboxDispatcher dispatcher;
    private final SpringOutboxRepository repository;

    public OutboxAdminController(OutboxDispatcher dispatcher, SpringOutboxRepository repository) {
        this.dispatcher = dispatcher;
        this.repository = repository;
    }

    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        OutboxDispatcher.OutboxStats stats = dispatcher.getStats();
        return ResponseEntity.ok(Map.of(
                "pendingEvents", stats.pendingEvents(),
                "processedEvents", stats.processedEvents(),
                "parkedEvents", stats.parkedEvents(),
                "dispatchEnabled", stats.dispatchEnabled(),
                "totalEvents", stats.pendingEvents() + stats.processedEvents()
        ));
    }

    @GetMapping("/letters/{letterId}")
    public List<Map<String, Object>> eventsForLetter(@PathVariable("letterId") UUID letterId) {
        return repository.findByAggregateIdOrderByOccurredAtAsc(letterId).stream()
                .map(e -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("eventId", e.getEventId());
                    m.put("type", e.getType());
                    m.put("occurredAt", e.getOccurredAt());
                    m.put("processedAt", e.getProcessedAt());
                    m.put("attempts", e.getAttempts());
                    m.put("lastError", e.getLastError());
                    return m;
                })
                .toList();
    }
}
