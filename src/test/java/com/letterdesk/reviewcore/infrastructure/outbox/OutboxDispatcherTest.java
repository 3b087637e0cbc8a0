package com.letterdesk.reviewcore.infrastructure.outbox;

import com.letterdesk.reviewcore.infrastructure.adapters.OutboxPublisherAdapter;
import com.letterdesk.reviewcore.infrastructure.jpa.OutboxEventEntity;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringOutboxRepository;
import com.letterdesk.reviewcore.infrastructure.notify.NotificationChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
class OutboxDispatcherTest {

    @MockBean
    private NotificationChannel channel;

    @Autowired
    private OutboxPublisherAdapter publisher;

    @Autowired
    private OutboxDispatcher dispatcher;

    @Autowired
    private SpringOutboxRepository outboxRepository;

    @BeforeEach
    void clearOutbox() {
        outboxRepository.deleteAll();
    }

    @Test
    void deliversQueuedEventsAndMarksThemProcessed() throws Exception {
        UUID letterId = UUID.randomUUID();
        publisher.publish(letterId, OutboxPublisherAdapter.APPROVED, Map.of("letterId", letterId.toString()));

        int delivered = dispatcher.dispatch();

        assertThat(delivered).isEqualTo(1);
        verify(channel).deliver(eq(OutboxPublisherAdapter.APPROVED), eq(letterId),
                argThat(payload -> letterId.toString().equals(payload.get("letterId"))));
        OutboxEventEntity event = outboxRepository.findByAggregateIdOrderByOccurredAtAsc(letterId).get(0);
        assertThat(event.isProcessed()).isTrue();
        assertThat(dispatcher.dispatch()).isZero();
    }

    @Test
    void failingDeliveryIsRetriedThenParked() throws Exception {
        doThrow(new IllegalStateException("smtp down")).when(channel).deliver(any(), any(), anyMap());
        publisher.operationalAlert("Letters stuck in generation", Map.of("stuckCount", 1));

        for (int i = 0; i < 5; i++) {
            assertThat(dispatcher.dispatch()).isZero();
        }

        OutboxEventEntity event = outboxRepository.findAll().get(0);
        assertThat(event.isProcessed()).isFalse();
        assertThat(event.getAttempts()).isEqualTo(5);
        assertThat(event.getLastError()).isEqualTo("smtp down");
        assertThat(event.getAggregateId()).isNull();

        OutboxDispatcher.OutboxStats stats = dispatcher.getStats();
        assertThat(stats.parkedEvents()).isEqualTo(1);
        assertThat(stats.pendingEvents()).isEqualTo(1);
        assertThat(stats.dispatchEnabled()).isFalse();

        // parked events are no longer picked up
        assertThat(dispatcher.dispatch()).isZero();
    }
}
