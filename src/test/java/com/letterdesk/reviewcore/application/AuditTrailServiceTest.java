package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.AuditEntry;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.ports.AuditRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuditTrailServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
    private AuditRepository repository;
    private SimpleMeterRegistry registry;
    private AuditTrailService service;

    @BeforeEach
    void setUp() {
        repository = mock(AuditRepository.class);
        registry = new SimpleMeterRegistry();
        service = new AuditTrailService(repository, clock, registry);
    }

    @Test
    void stampsEntryWithClockTime() {
        when(repository.append(any())).thenAnswer(inv -> inv.getArgument(0));
        UUID letterId = UUID.randomUUID();

        service.record(letterId, AuditAction.APPROVED, LetterStatus.UNDER_REVIEW, LetterStatus.APPROVED,
                UUID.randomUUID(), "looks good", Map.of("k", "v"));

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(repository).append(captor.capture());
        assertThat(captor.getValue().timestamp()).isEqualTo(OffsetDateTime.parse("2024-03-01T10:00:00Z"));
        assertThat(captor.getValue().metadata()).containsEntry("k", "v");
    }

    @Test
    void writeFailureIsSwallowedAndCounted() {
        when(repository.append(any())).thenThrow(new IllegalStateException("audit table locked"));

        var result = service.record(UUID.randomUUID(), AuditAction.CREATED, LetterStatus.GENERATING,
                LetterStatus.PENDING_REVIEW, null, "generated");

        assertThat(result).isEmpty();
        assertThat(registry.get("letters.audit.failures").counter().count()).isEqualTo(1.0);
    }
}
