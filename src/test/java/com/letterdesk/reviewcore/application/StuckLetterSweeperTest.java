package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.config.AppProperties;
import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.domain.ports.NotifierPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StuckLetterSweeperTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final OffsetDateTime now = OffsetDateTime.now(clock);

    private LetterRepository letters;
    private AuditTrailService audit;
    private NotifierPort notifier;
    private StuckLetterSweeper sweeper;

    @BeforeEach
    void setUp() {
        letters = mock(LetterRepository.class);
        audit = mock(AuditTrailService.class);
        notifier = mock(NotifierPort.class);
        sweeper = new StuckLetterSweeper(letters, audit, notifier, clock, new AppProperties());
    }

    private Letter generating(OffsetDateTime createdAt) {
        return Letter.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .letterType("demand_letter")
                .status(LetterStatus.GENERATING)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    @Test
    void nothingStuckMeansNoAlert() {
        when(letters.findByStatusCreatedBefore(eq(LetterStatus.GENERATING), any())).thenReturn(List.of());

        StuckLetterSweeper.SweepReport report = sweeper.sweep();

        assertThat(report.alerted()).isEmpty();
        assertThat(report.failed()).isEmpty();
        verifyNoInteractions(notifier, audit);
    }

    @Test
    void recentStragglersOnlyRaiseAnAlert() {
        Letter slow = generating(now.minusMinutes(15));
        when(letters.findByStatusCreatedBefore(LetterStatus.GENERATING, now.minusMinutes(10))).thenReturn(List.of(slow));

        StuckLetterSweeper.SweepReport report = sweeper.sweep();

        assertThat(report.alerted()).containsExactly(slow.getId());
        assertThat(report.failed()).isEmpty();
        verify(letters, never()).updateIfUnchanged(any(), any(), any());
        verify(notifier).operationalAlert(eq("Letters stuck in generation"), anyMap());
    }

    @Test
    void abandonedLettersAreMarkedFailed() {
        Letter abandoned = generating(now.minusHours(2));
        when(letters.findByStatusCreatedBefore(eq(LetterStatus.GENERATING), any())).thenReturn(List.of(abandoned));
        when(letters.updateIfUnchanged(any(), eq(LetterStatus.GENERATING), isNull())).thenReturn(true);

        StuckLetterSweeper.SweepReport report = sweeper.sweep();

        assertThat(report.failed()).containsExactly(abandoned.getId());
        ArgumentCaptor<Letter> written = ArgumentCaptor.forClass(Letter.class);
        verify(letters).updateIfUnchanged(written.capture(), eq(LetterStatus.GENERATING), isNull());
        assertThat(written.getValue().getStatus()).isEqualTo(LetterStatus.FAILED);
        assertThat(written.getValue().getGenerationError()).isEqualTo(StuckLetterSweeper.TIMEOUT_ERROR);
        verify(audit).record(abandoned.getId(), AuditAction.GENERATION_FAILED, LetterStatus.GENERATING,
                LetterStatus.FAILED, null, StuckLetterSweeper.TIMEOUT_ERROR, Map.of("sweep", true));
    }

    @Test
    void letterSettledMeanwhileIsNotAudited() {
        Letter raced = generating(now.minusHours(2));
        when(letters.findByStatusCreatedBefore(eq(LetterStatus.GENERATING), any())).thenReturn(List.of(raced));
        when(letters.updateIfUnchanged(any(), any(), any())).thenReturn(false);

        StuckLetterSweeper.SweepReport report = sweeper.sweep();

        assertThat(report.failed()).isEmpty();
        verify(audit, never()).record(any(), any(), any(), any(), any(), any(), anyMap());
    }
}
