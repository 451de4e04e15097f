package com.homepurse.analysis.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryAuditLogTest {

    private static final Instant NOW = Instant.parse("2024-06-15T08:00:00Z");
    private static final UUID HOUSEHOLD_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID USER_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");

    @Mock
    JpaAnalysisQueryRepository queryRepository;
    @Mock
    JpaAnalysisAttemptRepository attemptRepository;

    QueryAuditLog auditLog;

    @BeforeEach
    void setUp() {
        auditLog = new QueryAuditLog(queryRepository, attemptRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private AnalysisQueryEntity pendingQuery(int attempts) {
        AnalysisQueryEntity entity = new AnalysisQueryEntity(UUID.randomUUID(), HOUSEHOLD_ID, USER_ID,
                "openai", "gpt-test", "How much did we spend?", NOW.minusSeconds(10));
        entity.setAttemptCount(attempts);
        return entity;
    }

    @Test
    void startQueryPersistsPendingQuery() {
        UUID id = auditLog.startQuery("How much did we spend?", HOUSEHOLD_ID, USER_ID, "openai", "gpt-test");

        ArgumentCaptor<AnalysisQueryEntity> saved = ArgumentCaptor.forClass(AnalysisQueryEntity.class);
        verify(queryRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(id);
        assertThat(saved.getValue().getStatus()).isEqualTo(QueryStatus.PENDING);
        assertThat(saved.getValue().getAttemptCount()).isZero();
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void startQueryRejectsOverlongQuestion() {
        assertThatThrownBy(() -> auditLog.startQuery("x".repeat(2001), HOUSEHOLD_ID, USER_ID, "openai", "gpt-test"))
                .isInstanceOf(IllegalArgumentException.class);
        verify(queryRepository, never()).save(any());
    }

    @Test
    void recordAttemptWritesAttemptAndBumpsCount() {
        AnalysisQueryEntity query = pendingQuery(1);
        when(queryRepository.findById(query.getId())).thenReturn(Optional.of(query));

        auditLog.recordAttempt(query.getId(), new AttemptRecord(2, "SELECT 1", "totals", true, null, false,
                "ERROR: division by zero", "ERROR: division by zero"));

        ArgumentCaptor<AnalysisAttemptEntity> attempt = ArgumentCaptor.forClass(AnalysisAttemptEntity.class);
        verify(attemptRepository).saveAndFlush(attempt.capture());
        assertThat(attempt.getValue().getAnalysisQueryId()).isEqualTo(query.getId());
        assertThat(attempt.getValue().getAttemptNumber()).isEqualTo(2);
        assertThat(attempt.getValue().getDbError()).isEqualTo("ERROR: division by zero");
        assertThat(attempt.getValue().getRepairReason()).isEqualTo("ERROR: division by zero");
        assertThat(attempt.getValue().getLlmReason()).isEqualTo("totals");
        assertThat(query.getAttemptCount()).isEqualTo(2);
        assertThat(query.getUpdatedAt()).isEqualTo(NOW);
        verify(queryRepository).save(query);
    }

    @Test
    void recordAttemptRejectsGapsInNumbering() {
        AnalysisQueryEntity query = pendingQuery(0);
        when(queryRepository.findById(query.getId())).thenReturn(Optional.of(query));

        assertThatThrownBy(() -> auditLog.recordAttempt(query.getId(),
                new AttemptRecord(2, "SELECT 1", null, true, null, true, null, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("out of order");
        verify(attemptRepository, never()).saveAndFlush(any());
    }

    @Test
    void recordAttemptRejectsFinalizedQuery() {
        AnalysisQueryEntity query = pendingQuery(1);
        query.setStatus(QueryStatus.SUCCESS);
        when(queryRepository.findById(query.getId())).thenReturn(Optional.of(query));

        assertThatThrownBy(() -> auditLog.recordAttempt(query.getId(),
                new AttemptRecord(2, "SELECT 1", null, true, null, true, null, null)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finalizeFailedKeepsFailureReasonAndDropsSql() {
        AnalysisQueryEntity query = pendingQuery(3);
        when(queryRepository.findById(query.getId())).thenReturn(Optional.of(query));

        auditLog.finalizeQuery(query.getId(), QueryStatus.FAILED, "SELECT 1", "I could not answer that", "timeout");

        assertThat(query.getStatus()).isEqualTo(QueryStatus.FAILED);
        assertThat(query.getFinalSql()).isNull();
        assertThat(query.getFinalAnswer()).isEqualTo("I could not answer that");
        assertThat(query.getFailureReason()).isEqualTo("timeout");
    }

    @Test
    void finalizeSuccessRequiresSql() {
        assertThatThrownBy(() -> auditLog.finalizeQuery(UUID.randomUUID(), QueryStatus.PENDING, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);

        AnalysisQueryEntity query = pendingQuery(1);
        when(queryRepository.findById(query.getId())).thenReturn(Optional.of(query));
        assertThatThrownBy(() -> auditLog.finalizeQuery(query.getId(), QueryStatus.SUCCESS, " ", "answer", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(query.getStatus()).isEqualTo(QueryStatus.PENDING);
    }

    @Test
    void findQueryIsScopedToHousehold() {
        AnalysisQueryEntity query = pendingQuery(1);
        AnalysisAttemptEntity attempt = new AnalysisAttemptEntity();
        attempt.setAttemptNumber(1);
        attempt.setGeneratedSql("SELECT 1");
        attempt.setValidationOk(true);
        attempt.setExecutionOk(true);
        attempt.setCreatedAt(NOW);
        when(queryRepository.findByIdAndHouseholdId(query.getId(), HOUSEHOLD_ID)).thenReturn(Optional.of(query));
        when(attemptRepository.findByAnalysisQueryIdOrderByAttemptNumberAsc(query.getId())).thenReturn(List.of(attempt));

        Optional<AnalysisQueryView> view = auditLog.findQuery(query.getId(), HOUSEHOLD_ID);

        assertThat(view).isPresent();
        assertThat(view.get().question()).isEqualTo("How much did we spend?");
        assertThat(view.get().attempts()).singleElement()
                .satisfies(a -> assertThat(a.generatedSql()).isEqualTo("SELECT 1"));
    }
}
