package com.homepurse.analysis.audit;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable record of every analysis question and each of its attempts. Every write commits on its
 * own so the trail survives a later failure of the run.
 */
@Service
public class QueryAuditLog {

    private static final Logger log = LoggerFactory.getLogger(QueryAuditLog.class);
    static final int MAX_QUESTION_LENGTH = 2000;

    private final JpaAnalysisQueryRepository queryRepository;
    private final JpaAnalysisAttemptRepository attemptRepository;
    private final Clock clock;

    @Autowired
    public QueryAuditLog(JpaAnalysisQueryRepository queryRepository, JpaAnalysisAttemptRepository attemptRepository) {
        this(queryRepository, attemptRepository, Clock.systemUTC());
    }

    QueryAuditLog(JpaAnalysisQueryRepository queryRepository, JpaAnalysisAttemptRepository attemptRepository, Clock clock) {
        this.queryRepository = queryRepository;
        this.attemptRepository = attemptRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID startQuery(String question, UUID householdId, UUID userId, String provider, String model) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        if (question.length() > MAX_QUESTION_LENGTH) {
            throw new IllegalArgumentException("question must be at most " + MAX_QUESTION_LENGTH + " characters");
        }
        AnalysisQueryEntity entity = new AnalysisQueryEntity(
                UUID.randomUUID(), householdId, userId, provider, model, question, Instant.now(clock));
        queryRepository.save(entity);
        log.info("analysis_query_started queryId={} householdId={} provider={} model={}",
                entity.getId(), householdId, provider, model);
        return entity.getId();
    }

    /**
     * Inserts the attempt and bumps the query's attempt count in one transaction. Attempt numbers
     * must be contiguous from 1.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordAttempt(UUID queryId, AttemptRecord record) {
        AnalysisQueryEntity query = queryRepository.findById(queryId)
                .orElseThrow(() -> new IllegalStateException("Unknown analysis query " + queryId));
        if (query.getStatus() != QueryStatus.PENDING) {
            throw new IllegalStateException("Analysis query " + queryId + " is already " + query.getStatus());
        }
        int expected = query.getAttemptCount() + 1;
        if (record.attemptNumber() != expected) {
            throw new IllegalStateException("Attempt " + record.attemptNumber() + " recorded out of order for query "
                    + queryId + "; expected " + expected);
        }
        Instant now = Instant.now(clock);
        AnalysisAttemptEntity attempt = new AnalysisAttemptEntity();
        attempt.setId(UUID.randomUUID());
        attempt.setAnalysisQueryId(queryId);
        attempt.setAttemptNumber(record.attemptNumber());
        attempt.setGeneratedSql(record.generatedSql());
        attempt.setLlmReason(record.llmReason());
        attempt.setValidationOk(record.validationOk());
        attempt.setValidationReason(record.validationReason());
        attempt.setExecutionOk(record.executionOk());
        attempt.setDbError(record.dbError());
        attempt.setRepairReason(record.repairReason());
        attempt.setCreatedAt(now);
        attemptRepository.saveAndFlush(attempt);

        query.setAttemptCount(record.attemptNumber());
        query.setUpdatedAt(now);
        queryRepository.save(query);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void finalizeQuery(UUID queryId, QueryStatus status, String finalSql, String finalAnswer, String failureReason) {
        if (status == QueryStatus.PENDING) {
            throw new IllegalArgumentException("A query can only be finalized as SUCCESS or FAILED");
        }
        AnalysisQueryEntity query = queryRepository.findById(queryId)
                .orElseThrow(() -> new IllegalStateException("Unknown analysis query " + queryId));
        if (status == QueryStatus.SUCCESS && (finalSql == null || finalSql.isBlank())) {
            throw new IllegalArgumentException("A successful query must carry its final SQL");
        }
        query.setStatus(status);
        query.setFinalSql(status == QueryStatus.SUCCESS ? finalSql : null);
        query.setFinalAnswer(finalAnswer);
        query.setFailureReason(status == QueryStatus.FAILED ? failureReason : null);
        query.setUpdatedAt(Instant.now(clock));
        queryRepository.save(query);
        log.info("analysis_query_finalized queryId={} status={} attempts={}", queryId, status, query.getAttemptCount());
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisQueryView> findQuery(UUID queryId, UUID householdId) {
        return queryRepository.findByIdAndHouseholdId(queryId, householdId)
                .map(query -> toView(query, findAttempts(queryId)));
    }

    @Transactional(readOnly = true)
    public List<AnalysisQueryView.Attempt> findAttempts(UUID queryId) {
        return attemptRepository.findByAnalysisQueryIdOrderByAttemptNumberAsc(queryId).stream()
                .map(a -> new AnalysisQueryView.Attempt(
                        a.getAttemptNumber(),
                        a.getGeneratedSql(),
                        a.getLlmReason(),
                        a.isValidationOk(),
                        a.getValidationReason(),
                        a.isExecutionOk(),
                        a.getDbError(),
                        a.getRepairReason(),
                        a.getCreatedAt()))
                .toList();
    }

    private static AnalysisQueryView toView(AnalysisQueryEntity query, List<AnalysisQueryView.Attempt> attempts) {
        return new AnalysisQueryView(
                query.getId(),
                query.getHouseholdId(),
                query.getUserId(),
                query.getProvider(),
                query.getModel(),
                query.getQuestion(),
                query.getStatus(),
                query.getAttemptCount(),
                query.getFinalSql(),
                query.getFinalAnswer(),
                query.getFailureReason(),
                query.getCreatedAt(),
                query.getUpdatedAt(),
                attempts);
    }
}
