package com.homepurse.analysis.agent;

import com.homepurse.analysis.audit.QueryAuditLog;
import com.homepurse.analysis.audit.QueryStatus;
import com.homepurse.analysis.security.HouseholdScope;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers one household question end to end: schema, audited repair loop, summary.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);
    public static final int MAX_QUESTION_LENGTH = 2000;

    private final SchemaContextProvider schemaContextProvider;
    private final RepairLoopController repairLoopController;
    private final AnswerSummarizer answerSummarizer;
    private final QueryAuditLog auditLog;
    private final SqlGenerator sqlGenerator;

    public AnalysisService(SchemaContextProvider schemaContextProvider,
                           RepairLoopController repairLoopController,
                           AnswerSummarizer answerSummarizer,
                           QueryAuditLog auditLog,
                           SqlGenerator sqlGenerator) {
        this.schemaContextProvider = schemaContextProvider;
        this.repairLoopController = repairLoopController;
        this.answerSummarizer = answerSummarizer;
        this.auditLog = auditLog;
        this.sqlGenerator = sqlGenerator;
    }

    public AnalysisOutcome ask(HouseholdScope scope, String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        String trimmed = question.strip();
        if (trimmed.length() > MAX_QUESTION_LENGTH) {
            throw new IllegalArgumentException("question must be at most " + MAX_QUESTION_LENGTH + " characters");
        }

        // Setup failures surface before any audit row exists.
        SchemaContext context = schemaContextProvider.load(scope.householdId());

        UUID queryId = auditLog.startQuery(trimmed, scope.householdId(), scope.userId(),
                sqlGenerator.providerName(), sqlGenerator.model());
        AgentRun run = repairLoopController.run(queryId, trimmed, context);

        if (run.succeeded()) {
            AnalysisAnswer answer = answerSummarizer.summarize(trimmed, run.result());
            auditLog.finalizeQuery(queryId, QueryStatus.SUCCESS, run.finalSql(), answer.text(), null);
            return new AnalysisOutcome(queryId, QueryStatus.SUCCESS, answer, run.finalSql(), run.attemptCount());
        }
        AnalysisAnswer answer = answerSummarizer.failure(trimmed, run.attemptCount(), run.lastFailure());
        auditLog.finalizeQuery(queryId, QueryStatus.FAILED, null, answer.text(), run.lastFailure());
        log.warn("analysis_exhausted queryId={} attempts={} lastFailure={}", queryId, run.attemptCount(), run.lastFailure());
        return new AnalysisOutcome(queryId, QueryStatus.FAILED, answer, null, run.attemptCount());
    }
}
