package com.homepurse.analysis.agent;

import com.homepurse.analysis.ai.LanguageModelException;
import com.homepurse.analysis.audit.AttemptRecord;
import com.homepurse.analysis.audit.QueryAuditLog;
import com.homepurse.analysis.config.HomepurseProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives generate, validate, execute and repair for one question until a query succeeds or the
 * attempt ceiling is reached. Each attempt is written to the audit log when it ends.
 */
@Component
public class RepairLoopController {

    private static final Logger log = LoggerFactory.getLogger(RepairLoopController.class);
    private static final Duration EXECUTION_GRACE = Duration.ofSeconds(2);

    private final PromptComposer promptComposer;
    private final SqlGenerator sqlGenerator;
    private final SqlSafetyValidator validator;
    private final ScopedQueryExecutor executor;
    private final QueryAuditLog auditLog;
    private final int maxAttempts;
    private final Duration modelTimeout;
    private final Duration executionTimeout;

    public RepairLoopController(PromptComposer promptComposer,
                                SqlGenerator sqlGenerator,
                                SqlSafetyValidator validator,
                                ScopedQueryExecutor executor,
                                QueryAuditLog auditLog,
                                HomepurseProperties properties) {
        this.promptComposer = promptComposer;
        this.sqlGenerator = sqlGenerator;
        this.validator = validator;
        this.executor = executor;
        this.auditLog = auditLog;
        this.maxAttempts = properties.analysis().maxAttempts();
        this.modelTimeout = properties.analysis().modelTimeout();
        this.executionTimeout = properties.analysis().statementTimeout().plus(EXECUTION_GRACE);
    }

    public AgentRun run(UUID queryId, String question, SchemaContext context) {
        return new Pipeline(queryId, question, context).run();
    }

    /**
     * State of a single run. Never shared between questions.
     */
    private final class Pipeline {
        private final UUID queryId;
        private final String question;
        private final SchemaContext context;
        private final List<AttemptRecord> records = new ArrayList<>();

        private int attemptNumber;
        private PromptPayload prompt;
        private GeneratedSql candidate;
        private ValidationResult validation;
        private AttemptOutcome outcome;
        private String lastFailure;

        Pipeline(UUID queryId, String question, SchemaContext context) {
            this.queryId = queryId;
            this.question = question;
            this.context = context;
        }

        AgentRun run() {
            LoopState state = LoopState.INIT;
            while (!state.isTerminal()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw cancelled();
                }
                LoopState next = switch (state) {
                    case INIT -> start();
                    case GENERATING -> generate();
                    case VALIDATING -> validate();
                    case EXECUTING -> execute();
                    case REPAIRING -> repair();
                    default -> throw new IllegalStateException("Unexpected state " + state);
                };
                log.debug("analysis_transition queryId={} attempt={} from={} to={}", queryId, attemptNumber, state, next);
                state = next;
            }
            if (state == LoopState.SUCCEEDED) {
                AttemptOutcome.Accepted accepted = (AttemptOutcome.Accepted) outcome;
                return new AgentRun(state, records, candidate.sql(), accepted.result(), null);
            }
            return new AgentRun(state, records, null, null, lastFailure);
        }

        private LoopState start() {
            attemptNumber = 1;
            prompt = promptComposer.generation(question, context);
            return LoopState.GENERATING;
        }

        private LoopState generate() {
            candidate = null;
            validation = null;
            try {
                candidate = await(sqlGenerator.generate(prompt), modelTimeout);
                return LoopState.VALIDATING;
            } catch (TimeoutException ex) {
                outcome = new AttemptOutcome.RejectedGeneration("no reply within " + modelTimeout.toSeconds() + "s");
            } catch (SqlGenerationException | LanguageModelException ex) {
                outcome = new AttemptOutcome.RejectedGeneration(ex.getMessage());
            }
            return LoopState.REPAIRING;
        }

        private LoopState validate() {
            validation = validator.validate(candidate.sql(), context.allowedTables());
            if (validation.accepted()) {
                return LoopState.EXECUTING;
            }
            outcome = new AttemptOutcome.RejectedValidation(validation.reason());
            return LoopState.REPAIRING;
        }

        private LoopState execute() {
            try {
                QueryResult result = await(
                        executor.execute(candidate.sql(), validation.referencedTables(), context.householdId()),
                        executionTimeout);
                outcome = new AttemptOutcome.Accepted(result);
                record(null);
                log.info("analysis_attempt queryId={} attempt={} outcome=accepted rows={}",
                        queryId, attemptNumber, result.rowCount());
                return LoopState.SUCCEEDED;
            } catch (TimeoutException ex) {
                outcome = new AttemptOutcome.RejectedExecution(
                        "Query did not finish within " + executor.statementTimeout().toSeconds() + "s");
            } catch (QueryExecutionException ex) {
                outcome = new AttemptOutcome.RejectedExecution(ex.getMessage());
            }
            return LoopState.REPAIRING;
        }

        private LoopState repair() {
            String failureText = outcome.failureText();
            lastFailure = failureText;
            boolean retry = attemptNumber < maxAttempts;
            record(retry ? failureText : null);
            log.warn("analysis_attempt queryId={} attempt={} outcome={} reason={}",
                    queryId, attemptNumber, outcome.getClass().getSimpleName(), failureText);
            if (!retry) {
                return LoopState.EXHAUSTED;
            }
            String failedSql = candidate != null ? candidate.sql() : null;
            prompt = promptComposer.repair(question, context, failedSql, failureText);
            attemptNumber++;
            return LoopState.GENERATING;
        }

        private void record(String repairReason) {
            boolean validationOk = validation != null && validation.accepted();
            String validationReason = outcome instanceof AttemptOutcome.RejectedValidation rejected
                    ? rejected.reason()
                    : outcome instanceof AttemptOutcome.RejectedGeneration ? outcome.failureText() : null;
            String dbError = outcome instanceof AttemptOutcome.RejectedExecution rejected ? rejected.error() : null;
            AttemptRecord record = new AttemptRecord(
                    attemptNumber,
                    candidate != null ? candidate.sql() : "",
                    candidate != null ? candidate.reason() : null,
                    validationOk,
                    validationReason,
                    outcome.succeeded(),
                    dbError,
                    repairReason);
            auditLog.recordAttempt(queryId, record);
            records.add(record);
        }

        private <T> T await(CompletableFuture<T> future, Duration timeout) throws TimeoutException {
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw cancelled();
            } catch (TimeoutException ex) {
                future.cancel(true);
                throw ex;
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException(cause);
            }
        }

        private AnalysisCancelledException cancelled() {
            log.info("analysis_cancelled queryId={} attempt={}", queryId, attemptNumber);
            return new AnalysisCancelledException(queryId);
        }
    }
}
