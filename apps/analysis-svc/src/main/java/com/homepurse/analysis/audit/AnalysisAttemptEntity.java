package com.homepurse.analysis.audit;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "analysis_query_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uq_analysis_attempt_number",
                columnNames = {"analysis_query_id", "attempt_number"}))
public class AnalysisAttemptEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "analysis_query_id", nullable = false)
    private UUID analysisQueryId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "generated_sql", nullable = false, columnDefinition = "text")
    private String generatedSql;

    @Column(name = "llm_reason", columnDefinition = "text")
    private String llmReason;

    @Column(name = "validation_ok", nullable = false)
    private boolean validationOk;

    @Column(name = "validation_reason", columnDefinition = "text")
    private String validationReason;

    @Column(name = "execution_ok", nullable = false)
    private boolean executionOk;

    @Column(name = "db_error", columnDefinition = "text")
    private String dbError;

    @Column(name = "repair_reason", columnDefinition = "text")
    private String repairReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public AnalysisAttemptEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getAnalysisQueryId() { return analysisQueryId; }
    public void setAnalysisQueryId(UUID analysisQueryId) { this.analysisQueryId = analysisQueryId; }

    public int getAttemptNumber() { return attemptNumber; }
    public void setAttemptNumber(int attemptNumber) { this.attemptNumber = attemptNumber; }

    public String getGeneratedSql() { return generatedSql; }
    public void setGeneratedSql(String generatedSql) { this.generatedSql = generatedSql; }

    public String getLlmReason() { return llmReason; }
    public void setLlmReason(String llmReason) { this.llmReason = llmReason; }

    public boolean isValidationOk() { return validationOk; }
    public void setValidationOk(boolean validationOk) { this.validationOk = validationOk; }

    public String getValidationReason() { return validationReason; }
    public void setValidationReason(String validationReason) { this.validationReason = validationReason; }

    public boolean isExecutionOk() { return executionOk; }
    public void setExecutionOk(boolean executionOk) { this.executionOk = executionOk; }

    public String getDbError() { return dbError; }
    public void setDbError(String dbError) { this.dbError = dbError; }

    public String getRepairReason() { return repairReason; }
    public void setRepairReason(String repairReason) { this.repairReason = repairReason; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
