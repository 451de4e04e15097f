package com.homepurse.analysis.controller;

import com.homepurse.analysis.agent.AnalysisCancelledException;
import com.homepurse.analysis.agent.SchemaUnavailableException;
import com.homepurse.analysis.controller.dto.ErrorResponseDto;
import com.homepurse.analysis.security.HouseholdScopeResolver;
import com.homepurse.analysis.security.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request body is invalid",
                Map.of("reason", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(HouseholdScopeResolver.HouseholdNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNoHousehold(HouseholdScopeResolver.HouseholdNotFoundException ex) {
        return build(HttpStatus.FORBIDDEN, "HOUSEHOLD_REQUIRED", "User is not an active member of a household", Map.of());
    }

    @ExceptionHandler(AnalysisController.AnalysisQueryNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleQueryNotFound(AnalysisController.AnalysisQueryNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(SchemaUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleSchemaUnavailable(SchemaUnavailableException ex) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, "SCHEMA_UNAVAILABLE",
                "Analysis is temporarily unavailable; please try again shortly", Map.of());
    }

    @ExceptionHandler(AnalysisCancelledException.class)
    public ResponseEntity<ErrorResponseDto> handleCancelled(AnalysisCancelledException ex) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, "ANALYSIS_CANCELLED", "The analysis was cancelled",
                Map.of("queryId", ex.queryId().toString()));
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        String specific = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        log.warn("analysis_db_unavailable householdId={} error={}", currentHousehold(), specific);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Database temporarily unavailable", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        String msg = ex.getMessage() != null ? ex.getMessage().toLowerCase() : "";
        if (msg.contains("relation \"analysis_queries\" does not exist")
                || msg.contains("relation \"analysis_query_attempts\" does not exist")) {
            return build(HttpStatus.INTERNAL_SERVER_ERROR, "DB_SCHEMA_MISSING", "Database schema not initialized", Map.of(
                    "action", "Enable HOMEPURSE_DB_BOOTSTRAP=true once or apply db/bootstrap/analysis_schema.sql"));
        }
        log.error("analysis_unhandled_error householdId={}", currentHousehold(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of());
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status).body(ErrorResponseDto.of(code, message, details));
    }

    private static String currentHousehold() {
        return RequestContextHolder.scope().map(scope -> scope.householdId().toString()).orElse("-");
    }
}
