package com.homepurse.analysis.controller;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.homepurse.analysis.agent.AnalysisAnswer;
import com.homepurse.analysis.agent.AnalysisCancelledException;
import com.homepurse.analysis.agent.AnalysisOutcome;
import com.homepurse.analysis.agent.AnalysisService;
import com.homepurse.analysis.agent.SchemaUnavailableException;
import com.homepurse.analysis.audit.AnalysisQueryView;
import com.homepurse.analysis.audit.QueryAuditLog;
import com.homepurse.analysis.audit.QueryStatus;
import com.homepurse.analysis.security.HouseholdScope;
import com.homepurse.analysis.security.HouseholdScopeResolver;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    private static final UUID HOUSEHOLD_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID USER_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID QUERY_ID = UUID.fromString("33333333-3333-3333-3333-333333333333");
    private static final HouseholdScope SCOPE = new HouseholdScope(HOUSEHOLD_ID, USER_ID);

    @Mock
    AnalysisService analysisService;
    @Mock
    QueryAuditLog auditLog;
    @Mock
    HouseholdScopeResolver householdScopeResolver;

    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AnalysisController(analysisService, auditLog, householdScopeResolver))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void askReturnsAnswerTableAndChart() throws Exception {
        when(householdScopeResolver.requireCurrentScope()).thenReturn(SCOPE);
        AnalysisAnswer answer = new AnalysisAnswer(
                "Found 2 rows.",
                new AnalysisAnswer.Table(List.of("category", "total"),
                        List.of(List.<Object>of("Groceries", 120.0), List.<Object>of("Utilities", 80.0))),
                new AnalysisAnswer.Chart("bar", "Total by category",
                        List.of(new AnalysisAnswer.Point("Groceries", 120.0), new AnalysisAnswer.Point("Utilities", 80.0))));
        when(analysisService.ask(SCOPE, "Spending by category"))
                .thenReturn(new AnalysisOutcome(QUERY_ID, QueryStatus.SUCCESS, answer,
                        "SELECT category, SUM(amount) AS total FROM household_expenses GROUP BY category", 2));

        mockMvc.perform(post("/analysis/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Spending by category\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queryId").value(QUERY_ID.toString()))
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.answer").value("Found 2 rows."))
                .andExpect(jsonPath("$.table.columns[1]").value("total"))
                .andExpect(jsonPath("$.chart.chartType").value("bar"))
                .andExpect(jsonPath("$.chart.points[0].label").value("Groceries"))
                .andExpect(jsonPath("$.attemptCount").value(2));
    }

    @Test
    void exhaustedRunIsStillOk() throws Exception {
        when(householdScopeResolver.requireCurrentScope()).thenReturn(SCOPE);
        when(analysisService.ask(SCOPE, "Show spending"))
                .thenReturn(new AnalysisOutcome(QUERY_ID, QueryStatus.FAILED,
                        new AnalysisAnswer("I could not answer that after 3 attempt(s).", null, null), null, 3));

        mockMvc.perform(post("/api/analysis/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Show spending\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.finalSql").value(nullValue()))
                .andExpect(jsonPath("$.attemptCount").value(3));
    }

    @Test
    void blankQuestionIsRejected() throws Exception {
        mockMvc.perform(post("/analysis/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(analysisService);
    }

    @Test
    void schemaFailureMapsTo503() throws Exception {
        when(householdScopeResolver.requireCurrentScope()).thenReturn(SCOPE);
        when(analysisService.ask(any(), anyString())).thenThrow(new SchemaUnavailableException("down"));

        mockMvc.perform(post("/analysis/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Spending by category\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SCHEMA_UNAVAILABLE"));
    }

    @Test
    void cancellationMapsTo503WithQueryId() throws Exception {
        when(householdScopeResolver.requireCurrentScope()).thenReturn(SCOPE);
        when(analysisService.ask(any(), anyString())).thenThrow(new AnalysisCancelledException(QUERY_ID));

        mockMvc.perform(post("/analysis/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Spending by category\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("ANALYSIS_CANCELLED"))
                .andExpect(jsonPath("$.details.queryId").value(QUERY_ID.toString()));
    }

    @Test
    void missingHouseholdIsForbidden() throws Exception {
        when(householdScopeResolver.requireCurrentScope())
                .thenThrow(new HouseholdScopeResolver.HouseholdNotFoundException(USER_ID));

        mockMvc.perform(post("/analysis/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Spending by category\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("HOUSEHOLD_REQUIRED"));
    }

    @Test
    void queryDetailReturnsAttempts() throws Exception {
        when(householdScopeResolver.requireCurrentScope()).thenReturn(SCOPE);
        Instant at = Instant.parse("2024-06-15T08:00:00Z");
        AnalysisQueryView view = new AnalysisQueryView(QUERY_ID, HOUSEHOLD_ID, USER_ID, "openai", "gpt-test",
                "Show spending", QueryStatus.FAILED, 1, null, "I could not answer that", "timeout", at, at,
                List.of(new AnalysisQueryView.Attempt(1, "SELECT pg_sleep(10)", null, false,
                        "Function 'pg_sleep' is not allowed", false, null, null, at)));
        when(auditLog.findQuery(QUERY_ID, HOUSEHOLD_ID)).thenReturn(Optional.of(view));

        mockMvc.perform(get("/analysis/queries/{id}", QUERY_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.attempts[0].validationReason").value("Function 'pg_sleep' is not allowed"));
    }

    @Test
    void queryOfAnotherHouseholdIsNotFound() throws Exception {
        when(householdScopeResolver.requireCurrentScope()).thenReturn(SCOPE);
        when(auditLog.findQuery(QUERY_ID, HOUSEHOLD_ID)).thenReturn(Optional.empty());

        mockMvc.perform(get("/analysis/queries/{id}", QUERY_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
