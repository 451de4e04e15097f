package com.homepurse.analysis.controller;

import com.homepurse.analysis.agent.AnalysisAnswer;
import com.homepurse.analysis.agent.AnalysisOutcome;
import com.homepurse.analysis.agent.AnalysisService;
import com.homepurse.analysis.audit.AnalysisQueryView;
import com.homepurse.analysis.audit.QueryAuditLog;
import com.homepurse.analysis.controller.dto.AnalysisAskRequestDto;
import com.homepurse.analysis.controller.dto.AnalysisAskResponseDto;
import com.homepurse.analysis.controller.dto.AnalysisQueryResponseDto;
import com.homepurse.analysis.security.HouseholdScope;
import com.homepurse.analysis.security.HouseholdScopeResolver;
import com.homepurse.analysis.security.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/analysis", "/api/analysis"})
@Validated
public class AnalysisController {

    private final AnalysisService analysisService;
    private final QueryAuditLog auditLog;
    private final HouseholdScopeResolver householdScopeResolver;

    public AnalysisController(AnalysisService analysisService,
                              QueryAuditLog auditLog,
                              HouseholdScopeResolver householdScopeResolver) {
        this.analysisService = analysisService;
        this.auditLog = auditLog;
        this.householdScopeResolver = householdScopeResolver;
    }

    @PostMapping("/ask")
    public ResponseEntity<AnalysisAskResponseDto> ask(@Valid @RequestBody AnalysisAskRequestDto request) {
        HouseholdScope scope = householdScopeResolver.requireCurrentScope();
        AnalysisOutcome outcome = analysisService.ask(scope, request.question());
        return ResponseEntity.ok(toDto(outcome));
    }

    @GetMapping("/queries/{queryId}")
    public ResponseEntity<AnalysisQueryResponseDto> query(@PathVariable("queryId") UUID queryId) {
        HouseholdScope scope = householdScopeResolver.requireCurrentScope();
        AnalysisQueryView view = auditLog.findQuery(queryId, scope.householdId())
                .orElseThrow(() -> new AnalysisQueryNotFoundException(queryId));
        return ResponseEntity.ok(toDto(view));
    }

    private static AnalysisAskResponseDto toDto(AnalysisOutcome outcome) {
        AnalysisAnswer answer = outcome.answer();
        AnalysisAskResponseDto.TableDto table = answer.table() == null ? null
                : new AnalysisAskResponseDto.TableDto(answer.table().columns(), answer.table().rows());
        AnalysisAskResponseDto.ChartDto chart = answer.chart() == null ? null
                : new AnalysisAskResponseDto.ChartDto(answer.chart().chartType(), answer.chart().title(),
                        answer.chart().points().stream()
                                .map(p -> new AnalysisAskResponseDto.PointDto(p.label(), p.value()))
                                .toList());
        return new AnalysisAskResponseDto(
                outcome.queryId(),
                outcome.status().name().toLowerCase(Locale.ROOT),
                answer.text(),
                table,
                chart,
                outcome.finalSql(),
                outcome.attemptCount(),
                RequestContextHolder.traceId().orElse(null));
    }

    private static AnalysisQueryResponseDto toDto(AnalysisQueryView view) {
        return new AnalysisQueryResponseDto(
                view.id(),
                view.question(),
                view.status().name().toLowerCase(Locale.ROOT),
                view.provider(),
                view.model(),
                view.attemptCount(),
                view.finalSql(),
                view.finalAnswer(),
                view.failureReason(),
                view.createdAt(),
                view.updatedAt(),
                view.attempts().stream()
                        .map(a -> new AnalysisQueryResponseDto.AttemptDto(
                                a.attemptNumber(), a.generatedSql(), a.llmReason(), a.validationOk(),
                                a.validationReason(), a.executionOk(), a.dbError(), a.repairReason(), a.createdAt()))
                        .toList(),
                RequestContextHolder.traceId().orElse(null));
    }

    public static class AnalysisQueryNotFoundException extends RuntimeException {
        public AnalysisQueryNotFoundException(UUID queryId) {
            super("Analysis query " + queryId + " not found");
        }
    }
}
