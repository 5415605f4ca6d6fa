package com.assessorai.interfaces.api.dto;

import com.assessorai.domain.pipeline.model.Alert;
import com.assessorai.domain.pipeline.model.BlockInfo;
import com.assessorai.domain.pipeline.model.RunReport;
import com.assessorai.domain.pipeline.model.StageId;
import com.assessorai.domain.pipeline.model.StagePayload;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        String runId,
        String outcome,
        int exitCode,
        String status,
        BlockInfo block,
        String errorKind,
        String message,
        Map<StageId, StagePayload> results,
        List<Alert> alerts,
        List<String> escalations,
        Double globalConfidence,
        TokenSummary usage
) {
    public record TokenSummary(long promptTokens, long completionTokens, double estimatedCostUsd) {}

    public static RunResponse from(RunReport report) {
        return new RunResponse(
                report.runId(),
                report.outcome().name(),
                report.exitCode(),
                report.status().name(),
                report.block(),
                report.errorKind() == null ? null : report.errorKind().name(),
                report.message(),
                report.results(),
                report.alerts(),
                report.escalations(),
                report.globalConfidence(),
                new TokenSummary(report.promptTokens(), report.completionTokens(), report.estimatedCostUsd()));
    }
}
