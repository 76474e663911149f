package com.tenacy.rootpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tenacy.rootpulse.analysis.AnalysisResult;
import com.tenacy.rootpulse.collector.CollectorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime start;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime end;

    private List<RankedCauseResponse> rootCauses;
    private int errorRecordsExamined;
    private int latencyViolations;
    private boolean degraded;
    private List<CollectorKind> failedCollectors;

    public static AnalysisResponse of(AnalysisResult result) {
        return AnalysisResponse.builder()
                .start(result.getWindow().getStart())
                .end(result.getWindow().getEnd())
                .rootCauses(result.getRootCauses().stream()
                        .map(RankedCauseResponse::of)
                        .collect(Collectors.toList()))
                .errorRecordsExamined(result.getErrorRecordsExamined())
                .latencyViolations(result.getLatencyViolations())
                .degraded(result.isDegraded())
                .failedCollectors(result.getFailedCollectors())
                .build();
    }
}
