package com.tenacy.rootpulse.analysis;

import com.tenacy.rootpulse.collector.CollectorKind;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 한 번의 분석 결과. 생성 후 변경되지 않는다.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AnalysisResult {

    private final TimeWindow window;
    private final List<RankedCause> rootCauses;
    private final int errorRecordsExamined;
    private final int latencyViolations;
    private final boolean degraded;
    private final List<CollectorKind> failedCollectors;

    @Builder
    private AnalysisResult(TimeWindow window, List<RankedCause> rootCauses, int errorRecordsExamined,
                           int latencyViolations, boolean degraded, List<CollectorKind> failedCollectors) {
        this.window = window;
        this.rootCauses = rootCauses == null ? List.of() : List.copyOf(rootCauses);
        this.errorRecordsExamined = errorRecordsExamined;
        this.latencyViolations = latencyViolations;
        this.degraded = degraded;
        this.failedCollectors = failedCollectors == null ? List.of() : List.copyOf(failedCollectors);
    }

    public static AnalysisResult empty(TimeWindow window) {
        return AnalysisResult.builder().window(window).build();
    }

    public List<String> getRootCauseLabels() {
        return rootCauses.stream()
                .map(RankedCause::getLabel)
                .collect(Collectors.toList());
    }

    public boolean hasRootCause() {
        return !rootCauses.isEmpty();
    }

    public int getEvidenceCount(String label) {
        return rootCauses.stream()
                .filter(cause -> cause.getLabel().equals(label))
                .mapToInt(RankedCause::getEvidenceCount)
                .findFirst()
                .orElse(0);
    }
}
