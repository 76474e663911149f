package com.tenacy.rootpulse.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class RankedCause {
    private final String label;
    private final int evidenceCount;
    private final int errorEvidenceCount;
    private final int latencyEvidenceCount;
    private final double confidence;  // 전체 일치 증거 중 이 후보의 비율
}
