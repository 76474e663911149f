package com.tenacy.rootpulse.api.dto;

import com.tenacy.rootpulse.analysis.RankedCause;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedCauseResponse {
    private String label;
    private int evidenceCount;
    private int errorEvidenceCount;
    private int latencyEvidenceCount;
    private double confidence;

    public static RankedCauseResponse of(RankedCause cause) {
        return RankedCauseResponse.builder()
                .label(cause.getLabel())
                .evidenceCount(cause.getEvidenceCount())
                .errorEvidenceCount(cause.getErrorEvidenceCount())
                .latencyEvidenceCount(cause.getLatencyEvidenceCount())
                .confidence(cause.getConfidence())
                .build();
    }
}
