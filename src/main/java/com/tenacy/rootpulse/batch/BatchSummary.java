package com.tenacy.rootpulse.batch;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@AllArgsConstructor
@ToString
public class BatchSummary {
    private final List<CaseResult> results;

    public long count(CaseStatus status) {
        return results.stream().filter(result -> result.getStatus() == status).count();
    }

    public int total() {
        return results.size();
    }
}
