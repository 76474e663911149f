package com.tenacy.rootpulse.service;

import com.tenacy.rootpulse.analysis.AnalysisResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@RequiredArgsConstructor
public class AnalysisMetricsService {

    private final Counter analysisCompletedCounter;
    private final Counter analysisFailedCounter;
    private final Counter analysisDegradedCounter;
    private final Counter evidenceRecordsCounter;
    private final Timer analysisTimer;

    public void recordCompleted(AnalysisResult result, Duration elapsed) {
        analysisCompletedCounter.increment();
        evidenceRecordsCounter.increment(result.getErrorRecordsExamined() + result.getLatencyViolations());
        if (result.isDegraded()) {
            analysisDegradedCounter.increment();
        }
        analysisTimer.record(elapsed);
    }

    public void recordFailed(Duration elapsed) {
        analysisFailedCounter.increment();
        analysisTimer.record(elapsed);
    }
}
