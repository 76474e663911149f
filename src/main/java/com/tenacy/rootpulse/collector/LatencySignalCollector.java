package com.tenacy.rootpulse.collector;

import com.tenacy.rootpulse.analysis.TimeWindow;
import com.tenacy.rootpulse.config.AnalysisProperties;
import com.tenacy.rootpulse.config.LogStoreProperties;
import com.tenacy.rootpulse.exception.AnalysisValidationException;
import com.tenacy.rootpulse.query.LogQueryClient;
import com.tenacy.rootpulse.query.LogRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 구간 내 실행 시간이 임계값(나노초)을 넘는 span 조회.
 * 빈 결과는 "위반 없음"을 뜻한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LatencySignalCollector {

    private final LogQueryClient queryClient;
    private final AnalysisProperties analysisProperties;
    private final LogStoreProperties logStoreProperties;

    public List<LogRecord> collectLatencyViolations(TimeWindow window) {
        return collectLatencyViolations(window, analysisProperties.getDurationThresholdNanos());
    }

    public List<LogRecord> collectLatencyViolations(TimeWindow window, long durationThresholdNanos) {
        if (window == null) {
            throw new AnalysisValidationException("Time window is required");
        }
        if (durationThresholdNanos < 0) {
            throw new AnalysisValidationException("Duration threshold must not be negative: " + durationThresholdNanos);
        }

        String durationField = analysisProperties.getDurationField();
        String query = durationField + ":>" + durationThresholdNanos;
        int limit = analysisProperties.getLatencyTracesLimit();
        log.info("고지연 span 조회: window={}, query={}, limit={}", window, query, limit);

        List<LogRecord> records = queryClient.query(query, window, logStoreProperties.toQueryScope(), limit);

        // 서버 필터를 통과했더라도 값이 임계값 이하인 레코드는 제외
        List<LogRecord> violations = records.stream()
                .filter(record -> exceeds(record.getLong(durationField), durationThresholdNanos))
                .collect(Collectors.toList());

        if (violations.size() < records.size()) {
            log.debug("임계값 이하 레코드 {}건 제외", records.size() - violations.size());
        }
        log.info("임계값 초과 span 수: {}", violations.size());
        return violations;
    }

    /**
     * 장애 구간 직전의 평상시 구간에서 실행 시간이 기록된 span 을 조회한다. 독점 시간 평균 계산용이다.
     */
    public List<LogRecord> collectBaseline(TimeWindow incidentWindow) {
        if (incidentWindow == null) {
            throw new AnalysisValidationException("Time window is required");
        }

        TimeWindow baselineWindow = TimeWindow.of(
                incidentWindow.getStart().minus(analysisProperties.getBaselineWindow()),
                incidentWindow.getStart());
        String query = analysisProperties.getDurationField() + ":>0";
        int limit = analysisProperties.getBaselineTracesLimit();
        log.info("평상시 span 조회: window={}, query={}, limit={}", baselineWindow, query, limit);

        List<LogRecord> records = queryClient.query(query, baselineWindow, logStoreProperties.toQueryScope(), limit);

        log.info("평상시 span 수: {}", records.size());
        return records;
    }

    private boolean exceeds(Optional<Long> duration, long threshold) {
        // 값이 없으면 서버 필터 결과를 신뢰
        return duration.map(value -> value > threshold).orElse(true);
    }
}
