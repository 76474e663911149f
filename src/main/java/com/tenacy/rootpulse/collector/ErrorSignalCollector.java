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

/**
 * 구간 내 에러 span 조회. 한 번의 호출에 정확히 한 번 조회하며 재시도하지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ErrorSignalCollector {

    private final LogQueryClient queryClient;
    private final AnalysisProperties analysisProperties;
    private final LogStoreProperties logStoreProperties;

    public List<LogRecord> collectErrors(TimeWindow window) {
        return collectErrors(window, analysisProperties.getErrorTracesLimit());
    }

    public List<LogRecord> collectErrors(TimeWindow window, int limit) {
        if (window == null) {
            throw new AnalysisValidationException("Time window is required");
        }
        if (limit <= 0) {
            throw new AnalysisValidationException("Error record limit must be positive: " + limit);
        }

        String query = analysisProperties.getErrorQuery();
        log.info("에러 span 조회: window={}, query={}, limit={}", window, query, limit);

        // 저장소가 준 순서(최신 순)를 그대로 유지
        List<LogRecord> records = queryClient.query(query, window, logStoreProperties.toQueryScope(), limit);

        log.info("조회된 에러 span 수: {}", records.size());
        return records;
    }
}
