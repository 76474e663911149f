package com.tenacy.rootpulse.collector;

import com.tenacy.rootpulse.query.LogRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * trace 안에서 에러가 전파된 경로를 따라 가장 깊은 에러 span 만 남긴다.
 *
 * <p>statusCode 가 1 보다 큰 span 중, 같은 결과 집합 안에 에러 상태인 자식 span 이 없는 것이
 * 근본 원인 span 이다. traceId 나 spanId 가 없는 레코드는 판단할 수 없으므로 그대로 유지한다.
 */
@Component
@Slf4j
public class RootCauseSpanLocator {

    private static final int ERROR_STATUS_THRESHOLD = 1;

    public List<LogRecord> locate(List<LogRecord> errorRecords) {
        if (errorRecords == null || errorRecords.isEmpty()) {
            return List.of();
        }

        // traceId 별로 에러 상태인 부모 spanId 수집
        Map<String, Set<String>> parentsOfErrorSpans = new LinkedHashMap<>();
        for (LogRecord record : errorRecords) {
            Optional<String> traceId = record.getString(LogRecord.TRACE_ID);
            Optional<String> parentSpanId = record.getString(LogRecord.PARENT_SPAN_ID);
            if (traceId.isPresent() && parentSpanId.isPresent() && isError(record)) {
                parentsOfErrorSpans.computeIfAbsent(traceId.get(), k -> new HashSet<>()).add(parentSpanId.get());
            }
        }

        List<LogRecord> rootCauseSpans = new ArrayList<>();
        for (LogRecord record : errorRecords) {
            Optional<String> traceId = record.getString(LogRecord.TRACE_ID);
            Optional<String> spanId = record.getString(LogRecord.SPAN_ID);

            if (traceId.isEmpty() || spanId.isEmpty()) {
                rootCauseSpans.add(record);
                continue;
            }
            if (!isError(record)) {
                continue;
            }

            Set<String> erroredParents = parentsOfErrorSpans.getOrDefault(traceId.get(), Set.of());
            if (!erroredParents.contains(spanId.get())) {
                rootCauseSpans.add(record);
            }
        }

        log.info("근본 원인 span: {}건 / 에러 span {}건 (trace {}개)",
                rootCauseSpans.size(), errorRecords.size(), parentsOfErrorSpans.size());
        return rootCauseSpans;
    }

    private boolean isError(LogRecord record) {
        // statusCode 가 없으면 에러 쿼리 결과를 신뢰
        return record.getLong(LogRecord.STATUS_CODE)
                .map(status -> status > ERROR_STATUS_THRESHOLD)
                .orElse(true);
    }
}
