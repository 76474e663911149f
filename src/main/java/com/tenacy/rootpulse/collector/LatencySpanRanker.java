package com.tenacy.rootpulse.collector;

import com.tenacy.rootpulse.config.AnalysisProperties;
import com.tenacy.rootpulse.query.LogRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 지연 위반 span 을 독점 시간(자기 시간) 기여도로 줄인다.
 *
 * <p>span 의 독점 시간은 자신의 실행 시간에서 같은 결과 집합 안의 직계 자식 실행 시간 합을 뺀 값이다.
 * 평상시 구간의 서비스/span 별 평균 독점 시간을 빼서 평소보다 늘어난 만큼만 남기고,
 * 내림차순으로 누적해 전체의 {@code latencyContributionRatio} 에 도달할 때까지의 span 을 선택한다.
 * 실행 시간이 없는 레코드는 순위를 매길 수 없으므로 그대로 유지한다. 반환 순서는 입력 순서를 따른다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LatencySpanRanker {

    private final AnalysisProperties properties;

    public List<LogRecord> rank(List<LogRecord> violations, List<LogRecord> baseline) {
        if (violations == null || violations.isEmpty()) {
            return List.of();
        }

        String durationField = properties.getDurationField();
        Map<List<String>, Double> averages = properties.isLatencyMinusAverage()
                ? averageExclusiveDurations(baseline, durationField)
                : Map.of();

        Map<Integer, Long> exclusive = exclusiveDurations(violations, durationField);

        List<RankedSpan> ranked = new ArrayList<>();
        for (Map.Entry<Integer, Long> entry : exclusive.entrySet()) {
            LogRecord record = violations.get(entry.getKey());
            long adjusted = cap(entry.getValue());
            Double average = spanKey(record).map(averages::get).orElse(null);
            if (average != null) {
                adjusted = cap(Math.max(0L, adjusted - Math.round(average)));
            }
            ranked.add(new RankedSpan(entry.getKey(), record.getString(LogRecord.TRACE_ID).orElse(null), adjusted));
        }

        if (properties.isLatencyOnlyTop1PerTrace()) {
            ranked = topPerTrace(ranked);
        }

        boolean[] selected = selectTopContributors(ranked, violations.size());

        List<LogRecord> result = new ArrayList<>();
        for (int i = 0; i < violations.size(); i++) {
            if (selected[i] || !exclusive.containsKey(i)) {
                result.add(violations.get(i));
            }
        }

        log.info("독점 시간 상위 span: {}건 / 지연 위반 {}건 (평균 보정 키 {}개)",
                result.size(), violations.size(), averages.size());
        return result;
    }

    private boolean[] selectTopContributors(List<RankedSpan> ranked, int size) {
        boolean[] selected = new boolean[size];

        long total = ranked.stream().mapToLong(span -> span.adjusted).sum();
        if (total == 0) {
            log.debug("보정 후 독점 시간 합이 0, 상위 span 없음");
            return selected;
        }

        List<RankedSpan> sorted = new ArrayList<>(ranked);
        sorted.sort(Comparator.comparingLong((RankedSpan span) -> span.adjusted).reversed());

        double target = total * properties.getLatencyContributionRatio();
        long cumulative = 0;
        for (RankedSpan span : sorted) {
            cumulative += span.adjusted;
            selected[span.index] = true;
            if (cumulative >= target) {
                break;
            }
        }
        return selected;
    }

    // trace 마다 보정된 독점 시간이 가장 긴 span 하나 (동률이면 먼저 나온 span)
    private static List<RankedSpan> topPerTrace(List<RankedSpan> ranked) {
        Map<String, RankedSpan> top = new LinkedHashMap<>();
        List<RankedSpan> result = new ArrayList<>();
        for (RankedSpan span : ranked) {
            if (span.traceId == null) {
                result.add(span);
                continue;
            }
            top.merge(span.traceId, span, (current, candidate) -> candidate.adjusted > current.adjusted ? candidate : current);
        }
        result.addAll(top.values());
        return result;
    }

    /**
     * 레코드 위치 → 독점 시간. 실행 시간이 없거나 0 이하인 레코드는 제외된다.
     */
    Map<Integer, Long> exclusiveDurations(List<LogRecord> records, String durationField) {
        // traceId + parentSpanId 별 자식 실행 시간 합
        Map<List<String>, Long> childDurations = new HashMap<>();
        for (LogRecord record : records) {
            Optional<String> traceId = record.getString(LogRecord.TRACE_ID);
            Optional<String> parentSpanId = record.getString(LogRecord.PARENT_SPAN_ID);
            Optional<Long> duration = record.getLong(durationField);
            if (traceId.isPresent() && parentSpanId.isPresent() && duration.isPresent()) {
                childDurations.merge(List.of(traceId.get(), parentSpanId.get()), duration.get(), Long::sum);
            }
        }

        Map<Integer, Long> exclusive = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            LogRecord record = records.get(i);
            Optional<Long> duration = record.getLong(durationField);
            if (duration.isEmpty() || duration.get() <= 0) {
                continue;
            }

            long children = 0;
            Optional<String> traceId = record.getString(LogRecord.TRACE_ID);
            Optional<String> spanId = record.getString(LogRecord.SPAN_ID);
            if (traceId.isPresent() && spanId.isPresent()) {
                children = childDurations.getOrDefault(List.of(traceId.get(), spanId.get()), 0L);
            }
            exclusive.put(i, Math.max(0L, duration.get() - children));
        }
        return exclusive;
    }

    Map<List<String>, Double> averageExclusiveDurations(List<LogRecord> baseline, String durationField) {
        if (baseline == null || baseline.isEmpty()) {
            return Map.of();
        }

        Map<List<String>, long[]> sums = new HashMap<>();
        exclusiveDurations(baseline, durationField).forEach((index, duration) ->
                spanKey(baseline.get(index)).ifPresent(key -> {
                    long[] sum = sums.computeIfAbsent(key, k -> new long[2]);
                    sum[0] += duration;
                    sum[1]++;
                }));

        Map<List<String>, Double> averages = new HashMap<>();
        sums.forEach((key, sum) -> averages.put(key, (double) sum[0] / sum[1]));
        return averages;
    }

    private static Optional<List<String>> spanKey(LogRecord record) {
        Optional<String> service = record.getString(LogRecord.SERVICE_NAME);
        Optional<String> span = record.getString(LogRecord.SPAN_NAME);
        if (service.isEmpty() || span.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(List.of(service.get(), span.get()));
    }

    private long cap(long duration) {
        long max = properties.getMaxExclusiveDurationNanos();
        return max > 0 ? Math.min(duration, max) : duration;
    }

    private static final class RankedSpan {
        private final int index;
        private final String traceId;
        private final long adjusted;

        private RankedSpan(int index, String traceId, long adjusted) {
            this.index = index;
            this.traceId = traceId;
            this.adjusted = adjusted;
        }
    }
}
