package com.tenacy.rootpulse.collector;

import com.tenacy.rootpulse.config.AnalysisProperties;
import com.tenacy.rootpulse.query.LogRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LatencySpanRankerTest {

    private AnalysisProperties properties;
    private LatencySpanRanker ranker;

    @BeforeEach
    void setUp() {
        properties = new AnalysisProperties();
        ranker = new LatencySpanRanker(properties);
    }

    private static LogRecord span(String traceId, String spanId, String parentSpanId,
                                  String service, String spanName, Long duration) {
        Map<String, Object> fields = new HashMap<>();
        fields.put(LogRecord.TRACE_ID, traceId);
        fields.put(LogRecord.SPAN_ID, spanId);
        if (parentSpanId != null) {
            fields.put(LogRecord.PARENT_SPAN_ID, parentSpanId);
        }
        fields.put(LogRecord.SERVICE_NAME, service);
        fields.put(LogRecord.SPAN_NAME, spanName);
        if (duration != null) {
            fields.put("duration", duration);
        }
        return LogRecord.of(fields);
    }

    @Test
    @DisplayName("독점 시간은 직계 자식 실행 시간을 뺀 값이며 0 미만이 되지 않음")
    void exclusiveDurationSubtractsDirectChildren() {
        // given: frontend(10) → checkout(8) → payment(7), checkout 의 자식 합이 자신보다 긴 cart(9)
        List<LogRecord> records = List.of(
                span("t1", "a", null, "frontend", "GET /", 10L),
                span("t1", "b", "a", "checkout", "PlaceOrder", 8L),
                span("t1", "c", "b", "payment", "Charge", 7L),
                span("t2", "d", null, "cart", "GetCart", 9L),
                span("t2", "e", "d", "redis", "GET", 5L),
                span("t2", "f", "d", "redis", "GET", 6L));

        // when
        Map<Integer, Long> exclusive = ranker.exclusiveDurations(records, "duration");

        // then
        assertThat(exclusive).containsEntry(0, 2L)
                .containsEntry(1, 1L)
                .containsEntry(2, 7L)
                .containsEntry(3, 0L)
                .containsEntry(4, 5L)
                .containsEntry(5, 6L);
    }

    @Test
    @DisplayName("누적 기여도 95% 에 도달할 때까지의 span 만 선택하고 입력 순서로 반환")
    void selectsTopContributors() {
        // given
        properties.setLatencyMinusAverage(false);
        LogRecord small = span("t1", "a", null, "cart", "GetCart", 20L);
        LogRecord large = span("t2", "b", null, "checkout", "PlaceOrder", 900L);
        LogRecord medium = span("t3", "c", null, "payment", "Charge", 80L);

        // when
        List<LogRecord> ranked = ranker.rank(List.of(small, large, medium), List.of());

        // then: 900 + 80 = 980 >= 950
        assertThat(ranked).containsExactly(large, medium);
    }

    @Test
    @DisplayName("평상시 평균 독점 시간을 빼면 평소에도 느린 span 은 밀려남")
    void subtractsBaselineAverage() {
        // given
        LogRecord usuallySlow = span("t1", "a", null, "search", "Query", 1_000L);
        LogRecord regressed = span("t2", "b", null, "checkout", "PlaceOrder", 600L);
        List<LogRecord> baseline = List.of(
                span("b1", "x", null, "search", "Query", 950L),
                span("b2", "y", null, "search", "Query", 1_050L),
                span("b3", "z", null, "checkout", "PlaceOrder", 100L));

        // when
        List<LogRecord> ranked = ranker.rank(List.of(usuallySlow, regressed), baseline);

        // then: search 1000-1000=0, checkout 600-100=500
        assertThat(ranked).containsExactly(regressed);
        assertThat(ranker.averageExclusiveDurations(baseline, "duration"))
                .containsEntry(List.of("search", "Query"), 1_000.0)
                .containsEntry(List.of("checkout", "PlaceOrder"), 100.0);
    }

    @Test
    @DisplayName("trace 당 상위 1개 옵션이면 같은 trace 의 나머지 span 은 제외")
    void onlyTopSpanPerTrace() {
        // given
        properties.setLatencyMinusAverage(false);
        properties.setLatencyOnlyTop1PerTrace(true);
        properties.setLatencyContributionRatio(1.0);
        LogRecord first = span("t1", "a", null, "checkout", "PlaceOrder", 300L);
        LogRecord second = span("t1", "b", null, "payment", "Charge", 200L);
        LogRecord other = span("t2", "c", null, "cart", "GetCart", 100L);

        // when
        List<LogRecord> ranked = ranker.rank(List.of(first, second, other), List.of());

        // then
        assertThat(ranked).containsExactly(first, other);
    }

    @Test
    @DisplayName("실행 시간이 없는 레코드는 항상 유지하고 보정 합이 0 이면 나머지는 선택하지 않음")
    void recordsWithoutDurationAreKept() {
        // given
        LogRecord unknown = span("t1", "a", null, "checkout", "PlaceOrder", null);
        LogRecord normal = span("t2", "b", null, "cart", "GetCart", 100L);
        List<LogRecord> baseline = List.of(span("b1", "x", null, "cart", "GetCart", 150L));

        // when
        List<LogRecord> ranked = ranker.rank(List.of(unknown, normal), baseline);

        // then
        assertThat(ranked).containsExactly(unknown);
    }

    @Test
    @DisplayName("최대 독점 시간이 설정되면 그 값으로 잘라서 기여도를 계산")
    void capsExclusiveDuration() {
        // given
        properties.setLatencyMinusAverage(false);
        properties.setMaxExclusiveDurationNanos(100L);
        properties.setLatencyContributionRatio(0.5);
        LogRecord huge = span("t1", "a", null, "checkout", "PlaceOrder", 10_000L);
        LogRecord capped = span("t2", "b", null, "payment", "Charge", 100L);

        // when
        List<LogRecord> ranked = ranker.rank(List.of(huge, capped), List.of());

        // then: 둘 다 100 으로 같아 먼저 나온 span 하나로 50% 도달
        assertThat(ranked).containsExactly(huge);
    }

    @Test
    @DisplayName("빈 입력은 빈 결과")
    void emptyInput() {
        assertThat(ranker.rank(List.of(), List.of())).isEmpty();
        assertThat(ranker.rank(null, null)).isEmpty();
    }
}
