package com.tenacy.rootpulse.collector;

import com.tenacy.rootpulse.query.LogRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RootCauseSpanLocatorTest {

    private final RootCauseSpanLocator locator = new RootCauseSpanLocator();

    private static LogRecord span(String traceId, String spanId, String parentSpanId, int statusCode, String service) {
        Map<String, Object> fields = new HashMap<>();
        fields.put(LogRecord.TRACE_ID, traceId);
        fields.put(LogRecord.SPAN_ID, spanId);
        if (parentSpanId != null) {
            fields.put(LogRecord.PARENT_SPAN_ID, parentSpanId);
        }
        fields.put(LogRecord.STATUS_CODE, statusCode);
        fields.put(LogRecord.SERVICE_NAME, service);
        return LogRecord.of(fields);
    }

    @Test
    @DisplayName("에러가 전파된 체인에서 가장 깊은 span 만 남김")
    void keepsDeepestErrorSpan() {
        // given: frontend → checkout → payment 모두 에러
        LogRecord frontend = span("t1", "s1", null, 2, "frontend");
        LogRecord checkout = span("t1", "s2", "s1", 2, "checkout");
        LogRecord payment = span("t1", "s3", "s2", 2, "payment");

        // when
        List<LogRecord> located = locator.locate(List.of(frontend, checkout, payment));

        // then
        assertThat(located).containsExactly(payment);
    }

    @Test
    @DisplayName("trace 가 다르면 서로 영향을 주지 않음")
    void tracesAreIndependent() {
        LogRecord parent = span("t1", "s1", null, 2, "frontend");
        LogRecord otherTraceChild = span("t2", "s9", "s1", 2, "cart");

        assertThat(locator.locate(List.of(parent, otherTraceChild)))
                .containsExactly(parent, otherTraceChild);
    }

    @Test
    @DisplayName("정상 상태 자식은 부모를 가리지 않고 자신도 제외됨")
    void okChildDoesNotHideParent() {
        LogRecord parent = span("t1", "s1", null, 2, "frontend");
        LogRecord okChild = span("t1", "s2", "s1", 1, "payment");

        assertThat(locator.locate(List.of(parent, okChild))).containsExactly(parent);
    }

    @Test
    @DisplayName("traceId 나 spanId 가 없는 레코드는 유지")
    void recordsWithoutTraceContextAreKept() {
        LogRecord bare = LogRecord.of(Map.of(LogRecord.EVIDENCE, "payment.Timeout"));

        assertThat(locator.locate(List.of(bare))).containsExactly(bare);
        assertThat(locator.locate(List.of())).isEmpty();
    }
}
