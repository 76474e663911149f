package com.tenacy.rootpulse.query;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 로그 저장소에서 조회한 레코드 한 건. 필드 이름 → 값의 불변 맵이며 evidence 필드는 항상 존재한다.
 */
@EqualsAndHashCode
@ToString
public final class LogRecord {

    public static final String EVIDENCE = "evidence";
    public static final String TIMESTAMP = "timestamp";
    public static final String SERVICE_NAME = "serviceName";
    public static final String SPAN_NAME = "spanName";
    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String PARENT_SPAN_ID = "parentSpanId";
    public static final String STATUS_CODE = "statusCode";

    private final Map<String, Object> fields;

    private LogRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static LogRecord of(Map<String, ?> source) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> {
                if (key != null) {
                    fields.put(key, value);
                }
            });
        }

        Object evidence = fields.get(EVIDENCE);
        if (evidence == null || evidence.toString().isBlank()) {
            fields.put(EVIDENCE, composeEvidence(fields));
        } else {
            fields.put(EVIDENCE, evidence.toString());
        }
        return new LogRecord(fields);
    }

    // 저장소 문서에 evidence 가 없으면 serviceName/spanName 으로 패턴 결과 형식을 만든다
    private static String composeEvidence(Map<String, Object> fields) {
        Object service = fields.get(SERVICE_NAME);
        if (service == null || service.toString().isBlank()) {
            return "";
        }

        StringBuilder evidence = new StringBuilder("serviceName=\"").append(service).append('"');
        Object span = fields.get(SPAN_NAME);
        if (span != null && !span.toString().isBlank()) {
            evidence.append(" spanName=\"").append(span).append('"');
        }
        return evidence.toString();
    }

    public String getEvidence() {
        return (String) fields.get(EVIDENCE);
    }

    public String getTimestamp() {
        return getString(TIMESTAMP).orElse(null);
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Optional<String> getString(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Optional<Long> getLong(String name) {
        Object value = fields.get(name);
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.toString().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
