package com.tenacy.rootpulse.infra;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import com.tenacy.rootpulse.analysis.AnalysisResult;
import com.tenacy.rootpulse.analysis.RootCauseAnalyzer;
import com.tenacy.rootpulse.analysis.TimeWindow;
import com.tenacy.rootpulse.query.LogRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
public class ElasticsearchIntegrationTest {

    private static final String INDEX = "logstore-tracing";

    @Container
    static ElasticsearchContainer elasticsearchContainer = new ElasticsearchContainer(
            DockerImageName.parse("docker.elastic.co/elasticsearch/elasticsearch:8.15.5")
    ).withEnv("discovery.type", "single-node")
            .withEnv("xpack.security.enabled", "false");

    @Autowired
    private ElasticsearchClient elasticsearchClient;

    @Autowired
    private RootCauseAnalyzer rootCauseAnalyzer;

    @DynamicPropertySource
    static void registerElasticsearchProperties(DynamicPropertyRegistry registry) {
        registry.add("rootpulse.logstore.uris", () ->
                "http://" + elasticsearchContainer.getHost() + ":" + elasticsearchContainer.getMappedPort(9200));
    }

    private void index(Map<String, Object> document) throws IOException {
        elasticsearchClient.index(i -> i
                .index(INDEX)
                .document(document)
                .refresh(Refresh.True));
    }

    private static Map<String, Object> span(String traceId, String spanId, String parentSpanId,
                                            int statusCode, long duration, String service, String timestamp) {
        Map<String, Object> document = new HashMap<>();
        document.put(LogRecord.TRACE_ID, traceId);
        document.put(LogRecord.SPAN_ID, spanId);
        if (parentSpanId != null) {
            document.put(LogRecord.PARENT_SPAN_ID, parentSpanId);
        }
        document.put(LogRecord.STATUS_CODE, statusCode);
        document.put("duration", duration);
        document.put(LogRecord.SERVICE_NAME, service);
        document.put(LogRecord.SPAN_NAME, "GET /" + service);
        document.put(LogRecord.TIMESTAMP, timestamp);
        return document;
    }

    @Test
    @DisplayName("실제 인덱스에서 에러/지연 증거를 조회해 근본 원인 선정")
    void analyzesAgainstRealIndex() throws IOException {
        // given
        elasticsearchClient.indices().create(c -> c
                .index(INDEX)
                .mappings(m -> m
                        .properties(LogRecord.TIMESTAMP, p -> p.date(d -> d))
                        .properties(LogRecord.STATUS_CODE, p -> p.long_(l -> l))
                        .properties("duration", p -> p.long_(l -> l))
                        .properties(LogRecord.TRACE_ID, p -> p.keyword(k -> k))
                        .properties(LogRecord.SPAN_ID, p -> p.keyword(k -> k))
                        .properties(LogRecord.PARENT_SPAN_ID, p -> p.keyword(k -> k))));

        index(span("t1", "s1", null, 2, 1_000_000L, "frontend", "2025-08-28T15:09:00"));
        index(span("t1", "s2", "s1", 2, 1_000_000L, "payment", "2025-08-28T15:09:01"));
        index(span("t2", "s3", null, 1, 3_000_000_000L, "checkout", "2025-08-28T15:10:00"));
        // 구간 밖
        index(span("t3", "s4", null, 2, 1_000_000L, "inventory", "2025-08-28T16:00:00"));

        TimeWindow window = TimeWindow.parse("2025-08-28 15:08:03 ~ 2025-08-28 15:13:03");

        // when
        AnalysisResult result = rootCauseAnalyzer.analyze(window,
                List.of("payment", "checkout", "frontend", "inventory"));

        // then
        assertThat(result.getRootCauseLabels()).containsExactly("payment", "checkout");
        assertThat(result.getErrorRecordsExamined()).isEqualTo(2);
        assertThat(result.getLatencyViolations()).isEqualTo(1);
        assertThat(result.isDegraded()).isFalse();
    }
}
