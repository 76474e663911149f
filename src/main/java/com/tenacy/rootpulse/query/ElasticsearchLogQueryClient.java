package com.tenacy.rootpulse.query;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenacy.rootpulse.analysis.TimeWindow;
import com.tenacy.rootpulse.credential.CredentialProvider;
import com.tenacy.rootpulse.exception.LogQueryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.ResponseException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Elasticsearch 인덱스를 로그 저장소로 사용하는 조회 클라이언트.
 * 결과는 timestamp 내림차순(최신 순)으로 반환된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchLogQueryClient implements LogQueryClient {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    static final String PROJECT_FIELD = "project";

    private static final TypeReference<Map<String, Object>> SOURCE_TYPE = new TypeReference<>() {
    };

    private final ElasticsearchClient elasticsearchClient;
    private final CredentialProvider credentialProvider;
    private final ObjectMapper objectMapper;

    @Override
    public List<LogRecord> query(String queryExpression, TimeWindow window, QueryScope scope, int limit) {
        // 자격 증명 실패는 조회 실패와 구분되도록 먼저 확인
        credentialProvider.getValidCredentials();

        SearchRequest request = buildRequest(queryExpression, window, scope, limit);
        log.debug("로그 조회: index={}, query={}, window={}, limit={}",
                scope.getLogstore(), queryExpression, window, limit);

        try {
            SearchResponse<ObjectNode> response = elasticsearchClient.search(request, ObjectNode.class);

            List<LogRecord> records = new ArrayList<>();
            for (Hit<ObjectNode> hit : response.hits().hits()) {
                // _source 가 없는 문서는 빈 레코드로 남겨 개수를 맞춘다
                Map<String, Object> source = hit.source() == null
                        ? Map.of()
                        : objectMapper.convertValue(hit.source(), SOURCE_TYPE);
                records.add(LogRecord.of(source));
            }

            log.debug("로그 조회 완료: query={}, {} records", queryExpression, records.size());
            return records;

        } catch (ElasticsearchException e) {
            int status = e.status();
            throw new LogQueryException(
                    String.format("Log store rejected query '%s' (status %d): %s", queryExpression, status, e.getMessage()),
                    isTransientStatus(status), e);
        } catch (IOException e) {
            Integer status = findResponseStatus(e);
            boolean transientFailure = status == null || isTransientStatus(status);
            throw new LogQueryException(
                    String.format("Log store query '%s' failed: %s", queryExpression, e.getMessage()),
                    transientFailure, e);
        }
    }

    SearchRequest buildRequest(String queryExpression, TimeWindow window, QueryScope scope, int limit) {
        BoolQuery.Builder b = new BoolQuery.Builder();

        String expression = queryExpression == null ? "" : queryExpression.trim();
        if (expression.isEmpty() || "*".equals(expression)) {
            b.must(m -> m.matchAll(ma -> ma));
        } else {
            b.must(m -> m.queryString(q -> q.query(expression)));
        }

        String startStr = window.getStart().format(TIMESTAMP_FORMAT);
        String endStr = window.getEnd().format(TIMESTAMP_FORMAT);
        b.filter(f -> f.range(r -> r
                .date(t -> t
                        .field(LogRecord.TIMESTAMP)
                        .gte(startStr)
                        .lte(endStr))));

        if (scope.hasProject()) {
            b.filter(f -> f.term(t -> t.field(PROJECT_FIELD).value(scope.getProject())));
        }

        BoolQuery boolQuery = b.build();
        return SearchRequest.of(s -> s
                .index(scope.getLogstore())
                .query(q -> q.bool(boolQuery))
                .size(limit)
                .sort(o -> o.field(f -> f.field(LogRecord.TIMESTAMP).order(SortOrder.Desc))));
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private static Integer findResponseStatus(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ResponseException) {
                return ((ResponseException) current).getResponse().getStatusLine().getStatusCode();
            }
            current = current.getCause();
        }
        return null;
    }
}
