package com.tenacy.rootpulse.collector;

import com.tenacy.rootpulse.analysis.TimeWindow;
import com.tenacy.rootpulse.config.AnalysisProperties;
import com.tenacy.rootpulse.config.LogStoreProperties;
import com.tenacy.rootpulse.exception.AnalysisValidationException;
import com.tenacy.rootpulse.exception.LogQueryException;
import com.tenacy.rootpulse.query.LogQueryClient;
import com.tenacy.rootpulse.query.LogRecord;
import com.tenacy.rootpulse.query.QueryScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ErrorSignalCollectorTest {

    @Mock
    private LogQueryClient queryClient;

    private ErrorSignalCollector collector;
    private TimeWindow window;
    private QueryScope scope;

    @BeforeEach
    void setUp() {
        AnalysisProperties analysisProperties = new AnalysisProperties();
        analysisProperties.setErrorTracesLimit(50);

        LogStoreProperties logStoreProperties = new LogStoreProperties();
        logStoreProperties.setProject("proj-xyz");
        logStoreProperties.setLogstore("logstore-tracing");
        scope = logStoreProperties.toQueryScope();

        collector = new ErrorSignalCollector(queryClient, analysisProperties, logStoreProperties);
        window = TimeWindow.of(LocalDateTime.of(2025, 8, 28, 15, 0), LocalDateTime.of(2025, 8, 28, 15, 5));
    }

    @Test
    @DisplayName("설정된 에러 쿼리와 한도로 한 번 조회하고 순서를 유지")
    void collectsWithConfiguredQueryAndLimit() {
        // given
        List<LogRecord> records = List.of(
                LogRecord.of(Map.of(LogRecord.EVIDENCE, "payment.Timeout", LogRecord.TIMESTAMP, "2025-08-28T15:04:00")),
                LogRecord.of(Map.of(LogRecord.EVIDENCE, "cart.Failure", LogRecord.TIMESTAMP, "2025-08-28T15:01:00")));
        when(queryClient.query("statusCode:>1", window, scope, 50)).thenReturn(records);

        // when
        List<LogRecord> collected = collector.collectErrors(window);

        // then
        assertThat(collected).containsExactlyElementsOf(records);
        verify(queryClient, times(1)).query(anyString(), any(), any(), anyInt());
    }

    @Test
    @DisplayName("명시적 한도 사용")
    void explicitLimit() {
        when(queryClient.query(anyString(), eq(window), eq(scope), eq(5))).thenReturn(List.of());

        assertThat(collector.collectErrors(window, 5)).isEmpty();
    }

    @Test
    @DisplayName("한도가 0 이하이면 조회 없이 검증 오류")
    void nonPositiveLimitIsRejected() {
        assertThatThrownBy(() -> collector.collectErrors(window, 0))
                .isInstanceOf(AnalysisValidationException.class);
        verifyNoInteractions(queryClient);
    }

    @Test
    @DisplayName("조회 실패는 재시도 없이 그대로 전파")
    void queryFailurePropagatesWithoutRetry() {
        when(queryClient.query(anyString(), any(), any(), anyInt()))
                .thenThrow(new LogQueryException("unavailable", true));

        assertThatThrownBy(() -> collector.collectErrors(window))
                .isInstanceOf(LogQueryException.class);
        verify(queryClient, times(1)).query(anyString(), any(), any(), anyInt());
    }
}
