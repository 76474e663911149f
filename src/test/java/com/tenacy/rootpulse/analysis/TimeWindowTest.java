package com.tenacy.rootpulse.analysis;

import com.tenacy.rootpulse.exception.AnalysisValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeWindowTest {

    @Test
    @DisplayName("구간 문자열 파싱")
    void parseRange() {
        TimeWindow window = TimeWindow.parse("2025-08-28 15:08:03 ~ 2025-08-28 15:13:03");

        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2025, 8, 28, 15, 8, 3));
        assertThat(window.getEnd()).isEqualTo(LocalDateTime.of(2025, 8, 28, 15, 13, 3));
        assertThat(window.toString()).isEqualTo("2025-08-28 15:08:03 ~ 2025-08-28 15:13:03");
    }

    @Test
    @DisplayName("start 가 end 보다 앞서지 않으면 검증 오류")
    void rejectNonIncreasingWindow() {
        LocalDateTime t = LocalDateTime.of(2025, 8, 28, 15, 0);

        assertThatThrownBy(() -> TimeWindow.of(t, t))
                .isInstanceOf(AnalysisValidationException.class);
        assertThatThrownBy(() -> TimeWindow.of(t.plusMinutes(1), t))
                .isInstanceOf(AnalysisValidationException.class);
        assertThatThrownBy(() -> TimeWindow.of(null, t))
                .isInstanceOf(AnalysisValidationException.class);
    }

    @Test
    @DisplayName("형식이 잘못된 구간 문자열은 검증 오류")
    void rejectMalformedRange() {
        assertThatThrownBy(() -> TimeWindow.parse(null)).isInstanceOf(AnalysisValidationException.class);
        assertThatThrownBy(() -> TimeWindow.parse("2025-08-28 15:08:03")).isInstanceOf(AnalysisValidationException.class);
        assertThatThrownBy(() -> TimeWindow.parse("yesterday ~ today")).isInstanceOf(AnalysisValidationException.class);
    }
}
