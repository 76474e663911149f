package com.tenacy.rootpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * start/end 또는 timeRange("yyyy-MM-dd HH:mm:ss ~ yyyy-MM-dd HH:mm:ss") 중 하나로 구간을 지정한다.
 * alarmRules 는 선택 항목이며 에러/지연 중 어느 쪽 알람인지 판단하는 데 쓰인다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime start;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime end;

    private String timeRange;
    private List<String> candidates;
    private List<String> alarmRules;
}
