package com.tenacy.rootpulse.batch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 입력 JSONL 한 줄
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IncidentCase {

    @JsonProperty("problem_id")
    private String problemId;

    @JsonProperty("time_range")
    private String timeRange;

    @JsonProperty("candidate_root_causes")
    private List<String> candidateRootCauses;

    @JsonProperty("alarm_rules")
    private List<String> alarmRules;
}
