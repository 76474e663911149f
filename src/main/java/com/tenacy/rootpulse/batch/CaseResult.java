package com.tenacy.rootpulse.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 출력 JSONL 한 줄
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CaseResult {

    @JsonProperty("problem_id")
    private String problemId;

    @JsonProperty("root_causes")
    private List<String> rootCauses;

    private CaseStatus status;

    private String error;
}
