package com.tenacy.rootpulse.query;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 조회 대상 범위. logstore 는 인덱스 이름, project 는 비어 있지 않으면 project 필드 필터로 쓰인다.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class QueryScope {
    private final String project;
    private final String logstore;
    private final String region;

    public boolean hasProject() {
        return project != null && !project.isBlank();
    }
}
