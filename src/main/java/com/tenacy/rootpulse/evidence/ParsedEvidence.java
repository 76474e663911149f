package com.tenacy.rootpulse.evidence;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 증거 문자열에서 추출한 서비스/오퍼레이션. 일치하는 규칙이 없으면 serviceName 이 빈 문자열이다.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ParsedEvidence {

    private static final ParsedEvidence EMPTY = new ParsedEvidence("", "", "");

    private final String serviceName;
    private final String operation;
    private final String rawMatch;

    public static ParsedEvidence empty() {
        return EMPTY;
    }

    public static ParsedEvidence of(String serviceName, String operation, String rawMatch) {
        return new ParsedEvidence(
                serviceName == null ? "" : serviceName,
                operation == null ? "" : operation,
                rawMatch == null ? "" : rawMatch);
    }

    public boolean hasService() {
        return !serviceName.isEmpty();
    }

    public boolean hasOperation() {
        return !operation.isEmpty();
    }
}
