package com.tenacy.rootpulse.evidence;

import lombok.Getter;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정규식 하나로 서비스 이름을 뽑아내는 규칙의 공통 구현.
 * 우선순위 값이 작을수록 먼저 적용된다.
 */
@Getter
public abstract class AbstractEvidenceRule implements EvidenceRule {

    private final String ruleId;
    private final int priority;
    private final Pattern pattern;

    protected AbstractEvidenceRule(String ruleId, int priority, Pattern pattern) {
        this.ruleId = ruleId;
        this.priority = priority;
        this.pattern = pattern;
    }

    @Override
    public Optional<ParsedEvidence> apply(String evidenceText) {
        Matcher matcher = pattern.matcher(evidenceText);
        if (!matcher.find()) {
            return Optional.empty();
        }

        String serviceName = extractService(matcher);
        if (serviceName == null || serviceName.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(ParsedEvidence.of(
                serviceName.trim(), extractOperation(matcher, evidenceText), matcher.group()));
    }

    protected abstract String extractService(Matcher matcher);

    protected String extractOperation(Matcher matcher, String evidenceText) {
        return "";
    }

    /**
     * key=value 형식 값에서 따옴표 제거. "x", 'x', x 모두 허용.
     * 따옴표 없는 값은 문장 부호로 끝날 수 있으므로 끝의 '.' ':' 를 뗀다.
     */
    protected static String unquote(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        int end = trimmed.length();
        while (end > 0 && (trimmed.charAt(end - 1) == '.' || trimmed.charAt(end - 1) == ':')) {
            end--;
        }
        return trimmed.substring(0, end);
    }
}
