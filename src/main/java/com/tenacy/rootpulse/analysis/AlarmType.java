package com.tenacy.rootpulse.analysis;

import java.util.List;
import java.util.Locale;

/**
 * 장애를 일으킨 알람 규칙의 종류. 후보 매칭 시 어떤 신호의 kind 선호 순서를 쓸지 정한다.
 */
public enum AlarmType {

    /** 알람 정보 없음. 각 신호가 자신의 선호 순서를 사용 */
    UNSPECIFIED,
    ERROR,
    LATENCY;

    private static final List<String> ERROR_INDICATORS = List.of("error", "failure", "exception", "status");
    private static final List<String> LATENCY_INDICATORS = List.of("rt", "latency", "response", "duration", "time");

    /**
     * 규칙 이름에 포함된 단어로 분류한다. 대소문자를 무시하며 에러 단어가 지연 단어보다 우선한다.
     */
    public static AlarmType classify(List<String> alarmRules) {
        if (alarmRules == null || alarmRules.isEmpty()) {
            return UNSPECIFIED;
        }
        if (anyRuleContains(alarmRules, ERROR_INDICATORS)) {
            return ERROR;
        }
        if (anyRuleContains(alarmRules, LATENCY_INDICATORS)) {
            return LATENCY;
        }
        return UNSPECIFIED;
    }

    private static boolean anyRuleContains(List<String> alarmRules, List<String> indicators) {
        return alarmRules.stream()
                .filter(rule -> rule != null)
                .map(rule -> rule.toLowerCase(Locale.ROOT))
                .anyMatch(rule -> indicators.stream().anyMatch(rule::contains));
    }
}
