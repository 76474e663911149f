package com.tenacy.rootpulse.evidence.impl;

import com.tenacy.rootpulse.evidence.AbstractEvidenceRule;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code <service>.<ErrorType>} 형식 (예: payment.Timeout).
 * java.lang.NullPointerException 처럼 더 긴 점 구분 이름의 일부는 제외한다.
 * 문장 끝의 마침표는 이름의 일부로 보지 않는다.
 */
@Component
public class QualifiedErrorTypeRule extends AbstractEvidenceRule {

    private static final Pattern QUALIFIED = Pattern.compile(
            "(?<![\\w.-])([A-Za-z][\\w-]*)\\.([A-Za-z]\\w*)(?!\\w|[.-]\\w)");

    public QualifiedErrorTypeRule() {
        super("qualified-error-type", 30, QUALIFIED);
    }

    @Override
    protected String extractService(Matcher matcher) {
        return matcher.group(1);
    }

    @Override
    protected String extractOperation(Matcher matcher, String evidenceText) {
        return matcher.group(2);
    }
}
