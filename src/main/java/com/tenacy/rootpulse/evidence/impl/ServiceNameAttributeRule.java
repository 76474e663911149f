package com.tenacy.rootpulse.evidence.impl;

import com.tenacy.rootpulse.evidence.AbstractEvidenceRule;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 로그 저장소 패턴 분석 결과 형식: serviceName="payment" spanName="POST /charge"
 */
@Component
public class ServiceNameAttributeRule extends AbstractEvidenceRule {

    private static final Pattern SERVICE_NAME = Pattern.compile(
            "\\bserviceName\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s,;\\]\\)]+)");
    private static final Pattern SPAN_NAME = Pattern.compile(
            "\\bspanName\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s,;\\]\\)]+)");

    public ServiceNameAttributeRule() {
        super("service-name-attribute", 10, SERVICE_NAME);
    }

    @Override
    protected String extractService(Matcher matcher) {
        return unquote(matcher.group(1));
    }

    @Override
    protected String extractOperation(Matcher matcher, String evidenceText) {
        Matcher span = SPAN_NAME.matcher(evidenceText);
        return span.find() ? unquote(span.group(1)) : "";
    }
}
