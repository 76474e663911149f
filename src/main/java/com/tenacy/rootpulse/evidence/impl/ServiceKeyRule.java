package com.tenacy.rootpulse.evidence.impl;

import com.tenacy.rootpulse.evidence.AbstractEvidenceRule;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 일반 키 형식: service=checkout operation=PlaceOrder
 */
@Component
public class ServiceKeyRule extends AbstractEvidenceRule {

    private static final Pattern SERVICE = Pattern.compile(
            "(?<![\\w.])service\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s,;\\]\\)]+)");
    private static final Pattern OPERATION = Pattern.compile(
            "(?<![\\w.])(?:operation|op)\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s,;\\]\\)]+)");

    public ServiceKeyRule() {
        super("service-key", 20, SERVICE);
    }

    @Override
    protected String extractService(Matcher matcher) {
        return unquote(matcher.group(1));
    }

    @Override
    protected String extractOperation(Matcher matcher, String evidenceText) {
        Matcher operation = OPERATION.matcher(evidenceText);
        return operation.find() ? unquote(operation.group(1)) : "";
    }
}
