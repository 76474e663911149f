package com.tenacy.rootpulse.evidence;

import com.tenacy.rootpulse.evidence.impl.QualifiedErrorTypeRule;
import com.tenacy.rootpulse.evidence.impl.ServiceKeyRule;
import com.tenacy.rootpulse.evidence.impl.ServiceNameAttributeRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 증거 문자열 → {@link ParsedEvidence}.
 *
 * <p>규칙은 우선순위 순서로 적용되며 처음 일치한 규칙의 결과를 사용한다.
 * 어떤 입력에도 예외를 던지지 않는다.
 */
@Service
@Slf4j
public class EvidenceParser {

    private final List<EvidenceRule> rules;

    public EvidenceParser(List<EvidenceRule> ruleList) {
        List<EvidenceRule> sorted = new ArrayList<>(ruleList);
        sorted.sort(Comparator.comparingInt(EvidenceRule::getPriority));
        this.rules = List.copyOf(sorted);
        log.info("Initialized EvidenceParser with {} rules", rules.size());
    }

    public static EvidenceParser withDefaultRules() {
        return new EvidenceParser(List.of(
                new ServiceNameAttributeRule(),
                new ServiceKeyRule(),
                new QualifiedErrorTypeRule()));
    }

    public ParsedEvidence parse(String evidenceText) {
        if (evidenceText == null || evidenceText.isBlank()) {
            return ParsedEvidence.empty();
        }

        for (EvidenceRule rule : rules) {
            try {
                Optional<ParsedEvidence> parsed = rule.apply(evidenceText);
                if (parsed.isPresent()) {
                    return parsed.get();
                }
            } catch (RuntimeException e) {
                log.warn("Evidence rule {} failed on '{}': {}", rule.getRuleId(), abbreviate(evidenceText), e.getMessage());
            }
        }
        return ParsedEvidence.empty();
    }

    public List<EvidenceRule> getRules() {
        return rules;
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
