package com.tenacy.rootpulse.evidence;

import com.tenacy.rootpulse.evidence.impl.ServiceKeyRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceParserTest {

    private EvidenceParser parser;

    @BeforeEach
    void setUp() {
        parser = EvidenceParser.withDefaultRules();
    }

    @Test
    @DisplayName("serviceName 속성에서 서비스와 spanName 을 추출")
    void parseServiceNameAttribute() {
        // when
        ParsedEvidence parsed = parser.parse("serviceName=\"payment\" spanName=\"POST /charge\" statusCode=\"2\"");

        // then
        assertThat(parsed.getServiceName()).isEqualTo("payment");
        assertThat(parsed.getOperation()).isEqualTo("POST /charge");
    }

    @Test
    @DisplayName("작은따옴표와 따옴표 없는 serviceName 도 허용")
    void parseServiceNameVariants() {
        assertThat(parser.parse("serviceName='cart'").getServiceName()).isEqualTo("cart");
        assertThat(parser.parse("serviceName=checkout, other=1").getServiceName()).isEqualTo("checkout");
    }

    @Test
    @DisplayName("service= 키와 op= 키")
    void parseServiceKey() {
        ParsedEvidence parsed = parser.parse("level=ERROR service=inventory op=Reserve msg=timeout");

        assertThat(parsed.getServiceName()).isEqualTo("inventory");
        assertThat(parsed.getOperation()).isEqualTo("Reserve");
    }

    @Test
    @DisplayName("<service>.<ErrorType> 형식")
    void parseQualifiedErrorType() {
        ParsedEvidence parsed = parser.parse("request failed with payment.Timeout after 3s");

        assertThat(parsed.getServiceName()).isEqualTo("payment");
        assertThat(parsed.getOperation()).isEqualTo("Timeout");
        assertThat(parsed.getRawMatch()).isEqualTo("payment.Timeout");
    }

    @Test
    @DisplayName("문장 끝 마침표가 붙은 <service>.<ErrorType> 도 인식")
    void parseQualifiedErrorTypeAtSentenceEnd() {
        // when
        ParsedEvidence parsed = parser.parse("call failed: payment.Timeout.");

        // then
        assertThat(parsed.getServiceName()).isEqualTo("payment");
        assertThat(parsed.getOperation()).isEqualTo("Timeout");
        assertThat(parsed.getRawMatch()).isEqualTo("payment.Timeout");
    }

    @Test
    @DisplayName("따옴표 없는 키 값 끝의 '.' ':' 는 서비스 이름에서 제외")
    void stripTrailingPunctuationFromUnquotedValues() {
        assertThat(parser.parse("upstream error from service=payment.").getServiceName()).isEqualTo("payment");
        assertThat(parser.parse("serviceName=payment: connection reset").getServiceName()).isEqualTo("payment");
        assertThat(parser.parse("service=inventory op=Reserve.").getOperation()).isEqualTo("Reserve");
        assertThat(parser.parse("serviceName=\"payment.\"").getServiceName()).isEqualTo("payment.");
    }

    @Test
    @DisplayName("더 긴 점 구분 이름의 일부는 서비스로 보지 않음")
    void ignoreLongerDottedNames() {
        assertThat(parser.parse("java.lang.NullPointerException at line 3").hasService()).isFalse();
    }

    @Test
    @DisplayName("serviceName 규칙이 qualified 규칙보다 우선")
    void higherPriorityRuleWins() {
        ParsedEvidence parsed = parser.parse("cart.Failure observed serviceName=\"payment\"");

        assertThat(parsed.getServiceName()).isEqualTo("payment");
    }

    @Test
    @DisplayName("null, 빈 문자열, 알 수 없는 형식은 빈 결과")
    void unparseableInputsYieldEmpty() {
        assertThat(parser.parse(null)).isEqualTo(ParsedEvidence.empty());
        assertThat(parser.parse("")).isEqualTo(ParsedEvidence.empty());
        assertThat(parser.parse("   ")).isEqualTo(ParsedEvidence.empty());
        assertThat(parser.parse("something went wrong")).isEqualTo(ParsedEvidence.empty());
    }

    @Test
    @DisplayName("규칙이 예외를 던져도 다음 규칙으로 진행")
    void failingRuleIsSkipped() {
        EvidenceRule broken = new EvidenceRule() {
            @Override
            public String getRuleId() {
                return "broken";
            }

            @Override
            public int getPriority() {
                return 0;
            }

            @Override
            public Optional<ParsedEvidence> apply(String evidenceText) {
                throw new IllegalStateException("boom");
            }
        };
        EvidenceParser parserWithBrokenRule = new EvidenceParser(List.of(
                broken, new ServiceKeyRule()));

        ParsedEvidence parsed = parserWithBrokenRule.parse("service=payment");

        assertThat(parsed.getServiceName()).isEqualTo("payment");
        assertThat(parserWithBrokenRule.getRules()).extracting(EvidenceRule::getRuleId)
                .containsExactly("broken", "service-key");
    }
}
