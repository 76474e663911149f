package com.tenacy.rootpulse.analysis;

import com.tenacy.rootpulse.collector.CollectorKind;
import com.tenacy.rootpulse.evidence.ParsedEvidence;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 증거 한 건을 가장 잘 맞는 후보 하나에 대응시킨다. 대소문자를 구분한다.
 *
 * <ol>
 *   <li>{@code service.operation} 과 정확히 같은 후보</li>
 *   <li>{@code service} 와 정확히 같은 후보</li>
 *   <li>신호 종류별 선호 순서에 따른 {@code service.<kind>} 후보</li>
 *   <li>서비스 접두어가 같은 첫 번째 후보 (입력 순서)</li>
 * </ol>
 */
@Component
public class CandidateMatcher {

    static final List<String> ERROR_KINDS = List.of(
            "Failure", "Unreachable", "CacheFailure", "FloodHomepage",
            "LargeGc", "networkLatency", "latency", "cpu", "memory");

    static final List<String> LATENCY_KINDS = List.of(
            "cpu", "memory", "networkLatency", "latency",
            "Failure", "LargeGc", "Unreachable", "CacheFailure", "FloodHomepage");

    /**
     * @param candidates 중복이 제거된, 입력 순서를 유지하는 후보 집합
     */
    public Optional<String> bestMatch(ParsedEvidence evidence, Set<String> candidates, CollectorKind signal) {
        if (evidence == null || !evidence.hasService() || candidates.isEmpty()) {
            return Optional.empty();
        }

        String service = evidence.getServiceName();

        if (evidence.hasOperation()) {
            String qualified = service + "." + evidence.getOperation();
            if (candidates.contains(qualified)) {
                return Optional.of(qualified);
            }
        }

        if (candidates.contains(service)) {
            return Optional.of(service);
        }

        for (String kind : kindsFor(signal)) {
            String label = service + "." + kind;
            if (candidates.contains(label)) {
                return Optional.of(label);
            }
        }

        String prefix = service + ".";
        for (String candidate : candidates) {
            if (candidate.startsWith(prefix)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private List<String> kindsFor(CollectorKind signal) {
        return signal == CollectorKind.LATENCY ? LATENCY_KINDS : ERROR_KINDS;
    }
}
