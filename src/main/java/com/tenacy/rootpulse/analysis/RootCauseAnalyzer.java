package com.tenacy.rootpulse.analysis;

import com.tenacy.rootpulse.collector.CollectorKind;
import com.tenacy.rootpulse.collector.ErrorSignalCollector;
import com.tenacy.rootpulse.collector.LatencySignalCollector;
import com.tenacy.rootpulse.collector.LatencySpanRanker;
import com.tenacy.rootpulse.collector.RootCauseSpanLocator;
import com.tenacy.rootpulse.config.AnalysisProperties;
import com.tenacy.rootpulse.evidence.EvidenceParser;
import com.tenacy.rootpulse.evidence.ParsedEvidence;
import com.tenacy.rootpulse.exception.AnalysisValidationException;
import com.tenacy.rootpulse.exception.CollectionFailureException;
import com.tenacy.rootpulse.exception.LogQueryException;
import com.tenacy.rootpulse.query.LogRecord;
import com.tenacy.rootpulse.service.AnalysisMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 에러/지연 신호를 수집해 후보 근본 원인 중 증거가 뒷받침하는 것을 순위대로 돌려준다.
 *
 * <p>수집기 실패는 "근본 원인 없음"으로 바꾸지 않고 {@link CollectionFailureException} 으로 전달한다.
 * best-effort 모드에서만 수집기 하나의 실패를 허용하며, 그 결과는 degraded 로 표시된다.
 * 수집 제한 시간은 병렬 수집에만 적용되고, 순차 수집은 수집기 사이에서 인터럽트만 확인한다.
 */
@Service
@Slf4j
public class RootCauseAnalyzer {

    private final ErrorSignalCollector errorSignalCollector;
    private final LatencySignalCollector latencySignalCollector;
    private final RootCauseSpanLocator spanLocator;
    private final LatencySpanRanker latencySpanRanker;
    private final EvidenceParser evidenceParser;
    private final CandidateMatcher candidateMatcher;
    private final AnalysisProperties properties;
    private final AsyncTaskExecutor collectorExecutor;
    private final AnalysisMetricsService metricsService;

    public RootCauseAnalyzer(ErrorSignalCollector errorSignalCollector,
                             LatencySignalCollector latencySignalCollector,
                             RootCauseSpanLocator spanLocator,
                             LatencySpanRanker latencySpanRanker,
                             EvidenceParser evidenceParser,
                             CandidateMatcher candidateMatcher,
                             AnalysisProperties properties,
                             @Qualifier("collectorExecutor") AsyncTaskExecutor collectorExecutor,
                             AnalysisMetricsService metricsService) {
        this.errorSignalCollector = errorSignalCollector;
        this.latencySignalCollector = latencySignalCollector;
        this.spanLocator = spanLocator;
        this.latencySpanRanker = latencySpanRanker;
        this.evidenceParser = evidenceParser;
        this.candidateMatcher = candidateMatcher;
        this.properties = properties;
        this.collectorExecutor = collectorExecutor;
        this.metricsService = metricsService;
    }

    public AnalysisResult analyze(TimeWindow window, Collection<String> candidates) {
        return analyze(window, candidates, AlarmType.UNSPECIFIED);
    }

    /**
     * @param alarmType ERROR/LATENCY 이면 두 신호의 증거 모두 해당 신호의 kind 선호 순서로 매칭한다
     */
    public AnalysisResult analyze(TimeWindow window, Collection<String> candidates, AlarmType alarmType) {
        Set<String> orderedCandidates = validate(window, candidates);
        AlarmType focus = alarmType == null ? AlarmType.UNSPECIFIED : alarmType;

        if (orderedCandidates.isEmpty()) {
            log.info("후보가 없어 조회 없이 빈 결과 반환: window={}", window);
            return AnalysisResult.empty(window);
        }

        log.info("--- 근본 원인 분석 시작: window={}, 후보 {}개, alarm={} ---", window, orderedCandidates.size(), focus);
        long startedAt = System.nanoTime();

        try {
            CollectedSignals signals = collect(window, new ArrayList<>(orderedCandidates));
            AnalysisResult result = rank(window, orderedCandidates, signals, focus);

            metricsService.recordCompleted(result, Duration.ofNanos(System.nanoTime() - startedAt));
            log.info("분석 완료: rootCauses={}, errorRecords={}, latencyViolations={}, degraded={}",
                    result.getRootCauseLabels(), result.getErrorRecordsExamined(),
                    result.getLatencyViolations(), result.isDegraded());
            return result;

        } catch (CollectionFailureException e) {
            metricsService.recordFailed(Duration.ofNanos(System.nanoTime() - startedAt));
            log.error("분석 실패: window={}, failedCollectors={}, cause={}",
                    window, e.getFailedCollectors(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            throw e;
        }
    }

    private Set<String> validate(TimeWindow window, Collection<String> candidates) {
        if (window == null) {
            throw new AnalysisValidationException("Time window is required");
        }
        if (candidates == null) {
            throw new AnalysisValidationException("Candidate set is required (may be empty)");
        }

        Set<String> ordered = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                throw new AnalysisValidationException("Candidate labels must not be blank: " + candidates);
            }
            ordered.add(candidate);
        }
        return ordered;
    }

    // ---------------------------------------------------------------------
    // 수집
    // ---------------------------------------------------------------------

    private CollectedSignals collect(TimeWindow window, List<String> candidates) {
        Outcome<List<LogRecord>> errors;
        Outcome<LatencySignals> latencies;

        if (properties.isParallelCollection()) {
            Future<List<LogRecord>> errorFuture =
                    collectorExecutor.submit(() -> errorSignalCollector.collectErrors(window));
            Future<LatencySignals> latencyFuture =
                    collectorExecutor.submit(() -> collectLatency(window));

            long deadline = System.nanoTime() + properties.getCollectionTimeout().toNanos();
            try {
                errors = await(errorFuture, deadline);
                latencies = await(latencyFuture, deadline);
            } catch (InterruptedException e) {
                errorFuture.cancel(true);
                latencyFuture.cancel(true);
                Thread.currentThread().interrupt();
                throw interrupted(window, candidates, e);
            }
        } else {
            errors = run(() -> errorSignalCollector.collectErrors(window));
            if (Thread.currentThread().isInterrupted()) {
                throw interrupted(window, candidates, new InterruptedException("Interrupted between collectors"));
            }
            latencies = run(() -> collectLatency(window));
        }

        List<CollectorKind> failed = new ArrayList<>();
        List<RuntimeException> failures = new ArrayList<>();
        if (errors.failure != null) {
            failed.add(CollectorKind.ERROR);
            failures.add(errors.failure);
        }
        if (latencies.failure != null) {
            failed.add(CollectorKind.LATENCY);
            failures.add(latencies.failure);
        }

        if (!failed.isEmpty()) {
            boolean allFailed = failed.size() == 2;
            if (!properties.isBestEffort() || allFailed) {
                RuntimeException primary = primaryFailure(failures);
                failures.stream().filter(f -> f != primary).forEach(primary::addSuppressed);
                throw new CollectionFailureException(
                        String.format("Signal collection failed for %s: %s", failed, primary.getMessage()),
                        window, candidates, failed, primary);
            }
            log.warn("best-effort 모드: {} 수집기 실패를 무시하고 계속 진행 ({})", failed, failures.get(0).getMessage());
        }

        LatencySignals latency = latencies.value == null ? LatencySignals.EMPTY : latencies.value;
        return new CollectedSignals(
                errors.value == null ? List.of() : errors.value,
                latency.violations,
                latency.baseline,
                failed);
    }

    // 평상시 구간 조회는 지연 수집기의 일부로 취급한다 (실패하면 LATENCY 실패)
    private LatencySignals collectLatency(TimeWindow window) {
        List<LogRecord> violations = latencySignalCollector.collectLatencyViolations(window);
        boolean needsBaseline = properties.isLatencySpanRanking()
                && properties.isLatencyMinusAverage()
                && !violations.isEmpty();
        List<LogRecord> baseline = needsBaseline ? latencySignalCollector.collectBaseline(window) : List.of();
        return new LatencySignals(violations, baseline);
    }

    private CollectionFailureException interrupted(TimeWindow window, List<String> candidates, InterruptedException cause) {
        return new CollectionFailureException("Analysis interrupted while collecting signals",
                window, candidates, List.of(CollectorKind.ERROR, CollectorKind.LATENCY), cause);
    }

    private <T> Outcome<T> await(Future<T> future, long deadlineNanos) throws InterruptedException {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return Outcome.success(future.get(remaining, TimeUnit.NANOSECONDS));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                return Outcome.failure((RuntimeException) cause);
            }
            return Outcome.failure(new LogQueryException("Collector failed: " + cause, false, cause));
        } catch (TimeoutException e) {
            future.cancel(true);
            return Outcome.failure(new LogQueryException(
                    "Collector timed out after " + properties.getCollectionTimeout(), true, e));
        }
    }

    private <T> Outcome<T> run(Supplier<T> collector) {
        try {
            return Outcome.success(collector.get());
        } catch (RuntimeException e) {
            return Outcome.failure(e);
        }
    }

    // 영구 실패가 하나라도 있으면 그것을 대표 원인으로 삼아 재시도되지 않게 한다
    private RuntimeException primaryFailure(List<RuntimeException> failures) {
        return failures.stream()
                .filter(f -> !(f instanceof LogQueryException) || !((LogQueryException) f).isTransientFailure())
                .findFirst()
                .orElse(failures.get(0));
    }

    // ---------------------------------------------------------------------
    // 매칭과 순위
    // ---------------------------------------------------------------------

    private AnalysisResult rank(TimeWindow window, Set<String> candidates, CollectedSignals signals, AlarmType focus) {
        List<LogRecord> errorEvidence = properties.isErrorRootSpansOnly()
                ? spanLocator.locate(signals.errorRecords)
                : signals.errorRecords;
        List<LogRecord> latencyEvidence = properties.isLatencySpanRanking()
                ? latencySpanRanker.rank(signals.latencyRecords, signals.baselineRecords)
                : signals.latencyRecords;

        Map<String, int[]> counts = new LinkedHashMap<>();
        candidates.forEach(candidate -> counts.put(candidate, new int[2]));

        tally(errorEvidence, CollectorKind.ERROR, preference(CollectorKind.ERROR, focus), candidates, counts);
        tally(latencyEvidence, CollectorKind.LATENCY, preference(CollectorKind.LATENCY, focus), candidates, counts);

        int matchedTotal = counts.values().stream().mapToInt(c -> c[0] + c[1]).sum();

        List<RankedCause> ranked = new ArrayList<>();
        counts.forEach((label, c) -> {
            int total = c[0] + c[1];
            if (total > 0) {
                ranked.add(RankedCause.builder()
                        .label(label)
                        .evidenceCount(total)
                        .errorEvidenceCount(c[0])
                        .latencyEvidenceCount(c[1])
                        .confidence((double) total / matchedTotal)
                        .build());
            }
        });

        // List.sort 는 안정 정렬이므로 동률이면 입력 순서 유지
        ranked.sort(Comparator.comparingInt(RankedCause::getEvidenceCount).reversed());

        return AnalysisResult.builder()
                .window(window)
                .rootCauses(ranked)
                .errorRecordsExamined(signals.errorRecords.size())
                .latencyViolations(signals.latencyRecords.size())
                .degraded(!signals.failedCollectors.isEmpty())
                .failedCollectors(signals.failedCollectors)
                .build();
    }

    private static CollectorKind preference(CollectorKind signal, AlarmType focus) {
        switch (focus) {
            case ERROR:
                return CollectorKind.ERROR;
            case LATENCY:
                return CollectorKind.LATENCY;
            default:
                return signal;
        }
    }

    private void tally(List<LogRecord> records, CollectorKind signal, CollectorKind kindPreference,
                       Set<String> candidates, Map<String, int[]> counts) {
        int index = signal == CollectorKind.ERROR ? 0 : 1;
        int unparsed = 0;
        Map<String, Integer> unmatchedServices = new LinkedHashMap<>();

        for (LogRecord record : records) {
            ParsedEvidence evidence = evidenceParser.parse(record.getEvidence());
            if (!evidence.hasService()) {
                unparsed++;
                continue;
            }

            Optional<String> match = candidateMatcher.bestMatch(evidence, candidates, kindPreference);
            if (match.isPresent()) {
                counts.get(match.get())[index]++;
            } else {
                unmatchedServices.merge(evidence.getServiceName(), 1, Integer::sum);
            }
        }

        if (unparsed > 0 || !unmatchedServices.isEmpty()) {
            log.debug("{} 증거: 서비스 미식별 {}건, 후보 외 서비스 {}", signal, unparsed, unmatchedServices);
        }
    }

    private static final class Outcome<T> {
        private final T value;
        private final RuntimeException failure;

        private Outcome(T value, RuntimeException failure) {
            this.value = value;
            this.failure = failure;
        }

        static <T> Outcome<T> success(T value) {
            return new Outcome<>(value, null);
        }

        static <T> Outcome<T> failure(RuntimeException failure) {
            return new Outcome<>(null, failure);
        }
    }

    private static final class LatencySignals {
        private static final LatencySignals EMPTY = new LatencySignals(List.of(), List.of());

        private final List<LogRecord> violations;
        private final List<LogRecord> baseline;

        private LatencySignals(List<LogRecord> violations, List<LogRecord> baseline) {
            this.violations = violations == null ? List.of() : violations;
            this.baseline = baseline == null ? List.of() : baseline;
        }
    }

    private static final class CollectedSignals {
        private final List<LogRecord> errorRecords;
        private final List<LogRecord> latencyRecords;
        private final List<LogRecord> baselineRecords;
        private final List<CollectorKind> failedCollectors;

        private CollectedSignals(List<LogRecord> errorRecords, List<LogRecord> latencyRecords,
                                 List<LogRecord> baselineRecords, List<CollectorKind> failedCollectors) {
            this.errorRecords = errorRecords;
            this.latencyRecords = latencyRecords;
            this.baselineRecords = baselineRecords;
            this.failedCollectors = failedCollectors;
        }
    }
}
