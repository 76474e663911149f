package com.tenacy.rootpulse.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.rootpulse.analysis.AlarmType;
import com.tenacy.rootpulse.analysis.AnalysisResult;
import com.tenacy.rootpulse.analysis.RootCauseAnalyzer;
import com.tenacy.rootpulse.analysis.TimeWindow;
import com.tenacy.rootpulse.config.BatchProperties;
import com.tenacy.rootpulse.exception.AnalysisValidationException;
import com.tenacy.rootpulse.exception.CollectionFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSONL 입력의 케이스를 하나씩 분석하고 케이스당 한 줄씩 결과를 기록한다.
 *
 * <p>일시적 수집 실패는 설정된 횟수만큼 재시도하며, 끝내 실패한 케이스는 FAILED 로 기록된다.
 * 빈 결과(NO_EVIDENCE)와 실패(FAILED)는 항상 구분된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IncidentBatchService {

    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final BatchProperties batchProperties;
    private final ObjectMapper objectMapper;

    public BatchSummary process(Path inputFile, Path outputFile) {
        List<IncidentCase> cases = readCases(inputFile);
        log.info("Starting root cause analysis for {} cases", cases.size());

        List<CaseResult> results = new ArrayList<>();
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (BufferedWriter writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
                for (int i = 0; i < cases.size(); i++) {
                    log.info("Processing case {}/{}", i + 1, cases.size());
                    CaseResult result = processCase(cases.get(i), i + 1);
                    results.add(result);

                    writer.write(objectMapper.writeValueAsString(result));
                    writer.newLine();
                    writer.flush();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + outputFile, e);
        }

        BatchSummary summary = new BatchSummary(results);
        log.info("Analysis summary: total={}, success={}, noEvidence={}, failed={}, invalid={}",
                summary.total(), summary.count(CaseStatus.SUCCESS), summary.count(CaseStatus.NO_EVIDENCE),
                summary.count(CaseStatus.FAILED), summary.count(CaseStatus.INVALID));
        log.info("Results saved to: {}", outputFile.toAbsolutePath());
        return summary;
    }

    List<IncidentCase> readCases(Path inputFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(inputFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input file: " + inputFile, e);
        }

        List<IncidentCase> cases = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                cases.add(objectMapper.readValue(trimmed, IncidentCase.class));
            } catch (JsonProcessingException e) {
                log.warn("Failed to parse line: {}... Error: {}",
                        trimmed.length() > 100 ? trimmed.substring(0, 100) : trimmed, e.getOriginalMessage());
            }
        }

        log.info("Successfully read {} records from {}", cases.size(), inputFile);
        return cases;
    }

    CaseResult processCase(IncidentCase incident, int ordinal) {
        String problemId = incident.getProblemId() != null ? incident.getProblemId() : "problem_" + ordinal;
        List<String> candidates = incident.getCandidateRootCauses() != null
                ? incident.getCandidateRootCauses() : List.of();

        AlarmType alarmType = AlarmType.classify(incident.getAlarmRules());
        log.info("Processing problem {}: timeRange={}, alarmRules={} ({}), candidates={}",
                problemId, incident.getTimeRange(), incident.getAlarmRules(), alarmType, candidates.size());

        TimeWindow window;
        try {
            window = TimeWindow.parse(incident.getTimeRange());
        } catch (AnalysisValidationException e) {
            log.error("Invalid case {}: {}", problemId, e.getMessage());
            return failedResult(problemId, CaseStatus.INVALID, e.getMessage());
        }

        int maxAttempts = batchProperties.getMaxCaseAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                AnalysisResult result = rootCauseAnalyzer.analyze(window, candidates, alarmType);
                CaseStatus status = result.hasRootCause() ? CaseStatus.SUCCESS : CaseStatus.NO_EVIDENCE;
                log.info("Problem {} → {} {}", problemId, status, result.getRootCauseLabels());
                return CaseResult.builder()
                        .problemId(problemId)
                        .rootCauses(result.getRootCauseLabels())
                        .status(status)
                        .build();

            } catch (AnalysisValidationException e) {
                log.error("Invalid case {}: {}", problemId, e.getMessage());
                return failedResult(problemId, CaseStatus.INVALID, e.getMessage());

            } catch (CollectionFailureException e) {
                if (!e.isTransientFailure() || attempt >= maxAttempts) {
                    log.error("Problem {} failed after {} attempt(s): {}", problemId, attempt, e.getMessage());
                    return failedResult(problemId, CaseStatus.FAILED, e.getMessage());
                }

                log.warn("Problem {} transient failure (attempt {}/{}): {}", problemId, attempt, maxAttempts, e.getMessage());
                if (!backoff(attempt)) {
                    return failedResult(problemId, CaseStatus.FAILED, "Interrupted while retrying: " + e.getMessage());
                }
            }
        }
    }

    private boolean backoff(int attempt) {
        long millis = batchProperties.getRetryBackoff().toMillis() * attempt;
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CaseResult failedResult(String problemId, CaseStatus status, String error) {
        return CaseResult.builder()
                .problemId(problemId)
                .rootCauses(List.of())
                .status(status)
                .error(error)
                .build();
    }
}
