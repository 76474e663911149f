package com.tenacy.rootpulse.batch;

import com.tenacy.rootpulse.config.BatchProperties;
import com.tenacy.rootpulse.credential.CachingCredentialProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * rootpulse.batch.enabled=true 일 때 기동 시 입력 파일 전체를 분석한다.
 */
@Component
@ConditionalOnProperty(prefix = "rootpulse.batch", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IncidentBatchRunner implements CommandLineRunner {

    private final IncidentBatchService incidentBatchService;
    private final BatchProperties batchProperties;
    private final CachingCredentialProvider credentialProvider;

    @Override
    public void run(String... args) {
        log.info("Starting root cause analysis batch: input={}, output={}",
                batchProperties.getInputFile(), batchProperties.getOutputFile());

        // 연결 확인 실패는 경고만 남기고 진행 (케이스별 실패로 기록됨)
        if (!credentialProvider.isAvailable()) {
            log.warn("Log store credentials are not available; cases will likely fail");
        }

        BatchSummary summary = incidentBatchService.process(
                Path.of(batchProperties.getInputFile()), Path.of(batchProperties.getOutputFile()));

        for (CaseResult result : summary.getResults()) {
            log.info("{} {}: {}", result.getStatus(), result.getProblemId(), result.getRootCauses());
        }
        log.info("Analysis completed.");
    }
}
