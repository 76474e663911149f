package com.tenacy.rootpulse.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rootpulse.batch")
public class BatchProperties {

    private boolean enabled = false;

    @NotBlank
    private String inputFile = "dataset/input.jsonl";

    @NotBlank
    private String outputFile = "dataset/output.jsonl";

    /** 일시적 수집 실패 시 케이스당 최대 시도 횟수 */
    @Min(1)
    private int maxCaseAttempts = 3;

    @NotNull
    private Duration retryBackoff = Duration.ofSeconds(2);
}
