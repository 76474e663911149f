package com.tenacy.rootpulse.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 근본 원인 분석 설정
 *
 * <p>임계값과 조회 한도는 모두 이 객체를 통해서만 주입된다. 환경 변수 오버라이드는
 * application.yml 의 플레이스홀더에서 한 번만 해석된다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "rootpulse.analysis")
public class AnalysisProperties {

    /** 에러 span 조회 최대 건수 */
    @Min(1)
    private int errorTracesLimit = 2000;

    /** 고지연 span 조회 최대 건수 */
    @Min(1)
    private int latencyTracesLimit = 2000;

    /** 지연 위반 판단 기준 (나노초, 기본 2초) */
    @Min(0)
    private long durationThresholdNanos = 2_000_000_000L;

    /** 에러 span 조회 쿼리 */
    @NotBlank
    private String errorQuery = "statusCode:>1";

    /** span 실행 시간이 기록된 필드 */
    @NotBlank
    private String durationField = "duration";

    /** trace 내에서 자식 에러가 없는 가장 깊은 에러 span 만 증거로 사용 */
    private boolean errorRootSpansOnly = true;

    /** 두 수집기를 병렬로 실행 */
    private boolean parallelCollection = true;

    /** 수집기 하나가 실패해도 나머지 결과로 분석을 계속 (opt-in) */
    private boolean bestEffort = false;

    /** 병렬 수집 시 두 수집기를 기다리는 최대 시간. 순차 수집에는 적용되지 않는다 */
    @NotNull
    private Duration collectionTimeout = Duration.ofSeconds(60);

    /** 지연 증거를 독점 시간 기여도 상위 span 으로 줄임 */
    private boolean latencySpanRanking = true;

    /** 누적 독점 시간이 전체의 이 비율에 도달할 때까지 span 을 선택 */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double latencyContributionRatio = 0.95;

    /** 평상시 구간의 서비스/span 별 평균 독점 시간을 빼고 순위를 매김 */
    private boolean latencyMinusAverage = true;

    /** trace 당 독점 시간이 가장 긴 span 하나만 후보로 사용 */
    private boolean latencyOnlyTop1PerTrace = false;

    /** 평균 계산에 쓰는 평상시 구간 (장애 시작 직전) */
    @NotNull
    private Duration baselineWindow = Duration.ofHours(1);

    /** 평상시 구간 조회 최대 건수 */
    @Min(1)
    private int baselineTracesLimit = 3000;

    /** 독점 시간 상한 (나노초, 0 이면 제한 없음) */
    @Min(0)
    private long maxExclusiveDurationNanos = 0L;
}
