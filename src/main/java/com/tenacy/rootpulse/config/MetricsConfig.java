package com.tenacy.rootpulse.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter analysisCompletedCounter(MeterRegistry registry) {
        return Counter.builder("rootpulse.analysis.completed")
                .description("완료된 근본 원인 분석 수")
                .register(registry);
    }

    @Bean
    public Counter analysisFailedCounter(MeterRegistry registry) {
        return Counter.builder("rootpulse.analysis.failed")
                .description("수집 실패로 중단된 분석 수")
                .register(registry);
    }

    @Bean
    public Counter analysisDegradedCounter(MeterRegistry registry) {
        return Counter.builder("rootpulse.analysis.degraded")
                .description("best-effort 모드에서 수집기 하나만으로 완료된 분석 수")
                .register(registry);
    }

    @Bean
    public Counter evidenceRecordsCounter(MeterRegistry registry) {
        return Counter.builder("rootpulse.evidence.records")
                .description("분석에 사용된 로그 레코드 수")
                .register(registry);
    }

    @Bean
    public Timer analysisTimer(MeterRegistry registry) {
        return Timer.builder("rootpulse.analysis.duration")
                .description("분석 소요 시간")
                .register(registry);
    }
}
