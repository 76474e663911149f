package com.tenacy.rootpulse.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    @Value("${rootpulse.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${rootpulse.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${rootpulse.async.queue-capacity:100}")
    private int queueCapacity;

    /**
     * 에러/지연 수집기 조회를 동시에 실행하기 위한 풀
     */
    @Bean(name = "collectorExecutor")
    public ThreadPoolTaskExecutor collectorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("collector-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
