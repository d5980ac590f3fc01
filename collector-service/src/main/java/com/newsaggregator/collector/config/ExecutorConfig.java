package com.newsaggregator.collector.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final CollectorProperties properties;

    /**
     * 소스 수집 전용 고정 크기 실행자
     */
    @Bean(name = "scrapeExecutor")
    public ThreadPoolTaskExecutor scrapeExecutor() {
        int size = properties.getPipeline().getWorkerPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("scrape-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * 링크 미리보기 조회 전용 실행자
     */
    @Bean(name = "previewExecutor")
    public ThreadPoolTaskExecutor previewExecutor() {
        int size = properties.getPreview().getPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("preview-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * 소스별 타임아웃을 감시하는 스케줄러
     */
    @Bean(name = "watchdogScheduler")
    public ThreadPoolTaskScheduler watchdogScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("source-watchdog-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
