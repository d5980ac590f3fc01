package com.newsaggregator.collector.config;

import com.newsaggregator.collector.dto.CycleReport;
import com.newsaggregator.collector.pipeline.MultiSourceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * collector.run-on-startup=true 이면 기동 직후 사이클을 1회 실행한다 (cron 등 외부 스케줄러용).
 */
@Component
@Order(2)
@ConditionalOnProperty(prefix = "collector", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class CycleRunner implements ApplicationRunner {

    private final MultiSourceManager multiSourceManager;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running collection cycle on startup");
        CycleReport report = multiSourceManager.runCycle();
        log.info("Startup cycle {} committed {} new articles", report.cycleId(), report.newArticles());
    }
}
