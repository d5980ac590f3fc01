package com.newsaggregator.collector.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newsaggregator.collector.store.JsonStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class StoreConfig {

    private final CollectorProperties properties;

    @Bean
    public JsonStore jsonStore(Clock clock) {
        Path dataDir = Path.of(properties.getDataDir()).toAbsolutePath();
        log.info("Using JSON store at {} (backup retention {} days)", dataDir, properties.getBackupRetentionDays());
        return new JsonStore(storeObjectMapper(), dataDir, properties.getBackupRetentionDays(), clock);
    }

    /**
     * 저장 파일 전용 ObjectMapper (snake_case, ISO-8601 시간)
     */
    public static ObjectMapper storeObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
