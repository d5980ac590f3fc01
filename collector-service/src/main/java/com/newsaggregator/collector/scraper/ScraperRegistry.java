package com.newsaggregator.collector.scraper;

import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SourceKind별 수집기 조회. 모든 종류에 정확히 하나의 수집기가 있어야 기동된다.
 */
@Component
@Slf4j
public class ScraperRegistry {

    private final Map<SourceKind, ScraperAdapter<?>> adapters = new EnumMap<>(SourceKind.class);

    public ScraperRegistry(List<ScraperAdapter<?>> adapterBeans) {
        for (ScraperAdapter<?> adapter : adapterBeans) {
            ScraperAdapter<?> previous = adapters.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scraper for kind " + adapter.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        for (SourceKind kind : SourceKind.values()) {
            if (!adapters.containsKey(kind)) {
                throw new IllegalStateException("No scraper registered for kind " + kind.getValue());
            }
        }
        log.info("Registered scrapers: {}", adapters.keySet());
    }

    public ScraperAdapter<?> adapterFor(SourceKind kind) {
        return adapters.get(kind);
    }

    /**
     * 공통 제약과 종류별 설정을 네트워크 없이 검사한다. 문제가 없으면 empty.
     */
    public Optional<String> validate(Source source) {
        if (source.getKind() == null) {
            return Optional.of("kind is required");
        }
        if (source.getMaxItemsPerCycle() < 1) {
            return Optional.of("max_items_per_cycle must be at least 1, was " + source.getMaxItemsPerCycle());
        }
        if (source.getUpdateIntervalMinutes() < 1) {
            return Optional.of("update_interval_minutes must be at least 1, was " + source.getUpdateIntervalMinutes());
        }
        if (source.getTrust() < 0.0 || source.getTrust() > 1.0) {
            return Optional.of("trust must be between 0.0 and 1.0, was " + source.getTrust());
        }
        try {
            if (!adapterFor(source.getKind()).validateConfig(source)) {
                return Optional.of("Invalid configuration for " + source.getKind().getValue() + " source");
            }
        } catch (RuntimeException e) {
            log.warn("Config validation of source {} threw: {}", source.getId(), e.getMessage());
            return Optional.of("Configuration check failed: " + e.getMessage());
        }
        return Optional.empty();
    }
}
