package com.newsaggregator.collector.config;

import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.service.SourceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;

/**
 * Seeds sources from application.yml (collector.seed.sources) on startup.
 *
 * Existing sources (matched by id, then by name) are left untouched so operator changes
 * made through the API survive restarts.
 *
 * Profiles:
 * - default: Runs automatically
 * - no-seed: Skip seeding
 */
@Component
@Profile("!no-seed")
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class SourceSeeder implements ApplicationRunner {

    private final SourceService sourceService;
    private final CollectorProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        CollectorProperties.Seed seed = properties.getSeed();
        if (!seed.isEnabled()) {
            log.info("Source seeding is disabled via configuration.");
            return;
        }
        List<CollectorProperties.SourceEntry> entries = seed.getSources();
        if (entries.isEmpty()) {
            log.info("No seed sources configured.");
            return;
        }

        int created = 0;
        int skipped = 0;
        for (CollectorProperties.SourceEntry entry : entries) {
            Source desired;
            try {
                desired = toSource(entry);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping seed entry '{}': {}", entry.getName(), e.getMessage());
                skipped++;
                continue;
            }

            boolean exists = sourceService.findById(desired.getId()).isPresent()
                    || sourceService.findAll().stream().anyMatch(s -> desired.getName().equals(s.getName()));
            if (exists) {
                skipped++;
                continue;
            }
            sourceService.create(desired);
            created++;
        }

        log.info("Seeded sources. created={}, skipped={}, totalDesired={}", created, skipped, entries.size());
    }

    Source toSource(CollectorProperties.SourceEntry entry) {
        if (entry.getName() == null || entry.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        SourceKind kind = SourceKind.fromValue(entry.getKind());
        String id = entry.getId() != null && !entry.getId().isBlank()
                ? entry.getId()
                : Source.defaultId(kind, entry.getName());

        return Source.builder()
                .id(id)
                .name(entry.getName())
                .kind(kind)
                .enabled(entry.isEnabled())
                .updateIntervalMinutes(entry.getUpdateIntervalMinutes())
                .maxItemsPerCycle(entry.getMaxItemsPerCycle())
                .trust(entry.getTrust())
                .config(new HashMap<>(entry.getConfig()))
                .build();
    }
}
