package com.newsaggregator.collector.mapper;

import com.newsaggregator.collector.dto.ArticleDTO;
import com.newsaggregator.collector.dto.SourceCreateRequest;
import com.newsaggregator.collector.dto.SourceDTO;
import com.newsaggregator.collector.dto.SourceTestResponse;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.pipeline.SourceTestRun;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Component
public class EntityMapper {

    static final String MASK = "******";

    static final int TEST_SAMPLE_SIZE = 3;

    private static final Set<String> SECRET_KEYS = Set.of("bearer_token", "api_key", "password", "token", "secret");

    public SourceDTO toDTO(Source source) {
        return SourceDTO.builder()
                .id(source.getId())
                .name(source.getName())
                .kind(source.getKind())
                .enabled(source.isEnabled())
                .updateIntervalMinutes(source.getUpdateIntervalMinutes())
                .maxItemsPerCycle(source.getMaxItemsPerCycle())
                .trust(source.getTrust())
                .config(maskSecrets(source.getConfig()))
                .lastAttemptAt(source.getLastAttemptAt())
                .lastSuccessAt(source.getLastSuccessAt())
                .lastError(source.getLastError())
                .lastErrorKind(source.getLastErrorKind())
                .consecutiveFailures(source.getConsecutiveFailures())
                .validationStatus(source.getValidationStatus())
                .validationError(source.getValidationError())
                .build();
    }

    public Source toEntity(SourceCreateRequest request) {
        String id = request.id() != null && !request.id().isBlank()
                ? request.id()
                : Source.defaultId(request.kind(), request.name());
        return Source.builder()
                .id(id)
                .name(request.name().trim())
                .kind(request.kind())
                .enabled(request.enabled())
                .updateIntervalMinutes(request.updateIntervalMinutes())
                .maxItemsPerCycle(request.maxItemsPerCycle())
                .trust(request.trust())
                .config(new HashMap<>(request.config()))
                .build();
    }

    public SourceTestResponse toResponse(SourceTestRun run) {
        return new SourceTestResponse(
                run.sourceId(),
                run.status(),
                run.failureKind(),
                run.error(),
                run.scraped(),
                run.malformed(),
                run.duplicates(),
                run.spam(),
                run.durationMs(),
                run.candidates().stream()
                        .limit(TEST_SAMPLE_SIZE)
                        .map(this::toDTO)
                        .collect(Collectors.toList()));
    }

    public ArticleDTO toDTO(Article article) {
        return ArticleDTO.builder()
                .id(article.getId())
                .title(article.getTitle())
                .body(article.getBody())
                .url(article.getUrl())
                .sourceId(article.getSourceId())
                .sourceKind(article.getSourceKind())
                .author(article.getAuthor())
                .publishedAt(article.getPublishedAt())
                .scrapedAt(article.getScrapedAt())
                .relevance(article.getRelevance())
                .userRated(article.isUserRated())
                .links(article.getLinks())
                .previewRefs(article.getPreviewRefs())
                .mediaRefs(article.getMediaRefs())
                .build();
    }

    /**
     * 자격 증명으로 보이는 설정 값은 응답에 노출하지 않는다
     */
    Map<String, String> maskSecrets(Map<String, String> config) {
        Map<String, String> masked = new TreeMap<>();
        if (config == null) {
            return masked;
        }
        config.forEach((key, value) -> {
            String lower = key.toLowerCase(Locale.ROOT);
            boolean secret = lower.startsWith("header.") || SECRET_KEYS.contains(lower);
            masked.put(key, secret ? MASK : value);
        });
        return masked;
    }
}
