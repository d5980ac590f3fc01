package com.newsaggregator.collector.service;

import com.newsaggregator.collector.dto.SourceStatsDTO;
import com.newsaggregator.collector.dto.SourceStatsSummary;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.exception.ResourceNotFoundException;
import com.newsaggregator.collector.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 소스별 수집 통계. 기사 수는 호출 시점의 저장소 스냅샷으로 계산한다.
 */
@Service
@RequiredArgsConstructor
public class SourceStatsService {

    private final SourceService sourceService;
    private final ArticleRepository articleRepository;

    public SourceStatsSummary summarize() {
        Map<String, List<Article>> bySource = articleRepository.findAll().stream()
                .filter(article -> article.getSourceId() != null)
                .collect(Collectors.groupingBy(Article::getSourceId));

        List<Source> sources = sourceService.findAll();
        List<SourceStatsDTO> stats = sources.stream()
                .map(source -> statsOf(source, bySource.getOrDefault(source.getId(), List.of())))
                .collect(Collectors.toList());

        return new SourceStatsSummary(
                sources.size(),
                sources.stream().filter(Source::isEnabled).count(),
                sources.stream().filter(source -> source.getConsecutiveFailures() > 0).count(),
                sources.stream().filter(source -> Boolean.FALSE.equals(source.getValidationStatus())).count(),
                bySource.values().stream().mapToLong(List::size).sum(),
                stats);
    }

    public SourceStatsDTO statsFor(String sourceId) {
        Source source = sourceService.findById(sourceId)
                .orElseThrow(() -> ResourceNotFoundException.source(sourceId));
        return statsOf(source, articleRepository.findBySourceId(sourceId));
    }

    private SourceStatsDTO statsOf(Source source, List<Article> articles) {
        Map<Relevance, Long> byRelevance = new EnumMap<>(Relevance.class);
        for (Relevance relevance : Relevance.values()) {
            byRelevance.put(relevance, 0L);
        }
        articles.forEach(article -> byRelevance.merge(
                article.getRelevance() != null ? article.getRelevance() : Relevance.UNCLASSIFIED, 1L, Long::sum));

        Instant lastArticleAt = articles.stream()
                .map(Article::getScrapedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);

        return SourceStatsDTO.builder()
                .sourceId(source.getId())
                .name(source.getName())
                .kind(source.getKind())
                .enabled(source.isEnabled())
                .totalArticles(articles.size())
                .articlesByRelevance(byRelevance)
                .lastArticleAt(lastArticleAt)
                .lastAttemptAt(source.getLastAttemptAt())
                .lastSuccessAt(source.getLastSuccessAt())
                .lastError(source.getLastError())
                .lastErrorKind(source.getLastErrorKind())
                .consecutiveFailures(source.getConsecutiveFailures())
                .validationStatus(source.getValidationStatus())
                .build();
    }
}
