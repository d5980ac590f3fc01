package com.newsaggregator.collector.dedup;

import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.util.TextNormalizer;

import java.time.Instant;

/**
 * 중복 비교에 필요한 기사 요약. 사이클 동안만 유지된다.
 */
public record DuplicateRecord(
        String articleId,
        String contentHash,
        String normalizedTitle,
        String bodyPrefix,
        String sourceId,
        Instant ingestedAt
) {

    public static DuplicateRecord of(Article article, int bodyPrefixLength, Instant fallbackTime) {
        Instant ingestedAt = article.getScrapedAt() != null ? article.getScrapedAt() : fallbackTime;
        return new DuplicateRecord(
                article.getId(),
                TextNormalizer.contentHash(article.getTitle(), article.getBody()),
                TextNormalizer.normalize(article.getTitle()),
                TextNormalizer.prefix(article.getBody(), bodyPrefixLength),
                article.getSourceId(),
                ingestedAt);
    }
}
