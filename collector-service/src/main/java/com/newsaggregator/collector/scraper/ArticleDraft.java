package com.newsaggregator.collector.scraper;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * 수집기가 원시 항목에서 추출한 값. {@link ArticleFactory}가 Article로 완성한다.
 */
@Builder
public record ArticleDraft(
        String nativeKey,
        String title,
        String body,
        String url,
        List<String> extraLinks,
        List<String> mediaRefs,
        String author,
        List<String> tags,
        Instant publishedAt
) {
}
