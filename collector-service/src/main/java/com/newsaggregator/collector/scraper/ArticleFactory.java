package com.newsaggregator.collector.scraper;

import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.exception.MalformedItemException;
import com.newsaggregator.collector.util.LinkExtractor;
import com.newsaggregator.collector.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 모든 수집기가 공유하는 Article 생성 로직 (식별자, 정규화, 링크, 해시).
 */
@Component
@RequiredArgsConstructor
public class ArticleFactory {

    static final int TITLE_MAX_LENGTH = 100;

    private final Clock clock;

    public Article build(Source source, ArticleDraft draft) {
        if (draft.nativeKey() == null || draft.nativeKey().isBlank()) {
            throw MalformedItemException.missingKey(source.getId());
        }
        String title = TextNormalizer.clean(draft.title());
        String body = TextNormalizer.cleanMultiline(draft.body());
        if (title.isEmpty() && body.isEmpty()) {
            throw MalformedItemException.missingContent(source.getId(), draft.nativeKey());
        }
        if (title.isEmpty()) {
            title = defaultTitle(source, body);
        }

        String url = LinkExtractor.canonicalize(draft.url());
        List<String> links = new ArrayList<>(LinkExtractor.merge(
                LinkExtractor.extract(body),
                draft.extraLinks() != null ? draft.extraLinks() : List.of()));
        if (url != null) {
            links.remove(url);
        }

        return Article.builder()
                .id(stableId(source.getId(), draft.nativeKey()))
                .title(title)
                .body(body)
                .url(url)
                .links(links)
                .sourceId(source.getId())
                .sourceKind(source.getKind())
                .author(TextNormalizer.clean(draft.author()).isEmpty() ? null : TextNormalizer.clean(draft.author()))
                .tags(draft.tags() != null ? new ArrayList<>(draft.tags()) : new ArrayList<>())
                .mediaRefs(draft.mediaRefs() != null ? new ArrayList<>(draft.mediaRefs()) : new ArrayList<>())
                .publishedAt(draft.publishedAt())
                .scrapedAt(clock.instant())
                .relevance(Relevance.UNCLASSIFIED)
                .build()
                .rehash();
    }

    /**
     * 소스 ID와 원본 항목 키로부터 결정적인 UUID를 만든다. 같은 항목은 항상 같은 ID를 갖는다.
     */
    public static String stableId(String sourceId, String nativeKey) {
        return UUID.nameUUIDFromBytes((sourceId + "|" + nativeKey).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String defaultTitle(Source source, String body) {
        return switch (source.getKind()) {
            // 메시지형 소스: 첫 줄이 제목 역할
            case CHANNEL, PROFILE -> TextNormalizer.truncate(body.lines().findFirst().orElse(body), TITLE_MAX_LENGTH);
            case FEED, PAGE -> TextNormalizer.truncate(TextNormalizer.clean(body), TITLE_MAX_LENGTH);
        };
    }
}
