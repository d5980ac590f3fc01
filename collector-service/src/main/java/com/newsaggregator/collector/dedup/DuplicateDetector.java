package com.newsaggregator.collector.dedup;

import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 소스 간 중복 기사 탐지.
 *
 * 0단계: 같은 항목의 재수집 (결정적 ID 일치)
 * 1단계: 정규화된 제목+본문 해시 일치 (저장된 전체 기사 대상)
 * 2단계: 최근 윈도우 안의 기사와 제목 또는 본문 앞부분의 편집 거리 유사도 비교
 */
@Component
@Slf4j
public class DuplicateDetector {

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private final CollectorProperties.Dedup config;

    public DuplicateDetector(CollectorProperties properties) {
        this.config = properties.getDedup();
    }

    /**
     * 저장된 기사로 이번 사이클의 색인을 만든다.
     */
    public DuplicateIndex buildIndex(List<Article> corpus, Instant now) {
        Instant horizon = now.minus(Duration.ofHours(config.getWindowHours()));
        DuplicateIndex index = new DuplicateIndex(horizon, config.getWindowSize());

        List<Article> ordered = new ArrayList<>(corpus);
        ordered.sort(Comparator.comparing((Article article) ->
                article.getScrapedAt() != null ? article.getScrapedAt() : now));
        for (Article article : ordered) {
            boolean inWindow = config.isIncludeSpamInWindow() || article.getRelevance() != Relevance.SPAM;
            index.addExisting(DuplicateRecord.of(article, config.getBodyPrefixLength(), now), inWindow);
        }

        log.debug("Built duplicate index: {} hashes, {} windowed", index.hashCount(), index.windowSize());
        return index;
    }

    /**
     * 중복이 아니라고 판정된 후보를 색인에 등록한다. 스팸 제외 설정이면 스팸은 해시로만 잡힌다.
     */
    public void register(Article accepted, DuplicateIndex index, Instant now) {
        boolean inWindow = config.isIncludeSpamInWindow() || accepted.getRelevance() != Relevance.SPAM;
        index.register(DuplicateRecord.of(accepted, config.getBodyPrefixLength(), now), inWindow);
    }

    public DuplicateVerdict classify(Article candidate, DuplicateIndex index) {
        if (candidate.getId() != null && index.containsId(candidate.getId())) {
            return DuplicateVerdict.duplicateOf(candidate.getId(), MatchType.SAME_ITEM, 1.0);
        }
        String candidateHash = TextNormalizer.contentHash(candidate.getTitle(), candidate.getBody());
        String exact = index.idForHash(candidateHash);
        if (exact != null) {
            return DuplicateVerdict.duplicateOf(exact, MatchType.EXACT, 1.0);
        }

        String title = TextNormalizer.normalize(candidate.getTitle());
        String bodyPrefix = TextNormalizer.prefix(candidate.getBody(), config.getBodyPrefixLength());
        double threshold = config.getSimilarityThreshold();

        for (DuplicateRecord existing : index.window()) {
            double titleSimilarity = similarity(title, existing.normalizedTitle());
            if (titleSimilarity >= threshold) {
                return DuplicateVerdict.duplicateOf(existing.articleId(), MatchType.FUZZY_TITLE, titleSimilarity);
            }
            double bodySimilarity = similarity(bodyPrefix, existing.bodyPrefix());
            if (bodySimilarity >= threshold) {
                return DuplicateVerdict.duplicateOf(existing.articleId(), MatchType.FUZZY_BODY, bodySimilarity);
            }
        }
        return DuplicateVerdict.unique();
    }

    /**
     * 1 - (편집 거리 / 긴 문자열 길이). 어느 한쪽이라도 비어 있으면 0.
     */
    public static double similarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        int distance = LEVENSHTEIN.apply(a, b);
        return 1.0 - (double) distance / maxLength;
    }
}
