package com.newsaggregator.collector.service;

import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.exception.ResourceNotFoundException;
import com.newsaggregator.collector.repository.ArticleRepository;
import com.newsaggregator.collector.repository.SourceRepository;
import com.newsaggregator.collector.spam.SpamClassifier;
import com.newsaggregator.collector.spam.SpamVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 저장된 기사 조회와 관련도 평가.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleService {

    private static final Comparator<Article> NEWEST_FIRST = Comparator.comparing(
            (Article article) -> article.getPublishedAt() != null ? article.getPublishedAt() : article.getScrapedAt(),
            Comparator.nullsLast(Comparator.reverseOrder()));

    private final ArticleRepository articleRepository;
    private final SourceRepository sourceRepository;
    private final SpamClassifier spamClassifier;
    private final Clock clock;

    /**
     * 스팸을 제외한 기사, 최신순
     */
    public List<Article> findVisible() {
        return articleRepository.findBy(article -> article.getRelevance() != Relevance.SPAM).stream()
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    public List<Article> findByRelevance(Relevance relevance) {
        return articleRepository.findByRelevance(relevance).stream()
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    public Optional<Article> findById(String id) {
        return articleRepository.findById(id);
    }

    /**
     * 사용자 평가. 이후 재분류에서도 유지된다.
     */
    public synchronized Article rate(String id, Relevance relevance) {
        Article article = articleRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.article(id));
        article.setRelevance(relevance);
        article.setUserRated(true);
        article.setRatedAt(clock.instant());
        log.info("Article {} rated as {}", id, relevance.getValue());
        return articleRepository.save(article);
    }

    /**
     * 사용자 평가가 없는 기사를 현재 규칙으로 다시 분류한다.
     *
     * @return 관련도가 바뀐 기사 수
     */
    public synchronized int reclassifyUnrated() {
        Map<String, Source> sources = sourceRepository.findAll().stream()
                .collect(Collectors.toMap(Source::getId, Function.identity()));

        int changed = 0;
        for (Article article : articleRepository.findBy(article -> !article.isUserRated())) {
            Relevance before = article.getRelevance();
            SpamVerdict verdict = spamClassifier.apply(article, sources.get(article.getSourceId()));
            if (verdict.relevance() != before) {
                articleRepository.save(article);
                changed++;
            }
        }
        log.info("Reclassified unrated articles, {} changed", changed);
        return changed;
    }
}
