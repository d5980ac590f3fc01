package com.newsaggregator.collector.service;

import com.newsaggregator.collector.dto.SourceStatsDTO;
import com.newsaggregator.collector.dto.SourceStatsSummary;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.exception.ResourceNotFoundException;
import com.newsaggregator.collector.repository.ArticleRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * SourceStatsService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class SourceStatsServiceTest {

    @Mock
    private SourceService sourceService;

    @Mock
    private ArticleRepository articleRepository;

    @InjectMocks
    private SourceStatsService sourceStatsService;

    private static Article article(String id, String sourceId, Relevance relevance, String scrapedAt) {
        return Article.builder()
                .id(id)
                .title(id)
                .sourceId(sourceId)
                .relevance(relevance)
                .scrapedAt(Instant.parse(scrapedAt))
                .build();
    }

    private static Source failingFeed() {
        return Source.builder()
                .id("feed-a")
                .name("Feed A")
                .kind(SourceKind.FEED)
                .lastSuccessAt(Instant.parse("2024-03-09T09:00:00Z"))
                .lastAttemptAt(Instant.parse("2024-03-10T09:00:00Z"))
                .lastError("HTTP 503 from https://news.example/rss")
                .lastErrorKind("TRANSIENT")
                .consecutiveFailures(2)
                .build();
    }

    @Test
    @DisplayName("소스별 기사 수를 관련도별로 세고 마지막 성공과 오류를 함께 보여준다")
    void statsForSource() {
        // given
        when(sourceService.findById("feed-a")).thenReturn(Optional.of(failingFeed()));
        when(articleRepository.findBySourceId("feed-a")).thenReturn(List.of(
                article("a1", "feed-a", Relevance.UNCLASSIFIED, "2024-03-08T09:00:00Z"),
                article("a2", "feed-a", Relevance.SPAM, "2024-03-09T09:00:00Z"),
                article("a3", "feed-a", Relevance.SPAM, "2024-03-07T09:00:00Z")));

        // when
        SourceStatsDTO stats = sourceStatsService.statsFor("feed-a");

        // then
        assertThat(stats.getTotalArticles()).isEqualTo(3);
        assertThat(stats.getArticlesByRelevance())
                .containsEntry(Relevance.SPAM, 2L)
                .containsEntry(Relevance.UNCLASSIFIED, 1L)
                .containsKeys(Relevance.values());
        assertThat(stats.getLastArticleAt()).isEqualTo(Instant.parse("2024-03-09T09:00:00Z"));
        assertThat(stats.getLastSuccessAt()).isEqualTo(Instant.parse("2024-03-09T09:00:00Z"));
        assertThat(stats.getLastError()).contains("HTTP 503");
        assertThat(stats.getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("기사가 없는 소스는 0건과 빈 마지막 기사 시각")
    void sourceWithoutArticles() {
        Source quiet = Source.builder().id("page-a").name("Page A").kind(SourceKind.PAGE).build();
        when(sourceService.findById("page-a")).thenReturn(Optional.of(quiet));
        when(articleRepository.findBySourceId("page-a")).thenReturn(List.of());

        SourceStatsDTO stats = sourceStatsService.statsFor("page-a");

        assertThat(stats.getTotalArticles()).isZero();
        assertThat(stats.getArticlesByRelevance().values()).containsOnly(0L);
        assertThat(stats.getLastArticleAt()).isNull();
    }

    @Test
    @DisplayName("없는 소스는 예외")
    void unknownSource() {
        when(sourceService.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sourceStatsService.statsFor("missing"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("요약은 활성, 실패 중, 잘못된 설정 소스 수와 전체 기사 수를 센다")
    void summary() {
        // given
        Source invalid = Source.builder().id("page-bad").name("Bad").kind(SourceKind.PAGE)
                .enabled(false).validationStatus(false).build();
        when(sourceService.findAll()).thenReturn(List.of(failingFeed(), invalid));
        when(articleRepository.findAll()).thenReturn(List.of(
                article("a1", "feed-a", Relevance.UNCLASSIFIED, "2024-03-08T09:00:00Z"),
                article("a2", "feed-a", Relevance.SPAM, "2024-03-09T09:00:00Z"),
                article("o1", "deleted-source", Relevance.UNCLASSIFIED, "2024-03-09T09:00:00Z")));

        // when
        SourceStatsSummary summary = sourceStatsService.summarize();

        // then
        assertThat(summary.totalSources()).isEqualTo(2);
        assertThat(summary.activeSources()).isEqualTo(1);
        assertThat(summary.failingSources()).isEqualTo(1);
        assertThat(summary.invalidSources()).isEqualTo(1);
        assertThat(summary.totalArticles()).isEqualTo(3);
        assertThat(summary.sources()).extracting(SourceStatsDTO::getSourceId).containsExactly("feed-a", "page-bad");
        assertThat(summary.sources().get(1).getTotalArticles()).isZero();
    }
}
