package com.newsaggregator.collector.spam;

import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpamClassifierTest {

    // "buy now", "click here" 두 패턴만 걸리는 본문 (기본 점수 40)
    private static final String TWO_PATTERN_BODY =
            "Buy now and click here to read more about our weekly market roundup and analysis.";

    private CollectorProperties properties;
    private SpamClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new CollectorProperties();
        classifier = new SpamClassifier(properties);
    }

    private static Source source(String name, double trust) {
        return Source.builder().id("s").name(name).kind(SourceKind.FEED).trust(trust).build();
    }

    private static Article article(String title, String body) {
        return Article.builder().id("a").title(title).body(body).sourceId("s").build();
    }

    @Nested
    @DisplayName("점수 계산")
    class Scoring {

        @Test
        @DisplayName("평범한 기사는 미분류로 남는다")
        void ordinaryArticle() {
            SpamVerdict verdict = classifier.score(
                    article("City council approves budget", "The council voted on Tuesday to approve next year's budget."),
                    source("Local News", 0.5));

            assertThat(verdict.score()).isZero();
            assertThat(verdict.relevance()).isEqualTo(Relevance.UNCLASSIFIED);
            assertThat(verdict.reasons()).isEmpty();
        }

        @Test
        @DisplayName("광고 문구가 가득한 글은 스팸")
        void obviousSpam() {
            SpamVerdict verdict = classifier.score(
                    article("BUY NOW!!! LIMITED OFFER",
                            "Click here for free money, use promo code SALE. Giveaway and discount inside."),
                    source("Channel", 0.5));

            assertThat(verdict.isSpam()).isTrue();
            assertThat(verdict.score()).isGreaterThanOrEqualTo(50);
            assertThat(verdict.reasons()).contains("caps", "punctuation", "keywords:4");
        }

        @Test
        @DisplayName("링크만 있는 짧은 글에 가산점")
        void shortWithLink() {
            SpamVerdict verdict = classifier.score(article("Look", "https://x.example/offer"), null);

            assertThat(verdict.reasons()).contains("short-with-link");
            assertThat(verdict.score()).isEqualTo(20);
            assertThat(verdict.relevance()).isEqualTo(Relevance.NEUTRAL);
        }

        @Test
        @DisplayName("이모지가 10개를 넘으면 가산점")
        void manyEmojis() {
            String emojis = "🔥".repeat(11);
            SpamVerdict verdict = classifier.score(
                    article("Weekend plans", "Here is what is happening around town this weekend " + emojis),
                    source("Events", 0.5));

            assertThat(verdict.reasons()).contains("emojis:11");
            assertThat(verdict.score()).isEqualTo(25);
        }

        @Test
        @DisplayName("소스 이름이 광고성이면 가산점")
        void sourceNamePattern() {
            SpamVerdict verdict = classifier.score(
                    article("Regular update", "Nothing special happened in the markets today, prices held steady."),
                    source("Best Deals Daily", 0.5));

            assertThat(verdict.reasons()).containsExactly("source-name");
            assertThat(verdict.score()).isEqualTo(15);
        }
    }

    @Nested
    @DisplayName("소스 신뢰도 가중")
    class TrustWeighting {

        @Test
        @DisplayName("신뢰도 0이면 점수가 1.5배")
        void lowTrustAmplifies() {
            SpamVerdict verdict = classifier.score(article("Weekly roundup", TWO_PATTERN_BODY), source("Markets", 0.0));

            assertThat(verdict.score()).isEqualTo(60);
            assertThat(verdict.relevance()).isEqualTo(Relevance.SPAM);
        }

        @Test
        @DisplayName("신뢰도 1이면 점수가 절반")
        void highTrustDampens() {
            SpamVerdict verdict = classifier.score(article("Weekly roundup", TWO_PATTERN_BODY), source("Markets", 1.0));

            assertThat(verdict.score()).isEqualTo(20);
            assertThat(verdict.relevance()).isEqualTo(Relevance.NEUTRAL);
        }

        @Test
        @DisplayName("소스가 없으면 중립 신뢰도")
        void missingSourceIsNeutral() {
            SpamVerdict verdict = classifier.score(article("Weekly roundup", TWO_PATTERN_BODY), null);

            assertThat(verdict.score()).isEqualTo(40);
        }
    }

    @Nested
    @DisplayName("관련도")
    class RelevanceAssignment {

        @Test
        @DisplayName("관심 키워드가 제목에 있으면 즐겨찾기")
        void favoriteKeyword() {
            properties.getSpam().setFavoriteKeywords(List.of("election"));
            classifier = new SpamClassifier(properties);

            SpamVerdict verdict = classifier.score(
                    article("Election results announced", "Final counts were published this morning by the commission."),
                    source("Politics", 0.5));

            assertThat(verdict.relevance()).isEqualTo(Relevance.FAVORITE);
        }

        @Test
        @DisplayName("스팸 판정이 관심 키워드보다 우선")
        void spamBeatsFavorite() {
            properties.getSpam().setFavoriteKeywords(List.of("offer"));
            classifier = new SpamClassifier(properties);

            SpamVerdict verdict = classifier.score(
                    article("BUY NOW!!! LIMITED OFFER", "Click here for free money, use promo code SALE."),
                    source("Channel", 0.5));

            assertThat(verdict.relevance()).isEqualTo(Relevance.SPAM);
        }
    }

    @Nested
    @DisplayName("사용자 평가")
    class UserRated {

        @Test
        @DisplayName("사용자가 평가한 기사는 다시 분류해도 그대로")
        void userRatingPreserved() {
            // given
            Article rated = article("BUY NOW!!! LIMITED OFFER", "Click here for free money, use promo code SALE.");
            rated.setUserRated(true);
            rated.setRelevance(Relevance.FAVORITE);

            // when
            SpamVerdict first = classifier.apply(rated, source("Channel", 0.0));
            SpamVerdict second = classifier.apply(rated, source("Channel", 0.0));

            // then
            assertThat(first.userRated()).isTrue();
            assertThat(first.relevance()).isEqualTo(Relevance.FAVORITE);
            assertThat(second).isEqualTo(first);
            assertThat(rated.getRelevance()).isEqualTo(Relevance.FAVORITE);
        }

        @Test
        @DisplayName("평가되지 않은 기사는 apply가 결과를 기록한다")
        void applyWritesVerdict() {
            Article article = article("Weekly roundup", TWO_PATTERN_BODY);

            classifier.apply(article, source("Markets", 0.0));

            assertThat(article.getRelevance()).isEqualTo(Relevance.SPAM);
            assertThat(article.getSpamScore()).isEqualTo(60);
            assertThat(article.getSpamReasons()).hasSize(2);
        }
    }
}
