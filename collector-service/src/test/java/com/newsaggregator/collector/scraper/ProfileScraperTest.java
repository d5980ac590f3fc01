package com.newsaggregator.collector.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.exception.AuthException;
import com.newsaggregator.collector.exception.MalformedItemException;
import com.newsaggregator.collector.exception.TransientSourceException;
import com.newsaggregator.collector.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfileScraperTest {

    private static final String ENDPOINT = "https://api.social.example/users/42/posts";

    private static final String TIMELINE = """
            {"data": [
              {"id": "9001", "text": "Council meeting moved to Friday https://city.example/agenda",
               "created_at": "2024-03-10T06:00:00Z", "hashtags": ["city", "council"]},
              {"id": "9002", "text": "Second post", "created_at": 1710050400},
              {"text": "no id here"}
            ]}
            """;

    @Mock
    private HttpFetcher httpFetcher;

    private ProfileScraper scraper;

    @BeforeEach
    void setUp() {
        scraper = new ProfileScraper(httpFetcher, new ArticleFactory(MutableClock.at("2024-03-10T09:00:00Z")), new ObjectMapper());
    }

    private static Source source() {
        Map<String, String> config = new HashMap<>();
        config.put("endpoint", ENDPOINT);
        config.put("bearer_token", "secret-token");
        config.put("username", "cityhall");
        config.put("url_template", "https://social.example/{username}/status/{id}");
        return Source.builder().id("profile-cityhall").name("City Hall").kind(SourceKind.PROFILE).config(config).build();
    }

    @Test
    @DisplayName("게시물 배열을 읽어 기사로 변환하고 토큰은 헤더로 전달한다")
    void scrapesTimeline() {
        // given
        when(httpFetcher.get(eq(ENDPOINT), anyMap(), eq("profile-cityhall"))).thenReturn(TIMELINE);
        Source source = source();

        // when
        List<JsonNode> items = scraper.scrape(source);
        Article first = scraper.normalize(source, items.get(0));
        Article second = scraper.normalize(source, items.get(1));

        // then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(httpFetcher).get(eq(ENDPOINT), headers.capture(), eq("profile-cityhall"));
        assertThat(headers.getValue()).containsEntry("Authorization", "Bearer secret-token");

        assertThat(items).hasSize(3);
        assertThat(first.getUrl()).isEqualTo("https://social.example/cityhall/status/9001");
        assertThat(first.getTitle()).isEqualTo("Council meeting moved to Friday https://city.example/agenda");
        assertThat(first.getLinks()).containsExactly("https://city.example/agenda");
        assertThat(first.getTags()).containsExactly("city", "council");
        assertThat(first.getAuthor()).isEqualTo("cityhall");
        assertThat(first.getPublishedAt()).isEqualTo(Instant.parse("2024-03-10T06:00:00Z"));
        assertThat(second.getPublishedAt()).isEqualTo(Instant.ofEpochSecond(1710050400L));
    }

    @Test
    @DisplayName("id가 없는 게시물은 잘못된 항목")
    void itemWithoutId() {
        when(httpFetcher.get(eq(ENDPOINT), anyMap(), eq("profile-cityhall"))).thenReturn(TIMELINE);
        Source source = source();
        List<JsonNode> items = scraper.scrape(source);

        assertThatThrownBy(() -> scraper.normalize(source, items.get(2)))
                .isInstanceOf(MalformedItemException.class);
    }

    @Test
    @DisplayName("게시물 배열이 없으면 일시적 오류")
    void missingItemArray() {
        when(httpFetcher.get(eq(ENDPOINT), anyMap(), eq("profile-cityhall"))).thenReturn("{\"errors\": []}");

        assertThatThrownBy(() -> scraper.scrape(source()))
                .isInstanceOf(TransientSourceException.class);
    }

    @Test
    @DisplayName("자격 증명 거부는 그대로 전파된다")
    void authFailurePropagates() {
        when(httpFetcher.get(eq(ENDPOINT), anyMap(), eq("profile-cityhall")))
                .thenThrow(AuthException.rejected("profile-cityhall", ENDPOINT, 401));

        assertThatThrownBy(() -> scraper.scrape(source()))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("HTTP 401");
    }

    @Test
    @DisplayName("url_template에는 {id}가 있어야 한다")
    void validatesTemplate() {
        Source source = source();
        assertThat(scraper.validateConfig(source)).isTrue();

        source.getConfig().put("url_template", "https://social.example/static");
        assertThat(scraper.validateConfig(source)).isFalse();
    }
}
