package com.newsaggregator.collector.preview;

import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Preview;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetaTagPreviewFetcherTest {

    private static final String URL = "https://news.example/2024/story";

    @Mock
    private HttpFetcher httpFetcher;

    private final CollectorProperties properties = new CollectorProperties();

    @Test
    @DisplayName("Open Graph 태그를 우선 사용하고 상대 이미지 경로를 절대화한다")
    void readsOpenGraph() {
        when(httpFetcher.getHead(eq(URL), anyInt())).thenReturn("""
                <html><head>
                <title>Fallback title</title>
                <meta property="og:title" content="OG title">
                <meta property="og:description" content="  A   short summary  ">
                <meta property="og:image" content="/img/cover.jpg">
                <meta property="og:site_name" content="News Example">
                </head>
                """);

        Optional<Preview> preview = new MetaTagPreviewFetcher(httpFetcher, properties).fetch(URL);

        assertThat(preview).isPresent();
        assertThat(preview.get().getTitle()).isEqualTo("OG title");
        assertThat(preview.get().getDescription()).isEqualTo("A short summary");
        assertThat(preview.get().getImageUrl()).isEqualTo("https://news.example/img/cover.jpg");
        assertThat(preview.get().getSiteName()).isEqualTo("News Example");
    }

    @Test
    @DisplayName("제목과 설명이 모두 없으면 결과 없음")
    void emptyWithoutMetadata() {
        when(httpFetcher.getHead(eq(URL), anyInt())).thenReturn("<html><head></head>");

        assertThat(new MetaTagPreviewFetcher(httpFetcher, properties).fetch(URL)).isEmpty();
    }

    @Test
    @DisplayName("전체 문서 단계는 meta 설명이 없으면 본문 첫 문단을 쓴다")
    void fullPageFallsBackToBody() {
        when(httpFetcher.get(eq(URL), anyMap(), isNull())).thenReturn("""
                <html><head><title>Story</title></head><body>
                <h1>Story headline</h1>
                <p>Short.</p>
                <p>This paragraph is long enough to serve as the description of the page.</p>
                <img src="pic.png">
                </body></html>
                """);

        Optional<Preview> preview = new FullPagePreviewFetcher(httpFetcher, properties).fetch(URL);

        assertThat(preview).isPresent();
        assertThat(preview.get().getTitle()).isEqualTo("Story");
        assertThat(preview.get().getDescription()).startsWith("This paragraph is long enough");
        assertThat(preview.get().getImageUrl()).isEqualTo("https://news.example/2024/pic.png");
    }
}
