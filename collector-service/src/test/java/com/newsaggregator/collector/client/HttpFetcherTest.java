package com.newsaggregator.collector.client;

import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.exception.AuthException;
import com.newsaggregator.collector.exception.TransientSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HttpFetcher 테스트 (네트워크 대신 ExchangeFunction으로 응답을 만든다)
 */
class HttpFetcherTest {

    private static final String URL = "https://news.example/rss";

    private static HttpFetcher fetcher(ExchangeFunction exchange) {
        return new HttpFetcher(WebClient.builder().exchangeFunction(exchange).build(), new CollectorProperties());
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "text/plain")
                .body(body)
                .build());
    }

    @Test
    @DisplayName("본문을 문자열로 반환하고 소스 헤더를 전달한다")
    void returnsBodyWithHeaders() {
        // given
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        HttpFetcher fetcher = fetcher(request -> {
            captured.set(request);
            return respond(HttpStatus.OK, "<rss/>").exchange(request);
        });

        // when
        String body = fetcher.get(URL, Map.of("X-Api-Key", "abc"), "feed-a");

        // then
        assertThat(body).isEqualTo("<rss/>");
        assertThat(captured.get().headers().getFirst("X-Api-Key")).isEqualTo("abc");
    }

    @Test
    @DisplayName("401/403은 인증 실패")
    void authFailure() {
        assertThatThrownBy(() -> fetcher(respond(HttpStatus.FORBIDDEN, "denied")).get(URL, Map.of(), "feed-a"))
                .isInstanceOf(AuthException.class)
                .satisfies(e -> assertThat(((AuthException) e).getStatus()).isEqualTo(403))
                .satisfies(e -> assertThat(((AuthException) e).getSourceId()).isEqualTo("feed-a"));
    }

    @Test
    @DisplayName("그 밖의 HTTP 오류는 일시적 오류")
    void serverErrorIsTransient() {
        assertThatThrownBy(() -> fetcher(respond(HttpStatus.SERVICE_UNAVAILABLE, "busy")).get(URL, Map.of(), "feed-a"))
                .isInstanceOf(TransientSourceException.class)
                .hasMessageContaining("HTTP 503");
    }

    @Test
    @DisplayName("연결 실패도 일시적 오류")
    void networkErrorIsTransient() {
        HttpFetcher fetcher = fetcher(request -> Mono.error(new IOException("connection refused")));

        assertThatThrownBy(() -> fetcher.get(URL, Map.of(), "feed-a"))
                .isInstanceOf(TransientSourceException.class)
                .isNotInstanceOf(AuthException.class);
    }

    @Test
    @DisplayName("head 요청은 최대 바이트 수에서 자른다")
    void headTruncated() {
        HttpFetcher fetcher = fetcher(respond(HttpStatus.OK, "<html><head><title>abcdefghij</title>"));

        assertThat(fetcher.getHead(URL, 12)).isEqualTo("<html><head>");
    }

    @Nested
    @DisplayName("</head> 감지")
    class HeadEnd {

        private DataBuffer buffer(String text) {
            return DefaultDataBufferFactory.sharedInstance.wrap(text.getBytes(StandardCharsets.UTF_8));
        }

        private ExchangeFunction respondInChunks(AtomicInteger emitted, String... chunks) {
            return request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, "text/html")
                    .body(Flux.fromArray(chunks).doOnNext(chunk -> emitted.incrementAndGet()).map(this::buffer))
                    .build());
        }

        @Test
        @DisplayName("두 청크에 걸쳐 잘린 태그도 찾아서 그 뒤 청크는 읽지 않는다")
        void tagSplitAcrossChunks() {
            // given
            AtomicInteger emitted = new AtomicInteger();
            HttpFetcher fetcher = fetcher(respondInChunks(emitted,
                    "<html><head><title>T</title></he",
                    "ad><body>",
                    "<p>article text that should never be read</p>"));

            // when
            String head = fetcher.getHead(URL, 64 * 1024);

            // then
            assertThat(head).isEqualTo("<html><head><title>T</title></head><body>");
            assertThat(emitted.get()).isGreaterThanOrEqualTo(2);
        }

        @Test
        @DisplayName("한 글자씩 들어와도 찾는다")
        void tagDeliveredByteByByte() {
            HttpFetcher.HeadEndScanner scanner = new HttpFetcher.HeadEndScanner();
            String stream = "<head><meta charset=utf-8></HEAD>";

            int matchedAt = -1;
            for (int i = 0; i < stream.length(); i++) {
                if (scanner.accept(new byte[]{(byte) stream.charAt(i)})) {
                    matchedAt = i;
                    break;
                }
            }

            assertThat(matchedAt).isEqualTo(stream.length() - 1);
        }

        @Test
        @DisplayName("태그가 없으면 끝까지 읽는다")
        void noTag() {
            HttpFetcher.HeadEndScanner scanner = new HttpFetcher.HeadEndScanner();

            assertThat(scanner.accept("<html><he".getBytes(StandardCharsets.UTF_8))).isFalse();
            assertThat(scanner.accept("ader>not a head end</h".getBytes(StandardCharsets.UTF_8))).isFalse();
            assertThat(scanner.accept("ead".getBytes(StandardCharsets.UTF_8))).isFalse();
        }
    }
}
