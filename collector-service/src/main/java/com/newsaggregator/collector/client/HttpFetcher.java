package com.newsaggregator.collector.client;

import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.exception.AuthException;
import com.newsaggregator.collector.exception.TransientSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 모든 아웃바운드 HTTP 요청의 단일 진입점.
 *
 * 호출 스레드를 블로킹하며 (수집 작업자 스레드에서 호출됨),
 * 실패는 401/403이면 {@link AuthException}, 그 밖에는 {@link TransientSourceException}으로 변환한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpFetcher {

    private final WebClient webClient;
    private final CollectorProperties properties;

    public String get(String url, Map<String, String> headers, String sourceId) {
        URI uri = toUri(url, sourceId);
        try {
            return webClient.get()
                    .uri(uri)
                    .headers(h -> headers.forEach(h::set))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(requestTimeout())
                    .blockOptional()
                    .orElse("");
        } catch (Exception e) {
            throw translate(e, url, sourceId);
        }
    }

    /**
     * 문서 앞부분만 읽는다. maxBytes에 도달하거나 &lt;/head&gt;가 보이면 연결을 끊는다.
     */
    public String getHead(String url, int maxBytes) {
        URI uri = toUri(url, null);
        AtomicInteger total = new AtomicInteger();
        HeadEndScanner headEnd = new HeadEndScanner();
        try {
            List<byte[]> chunks = webClient.get()
                    .uri(uri)
                    .header("Range", "bytes=0-" + (maxBytes - 1))
                    .retrieve()
                    .bodyToFlux(DataBuffer.class)
                    .map(HttpFetcher::drain)
                    .takeUntil(chunk -> total.addAndGet(chunk.length) >= maxBytes || headEnd.accept(chunk))
                    .collectList()
                    .timeout(requestTimeout())
                    .block();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (chunks != null) {
                for (byte[] chunk : chunks) {
                    out.write(chunk, 0, Math.min(chunk.length, maxBytes - out.size()));
                    if (out.size() >= maxBytes) break;
                }
            }
            return out.toString(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw translate(e, url, null);
        }
    }

    /**
     * 청크 단위로 &lt;/head&gt;를 찾는다. 태그가 두 청크에 걸쳐 잘려도 놓치지 않도록
     * 앞 청크의 끝 몇 바이트를 이어 붙여 검사한다. 대소문자는 구분하지 않는다.
     */
    static final class HeadEndScanner {

        private static final byte[] TAG = "</head>".getBytes(StandardCharsets.US_ASCII);

        private byte[] carry = new byte[0];
        private boolean found;

        boolean accept(byte[] chunk) {
            if (found) {
                return true;
            }
            byte[] window = new byte[carry.length + chunk.length];
            System.arraycopy(carry, 0, window, 0, carry.length);
            System.arraycopy(chunk, 0, window, carry.length, chunk.length);
            found = indexOf(window) >= 0;

            int keep = Math.min(TAG.length - 1, window.length);
            carry = Arrays.copyOfRange(window, window.length - keep, window.length);
            return found;
        }

        private static int indexOf(byte[] window) {
            outer:
            for (int i = 0; i <= window.length - TAG.length; i++) {
                for (int j = 0; j < TAG.length; j++) {
                    if (Character.toLowerCase(window[i + j]) != TAG[j]) {
                        continue outer;
                    }
                }
                return i;
            }
            return -1;
        }
    }

    private Duration requestTimeout() {
        return Duration.ofMillis(properties.getHttp().getReadTimeout());
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static URI toUri(String url, String sourceId) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new TransientSourceException("Invalid URL: " + url, sourceId, e);
        }
    }

    private RuntimeException translate(Exception e, String url, String sourceId) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof AuthException || cause instanceof TransientSourceException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof WebClientResponseException wce) {
            int status = wce.getStatusCode().value();
            if (status == 401 || status == 403) {
                return AuthException.rejected(sourceId, url, status);
            }
            return TransientSourceException.httpStatus(sourceId, url, status);
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        log.debug("Request to {} failed: {}", url, cause.toString());
        return TransientSourceException.network(sourceId, url, cause);
    }
}
