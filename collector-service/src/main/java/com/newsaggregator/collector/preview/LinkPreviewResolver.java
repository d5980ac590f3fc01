package com.newsaggregator.collector.preview;

import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.exception.StoreException;
import com.newsaggregator.collector.repository.PreviewRepository;
import com.newsaggregator.collector.util.LinkExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 링크 미리보기 조회.
 *
 * embed → meta → full fetch 순으로 시도하고 모두 실패하면 빈 미리보기(none)를 남긴다.
 * 결과는 TTL 동안 저장소에 캐시되며, 같은 URL에 대한 동시 요청은 하나의 조회로 합쳐진다.
 * 기사 하나의 링크는 최대 maxConcurrentPerArticle 건까지만 동시에 조회한다.
 */
@Service
@Slf4j
public class LinkPreviewResolver {

    private final List<PreviewFetcher> fetchers;
    private final PreviewRepository previewRepository;
    private final Executor previewExecutor;
    private final Clock clock;
    private final CollectorProperties.Preview config;

    private final ConcurrentHashMap<String, CompletableFuture<Preview>> inFlight = new ConcurrentHashMap<>();

    public LinkPreviewResolver(List<PreviewFetcher> fetchers,
                               PreviewRepository previewRepository,
                               @Qualifier("previewExecutor") Executor previewExecutor,
                               Clock clock,
                               CollectorProperties properties) {
        this.fetchers = new ArrayList<>(fetchers);
        this.fetchers.sort(Comparator.comparing(fetcher -> fetcher.tier().ordinal()));
        this.previewRepository = previewRepository;
        this.previewExecutor = previewExecutor;
        this.clock = clock;
        this.config = properties.getPreview();
    }

    public Preview resolve(String url) {
        return resolveAsync(url).join();
    }

    /**
     * 캐시에 유효한 미리보기가 있으면 즉시 완료된 future를, 진행 중인 조회가 있으면 그 future를 반환한다.
     * 반환된 future는 예외로 완료되지 않는다.
     */
    public CompletableFuture<Preview> resolveAsync(String url) {
        String key = LinkExtractor.canonicalize(url);
        if (key == null) {
            return CompletableFuture.completedFuture(Preview.empty(url, clock.instant(), config.getFailureTtl()));
        }

        Optional<Preview> cached = cached(key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<Preview> created = new CompletableFuture<>();
        CompletableFuture<Preview> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("Joining in-flight preview resolution for {}", key);
            return existing;
        }

        try {
            previewExecutor.execute(() -> {
                try {
                    created.complete(load(key));
                } catch (RuntimeException e) {
                    log.warn("Preview resolution for {} failed unexpectedly: {}", key, e.getMessage(), e);
                    created.complete(Preview.empty(key, clock.instant(), config.getFailureTtl()));
                } finally {
                    inFlight.remove(key, created);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, created);
            log.warn("Preview executor rejected {}: {}", key, e.getMessage());
            created.complete(Preview.empty(key, clock.instant(), config.getFailureTtl()));
        }
        return created;
    }

    /**
     * 기사 하나의 링크 미리보기. 중복 제거 후 앞쪽 maxLinksPerArticle개만,
     * 동시에 maxConcurrentPerArticle개까지 조회한다. 결과 순서는 입력 순서를 따른다.
     */
    public CompletableFuture<List<Preview>> resolveAll(List<String> urls) {
        List<String> distinct = urls.stream()
                .map(LinkExtractor::canonicalize)
                .filter(Objects::nonNull)
                .distinct()
                .limit(config.getMaxLinksPerArticle())
                .collect(Collectors.toList());
        if (distinct.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        Preview[] results = new Preview[distinct.size()];
        AtomicInteger next = new AtomicInteger();
        int lanes = Math.min(Math.max(1, config.getMaxConcurrentPerArticle()), distinct.size());

        CompletableFuture<?>[] laneFutures = new CompletableFuture<?>[lanes];
        for (int i = 0; i < lanes; i++) {
            laneFutures[i] = runLane(distinct, results, next);
        }
        return CompletableFuture.allOf(laneFutures).thenApply(v -> Arrays.asList(results));
    }

    private CompletableFuture<Void> runLane(List<String> urls, Preview[] results, AtomicInteger next) {
        int index = next.getAndIncrement();
        if (index >= urls.size()) {
            return CompletableFuture.completedFuture(null);
        }
        return resolveAsync(urls.get(index))
                .thenAccept(preview -> results[index] = preview)
                .thenCompose(v -> runLane(urls, results, next));
    }

    private Preview load(String url) {
        // 대기 중 다른 조회가 먼저 끝나 저장했을 수 있다
        Optional<Preview> cached = cached(url);
        if (cached.isPresent()) {
            return cached.get();
        }

        for (PreviewFetcher fetcher : fetchers) {
            if (!fetcher.supports(url)) {
                continue;
            }
            try {
                Optional<Preview> preview = fetcher.fetch(url);
                if (preview.isPresent()) {
                    Preview result = preview.get().toBuilder()
                            .url(url)
                            .tier(fetcher.tier())
                            .fetchedAt(clock.instant())
                            .ttlSeconds(config.getTtl().getSeconds())
                            .build();
                    save(result);
                    log.debug("Resolved preview for {} via {}", url, fetcher.tier().getValue());
                    return result;
                }
            } catch (RuntimeException e) {
                log.debug("Preview tier {} failed for {}: {}", fetcher.tier().getValue(), url, e.getMessage());
            }
        }

        Preview empty = Preview.empty(url, clock.instant(), config.getFailureTtl());
        save(empty);
        return empty;
    }

    private Optional<Preview> cached(String url) {
        try {
            return previewRepository.findByUrl(url).filter(preview -> !preview.isExpired(clock.instant()));
        } catch (StoreException e) {
            log.warn("Preview cache unavailable for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private void save(Preview preview) {
        try {
            previewRepository.save(preview);
        } catch (StoreException e) {
            log.warn("Could not cache preview for {}: {}", preview.getUrl(), e.getMessage());
        }
    }
}
