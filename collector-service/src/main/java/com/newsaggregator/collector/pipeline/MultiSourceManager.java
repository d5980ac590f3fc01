package com.newsaggregator.collector.pipeline;

import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.dedup.DuplicateDetector;
import com.newsaggregator.collector.dedup.DuplicateIndex;
import com.newsaggregator.collector.dedup.DuplicateVerdict;
import com.newsaggregator.collector.dto.CommitFailure;
import com.newsaggregator.collector.dto.CycleReport;
import com.newsaggregator.collector.dto.FailureKind;
import com.newsaggregator.collector.dto.SourceCycleResult;
import com.newsaggregator.collector.dto.SourceStatus;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.exception.CollectorException;
import com.newsaggregator.collector.exception.MalformedItemException;
import com.newsaggregator.collector.exception.ResourceNotFoundException;
import com.newsaggregator.collector.exception.TransientSourceException;
import com.newsaggregator.collector.preview.LinkPreviewResolver;
import com.newsaggregator.collector.repository.ArticleRepository;
import com.newsaggregator.collector.scraper.ScraperAdapter;
import com.newsaggregator.collector.scraper.ScraperRegistry;
import com.newsaggregator.collector.service.SourceService;
import com.newsaggregator.collector.spam.SpamClassifier;
import com.newsaggregator.collector.spam.SpamVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 다중 소스 수집 사이클 오케스트레이터.
 *
 * 활성 소스를 검증한 뒤 고정 크기 작업자 풀에서 병렬로 수집하고, 도착 순서대로
 * 중복 제거 → 스팸 분류 → 링크 미리보기 → 저장을 수행한다.
 * 소스 하나의 실패나 시간 초과는 그 소스에만 영향을 준다. 사이클은 겹쳐 실행되지 않는다.
 */
@Service
@Slf4j
public class MultiSourceManager {

    private final SourceService sourceService;
    private final ArticleRepository articleRepository;
    private final ScraperRegistry scraperRegistry;
    private final DuplicateDetector duplicateDetector;
    private final SpamClassifier spamClassifier;
    private final LinkPreviewResolver previewResolver;
    private final AsyncTaskExecutor scrapeExecutor;
    private final TaskScheduler watchdogScheduler;
    private final Clock clock;
    private final CollectorProperties properties;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    public MultiSourceManager(SourceService sourceService,
                              ArticleRepository articleRepository,
                              ScraperRegistry scraperRegistry,
                              DuplicateDetector duplicateDetector,
                              SpamClassifier spamClassifier,
                              LinkPreviewResolver previewResolver,
                              @Qualifier("scrapeExecutor") AsyncTaskExecutor scrapeExecutor,
                              @Qualifier("watchdogScheduler") TaskScheduler watchdogScheduler,
                              Clock clock,
                              CollectorProperties properties) {
        this.sourceService = sourceService;
        this.articleRepository = articleRepository;
        this.scraperRegistry = scraperRegistry;
        this.duplicateDetector = duplicateDetector;
        this.spamClassifier = spamClassifier;
        this.previewResolver = previewResolver;
        this.scrapeExecutor = scrapeExecutor;
        this.watchdogScheduler = watchdogScheduler;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * 수집 사이클 1회 실행. 이미 실행 중인 사이클이 있으면 끝날 때까지 기다린 뒤 실행한다.
     */
    public CycleReport runCycle() {
        cycleLock.lock();
        try {
            CycleReport report = doRunCycle();
            lastReport.set(report);
            return report;
        } finally {
            cycleLock.unlock();
        }
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    private CycleReport doRunCycle() {
        String cycleId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        CollectorProperties.Pipeline pipeline = properties.getPipeline();

        List<Source> sources = sourceService.findEnabled();
        log.info("Starting collection cycle {} with {} enabled sources", cycleId, sources.size());

        // 저장소가 손상되어 읽을 수 없으면 수집 전에 실패한다
        DuplicateIndex index = duplicateDetector.buildIndex(articleRepository.findAll(), startedAt);

        Map<String, Tally> tallies = new LinkedHashMap<>();
        Queue<SourceBatch> arrivals = new ConcurrentLinkedQueue<>();
        List<SourceTask> tasks = new ArrayList<>();
        List<CompletableFuture<SourceBatch>> arrived = new ArrayList<>();

        for (Source source : sources) {
            Tally tally = new Tally(source);
            tallies.put(source.getId(), tally);

            if (pipeline.isHonorUpdateInterval() && !source.isDue(startedAt)) {
                tally.status = SourceStatus.NOT_DUE;
                continue;
            }

            Optional<String> problem = scraperRegistry.validate(source);
            if (problem.isPresent()) {
                tally.status = SourceStatus.SKIPPED_INVALID;
                tally.failureKind = FailureKind.INVALID_CONFIG;
                tally.error = problem.get();
                updateStatus(() -> sourceService.flagInvalid(source.getId(), tally.error));
                continue;
            }
            if (!Boolean.TRUE.equals(source.getValidationStatus())) {
                updateStatus(() -> sourceService.markValid(source.getId()));
            }

            SourceTask task = dispatch(source, scraperRegistry.adapterFor(source.getKind()));
            tasks.add(task);
            arrived.add(task.result.thenApply(batch -> {
                arrivals.add(batch);
                return batch;
            }));
        }

        awaitAll(tasks, arrived);

        // 도착 순서대로 후보 평가
        List<Article> survivors = new ArrayList<>();
        int totalCandidates = 0;
        for (SourceBatch batch : arrivals) {
            Tally tally = tallies.get(batch.source().getId());
            tally.record(batch);
            for (Article candidate : batch.articles()) {
                totalCandidates++;
                DuplicateVerdict verdict = duplicateDetector.classify(candidate, index);
                if (verdict.duplicate()) {
                    tally.duplicates++;
                    log.debug("Duplicate from {}: '{}' matches {} ({}, {})", batch.source().getId(),
                            candidate.getTitle(), verdict.existingId(), verdict.matchType(),
                            String.format("%.2f", verdict.similarity()));
                    continue;
                }
                SpamVerdict spam = spamClassifier.apply(candidate, batch.source());
                if (spam.isSpam()) {
                    tally.spam++;
                }
                duplicateDetector.register(candidate, index, startedAt);
                survivors.add(candidate);
            }
        }

        attachPreviews(survivors, pipeline.getPreviewTimeout());

        List<CommitFailure> commitFailures = new ArrayList<>();
        List<Article> committed = commit(survivors, commitFailures);
        int newArticles = 0;
        int spamArticles = 0;
        for (Article article : committed) {
            tallies.get(article.getSourceId()).committed++;
            if (article.getRelevance() == Relevance.SPAM) {
                spamArticles++;
            } else {
                newArticles++;
            }
        }

        for (Tally tally : tallies.values()) {
            recordSourceStatus(tally, startedAt);
        }

        int duplicates = tallies.values().stream().mapToInt(tally -> tally.duplicates).sum();
        CycleReport report = new CycleReport(
                cycleId,
                startedAt,
                clock.instant(),
                tallies.values().stream().map(Tally::toResult).collect(Collectors.toList()),
                totalCandidates,
                newArticles,
                duplicates,
                spamArticles,
                commitFailures);

        log.info("Cycle {} finished: candidates={}, new={}, duplicates={}, spam={}, commitFailures={}",
                cycleId, totalCandidates, newArticles, duplicates, spamArticles, commitFailures.size());
        return report;
    }

    /**
     * 살아남은 기사를 한 번에 저장한다. 일괄 쓰기가 실패하면 기사별로 다시 저장해
     * 실패한 기사만 CommitFailure로 남긴다.
     */
    private List<Article> commit(List<Article> survivors, List<CommitFailure> failures) {
        if (survivors.isEmpty()) {
            return List.of();
        }
        try {
            articleRepository.saveAll(survivors);
            return survivors;
        } catch (CollectorException e) {
            log.warn("Batch commit of {} articles failed ({}), committing one by one", survivors.size(), e.getMessage());
        }

        List<Article> committed = new ArrayList<>();
        for (Article article : survivors) {
            try {
                articleRepository.save(article);
                committed.add(article);
            } catch (CollectorException e) {
                log.error("Failed to commit article {} from {}: {}", article.getId(), article.getSourceId(), e.getMessage());
                failures.add(new CommitFailure(article.getId(), article.getSourceId(), e.getMessage()));
            }
        }
        return committed;
    }

    /**
     * 소스 하나를 저장 없이 수집해 본다. 상태 기록, 중복 등록, 저장은 하지 않으며
     * 실행 중인 사이클과 동시에 호출될 수 있다.
     */
    public SourceTestRun testSource(String sourceId) {
        Source source = sourceService.findById(sourceId)
                .orElseThrow(() -> ResourceNotFoundException.source(sourceId));
        Optional<String> problem = scraperRegistry.validate(source);
        if (problem.isPresent()) {
            return new SourceTestRun(sourceId, SourceStatus.SKIPPED_INVALID, FailureKind.INVALID_CONFIG,
                    problem.get(), 0, 0, 0, 0, 0, List.of());
        }

        log.info("Test run for source {}", sourceId);
        SourceTask task = dispatch(source, scraperRegistry.adapterFor(source.getKind()));
        awaitAll(List.of(task), List.of(task.result));
        SourceBatch batch = task.result.join();

        Instant now = clock.instant();
        DuplicateIndex index = duplicateDetector.buildIndex(articleRepository.findAll(), now);
        int duplicates = 0;
        int spam = 0;
        for (Article candidate : batch.articles()) {
            if (duplicateDetector.classify(candidate, index).duplicate()) {
                duplicates++;
                continue;
            }
            if (spamClassifier.apply(candidate, source).isSpam()) {
                spam++;
            }
            duplicateDetector.register(candidate, index, now);
        }
        return new SourceTestRun(sourceId, batch.status(), batch.failureKind(), batch.error(), batch.scraped(),
                batch.malformed(), duplicates, spam, batch.durationMs(), batch.articles());
    }

    /**
     * 소스 하나를 작업자 풀에 제출한다. 결과 future는 예외로 완료되지 않는다.
     * 타임아웃은 작업이 실제로 시작될 때부터 잰다.
     */
    private SourceTask dispatch(Source source, ScraperAdapter<?> adapter) {
        Duration timeout = properties.getPipeline().getSourceTimeout();
        SourceTask task = new SourceTask(source);

        try {
            task.future.set(scrapeExecutor.submit(() -> {
                long start = System.nanoTime();
                ScheduledFuture<?> watchdog = watchdogScheduler.schedule(() -> {
                    if (task.timeOut(timeout)) {
                        log.warn("Source {} timed out after {}ms, cancelling", source.getId(), timeout.toMillis());
                    }
                }, watchdogScheduler.getClock().instant().plus(timeout));
                try {
                    task.result.complete(collect(source, adapter, start));
                } catch (RuntimeException e) {
                    if (!task.result.isDone()) {
                        log.warn("Source {} failed: {}", source.getId(), e.getMessage());
                    }
                    task.result.complete(SourceBatch.failed(source, e, elapsedMs(start)));
                } finally {
                    watchdog.cancel(false);
                }
            }));
        } catch (RejectedExecutionException e) {
            task.result.complete(SourceBatch.failed(source, e, 0));
        }
        return task;
    }

    /**
     * 제출한 작업을 기다리되 전체 대기 시간을 제한한다. 인터럽트를 무시하는 작업이 작업자를
     * 모두 붙잡고 있어도 사이클은 끝난다. 기한 안에 끝나지 않은 작업은 대기열에 남은 것까지
     * 시간 초과로 처리된다.
     */
    private void awaitAll(List<SourceTask> tasks, List<? extends CompletableFuture<?>> completions) {
        if (tasks.isEmpty()) {
            return;
        }
        Duration budget = waitBudget(tasks.size());
        CompletableFuture.allOf(completions.toArray(new CompletableFuture<?>[0]))
                .completeOnTimeout(null, budget.toMillis(), TimeUnit.MILLISECONDS)
                .join();

        Duration timeout = properties.getPipeline().getSourceTimeout();
        for (SourceTask task : tasks) {
            if (task.timeOut(timeout)) {
                log.warn("Source {} did not finish within the {}ms wait budget, abandoning it",
                        task.source.getId(), budget.toMillis());
            }
        }
    }

    /**
     * 작업자 수만큼씩 순서대로 실행된다고 보고 (대기 회차 + 1) × 소스 타임아웃
     */
    Duration waitBudget(int taskCount) {
        int workers = Math.max(1, properties.getPipeline().getWorkerPoolSize());
        long waves = (taskCount + workers - 1) / workers;
        return properties.getPipeline().getSourceTimeout().multipliedBy(waves + 1);
    }

    private <R> SourceBatch collect(Source source, ScraperAdapter<R> adapter, long start) {
        List<R> raw = adapter.scrape(source);
        int limit = Math.min(raw.size(), source.getMaxItemsPerCycle());

        List<Article> articles = new ArrayList<>(limit);
        int malformed = 0;
        for (R item : raw.subList(0, limit)) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TransientSourceException("Interrupted while normalizing items", source.getId());
            }
            try {
                articles.add(adapter.normalize(source, item));
            } catch (MalformedItemException e) {
                malformed++;
                log.debug("Dropped malformed item from {}: {}", source.getId(), e.getMessage());
            } catch (RuntimeException e) {
                malformed++;
                log.warn("Unexpected error normalizing item from {}: {}", source.getId(), e.getMessage(), e);
            }
        }
        log.info("Source {} produced {} candidates ({} malformed)", source.getId(), articles.size(), malformed);
        return SourceBatch.succeeded(source, articles, raw.size(), malformed, elapsedMs(start));
    }

    /**
     * 기사별로 병렬 조회하되 기사 하나당 previewTimeout을 넘기면 미리보기 없이 진행한다.
     */
    private void attachPreviews(List<Article> articles, Duration previewTimeout) {
        Map<Article, CompletableFuture<List<Preview>>> pending = new LinkedHashMap<>();
        for (Article article : articles) {
            if (article.getLinks() == null || article.getLinks().isEmpty()) {
                continue;
            }
            pending.put(article, previewResolver.resolveAll(article.getLinks())
                    .completeOnTimeout(List.of(), previewTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.debug("Preview resolution failed for article {}: {}", article.getId(), e.getMessage());
                        return List.of();
                    }));
        }
        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0])).join();

        pending.forEach((article, future) -> article.setPreviewRefs(future.join().stream()
                .filter(preview -> !preview.isEmpty())
                .map(Preview::getUrl)
                .collect(Collectors.toList())));
    }

    private void recordSourceStatus(Tally tally, Instant attemptedAt) {
        String id = tally.source.getId();
        switch (tally.status) {
            case SUCCEEDED -> updateStatus(() -> sourceService.recordSuccess(id, attemptedAt));
            case FAILED, TIMED_OUT -> updateStatus(() -> sourceService.recordFailure(id, tally.failureKind, tally.error, attemptedAt));
            case SKIPPED_INVALID, NOT_DUE -> {
                // 이미 반영됨
            }
        }
    }

    private void updateStatus(Runnable update) {
        try {
            update.run();
        } catch (CollectorException e) {
            log.warn("Could not update source status: {}", e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * 제출된 소스 작업. result는 성공, 실패, 시간 초과 중 먼저 일어난 것으로 한 번만 완료된다.
     */
    private static final class SourceTask {
        private final Source source;
        private final CompletableFuture<SourceBatch> result = new CompletableFuture<>();
        private final AtomicReference<Future<?>> future = new AtomicReference<>();

        private SourceTask(Source source) {
            this.source = source;
        }

        /**
         * 아직 끝나지 않았으면 시간 초과로 완료하고 작업을 취소한다 (대기 중이면 실행되지 않는다).
         */
        private boolean timeOut(Duration timeout) {
            if (!result.complete(SourceBatch.timedOut(source, timeout))) {
                return false;
            }
            Future<?> running = future.get();
            if (running != null) {
                running.cancel(true);
            }
            return true;
        }
    }

    /**
     * 사이클 동안의 소스별 집계. 사이클 스레드에서만 변경된다.
     */
    private static final class Tally {
        private final Source source;
        private SourceStatus status;
        private FailureKind failureKind;
        private String error;
        private int scraped;
        private int malformed;
        private int duplicates;
        private int spam;
        private int committed;
        private long durationMs;

        private Tally(Source source) {
            this.source = source;
        }

        private void record(SourceBatch batch) {
            status = batch.status();
            failureKind = batch.failureKind();
            error = batch.error();
            scraped = batch.scraped();
            malformed = batch.malformed();
            durationMs = batch.durationMs();
        }

        private SourceCycleResult toResult() {
            return new SourceCycleResult(source.getId(), source.getName(), source.getKind(), status, failureKind,
                    error, scraped, malformed, duplicates, spam, committed, durationMs);
        }
    }
}
