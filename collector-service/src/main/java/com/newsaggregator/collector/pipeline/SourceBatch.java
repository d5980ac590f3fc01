package com.newsaggregator.collector.pipeline;

import com.newsaggregator.collector.dto.FailureKind;
import com.newsaggregator.collector.dto.SourceStatus;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.exception.AuthException;
import com.newsaggregator.collector.exception.SourceTimeoutException;
import com.newsaggregator.collector.exception.TransientSourceException;

import java.time.Duration;
import java.util.List;

/**
 * 소스 작업 하나의 결과. 실패하거나 시간 초과된 소스의 후보 목록은 항상 비어 있다.
 */
record SourceBatch(
        Source source,
        SourceStatus status,
        FailureKind failureKind,
        String error,
        List<Article> articles,
        int scraped,
        int malformed,
        long durationMs
) {

    static SourceBatch succeeded(Source source, List<Article> articles, int scraped, int malformed, long durationMs) {
        return new SourceBatch(source, SourceStatus.SUCCEEDED, null, null, List.copyOf(articles), scraped, malformed, durationMs);
    }

    static SourceBatch timedOut(Source source, Duration timeout) {
        return new SourceBatch(source, SourceStatus.TIMED_OUT, FailureKind.TIMEOUT,
                new SourceTimeoutException(source.getId(), timeout).getMessage(), List.of(), 0, 0, timeout.toMillis());
    }

    static SourceBatch failed(Source source, Throwable error, long durationMs) {
        FailureKind kind;
        SourceStatus status = SourceStatus.FAILED;
        if (error instanceof SourceTimeoutException) {
            kind = FailureKind.TIMEOUT;
            status = SourceStatus.TIMED_OUT;
        } else if (error instanceof AuthException) {
            kind = FailureKind.AUTH;
        } else if (error instanceof TransientSourceException) {
            kind = FailureKind.TRANSIENT;
        } else {
            kind = FailureKind.INTERNAL;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new SourceBatch(source, status, kind, message, List.of(), 0, 0, durationMs);
    }

    boolean isSuccess() {
        return status == SourceStatus.SUCCEEDED;
    }
}
