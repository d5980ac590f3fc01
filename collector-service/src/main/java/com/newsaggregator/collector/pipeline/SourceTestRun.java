package com.newsaggregator.collector.pipeline;

import com.newsaggregator.collector.dto.FailureKind;
import com.newsaggregator.collector.dto.SourceStatus;
import com.newsaggregator.collector.entity.Article;

import java.util.List;

/**
 * 저장 없이 소스 하나를 수집해 본 결과.
 * candidates는 정규화된 후보 전체이고, duplicates/spam은 실제 사이클이었다면 걸러졌을 건수다.
 */
public record SourceTestRun(
        String sourceId,
        SourceStatus status,
        FailureKind failureKind,
        String error,
        int scraped,
        int malformed,
        int duplicates,
        int spam,
        long durationMs,
        List<Article> candidates
) {

    public SourceTestRun {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
