package com.newsaggregator.collector.dto;

import java.time.Instant;
import java.util.List;

/**
 * 수집 사이클 하나의 결과 요약.
 *
 * newArticles와 spam은 이번 사이클에 저장된 기사 수를 나눈 값이다 (스팸도 저장은 된다).
 */
public record CycleReport(
        String cycleId,
        Instant startedAt,
        Instant finishedAt,
        List<SourceCycleResult> sources,
        int totalCandidates,
        int newArticles,
        int duplicates,
        int spam,
        List<CommitFailure> commitFailures
) {
    public CycleReport {
        sources = sources == null ? List.of() : List.copyOf(sources);
        commitFailures = commitFailures == null ? List.of() : List.copyOf(commitFailures);
    }

    public SourceCycleResult resultFor(String sourceId) {
        return sources.stream()
                .filter(result -> result.sourceId().equals(sourceId))
                .findFirst()
                .orElse(null);
    }
}
