package com.newsaggregator.collector.dto;

import com.newsaggregator.collector.entity.SourceKind;

public record SourceCycleResult(
        String sourceId,
        String name,
        SourceKind kind,
        SourceStatus status,
        FailureKind failureKind,
        String error,
        int scraped,
        int malformed,
        int duplicates,
        int spam,
        int committed,
        long durationMs
) {}
