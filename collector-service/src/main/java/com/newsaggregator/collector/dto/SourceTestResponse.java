package com.newsaggregator.collector.dto;

import java.util.List;

/**
 * POST /api/v1/sources/{id}/test 응답. 저장소는 변경되지 않는다.
 */
public record SourceTestResponse(
        String sourceId,
        SourceStatus status,
        FailureKind failureKind,
        String error,
        int scraped,
        int malformed,
        int duplicates,
        int spam,
        long durationMs,
        List<ArticleDTO> samples
) {}
