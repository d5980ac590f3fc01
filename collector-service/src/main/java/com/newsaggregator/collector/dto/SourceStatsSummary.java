package com.newsaggregator.collector.dto;

import java.util.List;

public record SourceStatsSummary(
        long totalSources,
        long activeSources,
        long failingSources,
        long invalidSources,
        long totalArticles,
        List<SourceStatsDTO> sources
) {}
