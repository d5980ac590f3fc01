package com.newsaggregator.collector.dto;

public record CommitFailure(
        String articleId,
        String sourceId,
        String error
) {}
