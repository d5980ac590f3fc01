package com.newsaggregator.collector.dto;

public enum FailureKind {
    TRANSIENT,
    AUTH,
    TIMEOUT,
    INVALID_CONFIG,
    INTERNAL
}
