package com.newsaggregator.collector.dto;

/**
 * 한 사이클에서 소스 하나의 처리 결과
 */
public enum SourceStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    SKIPPED_INVALID,
    NOT_DUE
}
