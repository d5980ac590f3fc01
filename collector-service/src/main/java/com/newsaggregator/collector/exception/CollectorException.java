package com.newsaggregator.collector.exception;

/**
 * 수집 파이프라인 예외 기본 클래스
 */
public class CollectorException extends RuntimeException {

    private final String errorCode;
    private final String sourceId;

    public CollectorException(String message) {
        this("COLLECTOR_ERROR", message, null, null);
    }

    public CollectorException(String message, Throwable cause) {
        this("COLLECTOR_ERROR", message, null, cause);
    }

    public CollectorException(String errorCode, String message, String sourceId) {
        this(errorCode, message, sourceId, null);
    }

    public CollectorException(String errorCode, String message, String sourceId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceId = sourceId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getSourceId() {
        return sourceId;
    }
}
