package com.newsaggregator.collector.exception;

/**
 * 일시적인 소스 장애 (네트워크, HTTP 5xx, 파싱 불가 응답).
 * 해당 사이클에서 소스는 0건을 기여하고 다음 사이클에 재시도된다.
 */
public class TransientSourceException extends CollectorException {

    public TransientSourceException(String message, String sourceId) {
        super("TRANSIENT_SOURCE_ERROR", message, sourceId);
    }

    public TransientSourceException(String message, String sourceId, Throwable cause) {
        super("TRANSIENT_SOURCE_ERROR", message, sourceId, cause);
    }

    protected TransientSourceException(String errorCode, String message, String sourceId, Throwable cause) {
        super(errorCode, message, sourceId, cause);
    }

    public static TransientSourceException httpStatus(String sourceId, String url, int status) {
        return new TransientSourceException("HTTP " + status + " from " + url, sourceId);
    }

    public static TransientSourceException network(String sourceId, String url, Throwable cause) {
        return new TransientSourceException("Request to " + url + " failed: " + cause.getMessage(), sourceId, cause);
    }

    public static TransientSourceException unparseable(String sourceId, String what, Throwable cause) {
        String detail = cause != null ? ": " + cause.getMessage() : "";
        return new TransientSourceException("Unparseable " + what + detail, sourceId, cause);
    }
}
