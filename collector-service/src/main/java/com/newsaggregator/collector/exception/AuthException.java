package com.newsaggregator.collector.exception;

/**
 * 인증/인가 실패 (HTTP 401/403). 운영자 확인이 필요한 상태로 소스에 기록된다.
 */
public class AuthException extends CollectorException {

    private final int status;

    public AuthException(String message, String sourceId, int status) {
        super("AUTH_ERROR", message, sourceId);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public static AuthException rejected(String sourceId, String url, int status) {
        return new AuthException("Credentials rejected by " + url + " (HTTP " + status + ")", sourceId, status);
    }
}
