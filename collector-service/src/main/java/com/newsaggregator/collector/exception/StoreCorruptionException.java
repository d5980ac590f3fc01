package com.newsaggregator.collector.exception;

/**
 * 컬렉션 파일이 손상되었고 복구 가능한 백업도 없을 때 발생.
 */
public class StoreCorruptionException extends StoreException {

    public StoreCorruptionException(String collection, String message, Throwable cause) {
        super("STORE_CORRUPTION", collection, message, cause);
    }
}
