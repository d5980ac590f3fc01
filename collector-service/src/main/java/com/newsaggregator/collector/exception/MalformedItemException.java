package com.newsaggregator.collector.exception;

/**
 * 원시 항목 하나를 Article로 변환할 수 없을 때. 해당 항목만 버려진다.
 */
public class MalformedItemException extends CollectorException {

    public MalformedItemException(String message, String sourceId) {
        super("MALFORMED_ITEM", message, sourceId);
    }

    public MalformedItemException(String message, String sourceId, Throwable cause) {
        super("MALFORMED_ITEM", message, sourceId, cause);
    }

    public static MalformedItemException missingContent(String sourceId, String itemKey) {
        return new MalformedItemException("Item " + itemKey + " has neither title nor body", sourceId);
    }

    public static MalformedItemException missingKey(String sourceId) {
        return new MalformedItemException("Item has no native identifier", sourceId);
    }
}
