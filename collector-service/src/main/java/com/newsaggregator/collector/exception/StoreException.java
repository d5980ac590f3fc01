package com.newsaggregator.collector.exception;

public class StoreException extends CollectorException {

    private final String collection;

    public StoreException(String collection, String message, Throwable cause) {
        super("STORE_ERROR", message, null, cause);
        this.collection = collection;
    }

    protected StoreException(String errorCode, String collection, String message, Throwable cause) {
        super(errorCode, message, null, cause);
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }

    public static StoreException writeFailed(String collection, Throwable cause) {
        return new StoreException(collection, "Failed to persist collection '" + collection + "': " + cause.getMessage(), cause);
    }

    public static StoreException serialization(String collection, Throwable cause) {
        return new StoreException(collection, "Failed to convert record of '" + collection + "': " + cause.getMessage(), cause);
    }
}
