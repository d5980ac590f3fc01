package com.newsaggregator.collector.exception;

public class ResourceConflictException extends CollectorException {

    public ResourceConflictException(String message) {
        super("CONFLICT", message, null);
    }

    public static ResourceConflictException sourceExists(String id, String name) {
        return new ResourceConflictException("Source already exists: id=" + id + ", name=" + name);
    }
}
