package com.newsaggregator.collector.exception;

public class ResourceNotFoundException extends CollectorException {

    public ResourceNotFoundException(String message) {
        super("NOT_FOUND", message, null);
    }

    public static ResourceNotFoundException source(String id) {
        return new ResourceNotFoundException("Source not found: " + id);
    }

    public static ResourceNotFoundException article(String id) {
        return new ResourceNotFoundException("Article not found: " + id);
    }
}
