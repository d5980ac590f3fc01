package com.newsaggregator.collector.exception;

import java.time.Duration;

public class SourceTimeoutException extends TransientSourceException {

    private final Duration timeout;

    public SourceTimeoutException(String sourceId, Duration timeout) {
        super("SOURCE_TIMEOUT", "Source did not finish within " + timeout.toMillis() + "ms", sourceId, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
