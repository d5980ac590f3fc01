package com.newsaggregator.collector.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of content sources.
 *
 * - CHANNEL: public chat channel (web preview of a broadcast channel)
 * - FEED: RSS/Atom syndication feed (Rome library)
 * - PAGE: arbitrary web page scraped with CSS selectors (Jsoup)
 * - PROFILE: social profile timeline exposed as JSON
 */
public enum SourceKind {
    CHANNEL("channel"),
    FEED("feed"),
    PAGE("page"),
    PROFILE("profile");

    private final String value;

    SourceKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SourceKind fromValue(String value) {
        for (SourceKind kind : SourceKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + value);
    }
}
