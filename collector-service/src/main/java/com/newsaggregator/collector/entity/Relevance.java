package com.newsaggregator.collector.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Relevance {
    UNCLASSIFIED("unclassified"),
    FAVORITE("favorite"),
    SPAM("spam"),
    NEUTRAL("neutral");

    private final String value;

    Relevance(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Relevance fromValue(String value) {
        for (Relevance relevance : Relevance.values()) {
            if (relevance.value.equalsIgnoreCase(value)) {
                return relevance;
            }
        }
        throw new IllegalArgumentException("Unknown relevance: " + value);
    }
}
