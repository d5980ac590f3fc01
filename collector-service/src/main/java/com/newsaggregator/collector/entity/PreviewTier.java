package com.newsaggregator.collector.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 링크 미리보기 획득 단계. 선언 순서가 곧 시도 순서다.
 */
public enum PreviewTier {
    EMBED("embed"),
    META("meta"),
    FULL_FETCH("full_fetch"),
    NONE("none");

    private final String value;

    PreviewTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PreviewTier fromValue(String value) {
        for (PreviewTier tier : PreviewTier.values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown preview tier: " + value);
    }
}
