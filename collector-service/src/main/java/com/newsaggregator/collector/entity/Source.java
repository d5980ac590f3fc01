package com.newsaggregator.collector.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 수집 대상 소스. 설정(시드) 또는 관리 API로 생성되며 암묵적으로 삭제되지 않는다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Source {

    private String id;

    private String name;

    private SourceKind kind;

    /**
     * 종류별 설정 (endpoint, selector, 자격 증명 등). 값은 해석하지 않고 그대로 전달된다.
     */
    @Builder.Default
    private Map<String, String> config = new HashMap<>();

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private int updateIntervalMinutes = 60;

    @Builder.Default
    private int maxItemsPerCycle = 50;

    /**
     * 0.0 ~ 1.0, 스팸 점수 가중치
     */
    @Builder.Default
    private double trust = 0.5;

    private Instant createdAt;

    private Instant lastAttemptAt;

    private Instant lastSuccessAt;

    private String lastError;

    private String lastErrorKind;

    private int consecutiveFailures;

    /**
     * null = 아직 검증되지 않음
     */
    private Boolean validationStatus;

    private String validationError;

    /**
     * id가 주어지지 않은 소스의 기본 id: "{kind}-{slug(name)}"
     */
    public static String defaultId(SourceKind kind, String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return kind.getValue() + "-" + slug;
    }

    public String config(String key) {
        return config == null ? null : config.get(key);
    }

    public String config(String key, String defaultValue) {
        String value = config(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    /**
     * "header."로 시작하는 설정 키를 HTTP 헤더로 변환
     */
    public Map<String, String> headers() {
        Map<String, String> headers = new HashMap<>();
        if (config == null) {
            return headers;
        }
        config.forEach((key, value) -> {
            if (key.startsWith("header.") && value != null) {
                headers.put(key.substring("header.".length()), value);
            }
        });
        return headers;
    }

    public boolean isDue(Instant now) {
        return lastSuccessAt == null
                || !lastSuccessAt.plusSeconds(updateIntervalMinutes * 60L).isAfter(now);
    }
}
