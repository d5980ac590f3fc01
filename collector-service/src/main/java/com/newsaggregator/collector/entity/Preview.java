package com.newsaggregator.collector.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 링크 미리보기. URL 자체가 식별자이며 기사에서는 URL로만 참조한다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Preview {

    private String url;

    private PreviewTier tier;

    private String title;

    private String description;

    private String imageUrl;

    private String siteName;

    private String embedHtml;

    private Instant fetchedAt;

    private long ttlSeconds;

    public static Preview empty(String url, Instant now, Duration ttl) {
        return Preview.builder()
                .url(url)
                .tier(PreviewTier.NONE)
                .fetchedAt(now)
                .ttlSeconds(ttl.getSeconds())
                .build();
    }

    public boolean isExpired(Instant now) {
        return fetchedAt == null || !fetchedAt.plusSeconds(ttlSeconds).isAfter(now);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tier == null || tier == PreviewTier.NONE;
    }
}
