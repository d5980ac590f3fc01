package com.newsaggregator.collector.dto;

import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceStatsDTO {
    private String sourceId;
    private String name;
    private SourceKind kind;
    private boolean enabled;
    private long totalArticles;
    private Map<Relevance, Long> articlesByRelevance;
    private Instant lastArticleAt;
    private Instant lastAttemptAt;
    private Instant lastSuccessAt;
    private String lastError;
    private String lastErrorKind;
    private int consecutiveFailures;
    private Boolean validationStatus;
}
