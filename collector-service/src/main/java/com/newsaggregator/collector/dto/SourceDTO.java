package com.newsaggregator.collector.dto;

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
public class SourceDTO {
    private String id;
    private String name;
    private SourceKind kind;
    private boolean enabled;
    private int updateIntervalMinutes;
    private int maxItemsPerCycle;
    private double trust;
    private Map<String, String> config;
    private Instant lastAttemptAt;
    private Instant lastSuccessAt;
    private String lastError;
    private String lastErrorKind;
    private int consecutiveFailures;
    private Boolean validationStatus;
    private String validationError;
}
