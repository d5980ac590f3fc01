package com.newsaggregator.collector.dto;

import com.newsaggregator.collector.entity.SourceKind;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

/**
 * 소스 등록 요청. id를 생략하면 종류와 이름으로 만든다.
 */
public record SourceCreateRequest(
        @Pattern(regexp = "[a-z0-9][a-z0-9-]*", message = "id must be lowercase letters, digits and dashes") String id,
        @NotBlank(message = "Name is required") String name,
        @NotNull(message = "Kind is required") SourceKind kind,
        Boolean enabled,
        @Min(value = 1, message = "Update interval must be at least 1 minute") Integer updateIntervalMinutes,
        @Min(value = 1, message = "At least one item per cycle is required") Integer maxItemsPerCycle,
        @DecimalMin(value = "0.0", message = "Trust must be between 0.0 and 1.0")
        @DecimalMax(value = "1.0", message = "Trust must be between 0.0 and 1.0") Double trust,
        Map<String, String> config
) {
    public SourceCreateRequest {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        updateIntervalMinutes = updateIntervalMinutes == null ? 60 : updateIntervalMinutes;
        maxItemsPerCycle = maxItemsPerCycle == null ? 50 : maxItemsPerCycle;
        trust = trust == null ? 0.5 : trust;
        config = config == null ? Map.of() : Map.copyOf(config);
    }
}
