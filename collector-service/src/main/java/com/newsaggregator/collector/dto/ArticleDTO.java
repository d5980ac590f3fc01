package com.newsaggregator.collector.dto;

import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleDTO {
    private String id;
    private String title;
    private String body;
    private String url;
    private String sourceId;
    private SourceKind sourceKind;
    private String author;
    private Instant publishedAt;
    private Instant scrapedAt;
    private Relevance relevance;
    private boolean userRated;
    private List<String> links;
    private List<String> previewRefs;
    private List<String> mediaRefs;
}
