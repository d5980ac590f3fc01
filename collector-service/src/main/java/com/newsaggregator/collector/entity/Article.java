package com.newsaggregator.collector.entity;

import com.newsaggregator.collector.util.TextNormalizer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 정규화된 기사. 모든 소스 종류가 같은 형태로 변환된다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    private String id;

    private String title;

    private String body;

    private String url;

    @Builder.Default
    private List<String> links = new ArrayList<>();

    private String sourceId;

    private SourceKind sourceKind;

    private String author;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant publishedAt;

    private Instant scrapedAt;

    private String contentHash;

    @Builder.Default
    private Relevance relevance = Relevance.UNCLASSIFIED;

    private boolean userRated;

    private Instant ratedAt;

    private Integer spamScore;

    @Builder.Default
    private List<String> spamReasons = new ArrayList<>();

    @Builder.Default
    private List<String> previewRefs = new ArrayList<>();

    @Builder.Default
    private List<String> mediaRefs = new ArrayList<>();

    /**
     * 제목/본문으로부터 콘텐츠 해시를 다시 계산한다. 텍스트가 바뀔 때마다 호출해야 한다.
     */
    public Article rehash() {
        this.contentHash = TextNormalizer.contentHash(title, body);
        return this;
    }
}
