package com.newsaggregator.collector.dto;

import com.newsaggregator.collector.entity.Relevance;

public record RelevanceRequest(Relevance relevance) {}
