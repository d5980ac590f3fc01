package com.newsaggregator.collector.controller;

import com.newsaggregator.collector.dto.ArticleDTO;
import com.newsaggregator.collector.dto.RelevanceRequest;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.mapper.EntityMapper;
import com.newsaggregator.collector.service.ArticleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/articles")
@RequiredArgsConstructor
public class ArticleController {

    private final ArticleService articleService;
    private final EntityMapper entityMapper;

    /**
     * GET /api/v1/articles - 스팸을 제외한 기사 (relevance 지정 시 해당 분류만)
     */
    @GetMapping
    public ResponseEntity<List<ArticleDTO>> listArticles(@RequestParam(required = false) String relevance) {
        List<Article> articles = relevance == null
                ? articleService.findVisible()
                : articleService.findByRelevance(Relevance.fromValue(relevance));
        return ResponseEntity.ok(articles.stream().map(entityMapper::toDTO).collect(Collectors.toList()));
    }

    /**
     * PUT /api/v1/articles/{id}/relevance - 사용자 평가
     */
    @PutMapping("/{id}/relevance")
    public ResponseEntity<ArticleDTO> rate(@PathVariable String id, @RequestBody RelevanceRequest request) {
        if (request.relevance() == null) {
            throw new IllegalArgumentException("relevance is required");
        }
        return ResponseEntity.ok(entityMapper.toDTO(articleService.rate(id, request.relevance())));
    }

    /**
     * POST /api/v1/articles/reclassify - 사용자 평가가 없는 기사 재분류
     */
    @PostMapping("/reclassify")
    public ResponseEntity<Map<String, Integer>> reclassify() {
        return ResponseEntity.ok(Map.of("changed", articleService.reclassifyUnrated()));
    }
}
