package com.newsaggregator.collector.repository;

import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.store.JsonStore;
import com.newsaggregator.collector.store.StoreCollection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

@Repository
@RequiredArgsConstructor
public class ArticleRepository {

    private final JsonStore store;

    public Optional<Article> findById(String id) {
        return store.get(StoreCollection.ARTICLES, id);
    }

    public List<Article> findAll() {
        return store.snapshot(StoreCollection.ARTICLES);
    }

    public List<Article> findBy(Predicate<Article> filter) {
        return store.list(StoreCollection.ARTICLES, filter);
    }

    public List<Article> findByRelevance(Relevance relevance) {
        return store.list(StoreCollection.ARTICLES, article -> article.getRelevance() == relevance);
    }

    public List<Article> findBySourceId(String sourceId) {
        return store.list(StoreCollection.ARTICLES, article -> sourceId.equals(article.getSourceId()));
    }

    public Article save(Article article) {
        return store.upsert(StoreCollection.ARTICLES, article);
    }

    public List<Article> saveAll(List<Article> articles) {
        return store.upsertAll(StoreCollection.ARTICLES, articles);
    }

    public long count() {
        return store.count(StoreCollection.ARTICLES);
    }
}
