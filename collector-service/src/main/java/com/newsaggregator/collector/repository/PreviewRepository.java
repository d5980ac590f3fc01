package com.newsaggregator.collector.repository;

import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.store.JsonStore;
import com.newsaggregator.collector.store.StoreCollection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PreviewRepository {

    private final JsonStore store;

    public Optional<Preview> findByUrl(String url) {
        return store.get(StoreCollection.PREVIEWS, url);
    }

    public Preview save(Preview preview) {
        return store.upsert(StoreCollection.PREVIEWS, preview);
    }
}
