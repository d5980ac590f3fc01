package com.newsaggregator.collector.repository;

import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.store.JsonStore;
import com.newsaggregator.collector.store.StoreCollection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SourceRepository {

    private final JsonStore store;

    public Optional<Source> findById(String id) {
        return store.get(StoreCollection.SOURCES, id);
    }

    public List<Source> findAll() {
        return store.snapshot(StoreCollection.SOURCES);
    }

    public List<Source> findByEnabledTrue() {
        return store.list(StoreCollection.SOURCES, Source::isEnabled);
    }

    public List<Source> findByKind(SourceKind kind) {
        return store.list(StoreCollection.SOURCES, source -> source.getKind() == kind);
    }

    public Optional<Source> findByName(String name) {
        return store.list(StoreCollection.SOURCES, source -> name.equals(source.getName()))
                .stream()
                .findFirst();
    }

    public boolean existsById(String id) {
        return findById(id).isPresent();
    }

    public Source save(Source source) {
        return store.upsert(StoreCollection.SOURCES, source);
    }
}
