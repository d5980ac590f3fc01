package com.newsaggregator.collector.store;

import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.entity.Source;

import java.util.function.Function;

/**
 * 저장소의 이름 있는 컬렉션. 컬렉션마다 파일 하나, 잠금 하나를 가진다.
 */
public final class StoreCollection<T> {

    public static final StoreCollection<Source> SOURCES =
            new StoreCollection<>("sources", Source.class, Source::getId);

    public static final StoreCollection<Article> ARTICLES =
            new StoreCollection<>("articles", Article.class, Article::getId);

    public static final StoreCollection<Preview> PREVIEWS =
            new StoreCollection<>("previews", Preview.class, Preview::getUrl);

    private final String name;
    private final Class<T> type;
    private final Function<T, String> idExtractor;

    public StoreCollection(String name, Class<T> type, Function<T, String> idExtractor) {
        this.name = name;
        this.type = type;
        this.idExtractor = idExtractor;
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public String idOf(T record) {
        String id = idExtractor.apply(record);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Record for collection '" + name + "' has no id");
        }
        return id;
    }

    @Override
    public String toString() {
        return name;
    }
}
