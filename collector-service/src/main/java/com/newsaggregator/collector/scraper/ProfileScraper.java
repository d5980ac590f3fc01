package com.newsaggregator.collector.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.exception.MalformedItemException;
import com.newsaggregator.collector.exception.TransientSourceException;
import com.newsaggregator.collector.util.LinkExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 소셜 프로필 타임라인 수집기. JSON 엔드포인트를 읽어 게시물 배열을 항목으로 사용한다.
 *
 * bearer_token은 해석하지 않고 Authorization 헤더로 그대로 전달한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProfileScraper implements ScraperAdapter<JsonNode> {

    static final String DEFAULT_ITEMS_PATH = "data";

    private final HttpFetcher httpFetcher;
    private final ArticleFactory articleFactory;
    private final ObjectMapper objectMapper;

    @Override
    public SourceKind kind() {
        return SourceKind.PROFILE;
    }

    @Override
    public boolean validateConfig(Source source) {
        String template = source.config("url_template");
        return LinkExtractor.isHttpUrl(source.config("endpoint"))
                && (template == null || template.contains("{id}"));
    }

    @Override
    public List<JsonNode> scrape(Source source) {
        String endpoint = source.config("endpoint");
        log.info("Fetching profile timeline: {}", endpoint);

        Map<String, String> headers = new HashMap<>(source.headers());
        headers.putIfAbsent("Accept", "application/json");
        String token = source.config("bearer_token");
        if (token != null && !token.isBlank()) {
            headers.put("Authorization", "Bearer " + token);
        }

        String json = httpFetcher.get(endpoint, headers, source.getId());
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw TransientSourceException.unparseable(source.getId(), "profile response", e);
        }

        JsonNode items = itemsAt(root, source.config("items_path", DEFAULT_ITEMS_PATH));
        if (items == null || !items.isArray()) {
            throw TransientSourceException.unparseable(source.getId(), "profile response (no item array)", null);
        }

        List<JsonNode> result = new ArrayList<>();
        for (JsonNode item : items) {
            if (result.size() >= source.getMaxItemsPerCycle()) break;
            result.add(item);
        }
        return result;
    }

    @Override
    public Article normalize(Source source, JsonNode item) {
        if (!item.isObject()) {
            throw new MalformedItemException("Profile item is not an object", source.getId());
        }
        String id = text(item, source.config("id_field", "id"));
        if (id == null) {
            throw MalformedItemException.missingKey(source.getId());
        }

        String template = source.config("url_template");
        String url = template == null ? text(item, "url") : template
                .replace("{id}", id)
                .replace("{username}", source.config("username", ""));

        List<String> tags = new ArrayList<>();
        JsonNode hashtags = item.path("hashtags");
        if (hashtags.isArray()) {
            hashtags.forEach(tag -> tags.add(tag.asText()));
        }

        return articleFactory.build(source, ArticleDraft.builder()
                .nativeKey(id)
                .title(text(item, source.config("title_field", "title")))
                .body(text(item, source.config("text_field", "text")))
                .url(url)
                .author(source.config("username"))
                .tags(tags)
                .publishedAt(parseDate(item.path(source.config("date_field", "created_at"))))
                .build());
    }

    /**
     * 점으로 구분된 경로를 따라간다. 빈 경로는 루트 자체.
     */
    private JsonNode itemsAt(JsonNode root, String path) {
        JsonNode node = root;
        if (path.isBlank()) {
            return node;
        }
        for (String part : path.split("\\.")) {
            node = node.get(part);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private Instant parseDate(JsonNode value) {
        if (value.isNumber()) {
            long epoch = value.asLong();
            // 초 단위와 밀리초 단위 모두 허용
            return epoch > 100_000_000_000L ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
        }
        if (!value.isTextual()) {
            return null;
        }
        String text = value.asText();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            } catch (DateTimeParseException ignored) {
                log.debug("Ignoring unparseable profile date '{}'", text);
                return null;
            }
        }
    }
}
