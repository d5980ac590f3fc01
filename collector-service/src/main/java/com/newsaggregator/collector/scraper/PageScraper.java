package com.newsaggregator.collector.scraper;

import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.util.LinkExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CSS 선택자 기반 웹 페이지 수집기 (Jsoup).
 *
 * item_selector에 맞는 요소가 없으면 페이지 전체를 하나의 항목으로 취급한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageScraper implements ScraperAdapter<Element> {

    static final String DEFAULT_ITEM_SELECTOR = "article";
    static final String DEFAULT_TITLE_SELECTOR = "h1, h2, h3";
    static final String DEFAULT_BODY_SELECTOR = "p";
    static final String DEFAULT_DATE_SELECTOR = "time[datetime]";

    private final HttpFetcher httpFetcher;
    private final ArticleFactory articleFactory;

    @Override
    public SourceKind kind() {
        return SourceKind.PAGE;
    }

    @Override
    public boolean validateConfig(Source source) {
        if (!LinkExtractor.isHttpUrl(source.config("url"))) {
            return false;
        }
        for (String key : List.of("item_selector", "title_selector", "body_selector", "date_selector")) {
            String selector = source.config(key);
            if (selector != null && !isValidSelector(selector)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<Element> scrape(Source source) {
        String url = source.config("url");
        log.info("Scraping page: {}", url);

        String html = httpFetcher.get(url, source.headers(), source.getId());
        Document doc = Jsoup.parse(html, url);

        Elements items = doc.select(source.config("item_selector", DEFAULT_ITEM_SELECTOR));
        if (items.isEmpty()) {
            log.debug("No items matched on {}, treating the whole page as one item", url);
            return List.of(doc);
        }
        return items.stream()
                .limit(source.getMaxItemsPerCycle())
                .collect(Collectors.toList());
    }

    @Override
    public Article normalize(Source source, Element item) {
        String pageUrl = source.config("url");
        Element titleEl = item.selectFirst(source.config("title_selector", DEFAULT_TITLE_SELECTOR));

        String title = titleEl != null ? titleEl.text() : "";
        if (title.isBlank() && item instanceof Document doc) {
            title = doc.title();
        }

        String body = item.select(source.config("body_selector", DEFAULT_BODY_SELECTOR)).stream()
                .map(Element::text)
                .filter(text -> !text.isBlank())
                .collect(Collectors.joining("\n"));
        if (body.isBlank() && titleEl == null) {
            body = item instanceof Document doc ? doc.body().text() : item.text();
        }

        String url = itemUrl(item, titleEl, pageUrl);

        List<String> links = new ArrayList<>();
        for (Element anchor : item.select("a[href]")) {
            links.add(anchor.absUrl("href"));
        }
        List<String> media = new ArrayList<>();
        for (Element img : item.select("img[src]")) {
            media.add(img.absUrl("src"));
        }

        return articleFactory.build(source, ArticleDraft.builder()
                .nativeKey(url != null && !url.equals(pageUrl) ? url : pageUrl + "#" + title)
                .title(title)
                .body(body)
                .url(url)
                .extraLinks(links)
                .mediaRefs(media)
                .publishedAt(publishedAt(item, source.config("date_selector", DEFAULT_DATE_SELECTOR)))
                .build());
    }

    private String itemUrl(Element item, Element titleEl, String pageUrl) {
        if (item instanceof Document) {
            return pageUrl;
        }
        Element anchor = null;
        if (titleEl != null) {
            anchor = titleEl.is("a[href]") ? titleEl : titleEl.selectFirst("a[href]");
        }
        if (anchor == null) {
            anchor = item.selectFirst("a[href]");
        }
        return anchor != null ? anchor.absUrl("href") : pageUrl;
    }

    private Instant publishedAt(Element item, String selector) {
        Element time = item.selectFirst(selector);
        if (time == null) {
            return null;
        }
        String value = time.hasAttr("datetime") ? time.attr("datetime") : time.text();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable date '{}'", value);
            return null;
        }
    }

    private static boolean isValidSelector(String selector) {
        try {
            Jsoup.parse("").select(selector);
            return true;
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            return false;
        }
    }
}
