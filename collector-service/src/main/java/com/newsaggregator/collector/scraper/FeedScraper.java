package com.newsaggregator.collector.scraper;

import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.exception.TransientSourceException;
import com.newsaggregator.collector.util.HtmlText;
import com.newsaggregator.collector.util.LinkExtractor;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * RSS/Atom 피드 수집기 (Rome)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedScraper implements ScraperAdapter<SyndEntry> {

    private final HttpFetcher httpFetcher;
    private final ArticleFactory articleFactory;

    @Override
    public SourceKind kind() {
        return SourceKind.FEED;
    }

    @Override
    public boolean validateConfig(Source source) {
        return LinkExtractor.isHttpUrl(source.config("url"));
    }

    @Override
    public List<SyndEntry> scrape(Source source) {
        String url = source.config("url");
        log.info("Fetching feed from: {}", url);

        Map<String, String> headers = new HashMap<>(source.headers());
        headers.putIfAbsent("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        String xml = httpFetcher.get(url, headers, source.getId());

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(xml));
        } catch (FeedException | IllegalArgumentException e) {
            throw TransientSourceException.unparseable(source.getId(), "feed document", e);
        }

        List<SyndEntry> entries = feed.getEntries();
        log.info("Found {} entries in feed: {}", entries.size(), source.getName());
        return entries.size() > source.getMaxItemsPerCycle()
                ? new ArrayList<>(entries.subList(0, source.getMaxItemsPerCycle()))
                : entries;
    }

    @Override
    public Article normalize(Source source, SyndEntry entry) {
        String html = contentOf(entry);
        Document doc = Jsoup.parseBodyFragment(html, entry.getLink() != null ? entry.getLink() : "");

        List<String> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            links.add(anchor.absUrl("href"));
        }
        List<String> media = new ArrayList<>();
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            if (enclosure.getUrl() != null) {
                media.add(enclosure.getUrl());
            }
        }
        for (Element img : doc.select("img[src]")) {
            media.add(img.absUrl("src"));
        }
        List<String> tags = new ArrayList<>();
        for (SyndCategory category : entry.getCategories()) {
            if (category.getName() != null) {
                tags.add(category.getName());
            }
        }

        Date published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();

        return articleFactory.build(source, ArticleDraft.builder()
                .nativeKey(firstNonBlank(entry.getUri(), entry.getLink(), entry.getTitle()))
                .title(entry.getTitle())
                .body(HtmlText.toPlainText(doc.body()))
                .url(entry.getLink())
                .extraLinks(links)
                .mediaRefs(media)
                .author(entry.getAuthor())
                .tags(tags)
                .publishedAt(published != null ? published.toInstant() : null)
                .build());
    }

    /**
     * content:encoded가 있으면 우선, 없으면 description
     */
    private String contentOf(SyndEntry entry) {
        for (SyndContent content : entry.getContents()) {
            if (content.getValue() != null && !content.getValue().isBlank()) {
                return content.getValue();
            }
        }
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return entry.getDescription().getValue();
        }
        return "";
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
