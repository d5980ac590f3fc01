package com.newsaggregator.collector.scraper;

import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;
import com.newsaggregator.collector.util.HtmlText;
import com.newsaggregator.collector.util.LinkExtractor;
import com.newsaggregator.collector.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 공개 채널 웹 미리보기 수집기.
 *
 * 메시지 첫 줄을 제목으로, 나머지 줄을 본문으로 사용한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChannelScraper implements ScraperAdapter<Element> {

    static final String DEFAULT_ENDPOINT = "https://t.me/s/{channel}";
    static final int SHORT_TITLE = 20;

    private static final Pattern CHANNEL_NAME = Pattern.compile("^@?[A-Za-z0-9_]{4,64}$");
    private static final Pattern BACKGROUND_URL = Pattern.compile("background-image:\\s*url\\(['\"]?([^'\")]+)['\"]?\\)");
    private static final Pattern MARKUP = Pattern.compile("\\*\\*|__|~~|`");

    private final HttpFetcher httpFetcher;
    private final ArticleFactory articleFactory;

    @Override
    public SourceKind kind() {
        return SourceKind.CHANNEL;
    }

    @Override
    public boolean validateConfig(Source source) {
        String channel = source.config("channel");
        if (channel == null || !CHANNEL_NAME.matcher(channel).matches()) {
            return false;
        }
        String endpoint = source.config("endpoint");
        return endpoint == null || LinkExtractor.isHttpUrl(endpoint.replace("{channel}", "x"));
    }

    @Override
    public List<Element> scrape(Source source) {
        String url = endpointOf(source);
        log.info("Fetching channel preview: {}", url);

        String html = httpFetcher.get(url, source.headers(), source.getId());
        Document doc = Jsoup.parse(html, url);
        Elements messages = doc.select(".tgme_widget_message[data-post]");

        // 미리보기 페이지는 오래된 메시지부터 나열된다. 최신 N건만 유지
        int limit = Math.max(0, source.getMaxItemsPerCycle());
        int from = Math.max(0, messages.size() - limit);
        return new ArrayList<>(messages.subList(from, messages.size()));
    }

    @Override
    public Article normalize(Source source, Element message) {
        String post = message.attr("data-post");
        Element textEl = message.selectFirst(".tgme_widget_message_text");

        String text = textEl != null ? HtmlText.toPlainText(textEl) : "";
        List<String> lines = new ArrayList<>(Arrays.asList(MARKUP.matcher(text).replaceAll("").split("\n")));
        lines.removeIf(String::isBlank);

        String title = "";
        String body = "";
        if (!lines.isEmpty()) {
            title = lines.remove(0).trim();
            if (title.length() < SHORT_TITLE && !lines.isEmpty()) {
                title = title + " " + lines.remove(0).trim();
            }
            title = TextNormalizer.truncate(title, ArticleFactory.TITLE_MAX_LENGTH);
            body = String.join("\n", lines);
        }

        List<String> links = new ArrayList<>();
        if (textEl != null) {
            for (Element anchor : textEl.select("a[href]")) {
                links.add(anchor.absUrl("href"));
            }
        }
        List<String> media = new ArrayList<>();
        for (Element photo : message.select(".tgme_widget_message_photo_wrap[style]")) {
            Matcher matcher = BACKGROUND_URL.matcher(photo.attr("style"));
            if (matcher.find()) {
                media.add(matcher.group(1));
            }
        }

        Element owner = message.selectFirst(".tgme_widget_message_owner_name");

        return articleFactory.build(source, ArticleDraft.builder()
                .nativeKey(post)
                .title(title)
                .body(body)
                .url(post.isBlank() ? null : "https://t.me/" + post)
                .extraLinks(links)
                .mediaRefs(media)
                .author(owner != null ? owner.text() : null)
                .publishedAt(publishedAt(message))
                .build());
    }

    private String endpointOf(Source source) {
        String channel = source.config("channel").replaceFirst("^@", "");
        return source.config("endpoint", DEFAULT_ENDPOINT).replace("{channel}", channel);
    }

    private Instant publishedAt(Element message) {
        Element time = message.selectFirst(".tgme_widget_message_date time[datetime], time[datetime]");
        if (time == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(time.attr("datetime")).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
