package com.newsaggregator.collector.preview;

import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.entity.PreviewTier;
import com.newsaggregator.collector.util.LinkExtractor;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * 마지막 수단: 문서 전체를 받아 meta가 없으면 본문에서 제목/첫 문단/첫 이미지를 찾는다
 */
@Component
@RequiredArgsConstructor
public class FullPagePreviewFetcher implements PreviewFetcher {

    private static final int MIN_PARAGRAPH = 40;

    private final HttpFetcher httpFetcher;
    private final CollectorProperties properties;

    @Override
    public PreviewTier tier() {
        return PreviewTier.FULL_FETCH;
    }

    @Override
    public boolean supports(String url) {
        return LinkExtractor.isHttpUrl(url);
    }

    @Override
    public Optional<Preview> fetch(String url) {
        CollectorProperties.Preview config = properties.getPreview();
        String html = httpFetcher.get(url, Map.of(), null);
        if (html.isBlank()) {
            return Optional.empty();
        }
        Document doc = Jsoup.parse(html, url);

        Optional<Preview> fromMeta = HtmlMetaExtractor.extract(doc, url, PreviewTier.FULL_FETCH,
                config.getTitleMaxLength(), config.getDescriptionMaxLength());
        if (fromMeta.isPresent() && fromMeta.get().getDescription() != null) {
            return fromMeta;
        }

        Element heading = doc.selectFirst("h1");
        String title = HtmlMetaExtractor.firstNonBlank(doc.title(), heading != null ? heading.text() : null);
        String description = null;
        for (Element paragraph : doc.select("p")) {
            if (paragraph.text().length() >= MIN_PARAGRAPH) {
                description = paragraph.text();
                break;
            }
        }
        if (title == null && description == null) {
            return Optional.empty();
        }
        Element image = doc.selectFirst("img[src]");

        return Optional.of(Preview.builder()
                .url(url)
                .tier(PreviewTier.FULL_FETCH)
                .title(HtmlMetaExtractor.shorten(title, config.getTitleMaxLength()))
                .description(HtmlMetaExtractor.shorten(description, config.getDescriptionMaxLength()))
                .imageUrl(image != null ? image.absUrl("src") : null)
                .build());
    }
}
