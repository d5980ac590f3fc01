package com.newsaggregator.collector.preview;

import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.entity.PreviewTier;
import com.newsaggregator.collector.util.LinkExtractor;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 문서 앞부분(head)만 받아 meta 태그를 읽는다
 */
@Component
@RequiredArgsConstructor
public class MetaTagPreviewFetcher implements PreviewFetcher {

    private final HttpFetcher httpFetcher;
    private final CollectorProperties properties;

    @Override
    public PreviewTier tier() {
        return PreviewTier.META;
    }

    @Override
    public boolean supports(String url) {
        return LinkExtractor.isHttpUrl(url);
    }

    @Override
    public Optional<Preview> fetch(String url) {
        CollectorProperties.Preview config = properties.getPreview();
        String head = httpFetcher.getHead(url, config.getMetaMaxBytes());
        if (head.isBlank()) {
            return Optional.empty();
        }
        return HtmlMetaExtractor.extract(Jsoup.parse(head, url), url, PreviewTier.META,
                config.getTitleMaxLength(), config.getDescriptionMaxLength());
    }
}
