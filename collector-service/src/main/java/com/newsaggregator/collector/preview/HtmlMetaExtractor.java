package com.newsaggregator.collector.preview;

import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.entity.PreviewTier;
import com.newsaggregator.collector.util.TextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * Open Graph / Twitter card / 일반 meta 태그에서 미리보기 정보 추출
 */
final class HtmlMetaExtractor {

    private HtmlMetaExtractor() {
    }

    static Optional<Preview> extract(Document doc, String url, PreviewTier tier, int titleMax, int descriptionMax) {
        String title = firstNonBlank(
                meta(doc, "property", "og:title"),
                meta(doc, "name", "twitter:title"),
                doc.title());
        String description = firstNonBlank(
                meta(doc, "property", "og:description"),
                meta(doc, "name", "twitter:description"),
                meta(doc, "name", "description"));
        if (title == null && description == null) {
            return Optional.empty();
        }
        String image = firstNonBlank(
                absolute(doc, meta(doc, "property", "og:image")),
                absolute(doc, meta(doc, "name", "twitter:image")));

        return Optional.of(Preview.builder()
                .url(url)
                .tier(tier)
                .title(shorten(title, titleMax))
                .description(shorten(description, descriptionMax))
                .imageUrl(image)
                .siteName(meta(doc, "property", "og:site_name"))
                .build());
    }

    static String meta(Document doc, String attribute, String key) {
        Element element = doc.selectFirst("meta[" + attribute + "=\"" + key + "\"]");
        if (element == null) {
            return null;
        }
        String content = element.attr("content");
        return content.isBlank() ? null : content.trim();
    }

    private static String absolute(Document doc, String url) {
        if (url == null) {
            return null;
        }
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        Element anchor = doc.createElement("a").attr("href", url);
        String resolved = anchor.absUrl("href");
        return resolved.isEmpty() ? null : resolved;
    }

    static String shorten(String text, int maxLength) {
        String cleaned = TextNormalizer.clean(text);
        return cleaned.isEmpty() ? null : TextNormalizer.truncate(cleaned, maxLength);
    }

    static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
