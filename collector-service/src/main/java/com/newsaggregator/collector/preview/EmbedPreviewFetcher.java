package com.newsaggregator.collector.preview;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsaggregator.collector.client.HttpFetcher;
import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.entity.PreviewTier;
import com.newsaggregator.collector.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * oEmbed 제공자 (동영상, 게시물 등)에 대한 임베드 미리보기
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbedPreviewFetcher implements PreviewFetcher {

    private final HttpFetcher httpFetcher;
    private final ObjectMapper objectMapper;
    private final CollectorProperties properties;

    @Override
    public PreviewTier tier() {
        return PreviewTier.EMBED;
    }

    @Override
    public boolean supports(String url) {
        return endpointFor(url) != null;
    }

    @Override
    public Optional<Preview> fetch(String url) {
        String endpoint = endpointFor(url);
        if (endpoint == null) {
            return Optional.empty();
        }
        CollectorProperties.Preview config = properties.getPreview();
        String request = endpoint
                + (endpoint.contains("?") ? "&" : "?")
                + "url=" + URLEncoder.encode(url, StandardCharsets.UTF_8)
                + "&format=json"
                + "&maxwidth=" + config.getMaxWidth()
                + "&maxheight=" + config.getMaxHeight();

        String json = httpFetcher.get(request, Map.of("Accept", "application/json"), null);
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("oEmbed response for {} is not JSON: {}", url, e.getMessage());
            return Optional.empty();
        }

        String title = node.path("title").asText("");
        String html = node.path("html").asText("");
        if (title.isBlank() && html.isBlank()) {
            return Optional.empty();
        }
        String author = node.path("author_name").asText("");

        return Optional.of(Preview.builder()
                .url(url)
                .tier(PreviewTier.EMBED)
                .title(TextNormalizer.truncate(title, config.getTitleMaxLength()))
                .description(author.isBlank() ? null : TextNormalizer.truncate(author, config.getDescriptionMaxLength()))
                .imageUrl(node.hasNonNull("thumbnail_url") ? node.get("thumbnail_url").asText() : null)
                .siteName(node.hasNonNull("provider_name") ? node.get("provider_name").asText() : null)
                .embedHtml(html.isBlank() ? null : html)
                .build());
    }

    /**
     * 호스트(www. 제외)나 상위 도메인이 등록된 제공자면 해당 oEmbed 엔드포인트
     */
    String endpointFor(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        for (Map.Entry<String, String> provider : properties.getPreview().getEmbedProviders().entrySet()) {
            String domain = provider.getKey().toLowerCase(Locale.ROOT);
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return provider.getValue();
            }
        }
        return null;
    }
}
