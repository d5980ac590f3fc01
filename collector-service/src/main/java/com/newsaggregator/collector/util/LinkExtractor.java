package com.newsaggregator.collector.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 본문에서 http(s) 링크를 추출하고 정규화한다.
 */
public final class LinkExtractor {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"]+[^\\s<>\".,;!?]");
    private static final String TRAILING = ".,;!?)";

    private LinkExtractor() {
    }

    /**
     * 텍스트에 등장한 순서대로 중복 없는 정규화 URL 목록을 반환
     */
    public static List<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> links = new LinkedHashSet<>();
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            String canonical = canonicalize(stripTrailing(matcher.group()));
            if (canonical != null) {
                links.add(canonical);
            }
        }
        return new ArrayList<>(links);
    }

    public static List<String> merge(Collection<String> first, Collection<String> second) {
        Set<String> merged = new LinkedHashSet<>();
        for (String url : first) {
            String canonical = canonicalize(url);
            if (canonical != null) merged.add(canonical);
        }
        for (String url : second) {
            String canonical = canonicalize(url);
            if (canonical != null) merged.add(canonical);
        }
        return new ArrayList<>(merged);
    }

    /**
     * scheme/host 소문자화, fragment 제거. http(s)가 아니거나 파싱 불가하면 null.
     */
    public static String canonicalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            StringBuilder normalized = new StringBuilder(scheme).append("://")
                    .append(uri.getRawAuthority().toLowerCase(Locale.ROOT));
            String path = uri.getRawPath();
            normalized.append(path == null || path.isEmpty() ? "/" : path);
            if (uri.getRawQuery() != null) {
                normalized.append('?').append(uri.getRawQuery());
            }
            return normalized.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttpUrl(String url) {
        return canonicalize(url) != null;
    }

    private static String stripTrailing(String url) {
        int end = url.length();
        while (end > 0 && TRAILING.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
