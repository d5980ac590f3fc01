package com.newsaggregator.collector.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * 중복 판정과 해시 계산에 쓰이는 텍스트 정규화 유틸리티.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * 공백을 정리하여 텍스트를 정규화 (표시용, 대소문자 유지)
     */
    public static String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * 줄 구분은 유지하면서 각 줄의 공백을 정리하고 빈 줄을 제거
     */
    public static String cleanMultiline(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\\R")) {
            String cleaned = clean(line);
            if (!cleaned.isEmpty()) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(cleaned);
            }
        }
        return sb.toString();
    }

    /**
     * 비교용 정규화: 소문자 + 공백 정리
     */
    public static String normalize(String text) {
        return clean(text).toLowerCase(Locale.ROOT);
    }

    public static String prefix(String text, int length) {
        String normalized = normalize(text);
        return normalized.length() <= length ? normalized : normalized.substring(0, length);
    }

    /**
     * 정규화된 제목과 본문의 SHA-256 해시 (16진수)
     */
    public static String contentHash(String title, String body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(normalize(title).getBytes(StandardCharsets.UTF_8));
            digest.update("\n".getBytes(StandardCharsets.UTF_8));
            digest.update(normalize(body).getBytes(StandardCharsets.UTF_8));

            byte[] hash = digest.digest();
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
