package com.newsaggregator.collector.spam;

import com.newsaggregator.collector.config.CollectorProperties;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.entity.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 규칙 기반 스팸/관련도 분류기.
 *
 * 패턴, 키워드, 구조(이모지, 대문자, 반복 문장부호, 링크만 있는 짧은 글), 소스 이름을 점수화하고
 * 소스 신뢰도로 가중한다. 사용자가 직접 평가한 기사는 다시 분류하지 않는다.
 */
@Component
@Slf4j
public class SpamClassifier {

    static final int KEYWORD_MANY = 30;
    static final int KEYWORD_FEW = 10;
    static final int EMOJI_MANY = 25;
    static final int EMOJI_FEW = 10;
    static final int CAPS = 20;
    static final int PUNCTUATION = 15;
    static final int SHORT_WITH_LINK = 20;
    static final int SOURCE_NAME = 15;

    private static final Pattern REPEATED_PUNCTUATION = Pattern.compile("[!?]{3,}");
    private static final int SHORT_CONTENT = 50;

    private final CollectorProperties.Spam config;
    private final List<Pattern> patterns;
    private final List<Pattern> sourceNamePatterns;

    public SpamClassifier(CollectorProperties properties) {
        this.config = properties.getSpam();
        this.patterns = config.getPatterns().stream().map(Pattern::compile).collect(Collectors.toList());
        this.sourceNamePatterns = config.getSourceNamePatterns().stream().map(Pattern::compile).collect(Collectors.toList());
    }

    /**
     * 기사를 점수화한다. 기사 자체는 바꾸지 않는다.
     *
     * @param source 기사 출처 (없으면 중립 신뢰도로 계산)
     */
    public SpamVerdict score(Article article, Source source) {
        if (article.isUserRated()) {
            int kept = article.getSpamScore() != null ? article.getSpamScore() : 0;
            return new SpamVerdict(article.getRelevance(), kept, article.getSpamReasons(), true);
        }

        String title = article.getTitle() != null ? article.getTitle() : "";
        String body = article.getBody() != null ? article.getBody() : "";
        String text = title + "\n" + body;
        String lower = text.toLowerCase(Locale.ROOT);

        int score = 0;
        List<String> reasons = new ArrayList<>();

        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                score += config.getPatternWeight();
                reasons.add("pattern:" + pattern.pattern());
            }
        }

        long keywordHits = config.getKeywords().stream()
                .filter(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)))
                .count();
        if (keywordHits >= 3) {
            score += KEYWORD_MANY;
            reasons.add("keywords:" + keywordHits);
        } else if (keywordHits >= 1) {
            score += KEYWORD_FEW;
            reasons.add("keywords:" + keywordHits);
        }

        long emojis = text.codePoints().filter(SpamClassifier::isEmoji).count();
        if (emojis > 10) {
            score += EMOJI_MANY;
            reasons.add("emojis:" + emojis);
        } else if (emojis > 5) {
            score += EMOJI_FEW;
            reasons.add("emojis:" + emojis);
        }

        if (capsRatio(title) > 0.7) {
            score += CAPS;
            reasons.add("caps");
        }

        if (REPEATED_PUNCTUATION.matcher(text).find()) {
            score += PUNCTUATION;
            reasons.add("punctuation");
        }

        boolean hasLinks = (article.getLinks() != null && !article.getLinks().isEmpty()) || lower.contains("http");
        if (text.strip().length() < SHORT_CONTENT && hasLinks) {
            score += SHORT_WITH_LINK;
            reasons.add("short-with-link");
        }

        String sourceName = source != null && source.getName() != null ? source.getName() : "";
        for (Pattern pattern : sourceNamePatterns) {
            if (pattern.matcher(sourceName).find()) {
                score += SOURCE_NAME;
                reasons.add("source-name");
                break;
            }
        }

        double trust = source != null ? Math.max(0.0, Math.min(1.0, source.getTrust())) : 0.5;
        int weighted = (int) Math.round(score * (1.5 - trust));

        return new SpamVerdict(relevanceFor(weighted, title), weighted, reasons, false);
    }

    /**
     * 점수를 계산해 기사에 반영한다. 사용자 평가가 있으면 그대로 둔다.
     */
    public SpamVerdict apply(Article article, Source source) {
        SpamVerdict verdict = score(article, source);
        if (!verdict.userRated()) {
            article.setRelevance(verdict.relevance());
            article.setSpamScore(verdict.score());
            article.setSpamReasons(new ArrayList<>(verdict.reasons()));
        }
        if (verdict.isSpam()) {
            log.debug("Article {} classified as spam (score={}, reasons={})", article.getId(), verdict.score(), verdict.reasons());
        }
        return verdict;
    }

    private Relevance relevanceFor(int score, String title) {
        if (score >= config.getThreshold()) {
            return Relevance.SPAM;
        }
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        for (String keyword : config.getFavoriteKeywords()) {
            if (lowerTitle.contains(keyword.toLowerCase(Locale.ROOT))) {
                return Relevance.FAVORITE;
            }
        }
        if (score >= config.getNeutralThreshold()) {
            return Relevance.NEUTRAL;
        }
        return Relevance.UNCLASSIFIED;
    }

    private static double capsRatio(String title) {
        int letters = 0;
        int upper = 0;
        for (char c : title.toCharArray()) {
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) upper++;
            }
        }
        return letters < 10 ? 0.0 : (double) upper / letters;
    }

    private static boolean isEmoji(int codePoint) {
        return (codePoint >= 0x1F300 && codePoint <= 0x1FAFF)
                || (codePoint >= 0x2600 && codePoint <= 0x27BF)
                || (codePoint >= 0x1F1E6 && codePoint <= 0x1F1FF);
    }
}
