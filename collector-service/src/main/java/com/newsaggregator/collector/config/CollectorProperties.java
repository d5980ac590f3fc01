package com.newsaggregator.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collector configuration bound from application.yml (prefix "collector").
 *
 * Every value has a default here so the service starts with an empty config.
 */
@ConfigurationProperties(prefix = "collector")
@Data
public class CollectorProperties {

    /**
     * Directory holding the JSON collections and their backups
     */
    private String dataDir = "./data";

    /**
     * Daily backups older than this are pruned
     */
    private int backupRetentionDays = 7;

    /**
     * Run one collection cycle when the application starts (cron-style invocation)
     */
    private boolean runOnStartup = false;

    private Pipeline pipeline = new Pipeline();
    private Dedup dedup = new Dedup();
    private Spam spam = new Spam();
    private Preview preview = new Preview();
    private Http http = new Http();
    private Seed seed = new Seed();

    @Data
    public static class Pipeline {
        /**
         * Fixed number of concurrent source tasks
         */
        private int workerPoolSize = 4;

        /**
         * Per-source budget, measured from when the task starts running
         */
        private Duration sourceTimeout = Duration.ofSeconds(300);

        /**
         * Upper bound for resolving all previews of one article
         */
        private Duration previewTimeout = Duration.ofSeconds(30);

        /**
         * Skip sources whose update interval has not elapsed since the last success
         */
        private boolean honorUpdateInterval = false;
    }

    @Data
    public static class Dedup {
        private double similarityThreshold = 0.85;
        private int windowHours = 48;
        private int windowSize = 500;
        private int bodyPrefixLength = 200;
        private boolean includeSpamInWindow = true;
    }

    @Data
    public static class Spam {
        private int threshold = 50;
        private int neutralThreshold = 20;
        private int patternWeight = 20;

        private List<String> patterns = new ArrayList<>(List.of(
                "(?i)\\b(buy now|order now|limited (time )?offer|act now)\\b",
                "(?i)\\b(click here|tap here|link in bio)\\b",
                "(?i)\\b(free (money|gift|giveaway)|100% free)\\b",
                "(?i)\\b(earn|make) \\$?\\d+[k]? (per|a) (day|week|hour)\\b",
                "(?i)\\b(crypto|forex) (signals?|pump)\\b",
                "(?i)(promo ?code|discount code|coupon)",
                "(?i)\\b(dm|message) (me|us) (for|to)\\b"
        ));

        private List<String> keywords = new ArrayList<>(List.of(
                "advertisement", "sponsored", "promo", "discount", "sale", "giveaway",
                "casino", "betting", "airdrop", "referral", "subscribe", "affiliate"
        ));

        /**
         * Titles containing one of these are promoted to favorite when not spam
         */
        private List<String> favoriteKeywords = new ArrayList<>();

        private List<String> sourceNamePatterns = new ArrayList<>(List.of(
                "(?i)(promo|offer|deal|ads|affiliate)"
        ));
    }

    @Data
    public static class Preview {
        private Duration ttl = Duration.ofHours(24);
        private Duration failureTtl = Duration.ofHours(1);
        private int maxConcurrentPerArticle = 3;
        private int maxLinksPerArticle = 5;
        private int metaMaxBytes = 16384;
        private int poolSize = 8;
        private int maxWidth = 400;
        private int maxHeight = 300;
        private int titleMaxLength = 100;
        private int descriptionMaxLength = 200;

        /**
         * Domain (without "www.") to oEmbed endpoint
         */
        private Map<String, String> embedProviders = new LinkedHashMap<>(Map.of(
                "youtube.com", "https://www.youtube.com/oembed",
                "youtu.be", "https://www.youtube.com/oembed",
                "twitter.com", "https://publish.twitter.com/oembed",
                "x.com", "https://publish.twitter.com/oembed",
                "vimeo.com", "https://vimeo.com/api/oembed.json",
                "soundcloud.com", "https://soundcloud.com/oembed",
                "open.spotify.com", "https://open.spotify.com/oembed",
                "reddit.com", "https://www.reddit.com/oembed",
                "flickr.com", "https://www.flickr.com/services/oembed/"
        ));
    }

    @Data
    public static class Http {
        private String userAgent = "NewsAggregator-Collector/1.0";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
        private int maxInMemorySize = 5 * 1024 * 1024;
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private List<SourceEntry> sources = new ArrayList<>();
    }

    @Data
    public static class SourceEntry {
        private String id;
        private String name;

        /**
         * channel, feed, page or profile
         */
        private String kind;
        private boolean enabled = true;
        private int updateIntervalMinutes = 60;
        private int maxItemsPerCycle = 50;
        private double trust = 0.5;
        private Map<String, String> config = new HashMap<>();
    }
}
