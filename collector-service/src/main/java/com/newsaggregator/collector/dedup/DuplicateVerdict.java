package com.newsaggregator.collector.dedup;

/**
 * 중복 판정 결과. unique이면 existingId/matchType은 null.
 */
public record DuplicateVerdict(boolean duplicate, String existingId, MatchType matchType, double similarity) {

    private static final DuplicateVerdict UNIQUE = new DuplicateVerdict(false, null, null, 0.0);

    public static DuplicateVerdict unique() {
        return UNIQUE;
    }

    public static DuplicateVerdict duplicateOf(String existingId, MatchType matchType, double similarity) {
        return new DuplicateVerdict(true, existingId, matchType, similarity);
    }
}
