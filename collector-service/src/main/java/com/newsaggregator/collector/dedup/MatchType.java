package com.newsaggregator.collector.dedup;

public enum MatchType {
    /** 같은 소스의 같은 항목을 다시 수집함 */
    SAME_ITEM,
    EXACT,
    FUZZY_TITLE,
    FUZZY_BODY
}
