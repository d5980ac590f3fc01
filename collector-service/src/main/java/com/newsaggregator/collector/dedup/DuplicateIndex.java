package com.newsaggregator.collector.dedup;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * 한 사이클 동안 쓰이는 중복 색인.
 *
 * 해시 색인은 저장된 전체 기사를 덮고, 퍼지 비교용 윈도우는 기간과 건수로 제한된다.
 * 윈도우는 최신 항목이 앞에 온다. 스레드 안전하지 않으며 사이클 스레드에서만 사용한다.
 */
public class DuplicateIndex {

    private final Map<String, String> hashToId = new HashMap<>();
    private final Set<String> knownIds = new HashSet<>();
    private final Deque<DuplicateRecord> window = new ArrayDeque<>();
    private final Instant horizon;
    private final int maxSize;

    public DuplicateIndex(Instant horizon, int maxSize) {
        this.horizon = horizon;
        this.maxSize = maxSize;
    }

    /**
     * 저장소에 있는 기사 색인. 해시는 항상 등록하고, 윈도우에는 기간 내일 때만 넣는다.
     * ingestedAt 오름차순으로 호출되어야 한다.
     */
    void addExisting(DuplicateRecord record, boolean includeInWindow) {
        knownIds.add(record.articleId());
        if (record.contentHash() != null) {
            hashToId.putIfAbsent(record.contentHash(), record.articleId());
        }
        if (includeInWindow && !record.ingestedAt().isBefore(horizon)) {
            window.addFirst(record);
            evict();
        }
    }

    /**
     * 이번 사이클에 새로 받아들인 기사를 등록해 이후 후보와 비교되게 한다.
     * ID와 해시는 항상 등록하고, 윈도우에는 includeInWindow일 때만 넣는다.
     */
    public void register(DuplicateRecord record, boolean includeInWindow) {
        knownIds.add(record.articleId());
        if (record.contentHash() != null) {
            hashToId.putIfAbsent(record.contentHash(), record.articleId());
        }
        if (includeInWindow) {
            window.addFirst(record);
            evict();
        }
    }

    public boolean containsId(String articleId) {
        return knownIds.contains(articleId);
    }

    public String idForHash(String contentHash) {
        return contentHash == null ? null : hashToId.get(contentHash);
    }

    public Iterable<DuplicateRecord> window() {
        return Collections.unmodifiableCollection(window);
    }

    public int windowSize() {
        return window.size();
    }

    public int hashCount() {
        return hashToId.size();
    }

    private void evict() {
        while (window.size() > maxSize) {
            window.removeLast();
        }
        Iterator<DuplicateRecord> oldest = window.descendingIterator();
        while (oldest.hasNext()) {
            if (oldest.next().ingestedAt().isBefore(horizon)) {
                oldest.remove();
            } else {
                break;
            }
        }
    }
}
