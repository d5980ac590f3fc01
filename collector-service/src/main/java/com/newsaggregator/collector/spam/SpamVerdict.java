package com.newsaggregator.collector.spam;

import com.newsaggregator.collector.entity.Relevance;

import java.util.List;

/**
 * @param score   소스 신뢰도로 가중된 최종 점수
 * @param reasons 점수에 기여한 규칙들
 * @param userRated 사용자 평가가 유지되어 점수가 적용되지 않은 경우 true
 */
public record SpamVerdict(Relevance relevance, int score, List<String> reasons, boolean userRated) {

    public boolean isSpam() {
        return relevance == Relevance.SPAM;
    }
}
