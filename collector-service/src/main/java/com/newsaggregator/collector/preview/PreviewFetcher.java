package com.newsaggregator.collector.preview;

import com.newsaggregator.collector.entity.Preview;
import com.newsaggregator.collector.entity.PreviewTier;

import java.util.Optional;

/**
 * 미리보기 획득 단계 하나. 결과가 없으면 빈 Optional, 실패하면 예외를 던진다.
 * fetchedAt/ttl은 resolver가 채운다.
 */
public interface PreviewFetcher {

    PreviewTier tier();

    boolean supports(String url);

    Optional<Preview> fetch(String url);
}
