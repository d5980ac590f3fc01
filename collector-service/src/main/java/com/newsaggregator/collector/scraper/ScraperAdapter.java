package com.newsaggregator.collector.scraper;

import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.entity.SourceKind;

import java.util.List;

/**
 * 소스 종류별 수집기 계약.
 *
 * @param <R> 소스 고유의 원시 항목 타입
 */
public interface ScraperAdapter<R> {

    SourceKind kind();

    /**
     * 네트워크 없이 설정 구조만 검사한다 (필수 키, URL 형식).
     */
    boolean validateConfig(Source source);

    /**
     * 원시 항목을 가져온다. 일부 항목이 쓸모없더라도 목록은 반환한다.
     *
     * @throws com.newsaggregator.collector.exception.TransientSourceException 네트워크/응답 오류
     * @throws com.newsaggregator.collector.exception.AuthException 자격 증명 거부
     */
    List<R> scrape(Source source);

    /**
     * 원시 항목 하나를 Article로 변환한다.
     *
     * @throws com.newsaggregator.collector.exception.MalformedItemException 변환할 수 없는 항목
     */
    Article normalize(Source source, R raw);
}
