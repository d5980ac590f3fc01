package com.newsaggregator.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * News Aggregator Collector Service Application
 *
 * 여러 종류의 소스(채널, 피드, 웹 페이지, 프로필)에서 기사를 수집해
 * 중복 제거, 스팸 분류, 링크 미리보기를 거쳐 JSON 저장소에 기록한다.
 * 주기 실행은 외부 스케줄러가 /api/v1/cycles 또는 run-on-startup으로 트리거한다.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectorApplication.class, args);
    }
}
