package com.newsaggregator.collector.controller;

import com.newsaggregator.collector.dto.CycleReport;
import com.newsaggregator.collector.pipeline.MultiSourceManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 외부 스케줄러가 수집 사이클을 트리거하는 경계
 */
@RestController
@RequestMapping("/api/v1/cycles")
@RequiredArgsConstructor
public class CycleController {

    private final MultiSourceManager multiSourceManager;

    /**
     * POST /api/v1/cycles - 사이클 1회 실행 후 결과 반환 (실행 중이면 끝날 때까지 대기)
     */
    @PostMapping
    public Mono<ResponseEntity<CycleReport>> runCycle() {
        return Mono.fromCallable(multiSourceManager::runCycle)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    /**
     * GET /api/v1/cycles/last - 마지막 사이클 결과
     */
    @GetMapping("/last")
    public ResponseEntity<CycleReport> lastCycle() {
        return multiSourceManager.lastReport()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }
}
