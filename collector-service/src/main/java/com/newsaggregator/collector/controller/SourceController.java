package com.newsaggregator.collector.controller;

import com.newsaggregator.collector.dto.SourceCreateRequest;
import com.newsaggregator.collector.dto.SourceDTO;
import com.newsaggregator.collector.dto.SourceStatsDTO;
import com.newsaggregator.collector.dto.SourceStatsSummary;
import com.newsaggregator.collector.dto.SourceTestResponse;
import com.newsaggregator.collector.exception.ResourceNotFoundException;
import com.newsaggregator.collector.mapper.EntityMapper;
import com.newsaggregator.collector.pipeline.MultiSourceManager;
import com.newsaggregator.collector.service.SourceService;
import com.newsaggregator.collector.service.SourceStatsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
public class SourceController {

    private final SourceService sourceService;
    private final SourceStatsService sourceStatsService;
    private final MultiSourceManager multiSourceManager;
    private final EntityMapper entityMapper;

    /**
     * GET /api/v1/sources - 모든 소스와 상태 (자격 증명은 가려짐)
     */
    @GetMapping
    public ResponseEntity<List<SourceDTO>> listSources() {
        return ResponseEntity.ok(sourceService.findAll().stream()
                .map(entityMapper::toDTO)
                .collect(Collectors.toList()));
    }

    /**
     * POST /api/v1/sources - 새 소스 등록
     * id를 생략하면 종류와 이름으로 만든다. 설정이 유효하지 않으면 400, id나 이름이 겹치면 409.
     */
    @PostMapping
    public ResponseEntity<SourceDTO> createSource(@Valid @RequestBody SourceCreateRequest request) {
        SourceDTO created = entityMapper.toDTO(sourceService.register(entityMapper.toEntity(request)));
        log.info("Registered source via API: id={}, kind={}", created.getId(), created.getKind());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/stats")
    public ResponseEntity<SourceStatsSummary> getStats() {
        return ResponseEntity.ok(sourceStatsService.summarize());
    }

    @GetMapping("/{id}/stats")
    public ResponseEntity<SourceStatsDTO> getSourceStats(@PathVariable String id) {
        return ResponseEntity.ok(sourceStatsService.statsFor(id));
    }

    /**
     * POST /api/v1/sources/{id}/test - 저장 없이 한 번 수집해 보고 결과와 샘플을 반환
     */
    @PostMapping("/{id}/test")
    public Mono<ResponseEntity<SourceTestResponse>> testSource(@PathVariable String id) {
        return Mono.fromCallable(() -> multiSourceManager.testSource(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(entityMapper::toResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SourceDTO> getSource(@PathVariable String id) {
        return sourceService.findById(id)
                .map(entityMapper::toDTO)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ResourceNotFoundException.source(id));
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<SourceDTO> enableSource(@PathVariable String id) {
        return ResponseEntity.ok(entityMapper.toDTO(sourceService.enable(id)));
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<SourceDTO> disableSource(@PathVariable String id) {
        return ResponseEntity.ok(entityMapper.toDTO(sourceService.disable(id)));
    }

    /**
     * PUT /api/v1/sources/{id}/interval?minutes=30 - 수집 주기 변경
     */
    @PutMapping("/{id}/interval")
    public ResponseEntity<SourceDTO> updateInterval(@PathVariable String id, @RequestParam int minutes) {
        return ResponseEntity.ok(entityMapper.toDTO(sourceService.setUpdateInterval(id, minutes)));
    }
}
