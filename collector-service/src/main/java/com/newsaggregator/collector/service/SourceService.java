package com.newsaggregator.collector.service;

import com.newsaggregator.collector.dto.FailureKind;
import com.newsaggregator.collector.entity.Source;
import com.newsaggregator.collector.exception.ResourceConflictException;
import com.newsaggregator.collector.exception.ResourceNotFoundException;
import com.newsaggregator.collector.repository.SourceRepository;
import com.newsaggregator.collector.scraper.ScraperRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 소스 관리 및 사이클별 상태 기록.
 *
 * 읽기-수정-쓰기는 이 서비스 안에서 직렬화되어 관리 API와 수집 사이클이 서로의 변경을 덮어쓰지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceService {

    private final SourceRepository sourceRepository;
    private final ScraperRegistry scraperRegistry;
    private final Clock clock;

    public List<Source> findAll() {
        return sourceRepository.findAll();
    }

    public List<Source> findEnabled() {
        return sourceRepository.findByEnabledTrue();
    }

    public Optional<Source> findById(String id) {
        return sourceRepository.findById(id);
    }

    public synchronized Source create(Source source) {
        if (source.getCreatedAt() == null) {
            source.setCreatedAt(clock.instant());
        }
        Source saved = sourceRepository.save(source);
        log.info("Created source: id={}, name={}, kind={}", saved.getId(), saved.getName(), saved.getKind());
        return saved;
    }

    /**
     * 관리 API를 통한 등록. 설정을 검증하고 id나 이름이 겹치면 거부한다.
     */
    public synchronized Source register(Source source) {
        scraperRegistry.validate(source).ifPresent(problem -> {
            throw new IllegalArgumentException(problem);
        });
        boolean exists = sourceRepository.findById(source.getId()).isPresent()
                || sourceRepository.findAll().stream().anyMatch(s -> source.getName().equalsIgnoreCase(s.getName()));
        if (exists) {
            throw ResourceConflictException.sourceExists(source.getId(), source.getName());
        }
        source.setValidationStatus(true);
        source.setValidationError(null);
        return create(source);
    }

    public Source enable(String id) {
        return update(id, source -> source.setEnabled(true));
    }

    public Source disable(String id) {
        return update(id, source -> source.setEnabled(false));
    }

    public Source setUpdateInterval(String id, int minutes) {
        if (minutes < 1) {
            throw new IllegalArgumentException("Update interval must be at least 1 minute");
        }
        return update(id, source -> source.setUpdateIntervalMinutes(minutes));
    }

    /**
     * 설정 검증 실패: 소스는 남겨두고 운영자가 볼 수 있도록 표시만 한다
     */
    public Source flagInvalid(String id, String reason) {
        log.warn("Source {} has invalid configuration: {}", id, reason);
        return update(id, source -> {
            source.setValidationStatus(false);
            source.setValidationError(reason);
        });
    }

    public Source markValid(String id) {
        return update(id, source -> {
            source.setValidationStatus(true);
            source.setValidationError(null);
        });
    }

    public Source recordSuccess(String id, Instant attemptedAt) {
        return update(id, source -> {
            source.setLastAttemptAt(attemptedAt);
            source.setLastSuccessAt(attemptedAt);
            source.setLastError(null);
            source.setLastErrorKind(null);
            source.setConsecutiveFailures(0);
        });
    }

    public Source recordFailure(String id, FailureKind kind, String error, Instant attemptedAt) {
        return update(id, source -> {
            source.setLastAttemptAt(attemptedAt);
            source.setLastError(error);
            source.setLastErrorKind(kind.name());
            source.setConsecutiveFailures(source.getConsecutiveFailures() + 1);
        });
    }

    private synchronized Source update(String id, Consumer<Source> change) {
        Source source = sourceRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.source(id));
        change.accept(source);
        return sourceRepository.save(source);
    }
}
