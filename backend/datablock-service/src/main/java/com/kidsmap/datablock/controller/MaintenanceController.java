package com.kidsmap.datablock.controller;

import com.kidsmap.datablock.dto.monitor.Alert;
import com.kidsmap.datablock.dto.monitor.MonitoringMetrics;
import com.kidsmap.datablock.dto.optimizer.CacheWarmResult;
import com.kidsmap.datablock.dto.optimizer.DeduplicationResult;
import com.kidsmap.datablock.dto.optimizer.IndexOptimizationResult;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationRequest;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationResult;
import com.kidsmap.datablock.service.monitor.BlockMonitor;
import com.kidsmap.datablock.service.optimizer.BlockOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.kidsmap.datablock.controller.BlockingCalls.async;

/**
 * 최적화(아카이브, 중복 병합, 인덱스, 캐시) 및 모니터링 API
 */
@RestController
@RequestMapping("/api/v1/maintenance")
@RequiredArgsConstructor
@Slf4j
public class MaintenanceController {

    static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final BlockOptimizer blockOptimizer;
    private final BlockMonitor blockMonitor;

    // ========================================
    // 최적화
    // ========================================

    @PostMapping("/optimize/quality")
    public Mono<ResponseEntity<QualityOptimizationResult>> optimizeByQuality(
            @RequestBody(required = false) QualityOptimizationRequest request) {
        QualityOptimizationRequest effective = request != null ? request : new QualityOptimizationRequest();
        log.info("Quality optimization requested: grades={}, refreshStale={}",
                effective.getArchiveGrades(), effective.getRefreshStale());
        return async(() -> blockOptimizer.optimizeByQuality(effective))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/optimize/dedupe")
    public Mono<ResponseEntity<DeduplicationResult>> deduplicate() {
        return async(blockOptimizer::deduplicateBlocks)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/optimize/indexes")
    public Mono<ResponseEntity<IndexOptimizationResult>> optimizeIndexes() {
        return async(blockOptimizer::optimizeIndexes)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/cache/warm")
    public Mono<ResponseEntity<CacheWarmResult>> warmCache(
            @RequestParam(defaultValue = "100") int topPlaces,
            @RequestParam(defaultValue = "50") int recentContents) {
        return async(() -> blockOptimizer.warmCache(topPlaces, recentContents))
                .map(ResponseEntity::ok);
    }

    // ========================================
    // 모니터링
    // ========================================

    @GetMapping("/monitor/metrics")
    public Mono<ResponseEntity<MonitoringMetrics>> getMetrics() {
        return async(blockMonitor::getMetrics)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/monitor/alerts")
    public Mono<ResponseEntity<List<Alert>>> getAlerts() {
        return async(blockMonitor::checkAlerts)
                .map(ResponseEntity::ok);
    }

    @GetMapping(value = "/monitor/report", produces = "text/markdown")
    public Mono<ResponseEntity<String>> getReport() {
        return async(blockMonitor::generateReport)
                .map(report -> ResponseEntity.ok().contentType(TEXT_MARKDOWN).body(report));
    }
}
