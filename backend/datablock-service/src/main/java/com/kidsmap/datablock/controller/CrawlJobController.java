package com.kidsmap.datablock.controller;

import com.kidsmap.datablock.dto.crawl.CrawlJobRequest;
import com.kidsmap.datablock.dto.crawl.CrawlScheduleRequest;
import com.kidsmap.datablock.dto.crawl.PresetRequest;
import com.kidsmap.datablock.dto.crawl.QueueStats;
import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import com.kidsmap.datablock.entity.CrawlSchedule;
import com.kidsmap.datablock.service.crawl.CrawlJobService;
import com.kidsmap.datablock.service.crawl.CrawlScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static com.kidsmap.datablock.controller.BlockingCalls.async;

/**
 * 크롤 작업 큐 관리 REST API.
 *
 * 작업 등록, 프리셋, 상태 조회, 취소/일시정지/재개, 반복 스케줄 관리 기능을 제공합니다.
 */
@RestController
@RequestMapping("/api/v1/crawl-jobs")
@RequiredArgsConstructor
@Slf4j
public class CrawlJobController {

    private final CrawlJobService crawlJobService;
    private final CrawlScheduleService crawlScheduleService;

    // ========================================
    // 작업 등록
    // ========================================

    @PostMapping
    public Mono<ResponseEntity<Map<String, String>>> schedule(@RequestBody CrawlJobRequest request) {
        return async(() -> crawlJobService.schedule(request))
                .map(this::accepted);
    }

    @PostMapping("/presets/full")
    public Mono<ResponseEntity<Map<String, String>>> scheduleFullCrawl() {
        return async(crawlJobService::scheduleFullCrawl)
                .map(this::accepted);
    }

    @PostMapping("/presets/region")
    public Mono<ResponseEntity<Map<String, String>>> scheduleRegionCrawl(@RequestBody PresetRequest request) {
        return async(() -> crawlJobService.scheduleRegionCrawl(request.getRegionCodes()))
                .map(this::accepted);
    }

    @PostMapping("/presets/content")
    public Mono<ResponseEntity<Map<String, String>>> scheduleContentCrawl(
            @RequestBody(required = false) PresetRequest request) {
        List<String> keywords = request != null ? request.getKeywords() : null;
        return async(() -> crawlJobService.scheduleContentCrawl(keywords))
                .map(this::accepted);
    }

    // ========================================
    // 상태 조회
    // ========================================

    @GetMapping("/{id}")
    public Mono<ResponseEntity<CrawlJob>> getStatus(@PathVariable String id) {
        return async(() -> crawlJobService.getStatus(id))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<QueueStats>> getQueueStats() {
        return async(crawlJobService::queueStats)
                .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<List<CrawlJob>>> listRecent(
            @RequestParam(required = false) CrawlJobStatus status,
            @RequestParam(defaultValue = "20") int limit) {
        return async(() -> crawlJobService.listRecent(status, limit))
                .map(ResponseEntity::ok);
    }

    // ========================================
    // 수동 제어
    // ========================================

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<CrawlJob>> cancel(@PathVariable String id) {
        log.info("Cancel requested for crawl job {}", id);
        return async(() -> crawlJobService.cancel(id))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/pause")
    public Mono<ResponseEntity<CrawlJob>> pause(@PathVariable String id) {
        return async(() -> crawlJobService.pause(id))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/resume")
    public Mono<ResponseEntity<CrawlJob>> resume(@PathVariable String id) {
        return async(() -> crawlJobService.resume(id))
                .map(ResponseEntity::ok);
    }

    // ========================================
    // 반복 스케줄
    // ========================================

    @GetMapping("/schedules")
    public Mono<ResponseEntity<List<CrawlSchedule>>> listSchedules() {
        return async(crawlScheduleService::list)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/schedules")
    public Mono<ResponseEntity<CrawlSchedule>> createSchedule(@Valid @RequestBody CrawlScheduleRequest request) {
        return async(() -> crawlScheduleService.create(request))
                .map(schedule -> ResponseEntity.status(HttpStatus.CREATED).body(schedule));
    }

    @PatchMapping("/schedules/{id}")
    public Mono<ResponseEntity<CrawlSchedule>> setScheduleEnabled(
            @PathVariable Long id,
            @RequestParam boolean enabled) {
        return async(() -> crawlScheduleService.setEnabled(id, enabled))
                .map(ResponseEntity::ok);
    }

    private ResponseEntity<Map<String, String>> accepted(String jobId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }
}
