package com.kidsmap.datablock.scheduler;

import com.kidsmap.datablock.dto.crawl.QueueStats;
import com.kidsmap.datablock.dto.monitor.Alert;
import com.kidsmap.datablock.dto.monitor.AlertLevel;
import com.kidsmap.datablock.service.block.BlockStatsService;
import com.kidsmap.datablock.service.block.ContentBlockService;
import com.kidsmap.datablock.service.block.PlaceBlockService;
import com.kidsmap.datablock.service.crawl.CrawlJobDispatcher;
import com.kidsmap.datablock.service.crawl.CrawlJobService;
import com.kidsmap.datablock.service.crawl.CrawlScheduleService;
import com.kidsmap.datablock.service.monitor.BlockMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 데이터 블록 백그라운드 작업 스케줄러.
 *
 * 크롤링 큐 분배, 멈춘 작업 복구, 반복 스케줄 실행, 신선도/통계 갱신, 상태 로깅을 담당한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "datablock.scheduler.enabled", havingValue = "true", matchIfMissing = false)
public class DataBlockScheduler {

    private final CrawlJobDispatcher crawlJobDispatcher;
    private final CrawlJobService crawlJobService;
    private final CrawlScheduleService crawlScheduleService;
    private final PlaceBlockService placeBlockService;
    private final ContentBlockService contentBlockService;
    private final BlockStatsService blockStatsService;
    private final BlockMonitor blockMonitor;

    // ========================================
    // 크롤링 큐
    // ========================================

    /**
     * 대기 작업을 빈 워커에 분배
     */
    @Scheduled(fixedDelayString = "${datablock.crawl.poll-interval-ms:5000}")
    public void dispatchPendingJobs() {
        try {
            int dispatched = crawlJobDispatcher.dispatch();
            if (dispatched > 0) {
                log.info("[CrawlQueue] Dispatched {} jobs", dispatched);
            }
        } catch (Exception e) {
            log.error("[CrawlQueue] Error dispatching jobs: {}", e.getMessage(), e);
        }
    }

    /**
     * 멈춘 작업 복구 (5분마다)
     */
    @Scheduled(fixedDelayString = "${datablock.scheduler.recovery-interval-ms:300000}")
    public void recoverStuckJobs() {
        try {
            crawlJobService.recoverStuckJobs();
        } catch (Exception e) {
            log.error("[CrawlQueue] Error recovering stuck jobs: {}", e.getMessage(), e);
        }
    }

    /**
     * 반복 스케줄 실행 (1분마다)
     */
    @Scheduled(cron = "${datablock.scheduler.schedule-cron:0 * * * * *}")
    public void fireDueSchedules() {
        try {
            int fired = crawlScheduleService.fireDueSchedules();
            if (fired > 0) {
                log.info("[CrawlQueue] Fired {} recurring schedules", fired);
            }
        } catch (Exception e) {
            log.error("[CrawlQueue] Error firing schedules: {}", e.getMessage(), e);
        }
    }

    // ========================================
    // 신선도 / 통계
    // ========================================

    /**
     * 신선도 재계산 후 통계 스냅샷 갱신 (10분마다)
     */
    @Scheduled(fixedDelayString = "${datablock.crawl.stats-refresh-interval-ms:600000}")
    public void refreshFreshnessAndStats() {
        try {
            int places = placeBlockService.refreshFreshness();
            int contents = contentBlockService.refreshFreshness();
            log.info("[Monitor] Freshness refreshed: places={}, contents={}", places, contents);
            blockStatsService.refreshStats();
        } catch (Exception e) {
            log.error("[Monitor] Error refreshing freshness/stats: {}", e.getMessage(), e);
        }
    }

    /**
     * 큐 상태와 알림 로깅 (10분마다)
     */
    @Scheduled(fixedDelayString = "${datablock.scheduler.stats-interval-ms:600000}")
    public void logQueueStatsAndAlerts() {
        try {
            QueueStats stats = crawlJobService.queueStats();
            log.info("[CrawlQueue Stats] waiting={}, delayed={}, active={}, completed={}, failed={}, cancelled={}, paused={}, " +
                            "sessionDispatched={}, sessionCompleted={}, sessionFailed={}",
                    stats.getWaiting(), stats.getDelayed(), stats.getActive(), stats.getCompleted(), stats.getFailed(),
                    stats.getCancelled(), stats.getPaused(),
                    stats.getSessionDispatched(), stats.getSessionCompleted(), stats.getSessionFailed());

            List<Alert> alerts = blockMonitor.checkAlerts();
            for (Alert alert : alerts) {
                if (alert.level() == AlertLevel.CRITICAL) {
                    log.error("[Monitor] {} {}", alert.code(), alert.message());
                } else {
                    log.warn("[Monitor] {} {}", alert.code(), alert.message());
                }
            }
        } catch (Exception e) {
            log.error("[Monitor] Error logging stats: {}", e.getMessage(), e);
        }
    }
}
