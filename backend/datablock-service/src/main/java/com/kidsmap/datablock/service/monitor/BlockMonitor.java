package com.kidsmap.datablock.service.monitor;

import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.BlockStats;
import com.kidsmap.datablock.dto.monitor.Alert;
import com.kidsmap.datablock.dto.monitor.AlertLevel;
import com.kidsmap.datablock.dto.monitor.MonitoringMetrics;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.QualityGrade;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.repository.CrawlJobRepository;
import com.kidsmap.datablock.service.block.BlockStatsService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 블록 저장소 상태 모니터링.
 * 지표와 알림은 호출할 때마다 다시 계산하며 저장하지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockMonitor {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BlockStatsService blockStatsService;
    private final ContentBlockRepository contentBlockRepository;
    private final CrawlJobRepository crawlJobRepository;
    private final DataBlockProperties properties;
    private final MeterRegistry meterRegistry;

    private volatile double lastAvgQualityScore;
    private volatile long lastRecentErrors;

    @PostConstruct
    public void initMetrics() {
        Gauge.builder("datablock.monitor.avg_quality_score", this, monitor -> monitor.lastAvgQualityScore)
                .description("Grade-weighted average quality of place blocks (A=5 ... F=1)")
                .register(meterRegistry);

        Gauge.builder("datablock.monitor.recent_errors", this, monitor -> monitor.lastRecentErrors)
                .description("Failed jobs plus failed records within the error window")
                .register(meterRegistry);
    }

    // ========================================
    // 지표
    // ========================================

    public MonitoringMetrics getMetrics() {
        return computeMetrics(blockStatsService.getStats());
    }

    MonitoringMetrics computeMetrics(BlockStats stats) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime since = now.minusHours(properties.getMonitor().getErrorWindowHours());

        long completed = 0;
        long failed = 0;
        long failedRecords = 0;
        for (CrawlJob job : crawlJobRepository.findByStatusInAndCompletedAtAfter(
                EnumSet.of(CrawlJobStatus.COMPLETED, CrawlJobStatus.FAILED, CrawlJobStatus.CANCELLED), since)) {
            if (job.getStatus() == CrawlJobStatus.COMPLETED) {
                completed++;
            } else if (job.getStatus() == CrawlJobStatus.FAILED) {
                failed++;
            }
            if (job.getProgress() != null) {
                failedRecords += job.getProgress().getFailed();
            }
        }
        double successRate = completed + failed == 0 ? 1.0 : (double) completed / (completed + failed);

        Map<String, Long> storage = new LinkedHashMap<>();
        storage.put("places", stats.getTotalPlaces());
        storage.put("contents", stats.getTotalContents());

        long activePlaces = stats.getPlacesByStatus().getOrDefault(BlockStatus.ACTIVE.name(), 0L);
        double avgQuality = averageQualityScore(stats.getQualityDistribution());
        long recentErrors = failed + failedRecords;

        lastAvgQualityScore = avgQuality;
        lastRecentErrors = recentErrors;

        return MonitoringMetrics.builder()
                .totalBlocks(stats.getTotalPlaces() + stats.getTotalContents())
                .activeBlocks(activePlaces + contentBlockRepository.countByStatus(BlockStatus.ACTIVE))
                .avgQualityScore(avgQuality)
                .freshnessDistribution(new LinkedHashMap<>(stats.getFreshnessDistribution()))
                .crawlSuccessRate(successRate)
                .lastCrawlAt(crawlJobRepository.findFirstByCompletedAtIsNotNullOrderByCompletedAtDesc()
                        .map(CrawlJob::getCompletedAt)
                        .orElse(null))
                .storageUsage(storage)
                .recentErrors(recentErrors)
                .computedAt(now)
                .build();
    }

    /**
     * 등급별 개수로 가중 평균 점수를 낸다. 블록이 없으면 0
     */
    static double averageQualityScore(Map<String, Long> qualityDistribution) {
        long count = 0;
        long weighted = 0;
        for (QualityGrade grade : QualityGrade.values()) {
            long n = qualityDistribution.getOrDefault(grade.name(), 0L);
            count += n;
            weighted += n * grade.getScore();
        }
        return count == 0 ? 0.0 : (double) weighted / count;
    }

    // ========================================
    // 알림
    // ========================================

    public List<Alert> checkAlerts() {
        BlockStats stats = blockStatsService.getStats();
        return evaluateAlerts(stats, computeMetrics(stats));
    }

    List<Alert> evaluateAlerts(BlockStats stats, MonitoringMetrics metrics) {
        DataBlockProperties.Monitor thresholds = properties.getMonitor();
        List<Alert> alerts = new ArrayList<>();

        if (stats.getTotalPlaces() > 0) {
            if (metrics.getAvgQualityScore() < thresholds.getMinAvgQuality()) {
                alerts.add(new Alert(AlertLevel.WARNING, "LOW_QUALITY", String.format(Locale.ROOT,
                        "Average quality score %.2f is below %.2f", metrics.getAvgQualityScore(), thresholds.getMinAvgQuality())));
            }

            double staleRatio = staleRatio(stats);
            if (staleRatio > thresholds.getMaxStaleRatio()) {
                alerts.add(new Alert(AlertLevel.WARNING, "STALE_DATA", String.format(Locale.ROOT,
                        "%.1f%% of places are stale or outdated (limit %.1f%%)",
                        staleRatio * 100, thresholds.getMaxStaleRatio() * 100)));
            }
        }

        if (metrics.getRecentErrors() > thresholds.getMaxRecentErrors()) {
            alerts.add(new Alert(AlertLevel.CRITICAL, "HIGH_ERROR_COUNT", String.format(Locale.ROOT,
                    "%d crawl errors in the last %dh (limit %d)",
                    metrics.getRecentErrors(), thresholds.getErrorWindowHours(), thresholds.getMaxRecentErrors())));
        }
        return alerts;
    }

    static double staleRatio(BlockStats stats) {
        if (stats.getTotalPlaces() == 0) {
            return 0.0;
        }
        Map<String, Long> freshness = stats.getFreshnessDistribution();
        long stale = freshness.getOrDefault(Freshness.STALE.name(), 0L) + freshness.getOrDefault(Freshness.OUTDATED.name(), 0L);
        return (double) stale / stats.getTotalPlaces();
    }

    // ========================================
    // 리포트
    // ========================================

    public String generateReport() {
        BlockStats stats = blockStatsService.getStats();
        MonitoringMetrics metrics = computeMetrics(stats);
        List<Alert> alerts = evaluateAlerts(stats, metrics);
        return renderReport(stats, metrics, alerts);
    }

    String renderReport(BlockStats stats, MonitoringMetrics metrics, List<Alert> alerts) {
        StringBuilder md = new StringBuilder();
        md.append("# KidsMap Data Block Report\n\n");
        md.append("Generated at ").append(TIMESTAMP.format(metrics.getComputedAt())).append("\n\n");

        md.append("## Overview\n\n");
        md.append("| Metric | Value |\n|---|---|\n");
        md.append("| Places | ").append(stats.getTotalPlaces()).append(" |\n");
        md.append("| Contents | ").append(stats.getTotalContents()).append(" |\n");
        md.append("| Active blocks | ").append(metrics.getActiveBlocks()).append(" |\n");
        md.append("| Average completeness | ").append(String.format(Locale.ROOT, "%.1f", stats.getAverageCompleteness())).append(" |\n");
        md.append("| Average quality score | ").append(String.format(Locale.ROOT, "%.2f", metrics.getAvgQualityScore())).append(" |\n\n");

        md.append("## Quality Distribution\n\n");
        appendTable(md, "Grade", stats.getQualityDistribution(), Integer.MAX_VALUE);

        md.append("## Freshness\n\n");
        appendTable(md, "Freshness", stats.getFreshnessDistribution(), Integer.MAX_VALUE);

        md.append("## Categories\n\n");
        appendTable(md, "Category", sortedByCount(stats.getPlacesByCategory()), Integer.MAX_VALUE);

        md.append("## Top Regions\n\n");
        appendTable(md, "Region", sortedByCount(stats.getPlacesByRegion()), 10);

        md.append("## Crawl Health\n\n");
        md.append("- Success rate: ").append(String.format(Locale.ROOT, "%.1f%%", metrics.getCrawlSuccessRate() * 100)).append('\n');
        md.append("- Recent errors (").append(properties.getMonitor().getErrorWindowHours()).append("h): ")
                .append(metrics.getRecentErrors()).append('\n');
        md.append("- Last crawl: ")
                .append(metrics.getLastCrawlAt() != null ? TIMESTAMP.format(metrics.getLastCrawlAt()) : "never")
                .append("\n\n");

        md.append("## Alerts\n\n");
        if (alerts.isEmpty()) {
            md.append("No active alerts.\n");
        } else {
            for (Alert alert : alerts) {
                md.append("- **").append(alert.level()).append("** `").append(alert.code()).append("`: ")
                        .append(alert.message()).append('\n');
            }
        }
        return md.toString();
    }

    private static void appendTable(StringBuilder md, String header, Map<String, Long> rows, int limit) {
        md.append("| ").append(header).append(" | Count |\n|---|---|\n");
        int written = 0;
        for (Map.Entry<String, Long> row : rows.entrySet()) {
            if (written++ >= limit) {
                break;
            }
            md.append("| ").append(row.getKey()).append(" | ").append(row.getValue()).append(" |\n");
        }
        md.append('\n');
    }

    private static Map<String, Long> sortedByCount(Map<String, Long> counts) {
        Map<String, Long> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }
}
