package com.kidsmap.datablock.dto.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringMetrics {

    private long totalBlocks;

    private long activeBlocks;

    /** 등급 점수(A=5 ... F=1) 가중 평균 */
    private double avgQualityScore;

    @Builder.Default
    private Map<String, Long> freshnessDistribution = new LinkedHashMap<>();

    /** 0.0 - 1.0 */
    private double crawlSuccessRate;

    private LocalDateTime lastCrawlAt;

    /** places / contents 행 수 */
    @Builder.Default
    private Map<String, Long> storageUsage = new LinkedHashMap<>();

    private long recentErrors;

    private LocalDateTime computedAt;
}
