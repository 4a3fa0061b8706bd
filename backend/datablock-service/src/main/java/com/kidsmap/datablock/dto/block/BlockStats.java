package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 블록 집계 통계 (삭제되지 않은 블록 기준)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlockStats implements Serializable {

    private long totalPlaces;

    private long totalContents;

    @Builder.Default
    private Map<String, Long> placesByStatus = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> placesByCategory = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> placesByRegion = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> contentsBySource = new LinkedHashMap<>();

    /** 등급(A-F)별 장소 수 */
    @Builder.Default
    private Map<String, Long> qualityDistribution = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> freshnessDistribution = new LinkedHashMap<>();

    private double averageCompleteness;

    private LocalDateTime lastUpdated;
}
