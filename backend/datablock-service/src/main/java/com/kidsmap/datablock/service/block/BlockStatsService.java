package com.kidsmap.datablock.service.block;

import com.kidsmap.datablock.dto.block.BlockStats;
import com.kidsmap.datablock.entity.BlockStatsSnapshot;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.QualityGrade;
import com.kidsmap.datablock.repository.BlockStatsSnapshotRepository;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.repository.PlaceBlockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 블록 집계 스냅샷 관리. 스냅샷은 삭제되지 않은 행의 group-by 결과로만 만든다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockStatsService {

    /** 스냅샷 보관 기간 */
    private static final int SNAPSHOT_RETENTION_DAYS = 7;

    private final PlaceBlockRepository placeBlockRepository;
    private final ContentBlockRepository contentBlockRepository;
    private final BlockStatsSnapshotRepository snapshotRepository;
    private final BlockCache blockCache;

    /**
     * 가장 최근 스냅샷. 없으면 새로 계산한다.
     */
    public BlockStats getStats() {
        BlockStats cached = blockCache.getStats();
        if (cached != null) {
            return cached;
        }
        return snapshotRepository.findFirstByOrderByComputedAtDesc()
                .map(BlockStatsSnapshot::getStats)
                .orElseGet(this::refreshStats);
    }

    @Transactional
    public BlockStats refreshStats() {
        LocalDateTime now = LocalDateTime.now();
        BlockStats stats = computeStats(now);

        snapshotRepository.save(BlockStatsSnapshot.builder()
                .stats(stats)
                .computedAt(now)
                .build());
        int purged = snapshotRepository.deleteOlderThan(now.minusDays(SNAPSHOT_RETENTION_DAYS));
        blockCache.putStats(stats);

        log.info("Block stats refreshed: places={}, contents={}, avgCompleteness={}, purgedSnapshots={}",
                stats.getTotalPlaces(), stats.getTotalContents(),
                String.format("%.1f", stats.getAverageCompleteness()), purged);
        return stats;
    }

    BlockStats computeStats(LocalDateTime now) {
        Map<String, Long> byStatus = toCountMap(placeBlockRepository.countGroupByStatus());
        Map<String, Long> qualityDistribution = new LinkedHashMap<>();
        for (QualityGrade grade : QualityGrade.values()) {
            qualityDistribution.put(grade.name(), 0L);
        }
        qualityDistribution.putAll(toCountMap(placeBlockRepository.countGroupByQualityGrade()));

        Map<String, Long> freshnessDistribution = new LinkedHashMap<>();
        for (Freshness freshness : Freshness.values()) {
            freshnessDistribution.put(freshness.name(), 0L);
        }
        freshnessDistribution.putAll(toCountMap(placeBlockRepository.countGroupByFreshness()));

        Double averageCompleteness = placeBlockRepository.averageCompleteness();

        return BlockStats.builder()
                .totalPlaces(placeBlockRepository.countByStatusNot(BlockStatus.DELETED))
                .totalContents(contentBlockRepository.countByStatusNot(BlockStatus.DELETED))
                .placesByStatus(byStatus)
                .placesByCategory(toCountMap(placeBlockRepository.countGroupByCategory()))
                .placesByRegion(toCountMap(placeBlockRepository.countGroupByRegion()))
                .contentsBySource(toCountMap(contentBlockRepository.countGroupBySource()))
                .qualityDistribution(qualityDistribution)
                .freshnessDistribution(freshnessDistribution)
                .averageCompleteness(averageCompleteness != null ? averageCompleteness : 0.0)
                .lastUpdated(now)
                .build();
    }

    private Map<String, Long> toCountMap(List<Object[]> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : rows) {
            String key = row[0] == null ? "UNKNOWN" : keyOf(row[0]);
            counts.merge(key, ((Number) row[1]).longValue(), Long::sum);
        }
        return counts;
    }

    private String keyOf(Object value) {
        return value instanceof Enum<?> ? ((Enum<?>) value).name() : value.toString();
    }
}
