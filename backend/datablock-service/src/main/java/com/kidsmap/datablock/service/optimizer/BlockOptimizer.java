package com.kidsmap.datablock.service.optimizer;

import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.optimizer.CacheWarmResult;
import com.kidsmap.datablock.dto.optimizer.DeduplicationResult;
import com.kidsmap.datablock.dto.optimizer.IndexOptimizationResult;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationRequest;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationResult;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentBlock;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.entity.QualityGrade;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.repository.PlaceBlockRepository;
import com.kidsmap.datablock.service.block.BlockCache;
import com.kidsmap.datablock.service.block.ContentBlockService;
import com.kidsmap.datablock.service.block.PlaceBlockService;
import com.kidsmap.datablock.service.quality.BlockQualityEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 블록 저장소 유지보수.
 * 상태 변경은 모두 PlaceBlockService 의 updateStatus / mergeRelatedContent 를 거친다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockOptimizer {

    static final List<String> BLOCK_TABLES = List.of("kidsmap_place_blocks", "kidsmap_content_blocks");

    private static final int SCAN_PAGE_SIZE = 500;

    private static final Comparator<PlaceBlock> SURVIVOR_ORDER = Comparator
            .comparing((PlaceBlock block) -> block.getCompleteness() != null ? block.getCompleteness() : 0)
            .thenComparing(block -> block.getUpdatedAt() != null ? block.getUpdatedAt() : LocalDateTime.MIN)
            .reversed();

    private final PlaceBlockRepository placeBlockRepository;
    private final ContentBlockRepository contentBlockRepository;
    private final PlaceBlockService placeBlockService;
    private final ContentBlockService contentBlockService;
    private final BlockQualityEngine qualityEngine;
    private final BlockCache blockCache;
    private final JdbcTemplate jdbcTemplate;

    // ========================================
    // 품질 기반 정리
    // ========================================

    /**
     * archiveGrades 에 해당하는 활성 장소 블록을 ARCHIVED 로 전이한다.
     * refreshStale 이면 STALE/OUTDATED 활성 블록 수를 함께 센다 (작업 등록은 하지 않음).
     */
    public QualityOptimizationResult optimizeByQuality(QualityOptimizationRequest request) {
        List<QualityGrade> grades = request.getArchiveGrades() != null ? request.getArchiveGrades() : List.of();

        int archived = 0;
        if (!grades.isEmpty()) {
            for (PlaceBlock block : placeBlockRepository.findByStatusAndQualityGradeIn(BlockStatus.ACTIVE, grades)) {
                placeBlockService.updateStatus(block.getId(), BlockStatus.ARCHIVED);
                archived++;
            }
        }

        long scheduledRefresh = 0;
        if (Boolean.TRUE.equals(request.getRefreshStale())) {
            scheduledRefresh = placeBlockRepository.countByStatusAndFreshnessIn(
                    BlockStatus.ACTIVE, EnumSet.of(Freshness.STALE, Freshness.OUTDATED));
        }

        log.info("[Optimizer] Quality optimization: archived={} (grades={}), refreshCandidates={}",
                archived, grades, scheduledRefresh);
        return new QualityOptimizationResult(archived, scheduledRefresh);
    }

    // ========================================
    // 중복 병합
    // ========================================

    /**
     * 활성 장소의 해시를 페이로드에서 다시 계산해 같은 해시끼리 묶는다.
     * 그룹마다 완성도가 높고 최근 갱신된 블록 하나를 남기고, 나머지의 연관 콘텐츠를 합친 뒤 DELETED 로 전이한다.
     */
    public DeduplicationResult deduplicateBlocks() {
        Map<String, List<PlaceBlock>> groups = new LinkedHashMap<>();
        int rehashed = 0;

        int pageIndex = 0;
        Page<PlaceBlock> page;
        do {
            page = placeBlockRepository.findByStatus(BlockStatus.ACTIVE,
                    PageRequest.of(pageIndex++, SCAN_PAGE_SIZE, Sort.by("id")));
            for (PlaceBlock block : page.getContent()) {
                String hash = recomputeHash(block);
                if (!hash.equals(block.getDedupeHash())) {
                    rehashed++;
                }
                groups.computeIfAbsent(hash, key -> new ArrayList<>()).add(block);
            }
        } while (page.hasNext());

        int merged = 0;
        int deleted = 0;
        for (List<PlaceBlock> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(SURVIVOR_ORDER);
            PlaceBlock survivor = group.get(0);
            List<String> absorbedContent = new ArrayList<>();

            for (PlaceBlock duplicate : group.subList(1, group.size())) {
                if (duplicate.getRelatedContentIds() != null) {
                    absorbedContent.addAll(duplicate.getRelatedContentIds());
                }
                placeBlockService.updateStatus(duplicate.getId(), BlockStatus.DELETED);
                deleted++;
            }
            placeBlockService.mergeRelatedContent(survivor.getId(), absorbedContent);
            merged++;
            log.debug("Merged {} duplicates into place block {}", group.size() - 1, survivor.getId());
        }

        log.info("[Optimizer] Deduplication: merged={}, deleted={}, staleHashes={}", merged, deleted, rehashed);
        return new DeduplicationResult(merged, deleted);
    }

    private String recomputeHash(PlaceBlock block) {
        try {
            NormalizedPlace place = placeBlockService.decode(block);
            return qualityEngine.placeDedupeHash(place);
        } catch (RuntimeException e) {
            log.warn("[Optimizer] Could not decode place block {}, keeping stored hash: {}", block.getId(), e.getMessage());
            return block.getDedupeHash();
        }
    }

    // ========================================
    // 인덱스 / 캐시
    // ========================================

    /**
     * PostgreSQL 이면 블록 테이블에 VACUUM ANALYZE 를 실행한다. 다른 DB 에서는 아무 것도 하지 않는다.
     */
    public IndexOptimizationResult optimizeIndexes() {
        String product;
        try {
            product = jdbcTemplate.execute((ConnectionCallback<String>) connection ->
                    connection.getMetaData().getDatabaseProductName());
        } catch (DataAccessException e) {
            log.warn("[Optimizer] Could not determine database product: {}", e.getMessage());
            return new IndexOptimizationResult(false, List.of(), "Database unavailable: " + e.getMessage());
        }

        if (product == null || !product.toLowerCase().contains("postgres")) {
            log.info("[Optimizer] Index optimization skipped on {}", product);
            return new IndexOptimizationResult(false, List.of(), "Not supported on " + product);
        }

        List<String> done = new ArrayList<>();
        for (String table : BLOCK_TABLES) {
            try {
                jdbcTemplate.execute("VACUUM ANALYZE " + table);
                done.add(table);
            } catch (DataAccessException e) {
                log.warn("[Optimizer] VACUUM ANALYZE {} failed: {}", table, e.getMessage());
            }
        }
        log.info("[Optimizer] VACUUM ANALYZE completed on {}", done);
        return new IndexOptimizationResult(!done.isEmpty(), done,
                done.size() == BLOCK_TABLES.size() ? "VACUUM ANALYZE completed" : "VACUUM ANALYZE partially completed");
    }

    /**
     * 완성도 상위 장소와 최근 게시 콘텐츠를 캐시에 미리 올린다
     */
    public CacheWarmResult warmCache(int topPlaces, int recentContents) {
        int cachedPlaces = 0;
        if (topPlaces > 0) {
            for (PlaceBlock block : placeBlockRepository.findByStatus(BlockStatus.ACTIVE,
                    PageRequest.of(0, topPlaces, Sort.by(Sort.Direction.DESC, "completeness")))) {
                blockCache.putPlace(placeBlockService.toDto(block));
                cachedPlaces++;
            }
        }

        int cachedContents = 0;
        if (recentContents > 0) {
            for (ContentBlock block : contentBlockRepository.findByStatus(BlockStatus.ACTIVE,
                    PageRequest.of(0, recentContents, Sort.by(Sort.Direction.DESC, "publishedAt")))) {
                blockCache.putContent(contentBlockService.toDto(block));
                cachedContents++;
            }
        }

        log.info("[Optimizer] Cache warmed: places={}, contents={}", cachedPlaces, cachedContents);
        return new CacheWarmResult(cachedPlaces, cachedContents);
    }

    public CacheWarmResult warmCache() {
        return warmCache(100, 50);
    }
}
