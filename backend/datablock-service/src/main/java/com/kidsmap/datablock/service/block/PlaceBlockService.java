package com.kidsmap.datablock.service.block;

import com.kidsmap.datablock.dto.block.BlockMetadata;
import com.kidsmap.datablock.dto.block.BulkUpsertResult;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.block.PageResponse;
import com.kidsmap.datablock.dto.block.PlaceBlockDto;
import com.kidsmap.datablock.dto.block.PlaceBlockFilter;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.DuplicateBlockException;
import com.kidsmap.datablock.repository.PlaceBlockRepository;
import com.kidsmap.datablock.repository.PlaceBlockSpecifications;
import com.kidsmap.datablock.service.quality.BlockQualityEngine;
import com.kidsmap.datablock.service.quality.QualityAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 장소 블록 저장소.
 *
 * dedupeHash 유일성은 생성 전 조회와 partial unique index 두 단계로 지킨다.
 * 동시 수정은 @Version 충돌 시 다시 읽어서 재적용한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlaceBlockService {

    static final int MAX_WRITE_ATTEMPTS = 3;
    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private static final Map<String, String> SORT_KEYS = Map.of(
            "createdAt", "createdAt",
            "updatedAt", "updatedAt",
            "completeness", "completeness",
            "qualityGrade", "qualityGrade",
            "name", "name"
    );

    private final PlaceBlockRepository placeBlockRepository;
    private final BlockQualityEngine qualityEngine;
    private final BlockPayloadCodec payloadCodec;
    private final BlockCache blockCache;

    // ========================================
    // 생성 / 수정
    // ========================================

    /**
     * 새 블록 생성. 삭제되지 않은 블록 중 같은 해시가 있으면 DuplicateBlockException.
     */
    public PlaceBlock create(NormalizedPlace place) {
        QualityAssessment assessment = qualityEngine.assessPlace(place);

        if (placeBlockRepository.findLiveByDedupeHash(assessment.dedupeHash()).isPresent()) {
            throw DuplicateBlockException.place(assessment.dedupeHash(), place.getName());
        }

        LocalDateTime now = LocalDateTime.now();
        PlaceBlock block = PlaceBlock.builder()
                .dedupeHash(assessment.dedupeHash())
                .completeness(assessment.completeness())
                .qualityGrade(assessment.grade())
                .status(BlockStatus.ACTIVE)
                .lastCrawledAt(now)
                .freshness(Freshness.FRESH)
                .crawlCount(1)
                .relatedContentIds(new ArrayList<>())
                .metadata(BlockMetadata.builder()
                        .source(place.getSource() != null ? place.getSource().name() : null)
                        .sourceId(place.getId())
                        .build())
                .build();
        applyPayload(block, place);

        try {
            PlaceBlock saved = placeBlockRepository.saveAndFlush(block);
            log.debug("Created place block: id={}, name={}, grade={}", saved.getId(), saved.getName(), saved.getQualityGrade());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 조회와 저장 사이에 다른 워커가 같은 해시를 먼저 저장한 경우
            throw new DuplicateBlockException(assessment.dedupeHash(),
                    "Duplicate place block (concurrent insert): " + place.getName(), e);
        }
    }

    /**
     * 얕은 병합 후 완성도/등급/키워드 재계산, crawlCount +1, metadata.version +1
     */
    public PlaceBlock update(UUID id, NormalizedPlace patch) {
        return applyChange(id, block -> {
            NormalizedPlace merged = payloadCodec.mergePlace(payloadCodec.decodePlace(block.getData()), patch);
            QualityAssessment assessment = qualityEngine.assessPlace(merged);

            if (!assessment.dedupeHash().equals(block.getDedupeHash())) {
                placeBlockRepository.findLiveByDedupeHash(assessment.dedupeHash())
                        .filter(other -> !other.getId().equals(block.getId()))
                        .ifPresent(other -> {
                            throw DuplicateBlockException.place(assessment.dedupeHash(), merged.getName());
                        });
                block.setDedupeHash(assessment.dedupeHash());
            }

            LocalDateTime now = LocalDateTime.now();
            applyPayload(block, merged);
            block.setCompleteness(assessment.completeness());
            block.setQualityGrade(assessment.grade());
            block.setLastCrawledAt(now);
            block.setFreshness(Freshness.of(now, now));
            block.setCrawlCount(block.getCrawlCount() + 1);
        });
    }

    public PlaceBlock updateStatus(UUID id, BlockStatus status) {
        return applyChange(id, block -> {
            if (block.getStatus() == BlockStatus.DELETED && status != BlockStatus.DELETED) {
                // 복구 시에도 해시 유일성 유지
                placeBlockRepository.findLiveByDedupeHash(block.getDedupeHash())
                        .filter(other -> !other.getId().equals(block.getId()))
                        .ifPresent(other -> {
                            throw DuplicateBlockException.place(block.getDedupeHash(), block.getName());
                        });
            }
            block.setStatus(status);
        });
    }

    /**
     * 콘텐츠 약한 참조 추가. 이미 연결되어 있으면 변경하지 않는다.
     */
    public PlaceBlock linkContent(UUID placeId, UUID contentId) {
        PlaceBlock current = placeBlockRepository.findById(placeId)
                .orElseThrow(() -> BlockNotFoundException.of("PlaceBlock", placeId));
        if (current.getRelatedContentIds() != null && current.getRelatedContentIds().contains(contentId.toString())) {
            return current;
        }
        return mergeRelatedContent(placeId, List.of(contentId.toString()));
    }

    /**
     * 연관 콘텐츠 ID 합집합으로 갱신 (중복 블록 병합 시 사용)
     */
    public PlaceBlock mergeRelatedContent(UUID placeId, Collection<String> contentIds) {
        return applyChange(placeId, block -> {
            Set<String> merged = new LinkedHashSet<>();
            if (block.getRelatedContentIds() != null) {
                merged.addAll(block.getRelatedContentIds());
            }
            merged.addAll(contentIds);
            block.setRelatedContentIds(new ArrayList<>(merged));
        });
    }

    /**
     * 변경 적용 + metadata.version 증가 + 저장. 낙관적 잠금 충돌 시 다시 읽어 재시도한다.
     */
    private PlaceBlock applyChange(UUID id, Consumer<PlaceBlock> change) {
        ObjectOptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            PlaceBlock block = placeBlockRepository.findById(id)
                    .orElseThrow(() -> BlockNotFoundException.of("PlaceBlock", id));
            change.accept(block);
            BlockMetadata metadata = block.getMetadata() != null ? block.getMetadata() : BlockMetadata.builder().version(0).build();
            block.setMetadata(metadata.nextVersion());
            try {
                PlaceBlock saved = placeBlockRepository.save(block);
                blockCache.evictPlace(id);
                return saved;
            } catch (ObjectOptimisticLockingFailureException e) {
                log.warn("Concurrent modification on place block {} (attempt {}/{})", id, attempt, MAX_WRITE_ATTEMPTS);
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    private void applyPayload(PlaceBlock block, NormalizedPlace place) {
        block.setData(payloadCodec.encodePlace(place));
        block.setName(place.getName());
        block.setCategory(place.getCategory());
        block.setAddress(place.getAddress());
        block.setRegionCode(qualityEngine.regionCode(place));
        block.setSigunguCode(place.getSigunguCode());
        block.setLatitude(place.getLatitude());
        block.setLongitude(place.getLongitude());
        block.setSearchKeywords(qualityEngine.searchKeywords(place));
    }

    // ========================================
    // 일괄 처리
    // ========================================

    /**
     * 레코드별로 생성/갱신/건너뛰기. 원자적이지 않으며 중간 실패 시 앞의 레코드는 이미 반영되어 있다.
     */
    public BulkUpsertResult bulkUpsert(List<NormalizedPlace> places, boolean skipDuplicates) {
        int created = 0;
        int updated = 0;
        int skipped = 0;

        for (NormalizedPlace place : places) {
            String hash = qualityEngine.placeDedupeHash(place);
            Optional<PlaceBlock> existing = placeBlockRepository.findLiveByDedupeHash(hash);
            if (existing.isPresent()) {
                if (skipDuplicates) {
                    skipped++;
                } else {
                    update(existing.get().getId(), place);
                    updated++;
                }
                continue;
            }
            try {
                create(place);
                created++;
            } catch (DuplicateBlockException e) {
                log.debug("Skipping concurrently inserted place: {}", place.getName());
                skipped++;
            }
        }

        log.info("Place bulk upsert: created={}, updated={}, skipped={}", created, updated, skipped);
        return new BulkUpsertResult(created, updated, skipped);
    }

    /**
     * 삭제되지 않은 블록의 신선도를 lastCrawledAt 기준으로 재계산
     */
    @Transactional
    public int refreshFreshness() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime sevenDaysAgo = now.minusDays(7);
        LocalDateTime thirtyDaysAgo = now.minusDays(30);
        LocalDateTime ninetyDaysAgo = now.minusDays(90);

        int changed = 0;
        changed += placeBlockRepository.updateFreshnessBetween(Freshness.FRESH, sevenDaysAgo, now.plusYears(100));
        changed += placeBlockRepository.updateFreshnessBetween(Freshness.RECENT, thirtyDaysAgo, sevenDaysAgo);
        changed += placeBlockRepository.updateFreshnessBetween(Freshness.STALE, ninetyDaysAgo, thirtyDaysAgo);
        changed += placeBlockRepository.markOutdated(ninetyDaysAgo);
        return changed;
    }

    // ========================================
    // 조회
    // ========================================

    public Optional<PlaceBlockDto> findById(UUID id) {
        PlaceBlockDto cached = blockCache.getPlace(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<PlaceBlockDto> loaded = placeBlockRepository.findById(id).map(this::toDto);
        loaded.ifPresent(blockCache::putPlace);
        return loaded;
    }

    public Optional<PlaceBlock> findEntity(UUID id) {
        return placeBlockRepository.findById(id);
    }

    /**
     * 삭제되지 않은 블록 중 해시가 같은 블록의 ID
     */
    public Optional<UUID> findLiveId(String dedupeHash) {
        return placeBlockRepository.findLiveByDedupeHash(dedupeHash).map(PlaceBlock::getId);
    }

    public Optional<PlaceBlockDto> findByDedupeHash(String dedupeHash) {
        return placeBlockRepository.findLiveByDedupeHash(dedupeHash).map(this::toDto);
    }

    public PageResponse<PlaceBlockDto> search(PlaceBlockFilter filter) {
        int page = filter.getPage() != null && filter.getPage() > 0 ? filter.getPage() : 1;
        int pageSize = filter.getPageSize() != null && filter.getPageSize() > 0
                ? Math.min(filter.getPageSize(), MAX_PAGE_SIZE) : DEFAULT_PAGE_SIZE;

        String sortKey = SORT_KEYS.getOrDefault(filter.getSortBy() != null ? filter.getSortBy() : "", "updatedAt");
        Sort.Direction direction = "asc".equalsIgnoreCase(filter.getSortDirection()) ? Sort.Direction.ASC : Sort.Direction.DESC;

        Page<PlaceBlock> result = placeBlockRepository.findAll(
                PlaceBlockSpecifications.from(filter),
                PageRequest.of(page - 1, pageSize, Sort.by(direction, sortKey)));
        return PageResponse.from(result, this::toDto);
    }

    public NormalizedPlace decode(PlaceBlock block) {
        return payloadCodec.decodePlace(block.getData());
    }

    public PlaceBlockDto toDto(PlaceBlock block) {
        return PlaceBlockDto.from(block, decode(block));
    }
}
