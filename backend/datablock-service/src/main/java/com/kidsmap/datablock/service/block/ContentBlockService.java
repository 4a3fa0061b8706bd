package com.kidsmap.datablock.service.block;

import com.kidsmap.datablock.dto.block.BlockMetadata;
import com.kidsmap.datablock.dto.block.BulkUpsertResult;
import com.kidsmap.datablock.dto.block.ContentBlockDto;
import com.kidsmap.datablock.dto.block.ContentBlockFilter;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.PageResponse;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentBlock;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.DuplicateBlockException;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.repository.ContentBlockSpecifications;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 콘텐츠 블록 저장소. 식별 기준은 (source, sourceUrl).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentBlockService {

    private static final int MAX_WRITE_ATTEMPTS = 3;
    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private static final Map<String, String> SORT_KEYS = Map.of(
            "createdAt", "createdAt",
            "publishedAt", "publishedAt",
            "viewCount", "viewCount",
            "likeCount", "likeCount"
    );

    private final ContentBlockRepository contentBlockRepository;
    private final BlockQualityEngine qualityEngine;
    private final BlockPayloadCodec payloadCodec;
    private final BlockCache blockCache;

    public ContentBlock create(NormalizedContent content) {
        return create(content, null);
    }

    public ContentBlock create(NormalizedContent content, UUID relatedPlaceId) {
        QualityAssessment assessment = qualityEngine.assessContent(content);

        if (contentBlockRepository.findLiveByDedupeHash(assessment.dedupeHash()).isPresent()) {
            throw DuplicateBlockException.content(assessment.dedupeHash(), content.getTitle());
        }

        LocalDateTime now = LocalDateTime.now();
        ContentBlock block = ContentBlock.builder()
                .dedupeHash(assessment.dedupeHash())
                .completeness(assessment.completeness())
                .qualityGrade(assessment.grade())
                .status(BlockStatus.ACTIVE)
                .freshness(Freshness.FRESH)
                .lastCrawledAt(now)
                .crawlCount(1)
                .relatedPlaceId(relatedPlaceId)
                .metadata(BlockMetadata.builder()
                        .source(content.getSource() != null ? content.getSource().name() : null)
                        .sourceId(content.getId())
                        .build())
                .build();
        applyPayload(block, content);

        try {
            ContentBlock saved = contentBlockRepository.saveAndFlush(block);
            log.debug("Created content block: id={}, source={}, grade={}", saved.getId(), saved.getSource(), saved.getQualityGrade());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateBlockException(assessment.dedupeHash(),
                    "Duplicate content block (concurrent insert): " + content.getTitle(), e);
        }
    }

    public ContentBlock update(UUID id, NormalizedContent patch) {
        return applyChange(id, block -> {
            NormalizedContent merged = payloadCodec.mergeContent(payloadCodec.decodeContent(block.getData()), patch);
            QualityAssessment assessment = qualityEngine.assessContent(merged);

            if (!assessment.dedupeHash().equals(block.getDedupeHash())) {
                contentBlockRepository.findLiveByDedupeHash(assessment.dedupeHash())
                        .filter(other -> !other.getId().equals(block.getId()))
                        .ifPresent(other -> {
                            throw DuplicateBlockException.content(assessment.dedupeHash(), merged.getTitle());
                        });
                block.setDedupeHash(assessment.dedupeHash());
            }

            LocalDateTime now = LocalDateTime.now();
            applyPayload(block, merged);
            block.setCompleteness(assessment.completeness());
            block.setQualityGrade(assessment.grade());
            block.setLastCrawledAt(now);
            block.setFreshness(Freshness.FRESH);
            block.setCrawlCount(block.getCrawlCount() + 1);
        });
    }

    public ContentBlock updateStatus(UUID id, BlockStatus status) {
        return applyChange(id, block -> {
            if (block.getStatus() == BlockStatus.DELETED && status != BlockStatus.DELETED) {
                contentBlockRepository.findLiveByDedupeHash(block.getDedupeHash())
                        .filter(other -> !other.getId().equals(block.getId()))
                        .ifPresent(other -> {
                            throw DuplicateBlockException.content(block.getDedupeHash(), block.getTitle());
                        });
            }
            block.setStatus(status);
        });
    }

    private ContentBlock applyChange(UUID id, Consumer<ContentBlock> change) {
        ObjectOptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            ContentBlock block = contentBlockRepository.findById(id)
                    .orElseThrow(() -> BlockNotFoundException.of("ContentBlock", id));
            change.accept(block);
            BlockMetadata metadata = block.getMetadata() != null ? block.getMetadata() : BlockMetadata.builder().version(0).build();
            block.setMetadata(metadata.nextVersion());
            try {
                ContentBlock saved = contentBlockRepository.save(block);
                blockCache.evictContent(id);
                return saved;
            } catch (ObjectOptimisticLockingFailureException e) {
                log.warn("Concurrent modification on content block {} (attempt {}/{})", id, attempt, MAX_WRITE_ATTEMPTS);
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    private void applyPayload(ContentBlock block, NormalizedContent content) {
        block.setData(payloadCodec.encodeContent(content));
        block.setTitle(content.getTitle());
        block.setSource(content.getSource());
        block.setSourceId(content.getId());
        block.setContentType(content.getType());
        block.setAuthor(content.getAuthor());
        block.setPublishedAt(content.getPublishedAt());
        block.setViewCount(content.getViewCount() != null ? content.getViewCount() : 0L);
        block.setLikeCount(content.getLikeCount() != null ? content.getLikeCount() : 0L);
    }

    /**
     * 레코드 단위로 적용되는 비원자적 일괄 반영
     */
    public BulkUpsertResult bulkUpsert(List<NormalizedContent> contents, boolean skipDuplicates) {
        int created = 0;
        int updated = 0;
        int skipped = 0;

        for (NormalizedContent content : contents) {
            String hash = qualityEngine.contentDedupeHash(content);
            Optional<ContentBlock> existing = contentBlockRepository.findLiveByDedupeHash(hash);
            if (existing.isPresent()) {
                if (skipDuplicates) {
                    skipped++;
                } else {
                    update(existing.get().getId(), content);
                    updated++;
                }
                continue;
            }
            try {
                create(content);
                created++;
            } catch (DuplicateBlockException e) {
                log.debug("Skipping concurrently inserted content: {}", content.getTitle());
                skipped++;
            }
        }

        log.info("Content bulk upsert: created={}, updated={}, skipped={}", created, updated, skipped);
        return new BulkUpsertResult(created, updated, skipped);
    }

    @Transactional
    public int refreshFreshness() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime sevenDaysAgo = now.minusDays(7);
        LocalDateTime thirtyDaysAgo = now.minusDays(30);
        LocalDateTime ninetyDaysAgo = now.minusDays(90);

        int changed = 0;
        changed += contentBlockRepository.updateFreshnessBetween(Freshness.FRESH, sevenDaysAgo, now.plusYears(100));
        changed += contentBlockRepository.updateFreshnessBetween(Freshness.RECENT, thirtyDaysAgo, sevenDaysAgo);
        changed += contentBlockRepository.updateFreshnessBetween(Freshness.STALE, ninetyDaysAgo, thirtyDaysAgo);
        changed += contentBlockRepository.markOutdated(ninetyDaysAgo);
        return changed;
    }

    // ========================================
    // 조회
    // ========================================

    public Optional<ContentBlockDto> findById(UUID id) {
        ContentBlockDto cached = blockCache.getContent(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ContentBlockDto> loaded = contentBlockRepository.findById(id).map(this::toDto);
        loaded.ifPresent(blockCache::putContent);
        return loaded;
    }

    /**
     * 삭제되지 않은 블록 중 해시가 같은 블록의 ID
     */
    public Optional<UUID> findLiveId(String dedupeHash) {
        return contentBlockRepository.findLiveByDedupeHash(dedupeHash).map(ContentBlock::getId);
    }

    public Optional<ContentBlockDto> findByDedupeHash(String dedupeHash) {
        return contentBlockRepository.findLiveByDedupeHash(dedupeHash).map(this::toDto);
    }

    /**
     * 장소에 연결된 활성 콘텐츠 (최신 게시순)
     */
    public List<ContentBlockDto> findByPlaceId(UUID placeId) {
        return contentBlockRepository.findByRelatedPlaceIdAndStatusOrderByPublishedAtDesc(placeId, BlockStatus.ACTIVE)
                .stream()
                .map(this::toDto)
                .toList();
    }

    public PageResponse<ContentBlockDto> search(ContentBlockFilter filter) {
        int page = filter.getPage() != null && filter.getPage() > 0 ? filter.getPage() : 1;
        int pageSize = filter.getPageSize() != null && filter.getPageSize() > 0
                ? Math.min(filter.getPageSize(), MAX_PAGE_SIZE) : DEFAULT_PAGE_SIZE;

        String sortKey = SORT_KEYS.getOrDefault(filter.getSortBy() != null ? filter.getSortBy() : "", "publishedAt");
        Sort.Direction direction = "asc".equalsIgnoreCase(filter.getSortDirection()) ? Sort.Direction.ASC : Sort.Direction.DESC;

        Page<ContentBlock> result = contentBlockRepository.findAll(
                ContentBlockSpecifications.from(filter),
                PageRequest.of(page - 1, pageSize, Sort.by(direction, sortKey)));
        return PageResponse.from(result, this::toDto);
    }

    public NormalizedContent decode(ContentBlock block) {
        return payloadCodec.decodeContent(block.getData());
    }

    public ContentBlockDto toDto(ContentBlock block) {
        return ContentBlockDto.from(block, decode(block));
    }
}
