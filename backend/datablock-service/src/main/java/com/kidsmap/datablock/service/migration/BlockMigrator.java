package com.kidsmap.datablock.service.migration;

import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.ContentBlockFilter;
import com.kidsmap.datablock.dto.block.PlaceBlockFilter;
import com.kidsmap.datablock.dto.migration.MigrationConfig;
import com.kidsmap.datablock.dto.migration.MigrationFilter;
import com.kidsmap.datablock.dto.migration.MigrationResult;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentBlock;
import com.kidsmap.datablock.entity.MigrationCheckpoint;
import com.kidsmap.datablock.entity.MigrationCheckpointStatus;
import com.kidsmap.datablock.entity.MigrationTargetType;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.ConfigurationException;
import com.kidsmap.datablock.exception.InvalidTransitionException;
import com.kidsmap.datablock.exception.MigrationValidationMismatchException;
import com.kidsmap.datablock.exception.ValidationException;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.repository.ContentBlockSpecifications;
import com.kidsmap.datablock.repository.MigrationCheckpointRepository;
import com.kidsmap.datablock.repository.PlaceBlockRepository;
import com.kidsmap.datablock.repository.PlaceBlockSpecifications;
import com.kidsmap.datablock.service.block.ContentBlockService;
import com.kidsmap.datablock.service.block.PlaceBlockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * 활성 블록을 다른 저장소로 옮긴다.
 *
 * 1. 체크포인트 생성 (선택)
 * 2. id 순 페이지 단위 전송
 * 3. 대상 저장소 재집계로 검증 (선택)
 * 배치 하나가 실패하면 그 자리에서 멈추고, 이미 옮긴 데이터는 자동으로 되돌리지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlockMigrator {

    static final String PLACES = "places";
    static final String CONTENTS = "contents";

    private final PlaceBlockRepository placeBlockRepository;
    private final ContentBlockRepository contentBlockRepository;
    private final PlaceBlockService placeBlockService;
    private final ContentBlockService contentBlockService;
    private final MigrationCheckpointRepository checkpointRepository;
    private final List<MigrationTarget> targets;
    private final DataBlockProperties properties;

    public MigrationResult migratePlaces(MigrationConfig config, MigrationFilter filter) {
        PlaceBlockFilter.PlaceBlockFilterBuilder placeFilter = PlaceBlockFilter.builder()
                .statuses(List.of(BlockStatus.ACTIVE));
        if (filter != null) {
            placeFilter.regionCodes(filter.getRegionCodes()).categories(filter.getCategories());
        }
        Specification<PlaceBlock> spec = PlaceBlockSpecifications.from(placeFilter.build());

        return migrate(PLACES, config,
                () -> placeBlockRepository.count(spec),
                pageable -> placeBlockRepository.findAll(spec, pageable)
                        .map(block -> new MigrationRecord(block.getId(), block.getDedupeHash(), placeBlockService.toDto(block))));
    }

    public MigrationResult migrateContents(MigrationConfig config) {
        Specification<ContentBlock> spec = ContentBlockSpecifications.from(ContentBlockFilter.builder()
                .statuses(List.of(BlockStatus.ACTIVE))
                .build());

        return migrate(CONTENTS, config,
                () -> contentBlockRepository.count(spec),
                pageable -> contentBlockRepository.findAll(spec, pageable)
                        .map(block -> new MigrationRecord(block.getId(), block.getDedupeHash(), contentBlockService.toDto(block))));
    }

    // ========================================
    // 실행
    // ========================================

    private MigrationResult migrate(String blockType,
                                    MigrationConfig config,
                                    LongSupplier counter,
                                    Function<Pageable, Page<MigrationRecord>> reader) {
        if (config == null || config.getTarget() == null) {
            throw new ValidationException("migration target is required");
        }
        int batchSize = config.getBatchSize() != null ? config.getBatchSize() : properties.getMigration().getBatchSize();
        if (batchSize < 1) {
            throw new ValidationException("batchSize must be >= 1");
        }

        long startTime = System.currentTimeMillis();
        MigrationResult result = MigrationResult.builder().dryRun(config.isDryRun()).build();

        if (config.isDryRun()) {
            result.setMigrated(counter.getAsLong());
            result.setDuration(System.currentTimeMillis() - startTime);
            log.info("[Migration] Dry run {} → {}: {} records would be migrated",
                    blockType, config.getTarget(), result.getMigrated());
            return result;
        }

        MigrationTarget target = resolveTarget(config.getTarget());
        MigrationCheckpoint checkpoint = MigrationCheckpoint.builder()
                .id("rollback_" + blockType + "_" + System.currentTimeMillis())
                .blockType(blockType)
                .target(config.getTarget())
                .status(MigrationCheckpointStatus.IN_PROGRESS)
                .build();
        boolean keepCheckpoint = config.isCreateRollbackPoint();
        if (keepCheckpoint) {
            checkpoint = checkpointRepository.save(checkpoint);
            result.setRollbackPointId(checkpoint.getId());
        }

        long migrated = 0;
        int batchIndex = 0;
        Page<MigrationRecord> page;
        do {
            page = reader.apply(PageRequest.of(batchIndex, batchSize, Sort.by("id")));
            List<MigrationRecord> records = page.getContent();
            if (records.isEmpty()) {
                break;
            }
            try {
                target.writeBatch(checkpoint, blockType, records, batchIndex);
            } catch (Exception e) {
                log.error("[Migration] Batch {} of {} failed after {} migrated: {}", batchIndex, blockType, migrated, e.getMessage(), e);
                result.setFailed(records.size());
                result.getErrors().add("Batch " + batchIndex + " failed: " + e.getMessage());
                checkpoint.setStatus(MigrationCheckpointStatus.FAILED);
                checkpoint.setErrorMessage(e.getMessage());
                checkpoint.setMigratedCount(migrated);
                if (keepCheckpoint) {
                    checkpointRepository.save(checkpoint);
                }
                result.setMigrated(migrated);
                result.setDuration(System.currentTimeMillis() - startTime);
                return result;
            }
            migrated += records.size();
            checkpoint.setMigratedCount(migrated);
            if (keepCheckpoint) {
                checkpoint = checkpointRepository.save(checkpoint);
            }
            batchIndex++;
        } while (page.hasNext());

        result.setMigrated(migrated);
        checkpoint.setStatus(MigrationCheckpointStatus.COMPLETED);
        checkpoint.setCompletedAt(LocalDateTime.now());
        if (keepCheckpoint) {
            checkpointRepository.save(checkpoint);
        }

        if (config.isValidateAfterMigration()) {
            try {
                validate(target, checkpoint, blockType, migrated);
                result.setValidated(true);
            } catch (MigrationValidationMismatchException e) {
                log.warn("[Migration] {}", e.getMessage());
                result.getErrors().add(e.getMessage());
            }
        }

        result.setDuration(System.currentTimeMillis() - startTime);
        log.info("[Migration] {} → {} finished: migrated={}, validated={}, checkpoint={}, {}ms",
                blockType, config.getTarget(), migrated, result.isValidated(), result.getRollbackPointId(), result.getDuration());
        return result;
    }

    private void validate(MigrationTarget target, MigrationCheckpoint checkpoint, String blockType, long expected) {
        long actual = target.countWritten(checkpoint, blockType);
        if (actual != expected) {
            throw new MigrationValidationMismatchException(checkpoint.getId(), expected, actual);
        }
    }

    // ========================================
    // 롤백
    // ========================================

    /**
     * 체크포인트 실행이 쓴 항목을 지운다. 실패한 실행도 되돌릴 수 있고, 두 번 되돌릴 수는 없다.
     */
    public MigrationCheckpoint rollback(String checkpointId) {
        MigrationCheckpoint checkpoint = checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> BlockNotFoundException.of("MigrationCheckpoint", checkpointId));
        if (checkpoint.getStatus() == MigrationCheckpointStatus.ROLLED_BACK) {
            throw InvalidTransitionException.of("MigrationCheckpoint", checkpointId,
                    checkpoint.getStatus(), MigrationCheckpointStatus.ROLLED_BACK);
        }

        resolveTarget(checkpoint.getTarget()).rollback(checkpoint);
        checkpoint.setStatus(MigrationCheckpointStatus.ROLLED_BACK);
        checkpoint.setRolledBackAt(LocalDateTime.now());
        MigrationCheckpoint saved = checkpointRepository.save(checkpoint);
        log.info("[Migration] Rolled back checkpoint {} ({} {} records)",
                checkpointId, checkpoint.getMigratedCount(), checkpoint.getBlockType());
        return saved;
    }

    public List<MigrationCheckpoint> listCheckpoints() {
        return checkpointRepository.findAllByOrderByCreatedAtDesc();
    }

    private MigrationTarget resolveTarget(MigrationTargetType type) {
        return targets.stream()
                .filter(target -> target.supports(type))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Migration target " + type + " is not enabled"));
    }
}
