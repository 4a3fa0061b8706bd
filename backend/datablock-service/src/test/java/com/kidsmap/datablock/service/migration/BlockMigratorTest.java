package com.kidsmap.datablock.service.migration;

import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.migration.MigrationConfig;
import com.kidsmap.datablock.dto.migration.MigrationResult;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.MigrationCheckpoint;
import com.kidsmap.datablock.entity.MigrationCheckpointStatus;
import com.kidsmap.datablock.entity.MigrationTargetType;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.ConfigurationException;
import com.kidsmap.datablock.exception.InvalidTransitionException;
import com.kidsmap.datablock.exception.ValidationException;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.repository.MigrationCheckpointRepository;
import com.kidsmap.datablock.repository.PlaceBlockRepository;
import com.kidsmap.datablock.service.block.ContentBlockService;
import com.kidsmap.datablock.service.block.PlaceBlockService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * BlockMigrator 단위 테스트. 대상 저장소는 메모리 구현으로 대신한다.
 */
@ExtendWith(MockitoExtension.class)
class BlockMigratorTest {

    @Mock
    private PlaceBlockRepository placeBlockRepository;

    @Mock
    private ContentBlockRepository contentBlockRepository;

    @Mock
    private PlaceBlockService placeBlockService;

    @Mock
    private ContentBlockService contentBlockService;

    @Mock
    private MigrationCheckpointRepository checkpointRepository;

    private InMemoryTarget target;
    private BlockMigrator migrator;

    @BeforeEach
    void setUp() {
        target = new InMemoryTarget();
        migrator = new BlockMigrator(placeBlockRepository, contentBlockRepository, placeBlockService,
                contentBlockService, checkpointRepository, List.of(target), new DataBlockProperties());
    }

    private static List<PlaceBlock> activeBlocks(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> PlaceBlock.builder()
                        .id(UUID.randomUUID())
                        .dedupeHash("hash-" + i)
                        .status(BlockStatus.ACTIVE)
                        .build())
                .toList();
    }

    @SuppressWarnings("unchecked")
    private void givenPlaces(List<PlaceBlock> blocks) {
        lenient().when(placeBlockRepository.count(any(Specification.class))).thenReturn((long) blocks.size());
        lenient().when(placeBlockRepository.findAll(any(Specification.class), any(Pageable.class))).thenAnswer(invocation -> {
            Pageable pageable = invocation.getArgument(1);
            int from = (int) Math.min(pageable.getOffset(), blocks.size());
            int to = Math.min(from + pageable.getPageSize(), blocks.size());
            return new PageImpl<>(blocks.subList(from, to), pageable, blocks.size());
        });
    }

    private void givenCheckpointsPersisted() {
        when(checkpointRepository.save(any(MigrationCheckpoint.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static MigrationConfig.MigrationConfigBuilder config() {
        return MigrationConfig.builder()
                .target(MigrationTargetType.NCP_OBJECT_STORAGE)
                .dryRun(false);
    }

    @Nested
    @DisplayName("장소 마이그레이션")
    class MigratePlaces {

        @Test
        @DisplayName("배치 단위로 모두 옮기고 대상 재집계가 일치하면 validated=true")
        void migratesAndValidates() {
            // given
            givenPlaces(activeBlocks(25));
            givenCheckpointsPersisted();

            // when
            MigrationResult result = migrator.migratePlaces(config().batchSize(10).build(), null);

            // then
            assertThat(result.getMigrated()).isEqualTo(25);
            assertThat(result.getFailed()).isZero();
            assertThat(result.isValidated()).isTrue();
            assertThat(result.getRollbackPointId()).startsWith("rollback_places_");
            assertThat(target.batchSizes).containsExactly(10, 10, 5);
            assertThat(target.lastCheckpoint.getStatus()).isEqualTo(MigrationCheckpointStatus.COMPLETED);
        }

        @Test
        @DisplayName("대상 저장소에 N-1 건만 남으면 validated=false 이고 불일치가 errors 에 기록된다")
        void validationMismatch() {
            // given
            givenPlaces(activeBlocks(12));
            givenCheckpointsPersisted();
            target.lose = 1;

            // when
            MigrationResult result = migrator.migratePlaces(config().batchSize(5).build(), null);

            // then
            assertThat(result.getMigrated()).isEqualTo(12);
            assertThat(result.isValidated()).isFalse();
            assertThat(result.getErrors()).hasSize(1);
            assertThat(result.getErrors().get(0)).contains("12").contains("11");
        }

        @Test
        @DisplayName("배치 하나가 실패하면 그 자리에서 멈추고 이미 옮긴 수를 보고한다")
        void stopsAtFailedBatch() {
            // given
            givenPlaces(activeBlocks(30));
            givenCheckpointsPersisted();
            target.failAtBatch = 1;

            // when
            MigrationResult result = migrator.migratePlaces(config().batchSize(10).build(), null);

            // then
            assertThat(result.getMigrated()).isEqualTo(10);
            assertThat(result.getFailed()).isEqualTo(10);
            assertThat(result.isValidated()).isFalse();
            assertThat(result.getErrors()).hasSize(1);
            assertThat(result.getErrors().get(0)).startsWith("Batch 1 failed");
            assertThat(target.lastCheckpoint.getStatus()).isEqualTo(MigrationCheckpointStatus.FAILED);
            assertThat(target.batchSizes).containsExactly(10);
        }

        @Test
        @DisplayName("dryRun 은 대상 없이 건수만 센다")
        void dryRunCountsOnly() {
            // given
            givenPlaces(activeBlocks(7));
            BlockMigrator withoutTargets = new BlockMigrator(placeBlockRepository, contentBlockRepository,
                    placeBlockService, contentBlockService, checkpointRepository, List.of(), new DataBlockProperties());

            // when
            MigrationResult result = withoutTargets.migratePlaces(config().dryRun(true).build(), null);

            // then
            assertThat(result.isDryRun()).isTrue();
            assertThat(result.getMigrated()).isEqualTo(7);
            assertThat(result.getRollbackPointId()).isNull();
            verifyNoInteractions(checkpointRepository);
        }

        @Test
        @DisplayName("createRollbackPoint=false 면 체크포인트를 저장하지 않는다")
        void withoutRollbackPoint() {
            // given
            givenPlaces(activeBlocks(3));

            // when
            MigrationResult result = migrator.migratePlaces(config().createRollbackPoint(false).build(), null);

            // then
            assertThat(result.getMigrated()).isEqualTo(3);
            assertThat(result.getRollbackPointId()).isNull();
            assertThat(result.isValidated()).isTrue();
            verifyNoInteractions(checkpointRepository);
        }

        @Test
        @DisplayName("대상이 없거나 비활성이면 거부한다")
        void rejectsMissingOrDisabledTarget() {
            assertThatThrownBy(() -> migrator.migratePlaces(MigrationConfig.builder().build(), null))
                    .isInstanceOf(ValidationException.class);

            assertThatThrownBy(() -> migrator.migratePlaces(
                    config().target(MigrationTargetType.SUPABASE).build(), null))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("롤백")
    class Rollback {

        @Test
        @DisplayName("체크포인트가 쓴 항목을 지우고 ROLLED_BACK 으로 전이한다")
        void rollsBack() {
            // given
            MigrationCheckpoint checkpoint = MigrationCheckpoint.builder()
                    .id("rollback_places_1")
                    .blockType("places")
                    .target(MigrationTargetType.NCP_OBJECT_STORAGE)
                    .status(MigrationCheckpointStatus.FAILED)
                    .build();
            when(checkpointRepository.findById("rollback_places_1")).thenReturn(Optional.of(checkpoint));
            givenCheckpointsPersisted();

            // when
            MigrationCheckpoint rolledBack = migrator.rollback("rollback_places_1");

            // then
            assertThat(rolledBack.getStatus()).isEqualTo(MigrationCheckpointStatus.ROLLED_BACK);
            assertThat(rolledBack.getRolledBackAt()).isNotNull();
            assertThat(target.rolledBack).containsExactly("rollback_places_1");
        }

        @Test
        @DisplayName("이미 되돌린 체크포인트는 InvalidTransitionException")
        void rejectsSecondRollback() {
            // given
            MigrationCheckpoint checkpoint = MigrationCheckpoint.builder()
                    .id("rollback_places_2")
                    .target(MigrationTargetType.NCP_OBJECT_STORAGE)
                    .status(MigrationCheckpointStatus.ROLLED_BACK)
                    .build();
            when(checkpointRepository.findById("rollback_places_2")).thenReturn(Optional.of(checkpoint));

            // when & then
            assertThatThrownBy(() -> migrator.rollback("rollback_places_2"))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(target.rolledBack).isEmpty();
        }

        @Test
        @DisplayName("모르는 체크포인트는 BlockNotFoundException")
        void unknownCheckpoint() {
            when(checkpointRepository.findById("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> migrator.rollback("nope"))
                    .isInstanceOf(BlockNotFoundException.class);
        }
    }

    /**
     * 쓴 레코드를 메모리에 보관하는 대상. lose 만큼 재집계에서 빠지고 failAtBatch 번째 배치에서 실패한다.
     */
    private static class InMemoryTarget implements MigrationTarget {

        private final List<Integer> batchSizes = new ArrayList<>();
        private final List<String> rolledBack = new ArrayList<>();
        private long written;
        private int lose;
        private int failAtBatch = -1;
        private MigrationCheckpoint lastCheckpoint;

        @Override
        public boolean supports(MigrationTargetType type) {
            return type == MigrationTargetType.NCP_OBJECT_STORAGE;
        }

        @Override
        public void writeBatch(MigrationCheckpoint checkpoint, String blockType, List<MigrationRecord> records, int batchIndex) {
            lastCheckpoint = checkpoint;
            if (batchIndex == failAtBatch) {
                throw new IllegalStateException("503 Slow Down");
            }
            batchSizes.add(records.size());
            written += records.size();
        }

        @Override
        public long countWritten(MigrationCheckpoint checkpoint, String blockType) {
            lastCheckpoint = checkpoint;
            return written - lose;
        }

        @Override
        public void rollback(MigrationCheckpoint checkpoint) {
            rolledBack.add(checkpoint.getId());
        }
    }
}
