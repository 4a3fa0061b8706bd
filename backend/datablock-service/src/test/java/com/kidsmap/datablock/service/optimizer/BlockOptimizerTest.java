package com.kidsmap.datablock.service.optimizer;

import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.optimizer.DeduplicationResult;
import com.kidsmap.datablock.dto.optimizer.IndexOptimizationResult;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationRequest;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationResult;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.QualityGrade;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.repository.PlaceBlockRepository;
import com.kidsmap.datablock.service.block.BlockCache;
import com.kidsmap.datablock.service.block.ContentBlockService;
import com.kidsmap.datablock.service.block.PlaceBlockService;
import com.kidsmap.datablock.service.quality.BlockQualityEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * BlockOptimizer 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class BlockOptimizerTest {

    @Mock
    private PlaceBlockRepository placeBlockRepository;

    @Mock
    private ContentBlockRepository contentBlockRepository;

    @Mock
    private PlaceBlockService placeBlockService;

    @Mock
    private ContentBlockService contentBlockService;

    @Mock
    private BlockCache blockCache;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private final BlockQualityEngine qualityEngine = new BlockQualityEngine();

    private BlockOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new BlockOptimizer(placeBlockRepository, contentBlockRepository, placeBlockService,
                contentBlockService, qualityEngine, blockCache, jdbcTemplate);
    }

    private static PlaceBlock block(QualityGrade grade) {
        return PlaceBlock.builder()
                .id(UUID.randomUUID())
                .status(BlockStatus.ACTIVE)
                .qualityGrade(grade)
                .build();
    }

    @Nested
    @DisplayName("품질 기반 정리")
    class QualityOptimization {

        @Test
        @DisplayName("D/F 등급 활성 블록 5개를 모두 ARCHIVED 로 전이한다")
        void archivesLowGradeBlocks() {
            // given
            List<PlaceBlock> lowGrade = new ArrayList<>();
            IntStream.range(0, 3).forEach(i -> lowGrade.add(block(QualityGrade.D)));
            IntStream.range(0, 2).forEach(i -> lowGrade.add(block(QualityGrade.F)));
            when(placeBlockRepository.findByStatusAndQualityGradeIn(BlockStatus.ACTIVE,
                    List.of(QualityGrade.D, QualityGrade.F))).thenReturn(lowGrade);

            QualityOptimizationRequest request = new QualityOptimizationRequest();
            request.setArchiveGrades(List.of(QualityGrade.D, QualityGrade.F));

            // when
            QualityOptimizationResult result = optimizer.optimizeByQuality(request);

            // then
            assertThat(result.archived()).isEqualTo(5);
            assertThat(result.scheduledRefresh()).isZero();
            lowGrade.forEach(block -> verify(placeBlockService).updateStatus(block.getId(), BlockStatus.ARCHIVED));
            verify(placeBlockRepository, never()).countByStatusAndFreshnessIn(any(), any());
        }

        @Test
        @DisplayName("등급 목록이 비어 있으면 보관하지 않고 refreshStale 이면 오래된 블록 수만 센다")
        void countsStaleBlocksOnly() {
            // given
            when(placeBlockRepository.countByStatusAndFreshnessIn(eq(BlockStatus.ACTIVE), any())).thenReturn(12L);

            QualityOptimizationRequest request = new QualityOptimizationRequest();
            request.setRefreshStale(true);

            // when
            QualityOptimizationResult result = optimizer.optimizeByQuality(request);

            // then
            assertThat(result.archived()).isZero();
            assertThat(result.scheduledRefresh()).isEqualTo(12L);
            verify(placeBlockRepository, never()).findByStatusAndQualityGradeIn(any(), any());
            verifyNoInteractions(placeBlockService);
        }
    }

    @Nested
    @DisplayName("중복 병합")
    class Deduplication {

        private final NormalizedPlace payload = NormalizedPlace.builder()
                .name("국립어린이과학관")
                .category(PlaceCategory.MUSEUM)
                .address("서울특별시 종로구 창경궁로 215")
                .latitude(37.5826)
                .longitude(126.9955)
                .build();

        @Test
        @DisplayName("같은 해시 그룹은 완성도가 가장 높은 블록만 남기고 나머지 콘텐츠를 합친다")
        void mergesIntoMostCompleteBlock() {
            // given
            PlaceBlock survivor = PlaceBlock.builder()
                    .id(UUID.randomUUID()).status(BlockStatus.ACTIVE)
                    .dedupeHash("old-hash-1").completeness(80)
                    .updatedAt(LocalDateTime.now().minusDays(3))
                    .relatedContentIds(new ArrayList<>(List.of("c-1")))
                    .build();
            PlaceBlock duplicate = PlaceBlock.builder()
                    .id(UUID.randomUUID()).status(BlockStatus.ACTIVE)
                    .dedupeHash("old-hash-2").completeness(60)
                    .updatedAt(LocalDateTime.now())
                    .relatedContentIds(new ArrayList<>(List.of("c-2", "c-3")))
                    .build();
            PlaceBlock unrelated = PlaceBlock.builder()
                    .id(UUID.randomUUID()).status(BlockStatus.ACTIVE)
                    .dedupeHash("unrelated").completeness(50)
                    .build();

            when(placeBlockRepository.findByStatus(eq(BlockStatus.ACTIVE), any(Pageable.class)))
                    .thenReturn(new PageImpl<>(List.of(duplicate, unrelated, survivor)));
            when(placeBlockService.decode(survivor)).thenReturn(payload);
            when(placeBlockService.decode(duplicate)).thenReturn(payload.toBuilder().name("  국립어린이과학관 ").build());
            when(placeBlockService.decode(unrelated)).thenThrow(new IllegalStateException("corrupt payload"));

            // when
            DeduplicationResult result = optimizer.deduplicateBlocks();

            // then
            assertThat(result.merged()).isEqualTo(1);
            assertThat(result.deleted()).isEqualTo(1);
            verify(placeBlockService).updateStatus(duplicate.getId(), BlockStatus.DELETED);
            verify(placeBlockService, never()).updateStatus(eq(survivor.getId()), any());

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Collection<String>> absorbed = ArgumentCaptor.forClass(Collection.class);
            verify(placeBlockService).mergeRelatedContent(eq(survivor.getId()), absorbed.capture());
            assertThat(absorbed.getValue()).containsExactlyInAnyOrder("c-2", "c-3");
        }

        @Test
        @DisplayName("중복이 없으면 아무 블록도 바꾸지 않는다")
        void noDuplicates() {
            // given
            PlaceBlock only = PlaceBlock.builder()
                    .id(UUID.randomUUID()).status(BlockStatus.ACTIVE)
                    .dedupeHash(qualityEngine.placeDedupeHash(payload))
                    .build();
            when(placeBlockRepository.findByStatus(eq(BlockStatus.ACTIVE), any(Pageable.class)))
                    .thenReturn(new PageImpl<>(List.of(only)));
            when(placeBlockService.decode(only)).thenReturn(payload);

            // when
            DeduplicationResult result = optimizer.deduplicateBlocks();

            // then
            assertThat(result.merged()).isZero();
            assertThat(result.deleted()).isZero();
            verify(placeBlockService, never()).updateStatus(any(), any());
        }
    }

    @Nested
    @DisplayName("인덱스 최적화")
    class Indexes {

        @Test
        @DisplayName("PostgreSQL 이 아니면 VACUUM 을 실행하지 않는다")
        @SuppressWarnings("unchecked")
        void skipsOnOtherDatabases() {
            // given
            when(jdbcTemplate.execute(any(ConnectionCallback.class))).thenReturn("H2");

            // when
            IndexOptimizationResult result = optimizer.optimizeIndexes();

            // then
            assertThat(result.executed()).isFalse();
            assertThat(result.message()).contains("H2");
            verify(jdbcTemplate, never()).execute(anyString());
        }

        @Test
        @DisplayName("PostgreSQL 이면 블록 테이블마다 VACUUM ANALYZE 를 실행하고 실패한 테이블은 제외한다")
        @SuppressWarnings("unchecked")
        void vacuumsBlockTables() {
            // given
            when(jdbcTemplate.execute(any(ConnectionCallback.class))).thenReturn("PostgreSQL");
            doNothing().when(jdbcTemplate).execute("VACUUM ANALYZE kidsmap_place_blocks");
            doThrow(new DataAccessResourceFailureException("lock timeout"))
                    .when(jdbcTemplate).execute("VACUUM ANALYZE kidsmap_content_blocks");

            // when
            IndexOptimizationResult result = optimizer.optimizeIndexes();

            // then
            assertThat(result.executed()).isTrue();
            assertThat(result.tables()).containsExactly("kidsmap_place_blocks");
            assertThat(result.message()).contains("partially");
            verify(jdbcTemplate).execute("VACUUM ANALYZE kidsmap_place_blocks");
        }
    }

    @Test
    @DisplayName("캐시 예열 개수가 0 이면 저장소를 조회하지 않는다")
    void warmCacheWithZeroLimits() {
        // when
        var result = optimizer.warmCache(0, 0);

        // then
        assertThat(result.cachedPlaces()).isZero();
        assertThat(result.cachedContents()).isZero();
        verifyNoInteractions(placeBlockRepository, contentBlockRepository, blockCache);
    }

    @Test
    @DisplayName("오래된 블록 수 집계에는 STALE 과 OUTDATED 가 포함된다")
    @SuppressWarnings("unchecked")
    void refreshCountsStaleAndOutdated() {
        // given
        ArgumentCaptor<Collection<Freshness>> freshness = ArgumentCaptor.forClass(Collection.class);
        when(placeBlockRepository.countByStatusAndFreshnessIn(eq(BlockStatus.ACTIVE), freshness.capture())).thenReturn(0L);
        QualityOptimizationRequest request = new QualityOptimizationRequest();
        request.setRefreshStale(true);

        // when
        optimizer.optimizeByQuality(request);

        // then
        assertThat(freshness.getValue()).containsExactlyInAnyOrder(Freshness.STALE, Freshness.OUTDATED);
    }
}
