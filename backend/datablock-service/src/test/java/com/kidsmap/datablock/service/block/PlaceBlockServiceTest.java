package com.kidsmap.datablock.service.block;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidsmap.datablock.dto.block.BlockMetadata;
import com.kidsmap.datablock.dto.block.BulkUpsertResult;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.block.PageResponse;
import com.kidsmap.datablock.dto.block.PlaceBlockDto;
import com.kidsmap.datablock.dto.block.PlaceBlockFilter;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.QualityGrade;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.DuplicateBlockException;
import com.kidsmap.datablock.repository.PlaceBlockRepository;
import com.kidsmap.datablock.service.quality.BlockQualityEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * PlaceBlockService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class PlaceBlockServiceTest {

    @Mock
    private PlaceBlockRepository placeBlockRepository;

    @Mock
    private BlockCache blockCache;

    private final BlockQualityEngine qualityEngine = new BlockQualityEngine();
    private final BlockPayloadCodec payloadCodec = new BlockPayloadCodec(new ObjectMapper());

    private PlaceBlockService placeBlockService;

    private NormalizedPlace place;

    @BeforeEach
    void setUp() {
        placeBlockService = new PlaceBlockService(placeBlockRepository, qualityEngine, payloadCodec, blockCache);
        place = NormalizedPlace.builder()
                .name("키즈카페 놀자")
                .category(PlaceCategory.KIDS_CAFE)
                .address("경기도 성남시 분당구 판교로 1")
                .latitude(37.401)
                .longitude(127.108)
                .imageUrl("https://img.example.com/kids.jpg")
                .build();
    }

    private PlaceBlock storedBlock(UUID id, NormalizedPlace payload) {
        return PlaceBlock.builder()
                .id(id)
                .dedupeHash(qualityEngine.placeDedupeHash(payload))
                .data(payloadCodec.encodePlace(payload))
                .name(payload.getName())
                .category(payload.getCategory())
                .status(BlockStatus.ACTIVE)
                .crawlCount(1)
                .relatedContentIds(new ArrayList<>())
                .metadata(BlockMetadata.builder().version(1).build())
                .build();
    }

    private void saveAssignsId() {
        when(placeBlockRepository.saveAndFlush(any(PlaceBlock.class))).thenAnswer(invocation -> {
            PlaceBlock block = invocation.getArgument(0);
            block.setId(UUID.randomUUID());
            return block;
        });
    }

    @Nested
    @DisplayName("생성")
    class Create {

        @Test
        @DisplayName("새 블록은 ACTIVE, FRESH, crawlCount 1 로 저장된다")
        void createsActiveBlock() {
            // given
            when(placeBlockRepository.findLiveByDedupeHash(anyString())).thenReturn(Optional.empty());
            saveAssignsId();

            // when
            PlaceBlock created = placeBlockService.create(place);

            // then
            assertThat(created.getId()).isNotNull();
            assertThat(created.getStatus()).isEqualTo(BlockStatus.ACTIVE);
            assertThat(created.getFreshness()).isEqualTo(Freshness.FRESH);
            assertThat(created.getCrawlCount()).isEqualTo(1);
            assertThat(created.getCompleteness()).isEqualTo(60);
            assertThat(created.getQualityGrade()).isEqualTo(QualityGrade.C);
            assertThat(created.getRegionCode()).isEqualTo("31");
            assertThat(created.getSearchKeywords()).contains("키즈카페", "성남시");
            assertThat(created.getDedupeHash()).isEqualTo(qualityEngine.placeDedupeHash(place));
        }

        @Test
        @DisplayName("같은 해시의 살아있는 블록이 있으면 DuplicateBlockException")
        void rejectsDuplicate() {
            // given
            when(placeBlockRepository.findLiveByDedupeHash(anyString()))
                    .thenReturn(Optional.of(storedBlock(UUID.randomUUID(), place)));

            // when & then
            assertThatThrownBy(() -> placeBlockService.create(place))
                    .isInstanceOf(DuplicateBlockException.class);
            verify(placeBlockRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("동시 삽입으로 유일 인덱스 위반이 나면 DuplicateBlockException 으로 변환")
        void concurrentInsertBecomesDuplicate() {
            // given
            when(placeBlockRepository.findLiveByDedupeHash(anyString())).thenReturn(Optional.empty());
            when(placeBlockRepository.saveAndFlush(any(PlaceBlock.class)))
                    .thenThrow(new DataIntegrityViolationException("uq_place_blocks_live_hash"));

            // when & then
            assertThatThrownBy(() -> placeBlockService.create(place))
                    .isInstanceOf(DuplicateBlockException.class)
                    .hasMessageContaining("concurrent insert");
        }
    }

    @Nested
    @DisplayName("수정")
    class Update {

        @Test
        @DisplayName("병합 후 등급을 다시 계산하고 crawlCount 와 metadata.version 을 올린다")
        void mergesAndBumpsVersion() {
            // given
            UUID id = UUID.randomUUID();
            NormalizedPlace sparse = place.toBuilder().imageUrl(null).build();
            when(placeBlockRepository.findById(id)).thenReturn(Optional.of(storedBlock(id, sparse)));
            when(placeBlockRepository.save(any(PlaceBlock.class))).thenAnswer(invocation -> invocation.getArgument(0));

            NormalizedPlace patch = NormalizedPlace.builder()
                    .imageUrl("https://img.example.com/new.jpg")
                    .description("실내 놀이 시설")
                    .tel("031-000-0000")
                    .build();

            // when
            PlaceBlock updated = placeBlockService.update(id, patch);

            // then
            assertThat(updated.getCrawlCount()).isEqualTo(2);
            assertThat(updated.getMetadata().getVersion()).isEqualTo(2);
            assertThat(updated.getCompleteness()).isEqualTo(75);
            assertThat(updated.getQualityGrade()).isEqualTo(QualityGrade.B);
            assertThat(updated.getFreshness()).isEqualTo(Freshness.FRESH);
            assertThat(payloadCodec.decodePlace(updated.getData()).getName()).isEqualTo("키즈카페 놀자");
            verify(blockCache).evictPlace(id);
        }

        @Test
        @DisplayName("낙관적 잠금 충돌 시 다시 읽어서 재적용한다")
        void retriesOnOptimisticLock() {
            // given
            UUID id = UUID.randomUUID();
            when(placeBlockRepository.findById(id))
                    .thenReturn(Optional.of(storedBlock(id, place)))
                    .thenReturn(Optional.of(storedBlock(id, place)));
            when(placeBlockRepository.save(any(PlaceBlock.class)))
                    .thenThrow(new ObjectOptimisticLockingFailureException(PlaceBlock.class, id))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            // when
            PlaceBlock updated = placeBlockService.updateStatus(id, BlockStatus.ARCHIVED);

            // then
            assertThat(updated.getStatus()).isEqualTo(BlockStatus.ARCHIVED);
            verify(placeBlockRepository, times(2)).findById(id);
            verify(placeBlockRepository, times(2)).save(any(PlaceBlock.class));
        }

        @Test
        @DisplayName("없는 블록은 BlockNotFoundException")
        void missingBlock() {
            UUID id = UUID.randomUUID();
            when(placeBlockRepository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> placeBlockService.updateStatus(id, BlockStatus.ARCHIVED))
                    .isInstanceOf(BlockNotFoundException.class);
        }

        @Test
        @DisplayName("삭제된 블록 복구 시 같은 해시의 살아있는 블록이 있으면 거부")
        void restoreKeepsHashUnique() {
            // given
            UUID id = UUID.randomUUID();
            PlaceBlock deleted = storedBlock(id, place);
            deleted.setStatus(BlockStatus.DELETED);
            when(placeBlockRepository.findById(id)).thenReturn(Optional.of(deleted));
            when(placeBlockRepository.findLiveByDedupeHash(deleted.getDedupeHash()))
                    .thenReturn(Optional.of(storedBlock(UUID.randomUUID(), place)));

            // when & then
            assertThatThrownBy(() -> placeBlockService.updateStatus(id, BlockStatus.ACTIVE))
                    .isInstanceOf(DuplicateBlockException.class);
        }

        @Test
        @DisplayName("이미 연결된 콘텐츠는 다시 저장하지 않는다")
        void linkContentIsIdempotent() {
            // given
            UUID placeId = UUID.randomUUID();
            UUID contentId = UUID.randomUUID();
            PlaceBlock block = storedBlock(placeId, place);
            block.getRelatedContentIds().add(contentId.toString());
            when(placeBlockRepository.findById(placeId)).thenReturn(Optional.of(block));

            // when
            PlaceBlock result = placeBlockService.linkContent(placeId, contentId);

            // then
            assertThat(result.getRelatedContentIds()).containsExactly(contentId.toString());
            verify(placeBlockRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("일괄 반영")
    class BulkUpsert {

        @Test
        @DisplayName("같은 입력을 두 번 반영해도 두 번째는 모두 건너뛴다")
        void secondRunSkipsEverything() {
            // given
            NormalizedPlace other = place.toBuilder().name("다른 키즈카페").build();
            when(placeBlockRepository.findLiveByDedupeHash(anyString())).thenReturn(Optional.empty());
            saveAssignsId();

            // when
            BulkUpsertResult first = placeBlockService.bulkUpsert(List.of(place, other), true);

            when(placeBlockRepository.findLiveByDedupeHash(anyString()))
                    .thenReturn(Optional.of(storedBlock(UUID.randomUUID(), place)));
            BulkUpsertResult second = placeBlockService.bulkUpsert(List.of(place, other), true);

            // then
            assertThat(first).isEqualTo(new BulkUpsertResult(2, 0, 0));
            assertThat(second).isEqualTo(new BulkUpsertResult(0, 0, 2));
            verify(placeBlockRepository, times(2)).saveAndFlush(any(PlaceBlock.class));
        }
    }

    @Nested
    @DisplayName("검색")
    class Search {

        @Test
        @DisplayName("1부터 시작하는 페이지를 0 기반 PageRequest 로 바꾸고 이전/다음 여부를 계산한다")
        @SuppressWarnings("unchecked")
        void pagingFlags() {
            // given
            UUID id = UUID.randomUUID();
            when(placeBlockRepository.findAll(any(Specification.class), any(Pageable.class)))
                    .thenAnswer(invocation -> {
                        Pageable pageable = invocation.getArgument(1);
                        return new PageImpl<>(List.of(storedBlock(id, place)), pageable, 45);
                    });

            PlaceBlockFilter filter = PlaceBlockFilter.builder().page(2).pageSize(20).build();

            // when
            PageResponse<PlaceBlockDto> response = placeBlockService.search(filter);

            // then
            assertThat(response.page()).isEqualTo(2);
            assertThat(response.totalPages()).isEqualTo(3);
            assertThat(response.hasNext()).isTrue();
            assertThat(response.hasPrev()).isTrue();
            assertThat(response.content()).hasSize(1);

            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            verify(placeBlockRepository).findAll(any(Specification.class), pageable.capture());
            assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        }

        @Test
        @DisplayName("페이지 크기는 100 으로 제한된다")
        @SuppressWarnings("unchecked")
        void capsPageSize() {
            // given
            when(placeBlockRepository.findAll(any(Specification.class), any(Pageable.class)))
                    .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 100), 0));

            // when
            PageResponse<PlaceBlockDto> response = placeBlockService.search(
                    PlaceBlockFilter.builder().pageSize(500).build());

            // then
            assertThat(response.pageSize()).isEqualTo(100);
            assertThat(response.hasNext()).isFalse();
            assertThat(response.hasPrev()).isFalse();
        }
    }
}
