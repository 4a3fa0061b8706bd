package com.kidsmap.datablock.service.block;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentBlock;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.ContentType;
import com.kidsmap.datablock.exception.DuplicateBlockException;
import com.kidsmap.datablock.repository.ContentBlockRepository;
import com.kidsmap.datablock.service.quality.BlockQualityEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * ContentBlockService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class ContentBlockServiceTest {

    @Mock
    private ContentBlockRepository contentBlockRepository;

    @Mock
    private BlockCache blockCache;

    private final BlockQualityEngine qualityEngine = new BlockQualityEngine();
    private final BlockPayloadCodec payloadCodec = new BlockPayloadCodec(new ObjectMapper());

    private ContentBlockService contentBlockService;

    private NormalizedContent video;

    @BeforeEach
    void setUp() {
        contentBlockService = new ContentBlockService(contentBlockRepository, qualityEngine, payloadCodec, blockCache);
        video = NormalizedContent.builder()
                .id("abc123")
                .source(ContentSourceType.YOUTUBE)
                .type(ContentType.values()[0])
                .sourceUrl("https://www.youtube.com/watch?v=abc123")
                .title("아이와 가볼 만한 실내 놀이터")
                .author("육아채널")
                .publishedAt(LocalDateTime.of(2024, 3, 1, 12, 0))
                .viewCount(1200L)
                .build();
    }

    @Test
    @DisplayName("관련 장소와 함께 생성하면 relatedPlaceId 가 저장된다")
    void createWithRelatedPlace() {
        // given
        UUID placeId = UUID.randomUUID();
        when(contentBlockRepository.findLiveByDedupeHash(anyString())).thenReturn(Optional.empty());
        when(contentBlockRepository.saveAndFlush(any(ContentBlock.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // when
        ContentBlock created = contentBlockService.create(video, placeId);

        // then
        assertThat(created.getRelatedPlaceId()).isEqualTo(placeId);
        assertThat(created.getSource()).isEqualTo(ContentSourceType.YOUTUBE);
        assertThat(created.getViewCount()).isEqualTo(1200L);
        assertThat(created.getLikeCount()).isZero();
        assertThat(created.getStatus()).isEqualTo(BlockStatus.ACTIVE);
        assertThat(created.getDedupeHash()).isEqualTo(qualityEngine.contentDedupeHash(video));
    }

    @Test
    @DisplayName("같은 출처/URL 의 콘텐츠는 중복으로 거부")
    void rejectsDuplicateUrl() {
        // given
        when(contentBlockRepository.findLiveByDedupeHash(qualityEngine.contentDedupeHash(video)))
                .thenReturn(Optional.of(ContentBlock.builder().id(UUID.randomUUID()).build()));

        // when & then
        assertThatThrownBy(() -> contentBlockService.create(video.toBuilder().title("제목만 다름").build()))
                .isInstanceOf(DuplicateBlockException.class);
    }

    @Test
    @DisplayName("수정하면 조회수가 갱신되고 crawlCount 가 오른다")
    void updateRefreshesCounters() {
        // given
        UUID id = UUID.randomUUID();
        ContentBlock stored = ContentBlock.builder()
                .id(id)
                .dedupeHash(qualityEngine.contentDedupeHash(video))
                .data(payloadCodec.encodeContent(video))
                .title(video.getTitle())
                .source(video.getSource())
                .status(BlockStatus.ACTIVE)
                .crawlCount(1)
                .build();
        when(contentBlockRepository.findById(id)).thenReturn(Optional.of(stored));
        when(contentBlockRepository.save(any(ContentBlock.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // when
        ContentBlock updated = contentBlockService.update(id,
                NormalizedContent.builder().viewCount(5000L).likeCount(30L).build());

        // then
        assertThat(updated.getViewCount()).isEqualTo(5000L);
        assertThat(updated.getLikeCount()).isEqualTo(30L);
        assertThat(updated.getCrawlCount()).isEqualTo(2);
        assertThat(updated.getTitle()).isEqualTo("아이와 가볼 만한 실내 놀이터");
        verify(blockCache).evictContent(id);
    }
}
