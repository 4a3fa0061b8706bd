package com.kidsmap.datablock.dto.block;

import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentBlock;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.ContentType;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.QualityGrade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentBlockDto implements Serializable {

    private UUID id;
    private String dedupeHash;
    private NormalizedContent data;
    private String title;
    private ContentSourceType source;
    private String sourceId;
    private ContentType contentType;
    private String author;
    private LocalDateTime publishedAt;
    private Long viewCount;
    private Long likeCount;
    private UUID relatedPlaceId;
    private Integer completeness;
    private QualityGrade qualityGrade;
    private BlockStatus status;
    private Freshness freshness;
    private LocalDateTime lastCrawledAt;
    private Integer crawlCount;
    private ContentAnalysis analysis;
    private BlockMetadata metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ContentBlockDto from(ContentBlock block, NormalizedContent data) {
        return ContentBlockDto.builder()
                .id(block.getId())
                .dedupeHash(block.getDedupeHash())
                .data(data)
                .title(block.getTitle())
                .source(block.getSource())
                .sourceId(block.getSourceId())
                .contentType(block.getContentType())
                .author(block.getAuthor())
                .publishedAt(block.getPublishedAt())
                .viewCount(block.getViewCount())
                .likeCount(block.getLikeCount())
                .relatedPlaceId(block.getRelatedPlaceId())
                .completeness(block.getCompleteness())
                .qualityGrade(block.getQualityGrade())
                .status(block.getStatus())
                .freshness(block.getFreshness())
                .lastCrawledAt(block.getLastCrawledAt())
                .crawlCount(block.getCrawlCount())
                .analysis(block.getAnalysis())
                .metadata(block.getMetadata())
                .createdAt(block.getCreatedAt())
                .updatedAt(block.getUpdatedAt())
                .build();
    }
}
