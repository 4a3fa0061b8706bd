package com.kidsmap.datablock.entity;

import com.kidsmap.datablock.dto.block.BlockMetadata;
import com.kidsmap.datablock.dto.block.ContentAnalysis;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 외부 콘텐츠 블록. dedupeHash 는 (source, sourceUrl) 기준.
 * relatedPlaceId 는 PlaceBlock 에 대한 약한 참조이다.
 */
@Entity
@Table(name = "kidsmap_content_blocks", indexes = {
        @Index(name = "idx_content_blocks_status", columnList = "status"),
        @Index(name = "idx_content_blocks_source", columnList = "source"),
        @Index(name = "idx_content_blocks_place", columnList = "related_place_id"),
        @Index(name = "idx_content_blocks_published", columnList = "published_at DESC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentBlock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "dedupe_hash", nullable = false, length = 64)
    private String dedupeHash;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private String data;

    @Column(nullable = false, length = 1024)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ContentSourceType source;

    @Column(name = "source_id", length = 255)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", length = 32)
    private ContentType contentType;

    @Column(length = 255)
    private String author;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "view_count")
    @Builder.Default
    private Long viewCount = 0L;

    @Column(name = "like_count")
    @Builder.Default
    private Long likeCount = 0L;

    @Column(name = "related_place_id")
    private UUID relatedPlaceId;

    @Column(nullable = false)
    @Builder.Default
    private Integer completeness = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_grade", nullable = false, length = 1)
    @Builder.Default
    private QualityGrade qualityGrade = QualityGrade.F;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private BlockStatus status = BlockStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Freshness freshness = Freshness.FRESH;

    @Column(name = "last_crawled_at")
    private LocalDateTime lastCrawledAt;

    @Column(name = "crawl_count", nullable = false)
    @Builder.Default
    private Integer crawlCount = 1;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private ContentAnalysis analysis;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private BlockMetadata metadata;

    @Version
    @Column(name = "lock_version")
    private Long lockVersion;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == BlockStatus.ACTIVE;
    }

    public int getMetadataVersion() {
        return metadata != null ? metadata.getVersion() : 0;
    }
}
