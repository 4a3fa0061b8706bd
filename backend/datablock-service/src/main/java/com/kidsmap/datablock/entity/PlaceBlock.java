package com.kidsmap.datablock.entity;

import com.kidsmap.datablock.dto.block.BlockMetadata;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 중복 제거 및 품질 등급이 매겨진 장소 블록.
 * dedupeHash 는 DELETED 가 아닌 블록 사이에서 유일하다 (partial unique index).
 */
@Entity
@Table(name = "kidsmap_place_blocks", indexes = {
        @Index(name = "idx_place_blocks_status", columnList = "status"),
        @Index(name = "idx_place_blocks_category", columnList = "category"),
        @Index(name = "idx_place_blocks_region", columnList = "region_code"),
        @Index(name = "idx_place_blocks_quality", columnList = "quality_grade"),
        @Index(name = "idx_place_blocks_freshness", columnList = "freshness"),
        @Index(name = "idx_place_blocks_location", columnList = "latitude, longitude")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceBlock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "dedupe_hash", nullable = false, length = 64)
    private String dedupeHash;

    /**
     * 버전이 붙은 NormalizedPlace JSON (BlockPayloadCodec 참고)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private String data;

    @Column(nullable = false, length = 512)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private PlaceCategory category;

    @Column(columnDefinition = "TEXT")
    private String address;

    @Column(name = "region_code", length = 10)
    private String regionCode;

    @Column(name = "sigungu_code", length = 10)
    private String sigunguCode;

    private Double latitude;

    private Double longitude;

    /**
     * 완성도 (0-100)
     */
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

    /**
     * 검색 키워드 (파생 데이터, 유일성/등급 판단에 사용하지 않음)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "search_keywords", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> searchKeywords = new ArrayList<>();

    /**
     * 연관 콘텐츠 블록 ID (약한 참조)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "related_content_ids", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> relatedContentIds = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private BlockMetadata metadata;

    /**
     * 낙관적 잠금
     */
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
