package com.kidsmap.datablock.dto.block;

import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.QualityGrade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceBlockDto implements Serializable {

    private UUID id;
    private String dedupeHash;
    private NormalizedPlace data;
    private String name;
    private PlaceCategory category;
    private String address;
    private String regionCode;
    private Double latitude;
    private Double longitude;
    private Integer completeness;
    private QualityGrade qualityGrade;
    private BlockStatus status;
    private Freshness freshness;
    private LocalDateTime lastCrawledAt;
    private Integer crawlCount;
    private List<String> searchKeywords;
    private List<String> relatedContentIds;
    private BlockMetadata metadata;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static PlaceBlockDto from(PlaceBlock block, NormalizedPlace data) {
        return PlaceBlockDto.builder()
                .id(block.getId())
                .dedupeHash(block.getDedupeHash())
                .data(data)
                .name(block.getName())
                .category(block.getCategory())
                .address(block.getAddress())
                .regionCode(block.getRegionCode())
                .latitude(block.getLatitude())
                .longitude(block.getLongitude())
                .completeness(block.getCompleteness())
                .qualityGrade(block.getQualityGrade())
                .status(block.getStatus())
                .freshness(block.getFreshness())
                .lastCrawledAt(block.getLastCrawledAt())
                .crawlCount(block.getCrawlCount())
                .searchKeywords(block.getSearchKeywords() != null ? new ArrayList<>(block.getSearchKeywords()) : new ArrayList<>())
                .relatedContentIds(block.getRelatedContentIds() != null ? new ArrayList<>(block.getRelatedContentIds()) : new ArrayList<>())
                .metadata(block.getMetadata())
                .createdAt(block.getCreatedAt())
                .updatedAt(block.getUpdatedAt())
                .build();
    }
}
