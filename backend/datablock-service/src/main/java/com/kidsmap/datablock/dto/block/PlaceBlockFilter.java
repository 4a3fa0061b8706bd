package com.kidsmap.datablock.dto.block;

import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.QualityGrade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 장소 블록 검색 조건.
 *
 * 반경 검색은 위도 1도 = 111km 근사로 만든 사각형(bounding box) 필터이다.
 * 측지선 거리가 아니므로 고위도에서 오차가 커진다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceBlockFilter {

    /** 비어 있으면 ACTIVE 만 */
    private List<BlockStatus> statuses;

    private List<PlaceCategory> categories;

    private List<String> regionCodes;

    private List<QualityGrade> qualityGrades;

    private List<Freshness> freshness;

    /** 이름 또는 주소 부분 일치 (대소문자 무시) */
    private String keyword;

    private Double latitude;

    private Double longitude;

    private Double radiusKm;

    private Integer minCompleteness;

    private Integer maxCompleteness;

    private LocalDateTime crawledAfter;

    private LocalDateTime crawledBefore;

    /** createdAt, updatedAt, completeness, qualityGrade, name */
    private String sortBy;

    /** asc / desc */
    private String sortDirection;

    /** 1부터 시작 */
    private Integer page;

    private Integer pageSize;

    public boolean hasRadius() {
        return latitude != null && longitude != null && radiusKm != null && radiusKm > 0;
    }
}
