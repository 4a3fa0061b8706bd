package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.kidsmap.datablock.entity.AgeGroup;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.PlaceSourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 소스별 원본 레코드를 정규화한 장소 데이터.
 * 블록의 data 컬럼에 schemaVersion 과 함께 저장된다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NormalizedPlace {

    /** 소스 내 식별자 (예: tour-126508) */
    private String id;

    private PlaceSourceType source;

    private String sourceUrl;

    private LocalDateTime fetchedAt;

    private String name;

    private PlaceCategory category;

    private String address;

    private String addressDetail;

    private Double latitude;

    private Double longitude;

    /** TourAPI 지역 코드 */
    private String areaCode;

    private String sigunguCode;

    private String tel;

    private String homepage;

    private String description;

    private String imageUrl;

    private String thumbnailUrl;

    private List<AgeGroup> recommendedAges;

    private Amenities amenities;

    private OperatingHours operatingHours;

    private AdmissionFee admissionFee;
}
