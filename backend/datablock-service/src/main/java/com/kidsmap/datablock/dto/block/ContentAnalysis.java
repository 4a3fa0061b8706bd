package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kidsmap.datablock.entity.AgeGroup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 콘텐츠 분석 결과. 분석 엔진은 외부에 있고 여기서는 저장/조회만 한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentAnalysis implements Serializable {

    /** positive / neutral / negative */
    private String sentiment;

    private Double sentimentScore;

    private List<String> extractedKeywords;

    private List<String> mentionedPlaces;

    private List<AgeGroup> recommendedAges;

    private Double kidsFriendlyScore;

    private String modelVersion;

    private LocalDateTime analyzedAt;
}
