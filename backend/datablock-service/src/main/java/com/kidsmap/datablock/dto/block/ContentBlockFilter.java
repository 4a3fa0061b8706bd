package com.kidsmap.datablock.dto.block;

import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.ContentType;
import com.kidsmap.datablock.entity.QualityGrade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 콘텐츠 블록 검색 조건
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentBlockFilter {

    private List<BlockStatus> statuses;

    private List<ContentSourceType> sources;

    private List<ContentType> contentTypes;

    private UUID relatedPlaceId;

    private List<QualityGrade> qualityGrades;

    /** 제목 부분 일치 */
    private String keyword;

    private LocalDateTime publishedAfter;

    private LocalDateTime publishedBefore;

    /** createdAt, publishedAt, viewCount, likeCount */
    private String sortBy;

    private String sortDirection;

    private Integer page;

    private Integer pageSize;
}
