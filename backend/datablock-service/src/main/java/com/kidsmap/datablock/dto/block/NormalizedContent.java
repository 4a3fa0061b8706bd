package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.ContentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 정규화된 외부 콘텐츠 (영상, 블로그 글, 클립)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NormalizedContent {

    private String id;

    private ContentSourceType source;

    private ContentType type;

    private String sourceUrl;

    private LocalDateTime fetchedAt;

    private String title;

    private String description;

    private String thumbnailUrl;

    private String author;

    private String authorUrl;

    private LocalDateTime publishedAt;

    private Long viewCount;

    private Long likeCount;

    private Long commentCount;

    /** 재생 시간 (초) */
    private Integer duration;
}
