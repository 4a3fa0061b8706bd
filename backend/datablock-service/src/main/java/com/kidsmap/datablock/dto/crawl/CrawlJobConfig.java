package com.kidsmap.datablock.dto.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
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

/**
 * 크롤링 작업 설정.
 * sources 는 PlaceSourceType 또는 ContentSourceType 이름을 담는다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlJobConfig implements Serializable {

    @Builder.Default
    private List<String> sources = new ArrayList<>(List.of("TOUR_API", "PLAYGROUND_API"));

    private List<String> regionCodes;

    private List<PlaceCategory> categories;

    private List<String> keywords;

    @Builder.Default
    private Integer pageSize = 50;

    @Builder.Default
    private Integer maxPages = 100;

    /** 요청 간 지연 (ms) */
    @Builder.Default
    private Long requestDelay = 500L;

    @Builder.Default
    private Integer concurrency = 2;

    @Builder.Default
    private Boolean retryOnFail = true;

    @Builder.Default
    private Boolean skipDuplicates = true;

    @Builder.Default
    private Boolean updateExisting = false;

    /** INCREMENTAL 전용 */
    private LocalDateTime modifiedSince;

    /** QUALITY_CHECK 전용 */
    private List<QualityGrade> archiveGrades;

    /**
     * 누락된 값을 기본값으로 채운 사본
     */
    public CrawlJobConfig withDefaults() {
        CrawlJobConfig defaults = CrawlJobConfig.builder().build();
        return toBuilder()
                .sources(sources != null ? sources : defaults.getSources())
                .pageSize(pageSize != null ? pageSize : defaults.getPageSize())
                .maxPages(maxPages != null ? maxPages : defaults.getMaxPages())
                .requestDelay(requestDelay != null ? requestDelay : defaults.getRequestDelay())
                .concurrency(concurrency != null ? concurrency : defaults.getConcurrency())
                .retryOnFail(retryOnFail != null ? retryOnFail : defaults.getRetryOnFail())
                .skipDuplicates(skipDuplicates != null ? skipDuplicates : defaults.getSkipDuplicates())
                .updateExisting(updateExisting != null ? updateExisting : defaults.getUpdateExisting())
                .build();
    }
}
