package com.kidsmap.datablock.dto.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 작업 진행 상황. 실행 중에 배치 단위로 갱신된다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlProgress implements Serializable {

    @Builder.Default
    private int totalEstimated = 0;

    @Builder.Default
    private int processed = 0;

    @Builder.Default
    private int succeeded = 0;

    @Builder.Default
    private int failed = 0;

    @Builder.Default
    private int skipped = 0;

    private String currentSource;

    private Integer currentPage;

    @Builder.Default
    private int percentage = 0;

    /** 예상 남은 시간 (초) */
    private Long estimatedTimeRemaining;

    public static CrawlProgress empty() {
        return CrawlProgress.builder().build();
    }
}
