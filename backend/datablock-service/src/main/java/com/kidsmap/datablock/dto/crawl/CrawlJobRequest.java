package com.kidsmap.datablock.dto.crawl;

import com.kidsmap.datablock.entity.CrawlJobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 작업 등록 요청. 검증은 CrawlJobConfigValidator 에서 한 번에 수행한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlJobRequest {

    private CrawlJobType type;

    /** 1-10, 없으면 기본 우선순위 */
    private Integer priority;

    private CrawlJobConfig config;

    private Integer maxRetries;
}
