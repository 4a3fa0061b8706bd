package com.kidsmap.datablock.dto.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업 완료 요약
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlResult implements Serializable {

    @Builder.Default
    private int newBlocks = 0;

    @Builder.Default
    private int updatedBlocks = 0;

    @Builder.Default
    private int deletedBlocks = 0;

    @Builder.Default
    private int duplicatesSkipped = 0;

    /**
     * 소스별 추출 통계. failed 는 엄격 파싱에서 거부된 레코드 수.
     */
    @Builder.Default
    private Map<String, SourceStat> sourceStats = new LinkedHashMap<>();

    /** 소요 시간 (ms) */
    private long duration;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceStat implements Serializable {
        private int total;
        private int success;
        private int failed;

        public void add(int total, int success, int failed) {
            this.total += total;
            this.success += success;
            this.failed += failed;
        }
    }
}
