package com.kidsmap.datablock.dto.crawl;

import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import com.kidsmap.datablock.entity.CrawlJobType;

import java.time.LocalDateTime;

/**
 * Kafka 로 발행되는 작업 상태 변경 이벤트
 */
public record CrawlJobEvent(
        String jobId,
        CrawlJobType type,
        CrawlJobStatus status,
        CrawlProgress progress,
        LocalDateTime occurredAt
) {
    public static CrawlJobEvent of(CrawlJob job) {
        return new CrawlJobEvent(job.getId(), job.getType(), job.getStatus(), job.getProgress(), LocalDateTime.now());
    }
}
