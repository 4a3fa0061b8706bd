package com.kidsmap.datablock.service.source;

import com.kidsmap.datablock.dto.crawl.CrawlResult;

import java.util.List;
import java.util.Map;

/**
 * 추출 결과. sourceStats 의 failed 는 엄격 검증에서 거부된 레코드 수.
 */
public record ExtractResult<T>(List<T> records,
                               Map<String, CrawlResult.SourceStat> sourceStats,
                               boolean interrupted) {
}
