package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.entity.ContentSourceType;

/**
 * 콘텐츠 데이터 소스 어댑터 (YouTube, 네이버 블로그, 네이버 클립).
 * 콘텐츠 소스는 키워드 검색만 지원한다.
 */
public interface ContentSourceClient {

    ContentSourceType getSourceType();

    boolean isAvailable();

    SourcePage fetchPage(SourceQuery query);

    NormalizedContent normalize(JsonNode item);
}
