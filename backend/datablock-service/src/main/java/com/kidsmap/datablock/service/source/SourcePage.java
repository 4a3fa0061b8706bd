package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 소스 API 응답 한 페이지 (정규화 전 원본 아이템)
 *
 * skipped 는 응답을 읽을 수 없어 건너뛴 페이지. 순회는 다음 페이지로 계속된다.
 */
public record SourcePage(List<JsonNode> items, long totalCount, boolean hasMore, boolean skipped) {

    public SourcePage(List<JsonNode> items, long totalCount, boolean hasMore) {
        this(items, totalCount, hasMore, false);
    }

    public static SourcePage empty() {
        return new SourcePage(List.of(), 0, false, false);
    }

    public static SourcePage unreadable() {
        return new SourcePage(List.of(), 0, true, true);
    }
}
