package com.kidsmap.datablock.service.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 소스 API 한 페이지 요청 조건. 어댑터마다 쓰는 필드가 다르다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceQuery {

    /** TourAPI 지역 코드 (1, 2, ... 39) */
    private String regionCode;

    private String keyword;

    /** INCREMENTAL 작업의 기준 시각 */
    private LocalDateTime modifiedSince;

    @Builder.Default
    private int page = 1;

    @Builder.Default
    private int pageSize = 50;

    public SourceQuery forPage(int page) {
        return toBuilder().page(page).build();
    }

    public String describe() {
        if (keyword != null) return "keyword=" + keyword;
        if (regionCode != null) return "region=" + regionCode;
        return "all";
    }
}
