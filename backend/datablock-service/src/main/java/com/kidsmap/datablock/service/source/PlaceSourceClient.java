package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.entity.PlaceSourceType;

import java.util.List;

/**
 * 장소 데이터 소스 어댑터
 *
 * 각 구현체는 하나의 외부 API(TourAPI, 어린이놀이시설, 카카오 로컬)를 페이지 단위로 조회하고
 * 원본 아이템을 NormalizedPlace 로 변환합니다.
 */
public interface PlaceSourceClient {

    PlaceSourceType getSourceType();

    /**
     * 설정상 사용 가능한지 (enabled + 인증 정보)
     */
    boolean isAvailable();

    /**
     * 작업 유형과 설정에 맞는 기본 조회 조건 목록. 각 조건은 1페이지부터 순서대로 조회된다.
     */
    List<SourceQuery> planQueries(CrawlJobType type, CrawlJobConfig config);

    /**
     * 한 페이지 조회. 응답 본문을 해석할 수 없으면 빈 페이지를 돌려준다.
     *
     * @throws com.kidsmap.datablock.exception.TransientNetworkException 재시도 소진
     * @throws com.kidsmap.datablock.exception.DataBlockException 4xx 등 재시도 불가 오류
     */
    SourcePage fetchPage(SourceQuery query);

    /**
     * 원본 아이템 변환. 필수 값이 없거나 형식이 틀리면 MalformedRecordException.
     */
    NormalizedPlace normalize(JsonNode item);
}
