package com.kidsmap.datablock.entity;

/**
 * 장소 데이터 출처
 */
public enum PlaceSourceType {
    /** 한국관광공사 TourAPI */
    TOUR_API,
    /** 행정안전부 전국어린이놀이시설정보 */
    PLAYGROUND_API,
    KAKAO_LOCAL,
    MANUAL
}
