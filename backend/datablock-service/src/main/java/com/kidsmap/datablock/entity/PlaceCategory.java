package com.kidsmap.datablock.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * 장소 카테고리와 카테고리별 기본 검색 키워드
 */
public enum PlaceCategory {
    AMUSEMENT_PARK("놀이공원", List.of("놀이공원", "테마파크", "어트랙션")),
    ZOO_AQUARIUM("동물원/아쿠아리움", List.of("동물원", "수족관", "아쿠아리움")),
    KIDS_CAFE("키즈카페", List.of("키즈카페", "실내놀이터", "키즈존")),
    MUSEUM("박물관/체험관", List.of("박물관", "체험관", "전시관")),
    NATURE_PARK("자연/공원", List.of("공원", "자연", "산책")),
    RESTAURANT("식당", List.of()),
    PUBLIC_FACILITY("공공시설", List.of()),
    OTHER("기타", List.of());

    private final String label;
    private final List<String> keywords;

    PlaceCategory(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PlaceCategory fromCode(String code) {
        if (code == null) return null;
        return PlaceCategory.valueOf(code.trim().toUpperCase());
    }
}
