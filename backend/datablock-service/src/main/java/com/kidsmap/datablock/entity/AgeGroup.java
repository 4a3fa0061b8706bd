package com.kidsmap.datablock.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 추천 연령대
 */
public enum AgeGroup {
    /** 0-2세 */
    INFANT,
    /** 3-5세 */
    TODDLER,
    /** 6-9세 */
    CHILD,
    /** 초등학생 */
    ELEMENTARY;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AgeGroup fromCode(String code) {
        if (code == null) return null;
        return AgeGroup.valueOf(code.trim().toUpperCase());
    }
}
