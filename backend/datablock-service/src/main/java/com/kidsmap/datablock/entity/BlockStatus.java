package com.kidsmap.datablock.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 블록 상태. 블록은 물리 삭제되지 않고 ARCHIVED / DELETED 로만 이동한다.
 */
public enum BlockStatus {
    DRAFT,
    ACTIVE,
    ARCHIVED,
    DELETED;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BlockStatus fromCode(String code) {
        if (code == null) return null;
        return BlockStatus.valueOf(code.trim().toUpperCase());
    }
}
