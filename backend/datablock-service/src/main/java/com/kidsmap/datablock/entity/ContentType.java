package com.kidsmap.datablock.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ContentType {
    VIDEO,
    BLOG_POST,
    SHORT_VIDEO;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ContentType fromCode(String code) {
        if (code == null) return null;
        return ContentType.valueOf(code.trim().toUpperCase());
    }
}
