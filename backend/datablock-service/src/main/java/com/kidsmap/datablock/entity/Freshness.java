package com.kidsmap.datablock.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 마지막 크롤링 시각 기준 신선도
 */
public enum Freshness {
    /** 7일 미만 */
    FRESH,
    /** 30일 미만 */
    RECENT,
    /** 90일 미만 */
    STALE,
    OUTDATED;

    public static Freshness of(LocalDateTime lastCrawledAt, LocalDateTime now) {
        if (lastCrawledAt == null) return OUTDATED;
        long days = Duration.between(lastCrawledAt, now).toDays();
        if (days < 7) return FRESH;
        if (days < 30) return RECENT;
        if (days < 90) return STALE;
        return OUTDATED;
    }

    public boolean needsRefresh() {
        return this == STALE || this == OUTDATED;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Freshness fromCode(String code) {
        if (code == null) return null;
        return Freshness.valueOf(code.trim().toUpperCase());
    }
}
