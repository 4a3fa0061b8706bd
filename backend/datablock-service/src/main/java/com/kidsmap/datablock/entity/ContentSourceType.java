package com.kidsmap.datablock.entity;

/**
 * 콘텐츠 데이터 출처
 */
public enum ContentSourceType {
    YOUTUBE,
    NAVER_BLOG,
    NAVER_CLIP
}
