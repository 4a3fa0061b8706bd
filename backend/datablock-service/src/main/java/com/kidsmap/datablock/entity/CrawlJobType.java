package com.kidsmap.datablock.entity;

/**
 * 크롤링 작업 유형
 */
public enum CrawlJobType {
    /** 전체 소스 크롤링 */
    FULL_CRAWL(true),
    /** modifiedSince 이후 변경분만 */
    INCREMENTAL(true),
    REGION_CRAWL(true),
    CATEGORY_CRAWL(true),
    /** 콘텐츠(YouTube, Naver) 갱신 */
    CONTENT_REFRESH(false),
    /** 저품질 블록 보관 처리 */
    QUALITY_CHECK(false),
    /** 중복 블록 병합 */
    DEDUP_SCAN(false);

    private final boolean placeCrawl;

    CrawlJobType(boolean placeCrawl) {
        this.placeCrawl = placeCrawl;
    }

    public boolean isPlaceCrawl() {
        return placeCrawl;
    }

    public boolean isMaintenance() {
        return this == QUALITY_CHECK || this == DEDUP_SCAN;
    }
}
