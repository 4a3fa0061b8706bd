package com.kidsmap.datablock.dto.optimizer;

/**
 * @param archived         ARCHIVED 로 전이된 블록 수
 * @param scheduledRefresh 갱신 대상(STALE/OUTDATED) 활성 블록 수. 작업 등록은 하지 않는다.
 */
public record QualityOptimizationResult(int archived, long scheduledRefresh) {
}
