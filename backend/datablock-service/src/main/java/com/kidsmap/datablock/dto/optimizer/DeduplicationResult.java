package com.kidsmap.datablock.dto.optimizer;

/**
 * @param merged  다른 블록을 흡수한 대표 블록 수
 * @param deleted DELETED 로 전이된 중복 블록 수
 */
public record DeduplicationResult(int merged, int deleted) {
}
