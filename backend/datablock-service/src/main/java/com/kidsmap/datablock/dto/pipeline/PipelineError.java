package com.kidsmap.datablock.dto.pipeline;

/**
 * 레코드 단위 오류. recordId 는 소스 내 식별자 또는 레코드 순번.
 * batchIndex 는 오류 목록 정렬 기준 (0 부터).
 */
public record PipelineError(PipelineStage stage, int batchIndex, String recordId, String message) {
}
