package com.kidsmap.datablock.service.pipeline;

import com.kidsmap.datablock.dto.pipeline.PipelineResult;

/**
 * 파이프라인 배치 진행 콜백. 작업 워커가 진행률 갱신과 협조적 취소에 사용한다.
 */
public interface PipelineListener {

    PipelineListener NONE = new PipelineListener() {
    };

    /**
     * 배치 하나가 끝날 때마다 지금까지의 누적 결과(사본)로 호출된다
     */
    default void onBatchComplete(PipelineResult partialResult) {
    }

    /**
     * 새 배치를 시작하기 전에 확인한다. 진행 중인 레코드는 끝까지 처리된다.
     */
    default boolean shouldContinue() {
        return true;
    }
}
