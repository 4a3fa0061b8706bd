package com.kidsmap.datablock.service.source;

/**
 * 추출 진행 콜백. 페이지 사이마다 호출된다.
 */
public interface ExtractListener {

    ExtractListener NONE = new ExtractListener() {
    };

    default void onPage(String source, int page) {
    }

    /**
     * false 면 다음 페이지를 요청하지 않고 지금까지 모은 레코드로 끝낸다
     */
    default boolean shouldContinue() {
        return true;
    }
}
