package com.kidsmap.datablock.controller;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * JPA 등 블로킹 호출을 이벤트 루프 밖(boundedElastic)에서 실행한다
 */
final class BlockingCalls {

    private BlockingCalls() {
    }

    static <T> Mono<T> async(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
