package com.kidsmap.datablock.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 크롤링 작업 상태 머신
 */
public enum CrawlJobStatus {
    /** 대기 (재시도 백오프 중인 작업 포함) */
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    /** RUNNING 에서만 진입 가능한 수동 중지 상태 */
    PAUSED;

    public boolean canTransitionTo(CrawlJobStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    private Set<CrawlJobStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, CANCELLED);
            case RUNNING:
                // PENDING: 재시도 또는 멈춘 작업 복구
                return EnumSet.of(COMPLETED, FAILED, CANCELLED, PAUSED, PENDING);
            case PAUSED:
                return EnumSet.of(PENDING, CANCELLED);
            default:
                return EnumSet.noneOf(CrawlJobStatus.class);
        }
    }
}
