package com.kidsmap.datablock.entity;

import com.kidsmap.datablock.dto.crawl.CrawlError;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.dto.crawl.CrawlProgress;
import com.kidsmap.datablock.dto.crawl.CrawlResult;
import com.kidsmap.datablock.exception.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 크롤링 작업 엔티티.
 * 스케줄러가 소유하며, 실행 중에는 워커가 progress / result 만 갱신한다.
 * 동시 갱신(취소 vs 진행 저장)은 @Version 낙관적 잠금으로 직렬화한다.
 */
@Entity
@Table(name = "kidsmap_crawl_jobs", indexes = {
        @Index(name = "idx_crawl_jobs_status", columnList = "status"),
        @Index(name = "idx_crawl_jobs_queue", columnList = "status, priority DESC, created_at"),
        @Index(name = "idx_crawl_jobs_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlJob {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private CrawlJobType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private CrawlJobStatus status = CrawlJobStatus.PENDING;

    /**
     * 우선순위 (1-10, 높을수록 먼저 실행)
     */
    @Column(nullable = false)
    @Builder.Default
    private Integer priority = 5;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private CrawlJobConfig config;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    @Builder.Default
    private CrawlProgress progress = CrawlProgress.empty();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private CrawlResult result;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private CrawlError error;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private Integer maxRetries = 3;

    /**
     * 다음 실행 가능 시각 (재시도 백오프용)
     */
    @Column(name = "next_attempt_after")
    private LocalDateTime nextAttemptAfter;

    /**
     * 반복 스케줄에서 생성된 경우 스케줄 ID
     */
    @Column(name = "schedule_id")
    private Long scheduleId;

    @Version
    @Column(name = "lock_version")
    private Long lockVersion;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    // ========================================
    // 상태 전이
    // ========================================

    public void transitionTo(CrawlJobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw InvalidTransitionException.of("CrawlJob", id, status, target);
        }
        this.status = target;
    }

    public void markRunning() {
        transitionTo(CrawlJobStatus.RUNNING);
        this.startedAt = LocalDateTime.now();
        this.completedAt = null;
        this.nextAttemptAfter = null;
    }

    public void markCompleted(CrawlResult result) {
        transitionTo(CrawlJobStatus.COMPLETED);
        this.result = result;
        this.completedAt = LocalDateTime.now();
    }

    public void markFailed(CrawlError error) {
        transitionTo(CrawlJobStatus.FAILED);
        this.error = error;
        this.completedAt = LocalDateTime.now();
    }

    public void markCancelled() {
        transitionTo(CrawlJobStatus.CANCELLED);
        this.completedAt = LocalDateTime.now();
    }

    public void markPaused() {
        transitionTo(CrawlJobStatus.PAUSED);
    }

    public void resume() {
        transitionTo(CrawlJobStatus.PENDING);
        this.nextAttemptAfter = null;
    }

    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /**
     * 일시적 오류 후 재시도 예약. 재시도 가능하면 PENDING 으로 돌아가고 true,
     * 한도를 넘으면 FAILED 로 전이하고 false 를 반환한다.
     * 지수 백오프: base * 2^(retryCount-1), 최대 maxBackoff
     */
    public boolean scheduleRetry(CrawlError error, Duration backoffBase, Duration maxBackoff) {
        this.error = error;
        if (!canRetry()) {
            markFailed(error);
            return false;
        }
        transitionTo(CrawlJobStatus.PENDING);
        this.retryCount++;
        long multiplier = 1L << Math.min(retryCount - 1, 30);
        Duration delay = backoffBase.multipliedBy(multiplier);
        if (delay.compareTo(maxBackoff) > 0) {
            delay = maxBackoff;
        }
        this.nextAttemptAfter = LocalDateTime.now().plus(delay);
        return true;
    }

    public boolean isReady(LocalDateTime now) {
        return status == CrawlJobStatus.PENDING
                && (nextAttemptAfter == null || !now.isBefore(nextAttemptAfter));
    }
}
