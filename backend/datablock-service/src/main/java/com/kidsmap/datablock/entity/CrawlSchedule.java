package com.kidsmap.datablock.entity;

import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

/**
 * 반복 크롤링 스케줄 (Spring cron 6필드 표현식)
 */
@Entity
@Table(name = "kidsmap_crawl_schedules", indexes = {
        @Index(name = "idx_crawl_schedules_due", columnList = "enabled, next_run_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, length = 64)
    private String cron;

    @Column(nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 32)
    private CrawlJobType jobType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "job_config", columnDefinition = "jsonb")
    private CrawlJobConfig jobConfig;

    @Column(nullable = false)
    @Builder.Default
    private Integer priority = 5;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @Column(name = "next_run_at")
    private LocalDateTime nextRunAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isDue(LocalDateTime now) {
        return Boolean.TRUE.equals(enabled) && nextRunAt != null && !now.isBefore(nextRunAt);
    }
}
