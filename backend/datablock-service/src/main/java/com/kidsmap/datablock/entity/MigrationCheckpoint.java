package com.kidsmap.datablock.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 마이그레이션 롤백 체크포인트.
 * 전체 복사본이 아니라 이번 실행이 대상 저장소에 쓴 항목의 참조(객체 키 또는 실행 태그)를 기록한다.
 */
@Entity
@Table(name = "kidsmap_migration_checkpoints", indexes = {
        @Index(name = "idx_migration_checkpoints_created", columnList = "created_at DESC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationCheckpoint {

    /**
     * rollback_{places|contents}_{epochMillis}
     */
    @Id
    @Column(length = 64)
    private String id;

    /** places / contents */
    @Column(name = "block_type", nullable = false, length = 16)
    private String blockType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MigrationTargetType target;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private MigrationCheckpointStatus status = MigrationCheckpointStatus.CREATED;

    /**
     * 대상 저장소에 쓴 객체 키 목록 (Object Storage)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "written_keys", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> writtenKeys = new ArrayList<>();

    @Column(name = "migrated_count", nullable = false)
    @Builder.Default
    private Long migratedCount = 0L;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "rolled_back_at")
    private LocalDateTime rolledBackAt;
}
