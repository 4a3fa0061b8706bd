package com.kidsmap.datablock.entity;

import com.kidsmap.datablock.dto.block.BlockStats;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

/**
 * 주기적으로 재계산되는 집계 스냅샷. 직접 수정하지 않는다.
 */
@Entity
@Table(name = "kidsmap_block_stats")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockStatsSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private BlockStats stats;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;
}
