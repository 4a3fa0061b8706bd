package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.entity.BlockStatsSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface BlockStatsSnapshotRepository extends JpaRepository<BlockStatsSnapshot, Long> {

    Optional<BlockStatsSnapshot> findFirstByOrderByComputedAtDesc();

    /**
     * 오래된 스냅샷 정리
     */
    @Modifying
    @Query("DELETE FROM BlockStatsSnapshot s WHERE s.computedAt < :before")
    int deleteOlderThan(@Param("before") LocalDateTime before);
}
