package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.Freshness;
import com.kidsmap.datablock.entity.PlaceBlock;
import com.kidsmap.datablock.entity.QualityGrade;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlaceBlockRepository extends JpaRepository<PlaceBlock, UUID>, JpaSpecificationExecutor<PlaceBlock> {

    /**
     * 삭제되지 않은 블록 중 해시가 같은 블록 (partial unique index 와 같은 범위)
     */
    @Query("SELECT p FROM PlaceBlock p WHERE p.dedupeHash = :hash AND p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED")
    Optional<PlaceBlock> findLiveByDedupeHash(@Param("hash") String dedupeHash);

    Page<PlaceBlock> findByStatus(BlockStatus status, Pageable pageable);

    List<PlaceBlock> findByStatusAndQualityGradeIn(BlockStatus status, Collection<QualityGrade> grades);

    long countByStatusAndFreshnessIn(BlockStatus status, Collection<Freshness> freshness);

    long countByStatus(BlockStatus status);

    long countByStatusNot(BlockStatus status);

    // ========================================
    // 통계 (삭제되지 않은 블록)
    // ========================================

    @Query("SELECT p.status, COUNT(p) FROM PlaceBlock p WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED GROUP BY p.status")
    List<Object[]> countGroupByStatus();

    @Query("SELECT p.category, COUNT(p) FROM PlaceBlock p WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED GROUP BY p.category")
    List<Object[]> countGroupByCategory();

    @Query("SELECT p.regionCode, COUNT(p) FROM PlaceBlock p WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED GROUP BY p.regionCode")
    List<Object[]> countGroupByRegion();

    @Query("SELECT p.qualityGrade, COUNT(p) FROM PlaceBlock p WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED GROUP BY p.qualityGrade")
    List<Object[]> countGroupByQualityGrade();

    @Query("SELECT p.freshness, COUNT(p) FROM PlaceBlock p WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED GROUP BY p.freshness")
    List<Object[]> countGroupByFreshness();

    @Query("SELECT AVG(p.completeness) FROM PlaceBlock p WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED")
    Double averageCompleteness();

    // ========================================
    // 신선도 일괄 재계산
    // ========================================

    /**
     * after < lastCrawledAt <= notAfter 인 블록의 신선도를 갱신
     */
    @Modifying
    @Query("UPDATE PlaceBlock p SET p.freshness = :freshness " +
            "WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED AND p.freshness <> :freshness " +
            "AND p.lastCrawledAt > :after AND p.lastCrawledAt <= :notAfter")
    int updateFreshnessBetween(@Param("freshness") Freshness freshness,
                               @Param("after") LocalDateTime after,
                               @Param("notAfter") LocalDateTime notAfter);

    @Modifying
    @Query("UPDATE PlaceBlock p SET p.freshness = com.kidsmap.datablock.entity.Freshness.OUTDATED " +
            "WHERE p.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED " +
            "AND p.freshness <> com.kidsmap.datablock.entity.Freshness.OUTDATED " +
            "AND (p.lastCrawledAt IS NULL OR p.lastCrawledAt <= :notAfter)")
    int markOutdated(@Param("notAfter") LocalDateTime notAfter);
}
