package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentBlock;
import com.kidsmap.datablock.entity.Freshness;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContentBlockRepository extends JpaRepository<ContentBlock, UUID>, JpaSpecificationExecutor<ContentBlock> {

    @Query("SELECT c FROM ContentBlock c WHERE c.dedupeHash = :hash AND c.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED")
    Optional<ContentBlock> findLiveByDedupeHash(@Param("hash") String dedupeHash);

    List<ContentBlock> findByRelatedPlaceIdAndStatusOrderByPublishedAtDesc(UUID relatedPlaceId, BlockStatus status);

    Page<ContentBlock> findByStatus(BlockStatus status, Pageable pageable);

    long countByStatus(BlockStatus status);

    long countByStatusNot(BlockStatus status);

    @Query("SELECT c.source, COUNT(c) FROM ContentBlock c WHERE c.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED GROUP BY c.source")
    List<Object[]> countGroupBySource();

    @Modifying
    @Query("UPDATE ContentBlock c SET c.freshness = :freshness " +
            "WHERE c.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED AND c.freshness <> :freshness " +
            "AND c.lastCrawledAt > :after AND c.lastCrawledAt <= :notAfter")
    int updateFreshnessBetween(@Param("freshness") Freshness freshness,
                               @Param("after") LocalDateTime after,
                               @Param("notAfter") LocalDateTime notAfter);

    @Modifying
    @Query("UPDATE ContentBlock c SET c.freshness = com.kidsmap.datablock.entity.Freshness.OUTDATED " +
            "WHERE c.status <> com.kidsmap.datablock.entity.BlockStatus.DELETED " +
            "AND c.freshness <> com.kidsmap.datablock.entity.Freshness.OUTDATED " +
            "AND (c.lastCrawledAt IS NULL OR c.lastCrawledAt <= :notAfter)")
    int markOutdated(@Param("notAfter") LocalDateTime notAfter);
}
