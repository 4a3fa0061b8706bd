package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CrawlJobRepository extends JpaRepository<CrawlJob, String> {

    /**
     * 실행 가능한 대기 작업 (우선순위 높은 순, 같은 우선순위는 먼저 등록된 순)
     */
    @Query("SELECT j FROM CrawlJob j WHERE j.status = com.kidsmap.datablock.entity.CrawlJobStatus.PENDING " +
            "AND (j.nextAttemptAfter IS NULL OR j.nextAttemptAfter <= :now) " +
            "ORDER BY j.priority DESC, j.createdAt ASC")
    List<CrawlJob> findReadyJobs(@Param("now") LocalDateTime now, Pageable pageable);

    /**
     * PENDING 인 경우에만 RUNNING 으로 선점. 반환값 1 이면 선점 성공.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE CrawlJob j SET j.status = com.kidsmap.datablock.entity.CrawlJobStatus.RUNNING, " +
            "j.startedAt = :now, j.completedAt = NULL, j.nextAttemptAfter = NULL, j.updatedAt = :now, " +
            "j.lockVersion = j.lockVersion + 1 " +
            "WHERE j.id = :id AND j.status = com.kidsmap.datablock.entity.CrawlJobStatus.PENDING")
    int claim(@Param("id") String id, @Param("now") LocalDateTime now);

    Page<CrawlJob> findByStatus(CrawlJobStatus status, Pageable pageable);

    long countByStatus(CrawlJobStatus status);

    long countByStatusAndNextAttemptAfterAfter(CrawlJobStatus status, LocalDateTime now);

    /**
     * 장시간 RUNNING 상태로 남은 작업 (프로세스 중단 후 복구용)
     */
    List<CrawlJob> findByStatusAndStartedAtBefore(CrawlJobStatus status, LocalDateTime before);

    long countByStatusAndCompletedAtAfter(CrawlJobStatus status, LocalDateTime since);

    List<CrawlJob> findByStatusInAndCompletedAtAfter(Collection<CrawlJobStatus> statuses, LocalDateTime since);

    Optional<CrawlJob> findFirstByCompletedAtIsNotNullOrderByCompletedAtDesc();
}
