package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.entity.CrawlSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface CrawlScheduleRepository extends JpaRepository<CrawlSchedule, Long> {

    List<CrawlSchedule> findByEnabledTrueAndNextRunAtLessThanEqual(LocalDateTime now);

    List<CrawlSchedule> findAllByOrderByIdAsc();
}
