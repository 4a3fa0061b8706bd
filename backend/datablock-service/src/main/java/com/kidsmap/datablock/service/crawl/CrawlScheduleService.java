package com.kidsmap.datablock.service.crawl;

import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.dto.crawl.CrawlJobRequest;
import com.kidsmap.datablock.dto.crawl.CrawlScheduleRequest;
import com.kidsmap.datablock.entity.CrawlSchedule;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.ValidationException;
import com.kidsmap.datablock.repository.CrawlScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 반복 크롤링 스케줄. 실행 시점이 된 스케줄은 일반 작업과 같은 schedule() 경로로 큐에 들어간다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlScheduleService {

    private final CrawlScheduleRepository scheduleRepository;
    private final CrawlJobService crawlJobService;
    private final CrawlJobConfigValidator configValidator;

    @Transactional
    public CrawlSchedule create(CrawlScheduleRequest request) {
        CronExpression cron = parseCron(request.getCron());
        CrawlJobConfig config = (request.getJobConfig() != null ? request.getJobConfig() : CrawlJobConfig.builder().build())
                .withDefaults();
        configValidator.validate(request.getJobType(), request.getPriority(), config);

        CrawlSchedule schedule = CrawlSchedule.builder()
                .name(request.getName())
                .cron(request.getCron())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .jobType(request.getJobType())
                .jobConfig(config)
                .priority(request.getPriority() != null ? request.getPriority() : 5)
                .nextRunAt(cron.next(LocalDateTime.now()))
                .build();

        CrawlSchedule saved = scheduleRepository.save(schedule);
        log.info("[CrawlQueue] Schedule created: id={}, name={}, cron={}, nextRunAt={}",
                saved.getId(), saved.getName(), saved.getCron(), saved.getNextRunAt());
        return saved;
    }

    public List<CrawlSchedule> list() {
        return scheduleRepository.findAllByOrderByIdAsc();
    }

    @Transactional
    public CrawlSchedule setEnabled(Long id, boolean enabled) {
        CrawlSchedule schedule = scheduleRepository.findById(id)
                .orElseThrow(() -> BlockNotFoundException.of("CrawlSchedule", id));
        schedule.setEnabled(enabled);
        if (enabled) {
            schedule.setNextRunAt(parseCron(schedule.getCron()).next(LocalDateTime.now()));
        }
        return scheduleRepository.save(schedule);
    }

    /**
     * 실행 시점이 지난 스케줄마다 작업을 등록하고 nextRunAt 을 다음 시점으로 옮긴다
     *
     * @return 등록된 작업 수
     */
    public int fireDueSchedules() {
        LocalDateTime now = LocalDateTime.now();
        int fired = 0;
        for (CrawlSchedule schedule : scheduleRepository.findByEnabledTrueAndNextRunAtLessThanEqual(now)) {
            try {
                String jobId = crawlJobService.schedule(CrawlJobRequest.builder()
                        .type(schedule.getJobType())
                        .priority(schedule.getPriority())
                        .config(schedule.getJobConfig())
                        .build(), schedule.getId());
                log.info("[CrawlQueue] Schedule {} fired job {}", schedule.getName(), jobId);
                fired++;
            } catch (ValidationException e) {
                log.warn("[CrawlQueue] Schedule {} has an invalid job config, disabling: {}",
                        schedule.getName(), e.getMessage());
                schedule.setEnabled(false);
            }
            schedule.setLastRunAt(now);
            schedule.setNextRunAt(parseCron(schedule.getCron()).next(now));
            scheduleRepository.save(schedule);
        }
        return fired;
    }

    private CronExpression parseCron(String expression) {
        try {
            return CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid cron expression '" + expression + "': " + e.getMessage());
        }
    }
}
