package com.kidsmap.datablock.service.crawl;

import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.crawl.CrawlError;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.dto.crawl.CrawlJobRequest;
import com.kidsmap.datablock.dto.crawl.CrawlProgress;
import com.kidsmap.datablock.dto.crawl.CrawlResult;
import com.kidsmap.datablock.dto.crawl.QueueStats;
import com.kidsmap.datablock.entity.CrawlFailureReason;
import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.TransientNetworkException;
import com.kidsmap.datablock.repository.CrawlJobRepository;
import com.kidsmap.datablock.service.source.SourceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 크롤링 작업 큐 관리 서비스.
 *
 * 작업을 PENDING 으로 등록하고 상태 전이(취소/일시정지/재개/재시도)를 관리한다.
 * 실행은 CrawlJobDispatcher 가 선점한 뒤 CrawlJobWorker 가 담당한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlJobService {

    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final CrawlJobRepository crawlJobRepository;
    private final CrawlJobConfigValidator configValidator;
    private final CrawlJobEventPublisher eventPublisher;
    private final DataBlockProperties properties;

    /**
     * 큐 통계용 세션 카운터
     */
    private final AtomicLong sessionDispatched = new AtomicLong(0);
    private final AtomicLong sessionCompleted = new AtomicLong(0);
    private final AtomicLong sessionFailed = new AtomicLong(0);

    // ========================================
    // 등록
    // ========================================

    /**
     * 설정을 검증하고 PENDING 으로 등록한다. 실행을 기다리지 않고 작업 ID 를 바로 반환한다.
     */
    public String schedule(CrawlJobRequest request) {
        return schedule(request, null);
    }

    public String schedule(CrawlJobType type, CrawlJobConfig config) {
        return schedule(CrawlJobRequest.builder().type(type).config(config).build());
    }

    @Transactional
    public String schedule(CrawlJobRequest request, Long scheduleId) {
        CrawlJobConfig config = (request.getConfig() != null ? request.getConfig() : CrawlJobConfig.builder().build())
                .withDefaults();
        configValidator.validate(request.getType(), request.getPriority(), config);

        CrawlJob job = CrawlJob.builder()
                .id(newJobId())
                .type(request.getType())
                .status(CrawlJobStatus.PENDING)
                .priority(request.getPriority() != null ? request.getPriority() : properties.getCrawl().getDefaultPriority())
                .config(config)
                .progress(CrawlProgress.empty())
                .maxRetries(request.getMaxRetries() != null && request.getMaxRetries() >= 0
                        ? request.getMaxRetries() : properties.getCrawl().getDefaultMaxRetries())
                .scheduleId(scheduleId)
                .build();

        CrawlJob saved = crawlJobRepository.save(job);
        eventPublisher.publish(saved);
        log.info("[CrawlQueue] Job scheduled: id={}, type={}, priority={}, sources={}",
                saved.getId(), saved.getType(), saved.getPriority(), config.getSources());
        return saved.getId();
    }

    /**
     * TourAPI, 놀이시설, 카카오 장소 전체 크롤링
     */
    public String scheduleFullCrawl() {
        return schedule(CrawlJobRequest.builder()
                .type(CrawlJobType.FULL_CRAWL)
                .priority(3)
                .config(CrawlJobConfig.builder()
                        .sources(List.of("TOUR_API", "PLAYGROUND_API", "KAKAO_LOCAL"))
                        .maxPages(200)
                        .build())
                .build());
    }

    public String scheduleRegionCrawl(List<String> regionCodes) {
        return schedule(CrawlJobRequest.builder()
                .type(CrawlJobType.REGION_CRAWL)
                .priority(5)
                .config(CrawlJobConfig.builder()
                        .sources(List.of("TOUR_API", "PLAYGROUND_API"))
                        .regionCodes(regionCodes)
                        .build())
                .build());
    }

    /**
     * @param keywords 비어 있으면 기본 키워드 사용
     */
    public String scheduleContentCrawl(List<String> keywords) {
        return schedule(CrawlJobRequest.builder()
                .type(CrawlJobType.CONTENT_REFRESH)
                .priority(6)
                .config(CrawlJobConfig.builder()
                        .sources(List.of("YOUTUBE", "NAVER_BLOG", "NAVER_CLIP"))
                        .keywords(keywords != null && !keywords.isEmpty() ? keywords : SourceExtractor.DEFAULT_CONTENT_KEYWORDS)
                        .maxPages(50)
                        .build())
                .build());
    }

    // ========================================
    // 조회
    // ========================================

    public CrawlJob getStatus(String jobId) {
        return crawlJobRepository.findById(jobId)
                .orElseThrow(() -> BlockNotFoundException.of("CrawlJob", jobId));
    }

    public boolean isRunning(String jobId) {
        return crawlJobRepository.findById(jobId)
                .map(job -> job.getStatus() == CrawlJobStatus.RUNNING)
                .orElse(false);
    }

    /**
     * 최근 작업 목록 (생성 역순)
     */
    public List<CrawlJob> listRecent(CrawlJobStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 100)), Sort.by(Sort.Direction.DESC, "createdAt"));
        if (status != null) {
            return crawlJobRepository.findByStatus(status, page).getContent();
        }
        return crawlJobRepository.findAll(page).getContent();
    }

    public QueueStats queueStats() {
        LocalDateTime now = LocalDateTime.now();
        long pending = crawlJobRepository.countByStatus(CrawlJobStatus.PENDING);
        long delayed = crawlJobRepository.countByStatusAndNextAttemptAfterAfter(CrawlJobStatus.PENDING, now);

        return QueueStats.builder()
                .waiting(pending - delayed)
                .delayed(delayed)
                .active(crawlJobRepository.countByStatus(CrawlJobStatus.RUNNING))
                .completed(crawlJobRepository.countByStatus(CrawlJobStatus.COMPLETED))
                .failed(crawlJobRepository.countByStatus(CrawlJobStatus.FAILED))
                .cancelled(crawlJobRepository.countByStatus(CrawlJobStatus.CANCELLED))
                .paused(crawlJobRepository.countByStatus(CrawlJobStatus.PAUSED))
                .sessionDispatched(sessionDispatched.get())
                .sessionCompleted(sessionCompleted.get())
                .sessionFailed(sessionFailed.get())
                .build();
    }

    // ========================================
    // 수동 상태 전이
    // ========================================

    /**
     * PENDING, RUNNING, PAUSED 에서만 가능. 실행 중이면 워커가 다음 배치 전에 멈춘다.
     */
    public CrawlJob cancel(String jobId) {
        CrawlJob job = mutate(jobId, CrawlJob::markCancelled);
        log.info("[CrawlQueue] Job cancelled: id={}", jobId);
        return job;
    }

    /**
     * RUNNING 에서만 가능
     */
    public CrawlJob pause(String jobId) {
        CrawlJob job = mutate(jobId, CrawlJob::markPaused);
        log.info("[CrawlQueue] Job paused: id={}", jobId);
        return job;
    }

    /**
     * PAUSED 에서만 가능. 다시 PENDING 이 되어 처음부터 실행된다.
     */
    public CrawlJob resume(String jobId) {
        CrawlJob job = mutate(jobId, CrawlJob::resume);
        log.info("[CrawlQueue] Job resumed: id={}", jobId);
        return job;
    }

    // ========================================
    // 디스패처 / 워커 콜백
    // ========================================

    /**
     * 실행 가능한 작업을 우선순위 순으로 최대 limit 개 선점한다.
     * 조건부 UPDATE 가 1 행을 바꾼 경우에만 선점한 것으로 본다.
     */
    @Transactional
    public List<String> claimReadyJobs(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        LocalDateTime now = LocalDateTime.now();
        List<String> claimed = new ArrayList<>();
        for (CrawlJob candidate : crawlJobRepository.findReadyJobs(now, PageRequest.of(0, limit))) {
            if (crawlJobRepository.claim(candidate.getId(), now) == 1) {
                claimed.add(candidate.getId());
            } else {
                log.debug("Job {} was claimed elsewhere", candidate.getId());
            }
        }
        return claimed;
    }

    public void onDispatched(String jobId) {
        sessionDispatched.incrementAndGet();
        crawlJobRepository.findById(jobId).ifPresent(eventPublisher::publish);
        log.info("[CrawlQueue] Job claimed: id={}", jobId);
    }

    /**
     * 워커에 넘기지 못한 선점을 되돌린다
     */
    public void releaseClaim(String jobId) {
        mutate(jobId, job -> job.transitionTo(CrawlJobStatus.PENDING));
        log.warn("[CrawlQueue] Released claim on job {}: no idle worker", jobId);
    }

    /**
     * 진행 상황을 저장하고 현재 상태를 반환한다. RUNNING 이 아니면 저장하지 않는다.
     */
    public CrawlJobStatus updateProgress(String jobId, CrawlProgress progress) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            CrawlJob job = getStatus(jobId);
            if (job.getStatus() != CrawlJobStatus.RUNNING) {
                return job.getStatus();
            }
            job.setProgress(progress);
            try {
                crawlJobRepository.save(job);
                return CrawlJobStatus.RUNNING;
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Progress save conflict on job {} (attempt {}/{})", jobId, attempt, MAX_WRITE_ATTEMPTS);
            }
        }
        return getStatus(jobId).getStatus();
    }

    /**
     * 실행 종료. 그 사이 취소/일시정지된 작업은 상태를 유지하고 부분 결과만 남긴다.
     */
    public CrawlJob complete(String jobId, CrawlResult result, CrawlProgress progress) {
        CrawlJob job = mutate(jobId, current -> {
            current.setProgress(progress);
            if (current.getStatus() == CrawlJobStatus.RUNNING) {
                current.markCompleted(result);
            } else {
                current.setResult(result);
            }
        });

        if (job.getStatus() == CrawlJobStatus.COMPLETED) {
            sessionCompleted.incrementAndGet();
            log.info("[CrawlQueue] Job completed: id={}, type={}, new={}, updated={}, deleted={}, duplicates={}, {}ms",
                    jobId, job.getType(), result.getNewBlocks(), result.getUpdatedBlocks(),
                    result.getDeletedBlocks(), result.getDuplicatesSkipped(), result.getDuration());
        } else {
            log.info("[CrawlQueue] Job stopped as {}: id={}, partial new={}", job.getStatus(), jobId, result.getNewBlocks());
        }
        return job;
    }

    /**
     * 실행 실패. 일시적 네트워크 오류이고 retryOnFail 이면 백오프 후 재시도를 예약하고,
     * 그 외에는 즉시 FAILED 로 전이한다.
     */
    public CrawlJob fail(String jobId, Throwable cause) {
        CrawlError error = CrawlError.from(cause);
        Duration base = Duration.ofMillis(properties.getCrawl().getBackoffBaseMs());
        Duration max = Duration.ofMillis(properties.getCrawl().getMaxBackoffMs());

        CrawlJob job = mutate(jobId, current -> {
            if (current.getStatus() != CrawlJobStatus.RUNNING) {
                current.setError(error);
                return;
            }
            boolean retryOnFail = current.getConfig() == null || !Boolean.FALSE.equals(current.getConfig().getRetryOnFail());
            if (cause instanceof TransientNetworkException && retryOnFail) {
                current.scheduleRetry(error, base, max);
            } else {
                current.markFailed(error);
            }
        });

        if (job.getStatus() == CrawlJobStatus.PENDING) {
            log.warn("[CrawlQueue] Job {} will retry ({}/{}) after {}: {}",
                    jobId, job.getRetryCount(), job.getMaxRetries(), job.getNextAttemptAfter(), error.getMessage());
        } else if (job.getStatus() == CrawlJobStatus.FAILED) {
            sessionFailed.incrementAndGet();
            log.error("[CrawlQueue] Job failed: id={}, code={}, retries={}, message={}",
                    jobId, error.getCode(), job.getRetryCount(), error.getMessage());
        }
        return job;
    }

    /**
     * stuckTimeoutMinutes 이상 RUNNING 으로 남은 작업을 PENDING 으로 되돌린다 (프로세스 중단 후 복구)
     */
    public int recoverStuckJobs() {
        LocalDateTime threshold = LocalDateTime.now().minusMinutes(properties.getCrawl().getStuckTimeoutMinutes());
        List<CrawlJob> stuck = crawlJobRepository.findByStatusAndStartedAtBefore(CrawlJobStatus.RUNNING, threshold);

        int recovered = 0;
        for (CrawlJob job : stuck) {
            try {
                mutate(job.getId(), current -> {
                    if (current.getStatus() == CrawlJobStatus.RUNNING) {
                        current.setError(CrawlError.builder()
                                .code(CrawlFailureReason.STUCK_TIMEOUT.getCode())
                                .message(CrawlFailureReason.STUCK_TIMEOUT.getDescription())
                                .build());
                        current.transitionTo(CrawlJobStatus.PENDING);
                    }
                });
                recovered++;
            } catch (ObjectOptimisticLockingFailureException e) {
                log.warn("[CrawlQueue] Could not recover job {}: concurrently modified", job.getId());
            }
        }
        if (recovered > 0) {
            log.warn("[CrawlQueue] Recovered {} stuck jobs", recovered);
        }
        return recovered;
    }

    private CrawlJob mutate(String jobId, Consumer<CrawlJob> change) {
        ObjectOptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            CrawlJob job = getStatus(jobId);
            CrawlJobStatus before = job.getStatus();
            change.accept(job);
            try {
                CrawlJob saved = crawlJobRepository.save(job);
                if (saved.getStatus() != before) {
                    eventPublisher.publish(saved);
                }
                return saved;
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Concurrent modification on job {} (attempt {}/{})", jobId, attempt, MAX_WRITE_ATTEMPTS);
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    private static String newJobId() {
        return "job_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
