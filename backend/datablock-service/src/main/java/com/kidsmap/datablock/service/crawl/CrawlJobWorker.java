package com.kidsmap.datablock.service.crawl;

import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.dto.crawl.CrawlProgress;
import com.kidsmap.datablock.dto.crawl.CrawlResult;
import com.kidsmap.datablock.dto.optimizer.DeduplicationResult;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationRequest;
import com.kidsmap.datablock.dto.optimizer.QualityOptimizationResult;
import com.kidsmap.datablock.dto.pipeline.PipelineConfig;
import com.kidsmap.datablock.dto.pipeline.PipelineResult;
import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.entity.QualityGrade;
import com.kidsmap.datablock.service.optimizer.BlockOptimizer;
import com.kidsmap.datablock.service.pipeline.DataBlockPipeline;
import com.kidsmap.datablock.service.pipeline.PipelineListener;
import com.kidsmap.datablock.service.source.ExtractListener;
import com.kidsmap.datablock.service.source.ExtractResult;
import com.kidsmap.datablock.service.source.SourceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 선점된 작업 하나를 실행한다.
 *
 * 장소/콘텐츠 작업은 Extract → 파이프라인 순서로 처리하고,
 * 페이지와 배치 사이마다 작업 상태를 다시 읽어 취소/일시정지에 협조한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrawlJobWorker {

    private static final List<QualityGrade> DEFAULT_ARCHIVE_GRADES = List.of(QualityGrade.D, QualityGrade.F);

    private final CrawlJobService crawlJobService;
    private final SourceExtractor sourceExtractor;
    private final DataBlockPipeline pipeline;
    private final BlockOptimizer blockOptimizer;

    public void execute(String jobId) {
        long startTime = System.currentTimeMillis();
        CrawlJob job;
        try {
            job = crawlJobService.getStatus(jobId);
        } catch (Exception e) {
            log.error("[CrawlQueue] Could not load claimed job {}: {}", jobId, e.getMessage(), e);
            return;
        }

        JobProgress tracker = new JobProgress(jobId, startTime);
        try {
            CrawlJobConfig config = job.getConfig() != null ? job.getConfig().withDefaults() : CrawlJobConfig.builder().build();
            CrawlResult result = run(job.getType(), config, tracker);
            result.setDuration(System.currentTimeMillis() - startTime);
            if (!tracker.stopped) {
                tracker.progress.setPercentage(100);
                tracker.progress.setEstimatedTimeRemaining(0L);
            }
            crawlJobService.complete(jobId, result, tracker.progress);
        } catch (Exception e) {
            log.warn("[CrawlQueue] Job {} ({}) failed: {}", jobId, job.getType(), e.getMessage());
            crawlJobService.fail(jobId, e);
        }
    }

    private CrawlResult run(CrawlJobType type, CrawlJobConfig config, JobProgress tracker) {
        switch (type) {
            case FULL_CRAWL:
            case REGION_CRAWL:
            case CATEGORY_CRAWL:
                return runPlaceCrawl(type, config, tracker);
            case INCREMENTAL:
                return runPlaceCrawl(type, config.toBuilder().updateExisting(true).build(), tracker);
            case CONTENT_REFRESH:
                return runContentRefresh(config, tracker);
            case QUALITY_CHECK:
                return runQualityCheck(config, tracker);
            case DEDUP_SCAN:
                return runDedupScan(tracker);
            default:
                throw new IllegalStateException("Unsupported job type: " + type);
        }
    }

    // ========================================
    // 작업 유형별 실행
    // ========================================

    private CrawlResult runPlaceCrawl(CrawlJobType type, CrawlJobConfig config, JobProgress tracker) {
        ExtractResult<NormalizedPlace> extracted = sourceExtractor.extractPlaces(type, config, tracker);
        CrawlResult result = CrawlResult.builder().sourceStats(extracted.sourceStats()).build();
        if (extracted.interrupted() || !tracker.shouldContinue()) {
            return result;
        }

        tracker.startLoading(extracted.records().size());
        PipelineResult loaded = pipeline.processPlaces(extracted.records(), pipelineConfig(config), tracker);
        return applyPipelineResult(result, loaded);
    }

    private CrawlResult runContentRefresh(CrawlJobConfig config, JobProgress tracker) {
        ExtractResult<NormalizedContent> extracted = sourceExtractor.extractContents(config, tracker);
        CrawlResult result = CrawlResult.builder().sourceStats(extracted.sourceStats()).build();
        if (extracted.interrupted() || !tracker.shouldContinue()) {
            return result;
        }

        tracker.startLoading(extracted.records().size());
        PipelineResult loaded = pipeline.processContents(extracted.records(), null, pipelineConfig(config), tracker);
        return applyPipelineResult(result, loaded);
    }

    private CrawlResult runQualityCheck(CrawlJobConfig config, JobProgress tracker) {
        List<QualityGrade> grades = config.getArchiveGrades() != null && !config.getArchiveGrades().isEmpty()
                ? config.getArchiveGrades() : DEFAULT_ARCHIVE_GRADES;
        QualityOptimizationResult optimized = blockOptimizer.optimizeByQuality(new QualityOptimizationRequest(grades, true));
        tracker.finishMaintenance(optimized.archived());
        return CrawlResult.builder()
                .deletedBlocks(optimized.archived())
                .build();
    }

    private CrawlResult runDedupScan(JobProgress tracker) {
        DeduplicationResult deduplicated = blockOptimizer.deduplicateBlocks();
        tracker.finishMaintenance(deduplicated.merged() + deduplicated.deleted());
        return CrawlResult.builder()
                .updatedBlocks(deduplicated.merged())
                .deletedBlocks(deduplicated.deleted())
                .build();
    }

    private PipelineConfig pipelineConfig(CrawlJobConfig config) {
        return PipelineConfig.builder()
                .concurrency(config.getConcurrency())
                .skipDuplicates(config.getSkipDuplicates())
                .updateExisting(config.getUpdateExisting())
                .build();
    }

    private CrawlResult applyPipelineResult(CrawlResult result, PipelineResult loaded) {
        result.setNewBlocks(loaded.getCreated());
        result.setUpdatedBlocks(loaded.getUpdated());
        result.setDuplicatesSkipped(loaded.getDuplicates());
        return result;
    }

    // ========================================
    // 진행 상황 / 협조적 중단
    // ========================================

    /**
     * 추출과 적재 양쪽의 콜백을 받아 작업 진행 상황으로 저장한다.
     * 저장 시점에 작업이 RUNNING 이 아니면 이후 shouldContinue 가 false 가 된다.
     */
    private class JobProgress implements ExtractListener, PipelineListener {

        private final String jobId;
        private final long startTime;
        private final CrawlProgress progress = CrawlProgress.empty();
        private volatile boolean stopped;
        private long loadStartTime;

        JobProgress(String jobId, long startTime) {
            this.jobId = jobId;
            this.startTime = startTime;
        }

        @Override
        public void onPage(String source, int page) {
            progress.setCurrentSource(source);
            progress.setCurrentPage(page);
            save();
        }

        @Override
        public void onBatchComplete(PipelineResult partialResult) {
            progress.setProcessed(partialResult.getProcessed());
            progress.setSucceeded(partialResult.getSucceeded());
            progress.setFailed(partialResult.getFailed());
            progress.setSkipped(partialResult.getSkipped());

            int total = progress.getTotalEstimated();
            int processed = partialResult.getProcessed();
            if (total > 0) {
                progress.setPercentage(Math.min(100, processed * 100 / total));
            }
            if (processed > 0 && total > processed) {
                long elapsed = System.currentTimeMillis() - loadStartTime;
                progress.setEstimatedTimeRemaining(elapsed * (total - processed) / processed / 1000);
            } else {
                progress.setEstimatedTimeRemaining(0L);
            }
            save();
        }

        @Override
        public boolean shouldContinue() {
            if (stopped) {
                return false;
            }
            if (!crawlJobService.isRunning(jobId)) {
                log.info("[CrawlQueue] Job {} is no longer running, stopping after {}ms",
                        jobId, System.currentTimeMillis() - startTime);
                stopped = true;
            }
            return !stopped;
        }

        void startLoading(int totalRecords) {
            loadStartTime = System.currentTimeMillis();
            progress.setTotalEstimated(totalRecords);
            progress.setCurrentSource(null);
            progress.setCurrentPage(null);
            save();
        }

        void finishMaintenance(int affected) {
            progress.setTotalEstimated(affected);
            progress.setProcessed(affected);
            progress.setSucceeded(affected);
            progress.setPercentage(100);
        }

        private void save() {
            CrawlJobStatus status = crawlJobService.updateProgress(jobId, progress.toBuilder().build());
            if (status != CrawlJobStatus.RUNNING) {
                stopped = true;
            }
        }
    }
}
