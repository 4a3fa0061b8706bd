package com.kidsmap.datablock.service.pipeline;

import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.pipeline.PipelineConfig;
import com.kidsmap.datablock.dto.pipeline.PipelineError;
import com.kidsmap.datablock.dto.pipeline.PipelineResult;
import com.kidsmap.datablock.dto.pipeline.PipelineStage;
import com.kidsmap.datablock.exception.DuplicateBlockException;
import com.kidsmap.datablock.exception.ValidationException;
import com.kidsmap.datablock.service.block.BlockStatsService;
import com.kidsmap.datablock.service.block.ContentBlockService;
import com.kidsmap.datablock.service.block.PlaceBlockService;
import com.kidsmap.datablock.service.quality.BlockQualityEngine;
import com.kidsmap.datablock.service.quality.QualityAssessment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ETL 파이프라인 (Transform + Load).
 *
 * 입력을 batchSize 로 나누고 최대 concurrency 개 배치를 동시에 처리한다.
 * 배치 안의 레코드는 순서대로 hash → 조회 → 쓰기를 수행한다.
 * 레코드 단위 예외는 결과의 errors 로 모으고 배치를 중단하지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataBlockPipeline {

    private final PlaceBlockService placeBlockService;
    private final ContentBlockService contentBlockService;
    private final BlockStatsService blockStatsService;
    private final BlockQualityEngine qualityEngine;
    private final DataBlockProperties properties;
    private final MeterRegistry meterRegistry;

    private Counter succeededCounter;
    private Counter failedCounter;
    private Counter skippedCounter;
    private Timer durationTimer;

    @PostConstruct
    public void initMetrics() {
        succeededCounter = Counter.builder("datablock.pipeline.records")
                .tag("outcome", "succeeded")
                .description("Records written by the pipeline")
                .register(meterRegistry);

        failedCounter = Counter.builder("datablock.pipeline.records")
                .tag("outcome", "failed")
                .description("Records that failed in the pipeline")
                .register(meterRegistry);

        skippedCounter = Counter.builder("datablock.pipeline.records")
                .tag("outcome", "skipped")
                .description("Records skipped as duplicates or below the quality threshold")
                .register(meterRegistry);

        durationTimer = Timer.builder("datablock.pipeline.duration")
                .description("Pipeline run duration")
                .register(meterRegistry);
    }

    // ========================================
    // 공개 API
    // ========================================

    public PipelineResult processPlaces(List<NormalizedPlace> records) {
        return processPlaces(records, null, PipelineListener.NONE);
    }

    public PipelineResult processPlaces(List<NormalizedPlace> records, PipelineConfig config, PipelineListener listener) {
        return run("places", records, config, listener, new RecordLoader<>() {
            @Override
            public String recordId(NormalizedPlace record) {
                return record.getId();
            }

            @Override
            public QualityAssessment assess(NormalizedPlace record) {
                return qualityEngine.assessPlace(record);
            }

            @Override
            public Optional<UUID> findExisting(String dedupeHash) {
                return placeBlockService.findLiveId(dedupeHash);
            }

            @Override
            public UUID create(NormalizedPlace record) {
                return placeBlockService.create(record).getId();
            }

            @Override
            public void update(UUID id, NormalizedPlace record) {
                placeBlockService.update(id, record);
            }
        });
    }

    public PipelineResult processContents(List<NormalizedContent> records) {
        return processContents(records, null, null, PipelineListener.NONE);
    }

    /**
     * @param relatedPlaceId 새로 만든 콘텐츠를 연결할 장소 (없으면 null)
     */
    public PipelineResult processContents(List<NormalizedContent> records,
                                          UUID relatedPlaceId,
                                          PipelineConfig config,
                                          PipelineListener listener) {
        return run("contents", records, config, listener, new RecordLoader<>() {
            @Override
            public String recordId(NormalizedContent record) {
                return record.getId();
            }

            @Override
            public QualityAssessment assess(NormalizedContent record) {
                return qualityEngine.assessContent(record);
            }

            @Override
            public Optional<UUID> findExisting(String dedupeHash) {
                return contentBlockService.findLiveId(dedupeHash);
            }

            @Override
            public UUID create(NormalizedContent record) {
                UUID id = contentBlockService.create(record, relatedPlaceId).getId();
                if (relatedPlaceId != null) {
                    placeBlockService.linkContent(relatedPlaceId, id);
                }
                return id;
            }

            @Override
            public void update(UUID id, NormalizedContent record) {
                contentBlockService.update(id, record);
            }
        });
    }

    // ========================================
    // 실행
    // ========================================

    private <T> PipelineResult run(String kind,
                                   List<T> records,
                                   PipelineConfig overrides,
                                   PipelineListener listener,
                                   RecordLoader<T> loader) {
        PipelineConfig config = resolve(overrides);
        long startTime = System.currentTimeMillis();
        PipelineListener callback = listener != null ? listener : PipelineListener.NONE;

        if (Boolean.TRUE.equals(config.getEnableBackup())) {
            log.debug("Backup requested for {} run (no backup target configured)", kind);
        }
        if (Boolean.TRUE.equals(config.getEnableAnalysis())) {
            log.debug("Analysis requested for {} run (no analysis engine configured)", kind);
        }

        PipelineResult total = PipelineResult.empty();
        total.setDryRun(config.getDryRun());
        if (records == null || records.isEmpty()) {
            return total;
        }

        List<List<T>> batches = partition(records, config.getBatchSize());
        Set<String> seenInDryRun = ConcurrentHashMap.newKeySet();

        log.info("Pipeline {} started: records={}, batches={}, concurrency={}, dryRun={}",
                kind, records.size(), batches.size(), config.getConcurrency(), config.getDryRun());

        Flux.range(0, batches.size())
                .flatMap(index -> Mono.fromCallable(() -> callback.shouldContinue()
                                        ? processBatch(batches.get(index), index, config, loader, seenInDryRun)
                                        : null)
                                .subscribeOn(Schedulers.boundedElastic()),
                        config.getConcurrency())
                .doOnNext(batchResult -> {
                    total.merge(batchResult);
                    callback.onBatchComplete(snapshot(total));
                })
                .blockLast();
        // 배치 완료 순서와 무관하게 입력 순서로 (정렬은 안정적이라 배치 내 순서 유지)
        total.getErrors().sort(Comparator.comparingInt(PipelineError::batchIndex));

        long duration = System.currentTimeMillis() - startTime;
        total.setDuration(duration);
        durationTimer.record(Duration.ofMillis(duration));
        succeededCounter.increment(total.getSucceeded());
        failedCounter.increment(total.getFailed());
        skippedCounter.increment(total.getSkipped());

        log.info("Pipeline {} finished: processed={}, succeeded={} (created={}, updated={}), failed={}, skipped={}, {}ms",
                kind, total.getProcessed(), total.getSucceeded(), total.getCreated(), total.getUpdated(),
                total.getFailed(), total.getSkipped(), duration);

        if (!config.getDryRun() && total.getSucceeded() > 0) {
            refreshStatsQuietly();
        }
        return total;
    }

    private <T> PipelineResult processBatch(List<T> batch,
                                            int batchIndex,
                                            PipelineConfig config,
                                            RecordLoader<T> loader,
                                            Set<String> seenInDryRun) {
        PipelineResult result = PipelineResult.empty();
        for (int i = 0; i < batch.size(); i++) {
            T record = batch.get(i);
            String recordId = Optional.ofNullable(loader.recordId(record))
                    .orElse("batch" + batchIndex + "#" + i);
            processRecord(record, recordId, batchIndex, config, loader, result, seenInDryRun);
        }
        return result;
    }

    private <T> void processRecord(T record,
                                   String recordId,
                                   int batchIndex,
                                   PipelineConfig config,
                                   RecordLoader<T> loader,
                                   PipelineResult result,
                                   Set<String> seenInDryRun) {
        QualityAssessment assessment;
        try {
            assessment = loader.assess(record);
        } catch (RuntimeException e) {
            log.warn("Transform failed for {}: {}", recordId, e.getMessage());
            result.recordFailure(new PipelineError(PipelineStage.TRANSFORM, batchIndex, recordId, e.getMessage()));
            return;
        }

        result.recordGrade(assessment.grade());
        if (assessment.grade().isWorseThan(config.getQualityThreshold())) {
            log.debug("Below quality threshold ({} < {}): {}", assessment.grade(), config.getQualityThreshold(), recordId);
            result.recordBelowThreshold();
            return;
        }

        try {
            Optional<UUID> existing = loader.findExisting(assessment.dedupeHash());
            if (existing.isEmpty() && config.getDryRun() && !seenInDryRun.add(assessment.dedupeHash())) {
                existing = Optional.of(new UUID(0L, 0L));
            }

            if (existing.isPresent() && config.getUpdateExisting()) {
                if (!config.getDryRun()) {
                    loader.update(existing.get(), record);
                }
                result.recordUpdated();
                return;
            }
            if (existing.isPresent() && config.getSkipDuplicates()) {
                log.debug("Duplicate skipped: {} ({})", recordId, assessment.dedupeHash());
                result.recordDuplicate();
                return;
            }

            if (config.getDryRun()) {
                result.recordCreated(null);
            } else {
                result.recordCreated(loader.create(record));
            }
        } catch (DuplicateBlockException e) {
            if (config.getSkipDuplicates()) {
                log.debug("Concurrent duplicate skipped: {}", recordId);
                result.recordDuplicate();
            } else {
                result.recordFailure(new PipelineError(PipelineStage.LOAD, batchIndex, recordId, e.getMessage()));
            }
        } catch (RuntimeException e) {
            log.warn("Load failed for {}: {}", recordId, e.getMessage());
            result.recordFailure(new PipelineError(PipelineStage.LOAD, batchIndex, recordId, e.getMessage()));
        }
    }

    // ========================================
    // 헬퍼
    // ========================================

    /**
     * 호출별 설정을 기본값 위에 합치고 검증한다. 배치 시작 전에 실패한다.
     */
    PipelineConfig resolve(PipelineConfig overrides) {
        PipelineConfig defaults = properties.getPipeline().toConfig();
        PipelineConfig config = overrides != null ? overrides.mergedOver(defaults) : defaults;

        List<String> violations = new ArrayList<>();
        if (config.getBatchSize() == null || config.getBatchSize() < 1) {
            violations.add("batchSize must be >= 1");
        }
        if (config.getConcurrency() == null || config.getConcurrency() < 1) {
            violations.add("concurrency must be >= 1");
        }
        if (config.getQualityThreshold() == null) {
            violations.add("qualityThreshold is required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return config;
    }

    private void refreshStatsQuietly() {
        try {
            blockStatsService.refreshStats();
        } catch (Exception e) {
            log.warn("Failed to refresh block stats after pipeline run: {}", e.getMessage());
        }
    }

    private static <T> List<List<T>> partition(List<T> records, int batchSize) {
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < records.size(); start += batchSize) {
            batches.add(records.subList(start, Math.min(start + batchSize, records.size())));
        }
        return batches;
    }

    private static PipelineResult snapshot(PipelineResult result) {
        PipelineResult copy = PipelineResult.empty();
        copy.merge(result);
        copy.setDryRun(result.isDryRun());
        return copy;
    }

    /**
     * 블록 종류별 Load 동작
     */
    private interface RecordLoader<T> {

        String recordId(T record);

        QualityAssessment assess(T record);

        Optional<UUID> findExisting(String dedupeHash);

        UUID create(T record);

        void update(UUID id, T record);
    }
}
