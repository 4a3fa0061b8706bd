package com.kidsmap.datablock.dto.pipeline;

import com.kidsmap.datablock.entity.QualityGrade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 파이프라인 실행 결과. processed == succeeded + failed + skipped 가 항상 성립한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {

    @Builder.Default
    private int processed = 0;

    @Builder.Default
    private int succeeded = 0;

    @Builder.Default
    private int failed = 0;

    @Builder.Default
    private int skipped = 0;

    /** succeeded 중 신규 생성 */
    @Builder.Default
    private int created = 0;

    /** succeeded 중 기존 블록 갱신 */
    @Builder.Default
    private int updated = 0;

    /** skipped 중 중복 */
    @Builder.Default
    private int duplicates = 0;

    /** skipped 중 품질 기준 미달 */
    @Builder.Default
    private int belowThreshold = 0;

    @Builder.Default
    private Map<QualityGrade, Integer> qualityDistribution = new EnumMap<>(QualityGrade.class);

    @Builder.Default
    private List<PipelineError> errors = new ArrayList<>();

    /** 생성된 블록 ID (dryRun 이면 비어 있음) */
    @Builder.Default
    private List<UUID> createdIds = new ArrayList<>();

    private long duration;

    private boolean dryRun;

    public static PipelineResult empty() {
        return PipelineResult.builder().build();
    }

    public void recordGrade(QualityGrade grade) {
        qualityDistribution.merge(grade, 1, Integer::sum);
    }

    public void recordCreated(UUID id) {
        processed++;
        succeeded++;
        created++;
        if (id != null) {
            createdIds.add(id);
        }
    }

    public void recordUpdated() {
        processed++;
        succeeded++;
        updated++;
    }

    public void recordDuplicate() {
        processed++;
        skipped++;
        duplicates++;
    }

    public void recordBelowThreshold() {
        processed++;
        skipped++;
        belowThreshold++;
    }

    public void recordFailure(PipelineError error) {
        processed++;
        failed++;
        errors.add(error);
    }

    /**
     * 다른 배치 결과를 누적한다. duration/dryRun 은 호출자가 설정한다.
     */
    public PipelineResult merge(PipelineResult other) {
        processed += other.processed;
        succeeded += other.succeeded;
        failed += other.failed;
        skipped += other.skipped;
        created += other.created;
        updated += other.updated;
        duplicates += other.duplicates;
        belowThreshold += other.belowThreshold;
        other.qualityDistribution.forEach((grade, count) -> qualityDistribution.merge(grade, count, Integer::sum));
        errors.addAll(other.errors);
        createdIds.addAll(other.createdIds);
        return this;
    }
}
