package com.kidsmap.datablock.dto.pipeline;

import com.kidsmap.datablock.entity.QualityGrade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 파이프라인 실행 설정. null 필드는 설정 기본값(datablock.pipeline.*)을 따른다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PipelineConfig {

    private Integer batchSize;

    private Integer concurrency;

    /** 이 등급보다 나쁜 레코드는 저장하지 않는다 */
    private QualityGrade qualityThreshold;

    private Boolean skipDuplicates;

    private Boolean updateExisting;

    private Boolean dryRun;

    private Boolean enableBackup;

    private Boolean enableAnalysis;

    /**
     * 이 설정의 값이 있으면 우선하고, 없으면 defaults 값을 쓴다.
     */
    public PipelineConfig mergedOver(PipelineConfig defaults) {
        return PipelineConfig.builder()
                .batchSize(batchSize != null ? batchSize : defaults.getBatchSize())
                .concurrency(concurrency != null ? concurrency : defaults.getConcurrency())
                .qualityThreshold(qualityThreshold != null ? qualityThreshold : defaults.getQualityThreshold())
                .skipDuplicates(skipDuplicates != null ? skipDuplicates : defaults.getSkipDuplicates())
                .updateExisting(updateExisting != null ? updateExisting : defaults.getUpdateExisting())
                .dryRun(dryRun != null ? dryRun : defaults.getDryRun())
                .enableBackup(enableBackup != null ? enableBackup : defaults.getEnableBackup())
                .enableAnalysis(enableAnalysis != null ? enableAnalysis : defaults.getEnableAnalysis())
                .build();
    }
}
