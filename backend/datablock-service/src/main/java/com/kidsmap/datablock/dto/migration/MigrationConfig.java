package com.kidsmap.datablock.dto.migration;

import com.kidsmap.datablock.entity.MigrationTargetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationConfig {

    @Builder.Default
    private String source = "postgres";

    private MigrationTargetType target;

    /** null 이면 datablock.migration.batch-size */
    private Integer batchSize;

    @Builder.Default
    private boolean validateAfterMigration = true;

    @Builder.Default
    private boolean createRollbackPoint = true;

    /** 기본은 dry run. 실제 복사는 명시적으로 false 를 줘야 한다. */
    @Builder.Default
    private boolean dryRun = true;
}
