package com.kidsmap.datablock.dto.migration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 마이그레이션 결과. 오류는 예외 대신 errors 로 전달된다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationResult {

    private long migrated;

    private long failed;

    private boolean validated;

    private String rollbackPointId;

    /** ms */
    private long duration;

    private boolean dryRun;

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
