package com.kidsmap.datablock.service.migration;

import com.kidsmap.datablock.entity.MigrationCheckpoint;
import com.kidsmap.datablock.entity.MigrationTargetType;

import java.util.List;

/**
 * 마이그레이션 대상 저장소.
 * 한 실행에서 쓴 항목은 checkpoint 로 식별할 수 있어야 검증과 롤백이 가능하다.
 */
public interface MigrationTarget {

    boolean supports(MigrationTargetType type);

    /**
     * 배치 하나를 쓴다. 실패하면 예외를 던지고, 이미 쓴 배치는 그대로 둔다.
     *
     * @param blockType places 또는 contents
     */
    void writeBatch(MigrationCheckpoint checkpoint, String blockType, List<MigrationRecord> records, int batchIndex);

    /**
     * 이번 실행이 대상 저장소에 남긴 레코드 수
     */
    long countWritten(MigrationCheckpoint checkpoint, String blockType);

    /**
     * 이번 실행이 쓴 항목을 지우고, 덮어쓴 항목은 실행 전 상태로 되돌린다
     */
    void rollback(MigrationCheckpoint checkpoint);
}
