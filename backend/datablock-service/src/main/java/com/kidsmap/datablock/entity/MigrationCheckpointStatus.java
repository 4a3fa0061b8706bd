package com.kidsmap.datablock.entity;

public enum MigrationCheckpointStatus {
    CREATED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    ROLLED_BACK
}
