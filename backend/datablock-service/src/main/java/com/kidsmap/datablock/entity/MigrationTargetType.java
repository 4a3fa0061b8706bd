package com.kidsmap.datablock.entity;

/**
 * 마이그레이션 대상 저장소
 */
public enum MigrationTargetType {
    /** Supabase Postgres (JDBC) */
    SUPABASE,
    /** NCP Cloud DB for PostgreSQL (JDBC) */
    NCP_POSTGRES,
    /** NCP Object Storage (S3 호환) */
    NCP_OBJECT_STORAGE;

    public boolean isRelational() {
        return this != NCP_OBJECT_STORAGE;
    }
}
