package com.kidsmap.datablock.exception;

/**
 * 마이그레이션 후 대상 저장소 건수가 기대값과 다름. 롤백 여부는 운영자가 결정한다.
 */
public class MigrationValidationMismatchException extends DataBlockException {

    private final long expected;
    private final long actual;

    public MigrationValidationMismatchException(String checkpointId, long expected, long actual) {
        super("MIGRATION_VALIDATION_MISMATCH",
                String.format("Migration %s validation mismatch: expected=%d, actual=%d", checkpointId, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public long getExpected() {
        return expected;
    }

    public long getActual() {
        return actual;
    }
}
