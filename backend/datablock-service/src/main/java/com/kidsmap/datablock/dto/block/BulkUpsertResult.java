package com.kidsmap.datablock.dto.block;

/**
 * bulkUpsert 결과. 레코드 단위로 적용되므로 중간 실패 시 일부만 반영될 수 있다.
 */
public record BulkUpsertResult(int created, int updated, int skipped) {

    public static BulkUpsertResult empty() {
        return new BulkUpsertResult(0, 0, 0);
    }
}
