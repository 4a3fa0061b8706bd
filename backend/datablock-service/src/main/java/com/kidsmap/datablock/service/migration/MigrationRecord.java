package com.kidsmap.datablock.service.migration;

import java.util.UUID;

/**
 * 대상 저장소로 옮길 블록 한 건. document 는 JSON 으로 직렬화되는 블록 DTO 이다.
 */
public record MigrationRecord(UUID id, String dedupeHash, Object document) {
}
