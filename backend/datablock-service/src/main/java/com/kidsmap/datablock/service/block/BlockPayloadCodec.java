package com.kidsmap.datablock.service.block;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.exception.DataBlockException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 블록 data 컬럼(JSON)의 버전 관리 직렬화.
 *
 * <ul>
 *   <li>v1: operatingHours 가 자유 형식 문자열</li>
 *   <li>v2: operatingHours 가 {weekday, saturday, sunday, closedDays} 객체</li>
 * </ul>
 * 읽을 때 v1 문서는 v2 로 올려서 해석하고, 알 수 없는 상위 버전은 거부한다.
 */
@Component
public class BlockPayloadCodec {

    public static final int CURRENT_VERSION = 2;
    public static final String VERSION_FIELD = "schemaVersion";

    private final ObjectMapper objectMapper;

    public BlockPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    // ========================================
    // 쓰기
    // ========================================

    public String encodePlace(NormalizedPlace place) {
        return encode(place);
    }

    public String encodeContent(NormalizedContent content) {
        return encode(content);
    }

    private String encode(Object payload) {
        ObjectNode node = objectMapper.valueToTree(payload);
        node.put(VERSION_FIELD, CURRENT_VERSION);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new DataBlockException("PAYLOAD_ENCODE_ERROR", "Failed to encode block payload: " + e.getMessage(), e);
        }
    }

    // ========================================
    // 읽기
    // ========================================

    public NormalizedPlace decodePlace(String json) {
        ObjectNode node = readVersioned(json);
        if (versionOf(node) < 2) {
            upgradeOperatingHours(node);
        }
        node.remove(VERSION_FIELD);
        return convert(node, NormalizedPlace.class);
    }

    public NormalizedContent decodeContent(String json) {
        ObjectNode node = readVersioned(json);
        node.remove(VERSION_FIELD);
        return convert(node, NormalizedContent.class);
    }

    private ObjectNode readVersioned(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "{}" : json);
        } catch (JsonProcessingException e) {
            throw new DataBlockException("PAYLOAD_DECODE_ERROR", "Block payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(root instanceof ObjectNode node)) {
            throw new DataBlockException("PAYLOAD_DECODE_ERROR", "Block payload must be a JSON object");
        }
        int version = versionOf(node);
        if (version > CURRENT_VERSION) {
            throw new DataBlockException("UNSUPPORTED_SCHEMA_VERSION",
                    "Block payload schemaVersion " + version + " is newer than supported " + CURRENT_VERSION);
        }
        return node;
    }

    /**
     * schemaVersion 이 없으면 v1
     */
    private int versionOf(JsonNode node) {
        return node.path(VERSION_FIELD).asInt(1);
    }

    /**
     * v1 → v2: "09:00-18:00" 같은 문자열을 weekday 로 옮긴다
     */
    private void upgradeOperatingHours(ObjectNode node) {
        JsonNode hours = node.get("operatingHours");
        if (hours != null && hours.isTextual()) {
            ObjectNode upgraded = objectMapper.createObjectNode();
            upgraded.put("weekday", hours.asText());
            node.set("operatingHours", upgraded);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new DataBlockException("PAYLOAD_DECODE_ERROR",
                    "Block payload does not match " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    // ========================================
    // 병합
    // ========================================

    /**
     * 얕은 병합: patch 의 null 이 아닌 최상위 필드가 기존 값을 덮어쓴다.
     * 중첩 객체와 배열은 통째로 교체된다.
     */
    public NormalizedPlace mergePlace(NormalizedPlace existing, NormalizedPlace patch) {
        return merge(existing, patch, NormalizedPlace.class);
    }

    public NormalizedContent mergeContent(NormalizedContent existing, NormalizedContent patch) {
        return merge(existing, patch, NormalizedContent.class);
    }

    private <T> T merge(T existing, T patch, Class<T> type) {
        try {
            T copy = objectMapper.treeToValue(objectMapper.valueToTree(existing), type);
            if (patch == null) {
                return copy;
            }
            JsonNode patchNode = objectMapper.valueToTree(patch);
            return objectMapper.readerForUpdating(copy).readValue(patchNode);
        } catch (IOException e) {
            throw new DataBlockException("PAYLOAD_MERGE_ERROR", "Failed to merge block payload: " + e.getMessage(), e);
        }
    }
}
