package com.kidsmap.datablock.service.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.entity.MigrationCheckpoint;
import com.kidsmap.datablock.entity.MigrationTargetType;
import com.kidsmap.datablock.exception.DataBlockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * NCP Object Storage 대상. 배치마다 JSON 배열 객체 하나를 쓴다.
 * 키: {prefix}/{places|contents}/batch_{epochMillis}_{i}.json
 */
@Component
@ConditionalOnProperty(name = "datablock.migration.object-storage.enabled", havingValue = "true")
@Slf4j
public class ObjectStorageMigrationTarget implements MigrationTarget {

    /** DeleteObjects 한 번에 지울 수 있는 최대 키 수 */
    private static final int DELETE_BATCH_SIZE = 1000;

    private final S3Client s3Client;
    private final ObjectMapper objectMapper;
    private final String bucket;
    private final String keyPrefix;

    public ObjectStorageMigrationTarget(S3Client objectStorageClient,
                                        ObjectMapper objectMapper,
                                        DataBlockProperties properties) {
        this.s3Client = objectStorageClient;
        this.objectMapper = objectMapper;
        this.bucket = properties.getMigration().getObjectStorage().getBucket();
        this.keyPrefix = properties.getMigration().getObjectStorage().getKeyPrefix();
    }

    @Override
    public boolean supports(MigrationTargetType type) {
        return type == MigrationTargetType.NCP_OBJECT_STORAGE;
    }

    @Override
    public void writeBatch(MigrationCheckpoint checkpoint, String blockType, List<MigrationRecord> records, int batchIndex) {
        String key = String.format("%s/%s/batch_%d_%d.json", keyPrefix, blockType, System.currentTimeMillis(), batchIndex);
        List<Object> documents = new ArrayList<>(records.size());
        records.forEach(record -> documents.add(record.document()));

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(documents);
        } catch (JsonProcessingException e) {
            throw new DataBlockException("MIGRATION_ERROR", "Failed to serialize batch " + batchIndex + ": " + e.getMessage(), e);
        }

        s3Client.putObject(PutObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .contentType("application/json")
                        .build(),
                RequestBody.fromBytes(body));
        checkpoint.getWrittenKeys().add(key);
        log.debug("Wrote {} {} to s3://{}/{}", records.size(), blockType, bucket, key);
    }

    /**
     * 체크포인트의 키를 다시 읽어 배열 길이를 합산한다. 읽을 수 없는 객체는 0 건으로 센다.
     */
    @Override
    public long countWritten(MigrationCheckpoint checkpoint, String blockType) {
        long total = 0;
        for (String key : checkpoint.getWrittenKeys()) {
            try {
                ResponseBytes<GetObjectResponse> object = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .build());
                JsonNode array = objectMapper.readTree(object.asByteArray());
                total += array.isArray() ? array.size() : 0;
            } catch (SdkException | IOException e) {
                log.warn("[Migration] Could not read back {}: {}", key, e.getMessage());
            }
        }
        return total;
    }

    @Override
    public void rollback(MigrationCheckpoint checkpoint) {
        List<String> keys = checkpoint.getWrittenKeys();
        for (int start = 0; start < keys.size(); start += DELETE_BATCH_SIZE) {
            List<ObjectIdentifier> identifiers = keys.subList(start, Math.min(start + DELETE_BATCH_SIZE, keys.size()))
                    .stream()
                    .map(key -> ObjectIdentifier.builder().key(key).build())
                    .toList();
            s3Client.deleteObjects(DeleteObjectsRequest.builder()
                    .bucket(bucket)
                    .delete(Delete.builder().objects(identifiers).build())
                    .build());
        }
        log.info("[Migration] Deleted {} objects for checkpoint {}", keys.size(), checkpoint.getId());
    }
}
