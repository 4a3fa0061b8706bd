package com.kidsmap.datablock.config;

import com.kidsmap.datablock.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;

/**
 * NCP Object Storage (S3 호환) 클라이언트.
 * 마이그레이션 대상으로 켜져 있을 때만 생성된다.
 */
@Configuration
@ConditionalOnProperty(name = "datablock.migration.object-storage.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ObjectStorageConfig {

    private final DataBlockProperties properties;

    @Bean(destroyMethod = "close")
    public S3Client objectStorageClient() {
        DataBlockProperties.ObjectStorage storage = properties.getMigration().getObjectStorage();
        if (isBlank(storage.getEndpoint())) {
            throw ConfigurationException.missing("ObjectStorage", "datablock.migration.object-storage.endpoint");
        }
        if (isBlank(storage.getBucket())) {
            throw ConfigurationException.missing("ObjectStorage", "datablock.migration.object-storage.bucket");
        }
        if (isBlank(storage.getAccessKey()) || isBlank(storage.getSecretKey())) {
            throw ConfigurationException.missing("ObjectStorage", "datablock.migration.object-storage.access-key/secret-key");
        }

        log.info("Object storage client initialized: endpoint={}, bucket={}", storage.getEndpoint(), storage.getBucket());
        return S3Client.builder()
                .endpointOverride(URI.create(storage.getEndpoint()))
                .region(Region.of(storage.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey())))
                // NCP 는 virtual-host 방식을 지원하지 않는 리전이 있음
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.builder().numRetries(2).build())
                        .apiCallTimeout(Duration.ofSeconds(60))
                        .build())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
