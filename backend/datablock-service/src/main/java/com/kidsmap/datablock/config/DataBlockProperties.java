package com.kidsmap.datablock.config;

import com.kidsmap.datablock.dto.pipeline.PipelineConfig;
import com.kidsmap.datablock.entity.QualityGrade;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 데이터 블록 서비스 설정 (datablock.*)
 */
@Configuration
@ConfigurationProperties(prefix = "datablock")
@Data
public class DataBlockProperties {

    private Pipeline pipeline = new Pipeline();

    private Crawl crawl = new Crawl();

    private Monitor monitor = new Monitor();

    private Migration migration = new Migration();

    private Sources sources = new Sources();

    @Data
    public static class Pipeline {
        private int batchSize = 100;
        private int concurrency = 5;
        private QualityGrade qualityThreshold = QualityGrade.F;
        private boolean skipDuplicates = true;
        private boolean updateExisting = false;
        private boolean dryRun = false;

        public PipelineConfig toConfig() {
            return PipelineConfig.builder()
                    .batchSize(batchSize)
                    .concurrency(concurrency)
                    .qualityThreshold(qualityThreshold)
                    .skipDuplicates(skipDuplicates)
                    .updateExisting(updateExisting)
                    .dryRun(dryRun)
                    .enableBackup(false)
                    .enableAnalysis(false)
                    .build();
        }
    }

    @Data
    public static class Crawl {
        private int workerCount = 2;
        private long pollIntervalMs = 5000;
        private long backoffBaseMs = 5000;
        private long maxBackoffMs = 3_600_000;
        private int defaultMaxRetries = 3;
        private int defaultPriority = 5;
        private int stuckTimeoutMinutes = 60;
        private long statsRefreshIntervalMs = 600_000;
    }

    @Data
    public static class Monitor {
        private double minAvgQuality = 2.5;
        private double maxStaleRatio = 0.3;
        private long maxRecentErrors = 100;
        private int errorWindowHours = 24;
    }

    @Data
    public static class Migration {
        private int batchSize = 500;
        private ObjectStorage objectStorage = new ObjectStorage();
        private Relational relational = new Relational();
    }

    @Data
    public static class ObjectStorage {
        private boolean enabled = false;
        /** NCP: https://kr.object.ncloudstorage.com */
        private String endpoint;
        private String region = "kr-standard";
        private String bucket;
        private String accessKey;
        private String secretKey;
        private String keyPrefix = "kidsmap";
    }

    @Data
    public static class Relational {
        private boolean enabled = false;
        private String url;
        private String username;
        private String password;
        private String placeTable = "kidsmap_place_blocks";
        private String contentTable = "kidsmap_content_blocks";
        private int maxPoolSize = 4;
    }

    @Data
    public static class Sources {
        private Source tourApi = new Source(
                "https://apis.data.go.kr/B551011/KorService1/areaBasedList1");
        private Source playgroundApi = new Source(
                "https://apis.data.go.kr/1741000/SafePlaygroundInfoService2/getSafePlaygroundInfoList");
        private Source kakaoLocal = new Source(
                "https://dapi.kakao.com/v2/local/search/keyword.json");
        private Source youtube = new Source(
                "https://www.googleapis.com/youtube/v3/search");
        private Source naver = new Source(
                "https://openapi.naver.com/v1/search");
    }

    /**
     * 외부 API 접속 정보. apiKey 는 serviceKey / REST 키 / API 키로 쓰이고,
     * Naver 는 clientId / clientSecret 을 쓴다.
     */
    @Data
    public static class Source {
        private boolean enabled = false;
        private String baseUrl;
        private String apiKey;
        private String clientId;
        private String clientSecret;
        private long requestTimeoutMs = 10_000;
        private int maxAttempts = 3;

        public Source() {
        }

        public Source(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
