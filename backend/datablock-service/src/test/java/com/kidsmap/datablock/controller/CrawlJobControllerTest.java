package com.kidsmap.datablock.controller;

import com.kidsmap.datablock.dto.crawl.CrawlJobRequest;
import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.exception.InvalidTransitionException;
import com.kidsmap.datablock.exception.ValidationException;
import com.kidsmap.datablock.service.crawl.CrawlJobService;
import com.kidsmap.datablock.service.crawl.CrawlScheduleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CrawlJobController 단위 테스트
 */
@WebFluxTest(CrawlJobController.class)
@ActiveProfiles("test")
class CrawlJobControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private CrawlJobService crawlJobService;

    @MockBean
    private CrawlScheduleService crawlScheduleService;

    @Test
    @DisplayName("POST /api/v1/crawl-jobs - 작업 등록 시 202 와 jobId 반환")
    void scheduleReturnsAccepted() {
        when(crawlJobService.schedule(any(CrawlJobRequest.class))).thenReturn("job_1714550000000_ab12cd");

        webTestClient.post()
                .uri("/api/v1/crawl-jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "REGION_CRAWL", "priority", 3,
                        "config", Map.of("regionCodes", List.of("1", "31"))))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("job_1714550000000_ab12cd");

        verify(crawlJobService).schedule(argThat((CrawlJobRequest request) ->
                request.getType() == CrawlJobType.REGION_CRAWL
                        && request.getPriority() == 3
                        && request.getConfig().getRegionCodes().equals(List.of("1", "31"))));
    }

    @Test
    @DisplayName("POST /api/v1/crawl-jobs - 잘못된 설정은 400 과 위반 목록")
    void scheduleRejectsInvalidConfig() {
        when(crawlJobService.schedule(any(CrawlJobRequest.class)))
                .thenThrow(new ValidationException(List.of("priority must be between 1 and 10", "pageSize must be >= 1")));

        webTestClient.post()
                .uri("/api/v1/crawl-jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "FULL_CRAWL", "priority", 11))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.violations.length()").isEqualTo(2);
    }

    @Test
    @DisplayName("POST /api/v1/crawl-jobs/presets/content - 본문 없이도 기본 키워드로 등록")
    void contentPresetWithoutBody() {
        when(crawlJobService.scheduleContentCrawl(null)).thenReturn("job_2");

        webTestClient.post()
                .uri("/api/v1/crawl-jobs/presets/content")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("job_2");
    }

    @Test
    @DisplayName("GET /api/v1/crawl-jobs/{id} - 작업 상태 조회")
    void getStatus() {
        CrawlJob job = CrawlJob.builder()
                .id("job_3")
                .type(CrawlJobType.FULL_CRAWL)
                .status(CrawlJobStatus.RUNNING)
                .build();
        when(crawlJobService.getStatus("job_3")).thenReturn(job);

        webTestClient.get()
                .uri("/api/v1/crawl-jobs/job_3")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("job_3")
                .jsonPath("$.status").isEqualTo("RUNNING");
    }

    @Test
    @DisplayName("GET /api/v1/crawl-jobs/{id} - 없는 작업은 404")
    void unknownJob() {
        when(crawlJobService.getStatus("missing")).thenThrow(BlockNotFoundException.of("CrawlJob", "missing"));

        webTestClient.get()
                .uri("/api/v1/crawl-jobs/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("POST /api/v1/crawl-jobs/{id}/cancel - 끝난 작업 취소는 409")
    void cancelFinishedJob() {
        when(crawlJobService.cancel("job_4")).thenThrow(
                InvalidTransitionException.of("CrawlJob", "job_4", CrawlJobStatus.COMPLETED, CrawlJobStatus.CANCELLED));

        webTestClient.post()
                .uri("/api/v1/crawl-jobs/job_4/cancel")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TRANSITION");
    }

    @Test
    @DisplayName("POST /api/v1/crawl-jobs/schedules - 필수 필드가 없으면 400")
    void createScheduleRequiresFields() {
        webTestClient.post()
                .uri("/api/v1/crawl-jobs/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "nightly"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

        verifyNoInteractions(crawlScheduleService);
    }
}
