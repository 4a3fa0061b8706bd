package com.kidsmap.datablock.entity;

import com.kidsmap.datablock.dto.crawl.CrawlError;
import com.kidsmap.datablock.exception.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CrawlJob 상태 전이 단위 테스트
 */
class CrawlJobTest {

    private static final Duration BASE = Duration.ofSeconds(5);
    private static final Duration MAX = Duration.ofMinutes(1);

    private CrawlJob job(CrawlJobStatus status, int maxRetries) {
        return CrawlJob.builder()
                .id("job_test")
                .type(CrawlJobType.FULL_CRAWL)
                .status(status)
                .retryCount(0)
                .maxRetries(maxRetries)
                .build();
    }

    @ParameterizedTest(name = "{0} -> {1} : {2}")
    @CsvSource({
            "PENDING, RUNNING, true",
            "PENDING, CANCELLED, true",
            "PENDING, PAUSED, false",
            "RUNNING, COMPLETED, true",
            "RUNNING, PAUSED, true",
            "RUNNING, PENDING, true",
            "PAUSED, PENDING, true",
            "PAUSED, RUNNING, false",
            "COMPLETED, PENDING, false",
            "FAILED, RUNNING, false",
            "CANCELLED, PENDING, false"
    })
    @DisplayName("허용된 상태 전이")
    void transitionTable(CrawlJobStatus from, CrawlJobStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @Test
    @DisplayName("종료 상태에서는 전이할 수 없다")
    void terminalStatesAreFinal() {
        CrawlJob completed = job(CrawlJobStatus.COMPLETED, 3);

        assertThatThrownBy(completed::markCancelled)
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(completed.getStatus()).isEqualTo(CrawlJobStatus.COMPLETED);
    }

    @Test
    @DisplayName("재시도는 지수 백오프로 예약되고 최대값을 넘지 않는다")
    void exponentialBackoff() {
        CrawlJob job = job(CrawlJobStatus.RUNNING, 10);
        CrawlError error = CrawlError.builder().code("TRANSIENT_NETWORK_ERROR").message("timeout").build();

        LocalDateTime before = LocalDateTime.now();
        assertThat(job.scheduleRetry(error, BASE, MAX)).isTrue();
        assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.PENDING);
        assertThat(job.getRetryCount()).isEqualTo(1);
        assertThat(job.getNextAttemptAfter()).isAfterOrEqualTo(before.plusSeconds(5));
        assertThat(job.isReady(LocalDateTime.now())).isFalse();

        // 2, 3, 4 번째 재시도: 10s, 20s, 40s / 5 번째: 80s 이지만 최대 60s
        for (int i = 0; i < 4; i++) {
            job.markRunning();
            job.scheduleRetry(error, BASE, MAX);
        }
        assertThat(job.getRetryCount()).isEqualTo(5);
        assertThat(job.getNextAttemptAfter()).isBefore(LocalDateTime.now().plus(MAX).plusSeconds(1));
    }

    @Test
    @DisplayName("재시도 한도를 넘으면 FAILED")
    void retriesExhausted() {
        CrawlJob job = job(CrawlJobStatus.RUNNING, 1);
        CrawlError error = CrawlError.builder().code("TRANSIENT_NETWORK_ERROR").message("timeout").build();

        assertThat(job.scheduleRetry(error, BASE, MAX)).isTrue();
        job.markRunning();
        assertThat(job.scheduleRetry(error, BASE, MAX)).isFalse();

        assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.FAILED);
        assertThat(job.getRetryCount()).isEqualTo(1);
        assertThat(job.getError()).isEqualTo(error);
        assertThat(job.getCompletedAt()).isNotNull();
    }

    @Test
    @DisplayName("재개하면 대기 시간이 지워지고 바로 실행 가능하다")
    void resumeClearsDelay() {
        CrawlJob job = job(CrawlJobStatus.PAUSED, 3);
        job.setNextAttemptAfter(LocalDateTime.now().plusHours(1));

        job.resume();

        assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.PENDING);
        assertThat(job.isReady(LocalDateTime.now())).isTrue();
    }
}
