package com.kidsmap.datablock.service.crawl;

import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.dto.crawl.CrawlJobRequest;
import com.kidsmap.datablock.dto.crawl.CrawlProgress;
import com.kidsmap.datablock.dto.crawl.CrawlResult;
import com.kidsmap.datablock.entity.CrawlJob;
import com.kidsmap.datablock.entity.CrawlJobStatus;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.exception.InvalidTransitionException;
import com.kidsmap.datablock.exception.TransientNetworkException;
import com.kidsmap.datablock.exception.ValidationException;
import com.kidsmap.datablock.repository.CrawlJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * CrawlJobService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class CrawlJobServiceTest {

    @Mock
    private CrawlJobRepository crawlJobRepository;

    @Mock
    private CrawlJobEventPublisher eventPublisher;

    private CrawlJobService crawlJobService;

    @BeforeEach
    void setUp() {
        crawlJobService = new CrawlJobService(crawlJobRepository, new CrawlJobConfigValidator(),
                eventPublisher, new DataBlockProperties());
    }

    private CrawlJob stored(String id, CrawlJobStatus status) {
        CrawlJob job = CrawlJob.builder()
                .id(id)
                .type(CrawlJobType.REGION_CRAWL)
                .status(status)
                .priority(5)
                .config(CrawlJobConfig.builder().regionCodes(List.of("1")).build().withDefaults())
                .progress(CrawlProgress.empty())
                .retryCount(0)
                .maxRetries(2)
                .build();
        lenient().when(crawlJobRepository.findById(id)).thenReturn(Optional.of(job));
        lenient().when(crawlJobRepository.save(job)).thenReturn(job);
        return job;
    }

    @Nested
    @DisplayName("등록")
    class Schedule {

        @Test
        @DisplayName("유효한 요청은 PENDING 으로 저장되고 작업 ID 를 바로 반환한다")
        void schedulesPendingJob() {
            // given
            when(crawlJobRepository.save(any(CrawlJob.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // when
            String jobId = crawlJobService.scheduleRegionCrawl(List.of("1", "31"));

            // then
            assertThat(jobId).startsWith("job_");
            ArgumentCaptor<CrawlJob> captor = ArgumentCaptor.forClass(CrawlJob.class);
            verify(crawlJobRepository).save(captor.capture());
            CrawlJob saved = captor.getValue();
            assertThat(saved.getStatus()).isEqualTo(CrawlJobStatus.PENDING);
            assertThat(saved.getPriority()).isEqualTo(5);
            assertThat(saved.getMaxRetries()).isEqualTo(3);
            assertThat(saved.getConfig().getPageSize()).isEqualTo(50);
            assertThat(saved.getConfig().getRegionCodes()).containsExactly("1", "31");
            verify(eventPublisher, times(1)).publish(saved);
        }

        @Test
        @DisplayName("잘못된 설정은 위반 사항을 모두 모아 거부하고 큐에 넣지 않는다")
        void rejectsInvalidConfig() {
            // given
            CrawlJobRequest request = CrawlJobRequest.builder()
                    .type(CrawlJobType.REGION_CRAWL)
                    .priority(11)
                    .config(CrawlJobConfig.builder().pageSize(0).sources(List.of("YOUTUBE")).build())
                    .build();

            // when & then
            assertThatThrownBy(() -> crawlJobService.schedule(request))
                    .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getViolations())
                            .hasSize(4)
                            .anyMatch(v -> v.contains("priority"))
                            .anyMatch(v -> v.contains("pageSize"))
                            .anyMatch(v -> v.contains("YOUTUBE"))
                            .anyMatch(v -> v.contains("regionCodes")));
            verify(crawlJobRepository, never()).save(any());
        }

        @Test
        @DisplayName("INCREMENTAL 은 미래 시점의 modifiedSince 를 거부한다")
        void rejectsFutureModifiedSince() {
            CrawlJobConfig config = CrawlJobConfig.builder().modifiedSince(LocalDateTime.now().plusDays(1)).build();

            assertThatThrownBy(() -> crawlJobService.schedule(CrawlJobType.INCREMENTAL, config))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("future");
        }

        @Test
        @DisplayName("콘텐츠 프리셋은 키워드가 없으면 기본 키워드를 쓴다")
        void contentPresetUsesDefaultKeywords() {
            when(crawlJobRepository.save(any(CrawlJob.class))).thenAnswer(invocation -> invocation.getArgument(0));

            crawlJobService.scheduleContentCrawl(List.of());

            ArgumentCaptor<CrawlJob> captor = ArgumentCaptor.forClass(CrawlJob.class);
            verify(crawlJobRepository).save(captor.capture());
            assertThat(captor.getValue().getType()).isEqualTo(CrawlJobType.CONTENT_REFRESH);
            assertThat(captor.getValue().getPriority()).isEqualTo(6);
            assertThat(captor.getValue().getConfig().getKeywords()).isNotEmpty();
        }
    }

    @Nested
    @DisplayName("상태 전이")
    class Transitions {

        @Test
        @DisplayName("완료된 작업은 취소할 수 없다")
        void cannotCancelCompleted() {
            stored("job_done", CrawlJobStatus.COMPLETED);

            assertThatThrownBy(() -> crawlJobService.cancel("job_done"))
                    .isInstanceOf(InvalidTransitionException.class);
            verify(crawlJobRepository, never()).save(any());
        }

        @Test
        @DisplayName("대기 중인 작업은 일시정지할 수 없다")
        void cannotPausePending() {
            stored("job_wait", CrawlJobStatus.PENDING);

            assertThatThrownBy(() -> crawlJobService.pause("job_wait"))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("실행 중 취소된 작업은 완료 보고가 와도 CANCELLED 를 유지한다")
        void cancelledJobStaysCancelled() {
            // given
            CrawlJob job = stored("job_run", CrawlJobStatus.RUNNING);
            crawlJobService.cancel("job_run");

            // when
            CrawlJob result = crawlJobService.complete("job_run",
                    CrawlResult.builder().newBlocks(3).build(), CrawlProgress.empty());

            // then
            assertThat(result.getStatus()).isEqualTo(CrawlJobStatus.CANCELLED);
            assertThat(result.getResult().getNewBlocks()).isEqualTo(3);
            assertThat(job.getCompletedAt()).isNotNull();
            assertThat(crawlJobService.queueStats().getSessionCompleted()).isZero();
        }

        @Test
        @DisplayName("RUNNING 이 아닌 작업의 진행 상황은 저장하지 않는다")
        void progressIgnoredWhenNotRunning() {
            stored("job_paused", CrawlJobStatus.PAUSED);

            CrawlJobStatus status = crawlJobService.updateProgress("job_paused", CrawlProgress.empty());

            assertThat(status).isEqualTo(CrawlJobStatus.PAUSED);
            verify(crawlJobRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("실패와 재시도")
    class Retry {

        @Test
        @DisplayName("일시적 오류는 maxRetries 번까지 재시도하고 그 다음 실패에서 FAILED")
        void retryBound() {
            // given
            CrawlJob job = stored("job_retry", CrawlJobStatus.RUNNING);
            TransientNetworkException timeout = new TransientNetworkException("TourAPI timeout");

            // when
            crawlJobService.fail("job_retry", timeout);
            assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.PENDING);
            assertThat(job.getNextAttemptAfter()).isAfter(LocalDateTime.now());

            job.markRunning();
            crawlJobService.fail("job_retry", timeout);
            assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.PENDING);

            job.markRunning();
            crawlJobService.fail("job_retry", timeout);

            // then
            assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.FAILED);
            assertThat(job.getRetryCount()).isEqualTo(2);
            assertThat(job.getError().getMessage()).contains("TourAPI timeout");
        }

        @Test
        @DisplayName("일시적이지 않은 오류는 바로 FAILED")
        void nonTransientFailsImmediately() {
            CrawlJob job = stored("job_bug", CrawlJobStatus.RUNNING);

            crawlJobService.fail("job_bug", new IllegalStateException("boom"));

            assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.FAILED);
            assertThat(job.getRetryCount()).isZero();
        }

        @Test
        @DisplayName("retryOnFail=false 이면 일시적 오류도 재시도하지 않는다")
        void retryDisabled() {
            CrawlJob job = stored("job_noretry", CrawlJobStatus.RUNNING);
            job.getConfig().setRetryOnFail(false);

            crawlJobService.fail("job_noretry", new TransientNetworkException("503"));

            assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("선점")
    class Claim {

        @Test
        @DisplayName("조건부 UPDATE 가 성공한 작업만 선점된다")
        void claimsOnlyWinners() {
            // given
            CrawlJob a = CrawlJob.builder().id("job_a").priority(9).build();
            CrawlJob b = CrawlJob.builder().id("job_b").priority(7).build();
            CrawlJob c = CrawlJob.builder().id("job_c").priority(5).build();
            when(crawlJobRepository.findReadyJobs(any(LocalDateTime.class), any(Pageable.class)))
                    .thenReturn(List.of(a, b, c));
            when(crawlJobRepository.claim(eq("job_a"), any(LocalDateTime.class))).thenReturn(1);
            when(crawlJobRepository.claim(eq("job_b"), any(LocalDateTime.class))).thenReturn(0);
            when(crawlJobRepository.claim(eq("job_c"), any(LocalDateTime.class))).thenReturn(1);

            // when
            List<String> claimed = crawlJobService.claimReadyJobs(3);

            // then
            assertThat(claimed).containsExactly("job_a", "job_c");
        }

        @Test
        @DisplayName("유휴 워커가 없으면 조회하지 않는다")
        void zeroLimit() {
            assertThat(crawlJobService.claimReadyJobs(0)).isEmpty();
            verifyNoInteractions(crawlJobRepository);
        }
    }
}
