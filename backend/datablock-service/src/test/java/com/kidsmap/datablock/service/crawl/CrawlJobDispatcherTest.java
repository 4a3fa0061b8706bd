package com.kidsmap.datablock.service.crawl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * CrawlJobDispatcher 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class CrawlJobDispatcherTest {

    @Mock
    private CrawlJobService crawlJobService;

    @Mock
    private CrawlJobWorker crawlJobWorker;

    @Mock
    private ThreadPoolTaskExecutor workerExecutor;

    private CrawlJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new CrawlJobDispatcher(crawlJobService, crawlJobWorker, workerExecutor);
    }

    @Test
    @DisplayName("빈 워커 수만큼만 작업을 선점하고 각 작업을 워커로 실행한다")
    void claimsUpToIdleWorkers() {
        // given
        when(workerExecutor.getMaxPoolSize()).thenReturn(4);
        when(workerExecutor.getActiveCount()).thenReturn(1);
        when(crawlJobService.claimReadyJobs(3)).thenReturn(List.of("job_a", "job_b"));

        // when
        int dispatched = dispatcher.dispatch();

        // then
        assertThat(dispatched).isEqualTo(2);
        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        verify(workerExecutor, times(2)).execute(tasks.capture());
        tasks.getAllValues().forEach(Runnable::run);
        verify(crawlJobWorker).execute("job_a");
        verify(crawlJobWorker).execute("job_b");
        verify(crawlJobService).onDispatched("job_a");
        verify(crawlJobService).onDispatched("job_b");
        verify(crawlJobService, never()).releaseClaim(any());
    }

    @Test
    @DisplayName("워커가 모두 바쁘면 작업을 선점하지 않는다")
    void noIdleWorker() {
        // given
        when(workerExecutor.getMaxPoolSize()).thenReturn(2);
        when(workerExecutor.getActiveCount()).thenReturn(2);

        // when
        int dispatched = dispatcher.dispatch();

        // then
        assertThat(dispatched).isZero();
        verify(crawlJobService, never()).claimReadyJobs(anyInt());
        verify(workerExecutor, never()).execute(any(Runnable.class));
    }

    @Test
    @DisplayName("풀이 작업을 거부하면 선점을 풀어 다시 대기 상태로 돌린다")
    void releasesClaimOnRejection() {
        // given
        when(workerExecutor.getMaxPoolSize()).thenReturn(2);
        when(workerExecutor.getActiveCount()).thenReturn(0);
        when(crawlJobService.claimReadyJobs(2)).thenReturn(List.of("job_a", "job_b"));
        doNothing()
                .doThrow(new TaskRejectedException("queue full"))
                .when(workerExecutor).execute(any(Runnable.class));

        // when
        int dispatched = dispatcher.dispatch();

        // then
        assertThat(dispatched).isEqualTo(1);
        verify(crawlJobService).onDispatched("job_a");
        verify(crawlJobService).releaseClaim("job_b");
        verify(crawlJobService, never()).onDispatched("job_b");
    }
}
