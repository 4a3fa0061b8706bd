package com.kidsmap.datablock.service.crawl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 빈 워커 수만큼 대기 작업을 선점해서 워커 풀에 넘긴다.
 */
@Component
@Slf4j
public class CrawlJobDispatcher {

    private final CrawlJobService crawlJobService;
    private final CrawlJobWorker crawlJobWorker;
    private final ThreadPoolTaskExecutor workerExecutor;

    public CrawlJobDispatcher(CrawlJobService crawlJobService,
                              CrawlJobWorker crawlJobWorker,
                              @Qualifier("crawlWorkerExecutor") ThreadPoolTaskExecutor workerExecutor) {
        this.crawlJobService = crawlJobService;
        this.crawlJobWorker = crawlJobWorker;
        this.workerExecutor = workerExecutor;
    }

    /**
     * @return 워커에 넘긴 작업 수
     */
    public int dispatch() {
        int idle = workerExecutor.getMaxPoolSize() - workerExecutor.getActiveCount();
        if (idle <= 0) {
            log.debug("No idle crawl worker");
            return 0;
        }

        List<String> claimed = crawlJobService.claimReadyJobs(idle);
        int dispatched = 0;
        for (String jobId : claimed) {
            try {
                workerExecutor.execute(() -> crawlJobWorker.execute(jobId));
                crawlJobService.onDispatched(jobId);
                dispatched++;
            } catch (TaskRejectedException e) {
                crawlJobService.releaseClaim(jobId);
            }
        }
        return dispatched;
    }
}
