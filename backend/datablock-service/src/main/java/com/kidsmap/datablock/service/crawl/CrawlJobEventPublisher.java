package com.kidsmap.datablock.service.crawl;

import com.kidsmap.datablock.dto.crawl.CrawlJobEvent;
import com.kidsmap.datablock.entity.CrawlJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * 작업 상태 변경 이벤트 발행.
 * datablock.events.enabled=false 이면 KafkaTemplate 빈이 없으므로 아무 것도 하지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrawlJobEventPublisher {

    private final ObjectProvider<KafkaTemplate<String, CrawlJobEvent>> kafkaTemplateProvider;

    @Value("${datablock.events.topic:kidsmap.crawl.job-events}")
    private String jobEventsTopic;

    public void publish(CrawlJob job) {
        KafkaTemplate<String, CrawlJobEvent> kafkaTemplate = kafkaTemplateProvider.getIfAvailable();
        if (kafkaTemplate == null) {
            return;
        }

        CrawlJobEvent event = CrawlJobEvent.of(job);
        try {
            kafkaTemplate.send(jobEventsTopic, job.getId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish crawl job event: jobId={}, status={}, error={}",
                                    job.getId(), event.status(), ex.getMessage());
                        } else {
                            log.debug("Published crawl job event: jobId={}, status={}", job.getId(), event.status());
                        }
                    });
        } catch (Exception e) {
            // 이벤트 발행 실패가 작업 상태 전이를 막지 않는다
            log.warn("Failed to send crawl job event: jobId={}, error={}", job.getId(), e.getMessage());
        }
    }
}
