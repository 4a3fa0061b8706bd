package com.kidsmap.datablock.dto.crawl;

import com.kidsmap.datablock.entity.CrawlJobType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlScheduleRequest {

    @NotBlank
    private String name;

    /** Spring 6필드 cron (예: 0 0 3 * * *) */
    @NotBlank
    private String cron;

    @NotNull
    private CrawlJobType jobType;

    private CrawlJobConfig jobConfig;

    private Integer priority;

    private Boolean enabled;
}
