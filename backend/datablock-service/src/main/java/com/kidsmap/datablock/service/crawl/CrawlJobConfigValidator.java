package com.kidsmap.datablock.service.crawl;

import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.entity.PlaceSourceType;
import com.kidsmap.datablock.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 작업 등록 전 설정 검증. 위반 사항을 모두 모아 한 번에 ValidationException 으로 던진다.
 */
@Component
public class CrawlJobConfigValidator {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    private static final Set<String> PLACE_SOURCES = Arrays.stream(PlaceSourceType.values())
            .filter(type -> type != PlaceSourceType.MANUAL)
            .map(Enum::name)
            .collect(Collectors.toSet());

    private static final Set<String> CONTENT_SOURCES = Arrays.stream(ContentSourceType.values())
            .map(Enum::name)
            .collect(Collectors.toSet());

    /**
     * @param config 기본값이 채워진 설정
     */
    public void validate(CrawlJobType type, Integer priority, CrawlJobConfig config) {
        List<String> violations = new ArrayList<>();

        if (type == null) {
            violations.add("type is required");
        }
        if (priority != null && (priority < MIN_PRIORITY || priority > MAX_PRIORITY)) {
            violations.add("priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
        if (config == null) {
            throw new ValidationException(violations.isEmpty() ? List.of("config is required") : violations);
        }

        if (config.getPageSize() < 1 || config.getPageSize() > 100) {
            violations.add("pageSize must be between 1 and 100");
        }
        if (config.getMaxPages() < 1 || config.getMaxPages() > 1000) {
            violations.add("maxPages must be between 1 and 1000");
        }
        if (config.getConcurrency() < 1 || config.getConcurrency() > 10) {
            violations.add("concurrency must be between 1 and 10");
        }
        if (config.getRequestDelay() < 0) {
            violations.add("requestDelay must be >= 0");
        }

        if (type != null) {
            validateSources(type, config, violations);
            validateTypeSpecific(type, config, violations);
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void validateSources(CrawlJobType type, CrawlJobConfig config, List<String> violations) {
        if (type.isMaintenance()) {
            return;
        }
        List<String> sources = config.getSources();
        if (sources == null || sources.isEmpty()) {
            violations.add("at least one source is required");
            return;
        }
        Set<String> allowed = type.isPlaceCrawl() ? PLACE_SOURCES : CONTENT_SOURCES;
        for (String source : sources) {
            if (source == null || !allowed.contains(source)) {
                violations.add("source " + source + " is not valid for " + type);
            }
        }
    }

    private void validateTypeSpecific(CrawlJobType type, CrawlJobConfig config, List<String> violations) {
        switch (type) {
            case REGION_CRAWL:
                if (config.getRegionCodes() == null || config.getRegionCodes().isEmpty()) {
                    violations.add("REGION_CRAWL requires regionCodes");
                }
                break;
            case CATEGORY_CRAWL:
                if (config.getCategories() == null || config.getCategories().isEmpty()) {
                    violations.add("CATEGORY_CRAWL requires categories");
                }
                break;
            case INCREMENTAL:
                if (config.getModifiedSince() == null) {
                    violations.add("INCREMENTAL requires modifiedSince");
                } else if (config.getModifiedSince().isAfter(LocalDateTime.now())) {
                    violations.add("modifiedSince must not be in the future");
                }
                break;
            default:
                break;
        }
    }
}
