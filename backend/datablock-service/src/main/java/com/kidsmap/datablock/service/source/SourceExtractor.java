package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.dto.crawl.CrawlResult;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.PlaceSourceType;
import com.kidsmap.datablock.exception.MalformedRecordException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Extract 단계.
 *
 * 설정된 소스를 순서대로 페이지 단위로 조회하고, 각 아이템을 정규화 + 엄격 검증한다.
 * 검증에 실패한 레코드는 DEBUG 로그를 남기고 sourceStats.failed 로만 집계한다.
 * 읽을 수 없는 페이지는 건너뛰고 다음 페이지로 진행한다.
 * 네트워크 오류는 그대로 전파되어 작업 단위 재시도로 이어진다.
 */
@Component
@Slf4j
public class SourceExtractor {

    public static final List<String> DEFAULT_CONTENT_KEYWORDS =
            List.of("키즈카페 추천", "아이랑 놀이공원", "어린이 박물관 후기", "실내놀이터 브이로그");

    private final Map<PlaceSourceType, PlaceSourceClient> placeClients = new EnumMap<>(PlaceSourceType.class);
    private final Map<ContentSourceType, ContentSourceClient> contentClients = new EnumMap<>(ContentSourceType.class);
    private final NormalizedRecordValidator validator;

    public SourceExtractor(List<PlaceSourceClient> placeSourceClients,
                           List<ContentSourceClient> contentSourceClients,
                           NormalizedRecordValidator validator) {
        placeSourceClients.forEach(client -> placeClients.put(client.getSourceType(), client));
        contentSourceClients.forEach(client -> contentClients.put(client.getSourceType(), client));
        this.validator = validator;
    }

    // ========================================
    // 장소
    // ========================================

    public ExtractResult<NormalizedPlace> extractPlaces(CrawlJobType type, CrawlJobConfig config, ExtractListener listener) {
        List<NormalizedPlace> places = new ArrayList<>();
        Map<String, CrawlResult.SourceStat> stats = new LinkedHashMap<>();
        Set<PlaceCategory> categoryFilter = type == CrawlJobType.CATEGORY_CRAWL && config.getCategories() != null
                && !config.getCategories().isEmpty()
                ? EnumSet.copyOf(config.getCategories()) : null;

        for (String sourceName : config.getSources()) {
            PlaceSourceType sourceType = parse(PlaceSourceType.class, sourceName);
            PlaceSourceClient client = sourceType != null ? placeClients.get(sourceType) : null;
            if (client == null || !client.isAvailable()) {
                log.warn("Place source {} is not available, skipping", sourceName);
                continue;
            }

            CrawlResult.SourceStat stat = stats.computeIfAbsent(sourceName, key -> new CrawlResult.SourceStat());
            for (SourceQuery query : client.planQueries(type, config)) {
                boolean completed = pageThrough(sourceName, query, config, listener, client::fetchPage, item -> {
                    NormalizedPlace place = validator.validate(client.normalize(item));
                    if (categoryFilter != null && !categoryFilter.contains(place.getCategory())) {
                        log.debug("Dropping {} outside category filter: {}", place.getId(), place.getCategory());
                        return null;
                    }
                    return place;
                }, places, stat);
                if (!completed) {
                    return new ExtractResult<>(places, stats, true);
                }
            }
            log.info("Extracted from {}: total={}, accepted={}, rejected={}",
                    sourceName, stat.getTotal(), stat.getSuccess(), stat.getFailed());
        }
        return new ExtractResult<>(places, stats, false);
    }

    // ========================================
    // 콘텐츠
    // ========================================

    public ExtractResult<NormalizedContent> extractContents(CrawlJobConfig config, ExtractListener listener) {
        List<NormalizedContent> contents = new ArrayList<>();
        Map<String, CrawlResult.SourceStat> stats = new LinkedHashMap<>();
        List<String> keywords = config.getKeywords() != null && !config.getKeywords().isEmpty()
                ? config.getKeywords() : DEFAULT_CONTENT_KEYWORDS;

        for (String keyword : keywords) {
            for (String sourceName : config.getSources()) {
                ContentSourceType sourceType = parse(ContentSourceType.class, sourceName);
                ContentSourceClient client = sourceType != null ? contentClients.get(sourceType) : null;
                if (client == null || !client.isAvailable()) {
                    log.warn("Content source {} is not available, skipping", sourceName);
                    continue;
                }

                CrawlResult.SourceStat stat = stats.computeIfAbsent(sourceName, key -> new CrawlResult.SourceStat());
                SourceQuery query = SourceQuery.builder().keyword(keyword).pageSize(config.getPageSize()).build();
                boolean completed = pageThrough(sourceName, query, config, listener, client::fetchPage,
                        item -> validator.validate(client.normalize(item)), contents, stat);
                if (!completed) {
                    return new ExtractResult<>(contents, stats, true);
                }
            }
        }
        return new ExtractResult<>(contents, stats, false);
    }

    // ========================================
    // 공통
    // ========================================

    /**
     * 한 조회 조건을 maxPages 까지 페이지 순회. 중단 요청을 받으면 false.
     */
    private <T> boolean pageThrough(String sourceName,
                                    SourceQuery query,
                                    CrawlJobConfig config,
                                    ExtractListener listener,
                                    Function<SourceQuery, SourcePage> fetcher,
                                    Function<JsonNode, T> parser,
                                    List<T> sink,
                                    CrawlResult.SourceStat stat) {
        for (int page = 1; page <= config.getMaxPages(); page++) {
            if (!listener.shouldContinue()) {
                log.info("Extraction from {} stopped at page {} ({})", sourceName, page, query.describe());
                return false;
            }
            listener.onPage(sourceName, page);

            SourcePage result = fetcher.apply(query.forPage(page));
            int accepted = 0;
            int rejected = 0;
            for (JsonNode item : result.items()) {
                try {
                    T record = parser.apply(item);
                    accepted++;
                    if (record != null) {
                        sink.add(record);
                    }
                } catch (MalformedRecordException e) {
                    rejected++;
                    log.debug("[{}] {}", sourceName, e.getMessage());
                } catch (RuntimeException e) {
                    rejected++;
                    log.debug("[{}] Unreadable item skipped: {}", sourceName, e.getMessage());
                }
            }
            stat.add(result.items().size(), accepted, rejected);

            if (result.skipped()) {
                log.warn("[{}] Page {} skipped ({})", sourceName, page, query.describe());
            } else if (!result.hasMore() || result.items().isEmpty()) {
                break;
            }
            if (!pause(config.getRequestDelay())) {
                return false;
            }
        }
        return true;
    }

    /**
     * 요청 간 지연. 인터럽트되면 false.
     */
    private boolean pause(Long delayMs) {
        if (delayMs == null || delayMs <= 0) return true;
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String name) {
        if (name == null) return null;
        try {
            return Enum.valueOf(type, name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
