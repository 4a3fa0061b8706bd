package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.entity.AgeGroup;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.PlaceSourceType;
import com.kidsmap.datablock.exception.ConfigurationException;
import com.kidsmap.datablock.exception.DataBlockException;
import com.kidsmap.datablock.exception.MalformedRecordException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 행정안전부 전국어린이놀이시설정보 (SafePlaygroundInfoService2) 어댑터
 *
 * 지역 필터는 TourAPI 지역 코드를 받아 행정구역 시도 코드로 바꿔서 보낸다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaygroundApiClient implements PlaceSourceClient {

    static final String SOURCE_NAME = "PlaygroundAPI";

    private static final String SOURCE_URL = "https://www.cpf.go.kr/";

    /** TourAPI 지역 코드 → 행정구역 시도 코드 */
    private static final Map<String, String> AREA_TO_SIDO = Map.ofEntries(
            Map.entry("1", "11"), Map.entry("2", "28"), Map.entry("3", "30"), Map.entry("4", "27"),
            Map.entry("5", "29"), Map.entry("6", "26"), Map.entry("7", "31"), Map.entry("8", "36"),
            Map.entry("31", "41"), Map.entry("32", "42"), Map.entry("33", "43"), Map.entry("34", "44"),
            Map.entry("35", "47"), Map.entry("36", "48"), Map.entry("37", "45"), Map.entry("38", "46"),
            Map.entry("39", "50")
    );

    /** 설치장소 코드 → 카테고리 (06 도시공원, 07 어린이공원, 08 놀이제공영업소, 09 대규모점포) */
    private static final Map<String, PlaceCategory> LOCATION_CATEGORIES = Map.of(
            "06", PlaceCategory.NATURE_PARK,
            "07", PlaceCategory.NATURE_PARK,
            "08", PlaceCategory.KIDS_CAFE,
            "09", PlaceCategory.KIDS_CAFE
    );

    private final SourceHttpClient httpClient;
    private final DataBlockProperties properties;

    @PostConstruct
    void checkConfiguration() {
        DataBlockProperties.Source settings = settings();
        if (settings.isEnabled() && (settings.getApiKey() == null || settings.getApiKey().isBlank())) {
            throw ConfigurationException.missing(SOURCE_NAME, "datablock.sources.playground-api.api-key");
        }
    }

    @Override
    public PlaceSourceType getSourceType() {
        return PlaceSourceType.PLAYGROUND_API;
    }

    @Override
    public boolean isAvailable() {
        return settings().isEnabled() && settings().getApiKey() != null && !settings().getApiKey().isBlank();
    }

    @Override
    public List<SourceQuery> planQueries(CrawlJobType type, CrawlJobConfig config) {
        // 변경일 조회를 지원하지 않으므로 INCREMENTAL 에서는 건너뛴다
        if (type == CrawlJobType.INCREMENTAL) {
            return List.of();
        }
        SourceQuery base = SourceQuery.builder().pageSize(config.getPageSize()).build();
        if (config.getRegionCodes() == null || config.getRegionCodes().isEmpty()) {
            return List.of(base);
        }
        List<SourceQuery> queries = new ArrayList<>();
        for (String regionCode : config.getRegionCodes()) {
            queries.add(base.toBuilder().regionCode(regionCode).build());
        }
        return queries;
    }

    @Override
    public SourcePage fetchPage(SourceQuery query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(settings().getBaseUrl())
                .queryParam("serviceKey", settings().getApiKey())
                .queryParam("type", "json")
                .queryParam("pageNo", query.getPage())
                .queryParam("numOfRows", query.getPageSize());
        if (query.getRegionCode() != null) {
            String sidoCode = AREA_TO_SIDO.get(query.getRegionCode());
            if (sidoCode == null) {
                log.warn("[{}] Unknown region code {}, skipping", SOURCE_NAME, query.getRegionCode());
                return SourcePage.empty();
            }
            builder.queryParam("sidoCode", sidoCode);
        }
        URI uri = builder.encode().build().toUri();

        return httpClient.getJson(SOURCE_NAME, settings(), uri, headers -> { })
                .map(root -> toPage(root, query))
                .orElseGet(SourcePage::unreadable);
    }

    SourcePage toPage(JsonNode root, SourceQuery query) {
        JsonNode header = root.path("response").path("header");
        String resultCode = header.path("resultCode").asText("");
        if (!resultCode.isEmpty() && !resultCode.matches("0+")) {
            throw DataBlockException.sourceError(SOURCE_NAME,
                    "resultCode=" + resultCode + " " + header.path("resultMsg").asText(""), null);
        }

        JsonNode body = root.path("response").path("body");
        List<JsonNode> items = new ArrayList<>();
        JsonNode item = body.path("items").path("item");
        if (item.isArray()) {
            item.forEach(items::add);
        } else if (item.isObject()) {
            items.add(item);
        }
        long totalCount = body.path("totalCount").asLong(0);
        return new SourcePage(items, totalCount, (long) query.getPage() * query.getPageSize() < totalCount);
    }

    @Override
    public NormalizedPlace normalize(JsonNode item) {
        String serial = SourceText.text(item, "pfctSn");
        if (serial == null) {
            throw new MalformedRecordException("Playground item without pfctSn");
        }
        String address = SourceText.text(item, "ronaAddr");
        if (address == null) {
            address = SourceText.text(item, "lotnoAddr");
        }
        String locationName = SourceText.text(item, "locNm");
        String locationCode = SourceText.text(item, "locCd");

        return NormalizedPlace.builder()
                .id("playground-" + serial)
                .source(PlaceSourceType.PLAYGROUND_API)
                .sourceUrl(SOURCE_URL)
                .fetchedAt(LocalDateTime.now())
                .name(SourceText.text(item, "pfctNm"))
                .category(locationCode != null
                        ? LOCATION_CATEGORIES.getOrDefault(locationCode, PlaceCategory.OTHER)
                        : PlaceCategory.OTHER)
                .address(address)
                .addressDetail(SourceText.text(item, "emdNm"))
                .latitude(SourceText.parseDouble(SourceText.text(item, "lat")))
                .longitude(SourceText.parseDouble(SourceText.text(item, "lot")))
                .sigunguCode(SourceText.text(item, "sigunguCd"))
                .tel(SourceText.text(item, "mngInstTelno"))
                .description(locationName != null ? locationName + " 소재 어린이놀이시설" : null)
                // 놀이시설은 주로 유아~아동 대상
                .recommendedAges(List.of(AgeGroup.TODDLER, AgeGroup.CHILD))
                .build();
    }

    private DataBlockProperties.Source settings() {
        return properties.getSources().getPlaygroundApi();
    }
}
