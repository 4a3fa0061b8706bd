package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.AdmissionFee;
import com.kidsmap.datablock.dto.block.Amenities;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.block.OperatingHours;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
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
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 한국관광공사 TourAPI (KorService1 areaBasedList1) 어댑터
 *
 * 응답 아이템 위치: response.body.items.item
 * 아이템이 하나면 배열이 아닌 객체로, 없으면 빈 문자열로 온다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TourApiClient implements PlaceSourceClient {

    static final String SOURCE_NAME = "TourAPI";

    /** TourAPI 지역 코드 전체 */
    public static final List<String> AREA_CODES = List.of(
            "1", "2", "3", "4", "5", "6", "7", "8",
            "31", "32", "33", "34", "35", "36", "37", "38", "39");

    private static final String DETAIL_URL = "https://www.visitkorea.or.kr/kfes/detail/detailL.do?cid=";
    private static final DateTimeFormatter MODIFIED_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /** cat2 중분류 → 카테고리 */
    private static final Map<String, PlaceCategory> CAT2_CATEGORIES = Map.ofEntries(
            Map.entry("A0101", PlaceCategory.NATURE_PARK),
            Map.entry("A0102", PlaceCategory.NATURE_PARK),
            Map.entry("A0103", PlaceCategory.NATURE_PARK),
            Map.entry("A0104", PlaceCategory.ZOO_AQUARIUM),
            Map.entry("A0201", PlaceCategory.MUSEUM),
            Map.entry("A0202", PlaceCategory.MUSEUM),
            Map.entry("A0203", PlaceCategory.MUSEUM),
            Map.entry("A0204", PlaceCategory.MUSEUM),
            Map.entry("A0205", PlaceCategory.AMUSEMENT_PARK),
            Map.entry("A0301", PlaceCategory.AMUSEMENT_PARK)
    );

    private final SourceHttpClient httpClient;
    private final DataBlockProperties properties;

    @PostConstruct
    void checkConfiguration() {
        DataBlockProperties.Source settings = settings();
        if (settings.isEnabled() && isBlank(settings.getApiKey())) {
            throw ConfigurationException.missing(SOURCE_NAME, "datablock.sources.tour-api.api-key");
        }
    }

    @Override
    public PlaceSourceType getSourceType() {
        return PlaceSourceType.TOUR_API;
    }

    @Override
    public boolean isAvailable() {
        return settings().isEnabled() && !isBlank(settings().getApiKey());
    }

    @Override
    public List<SourceQuery> planQueries(CrawlJobType type, CrawlJobConfig config) {
        SourceQuery base = SourceQuery.builder()
                .pageSize(config.getPageSize())
                .modifiedSince(type == CrawlJobType.INCREMENTAL ? config.getModifiedSince() : null)
                .build();

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
                .queryParam("MobileOS", "ETC")
                .queryParam("MobileApp", "KidsMap")
                .queryParam("_type", "json")
                .queryParam("pageNo", query.getPage())
                .queryParam("numOfRows", query.getPageSize())
                .queryParam("arrange", "C");
        if (query.getRegionCode() != null) {
            builder.queryParam("areaCode", query.getRegionCode());
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
        boolean hasMore = (long) query.getPage() * query.getPageSize() < totalCount;

        // arrange=C 는 수정일 역순이므로 기준 시각보다 오래된 아이템이 나오면 다음 페이지는 필요 없다
        if (query.getModifiedSince() != null) {
            int before = items.size();
            items.removeIf(node -> !modifiedAfter(node, query.getModifiedSince()));
            if (items.size() < before) {
                hasMore = false;
            }
        }
        return new SourcePage(items, totalCount, hasMore);
    }

    private boolean modifiedAfter(JsonNode item, LocalDateTime since) {
        String modified = SourceText.text(item, "modifiedtime");
        if (modified == null || modified.length() < 14) return true;
        try {
            return !LocalDateTime.parse(modified.substring(0, 14), MODIFIED_TIME).isBefore(since);
        } catch (Exception e) {
            return true;
        }
    }

    @Override
    public NormalizedPlace normalize(JsonNode item) {
        String contentId = SourceText.text(item, "contentid");
        if (contentId == null) {
            throw new MalformedRecordException("TourAPI item without contentid");
        }
        String title = SourceText.text(item, "title");
        String overview = SourceText.stripHtml(SourceText.text(item, "overview"));

        return NormalizedPlace.builder()
                .id("tour-" + contentId)
                .source(PlaceSourceType.TOUR_API)
                .sourceUrl(DETAIL_URL + contentId)
                .fetchedAt(LocalDateTime.now())
                .name(title)
                .category(mapCategory(SourceText.text(item, "cat2")))
                .address(SourceText.text(item, "addr1"))
                .addressDetail(SourceText.text(item, "addr2"))
                .latitude(SourceText.parseDouble(SourceText.text(item, "mapy")))
                .longitude(SourceText.parseDouble(SourceText.text(item, "mapx")))
                .areaCode(SourceText.text(item, "areacode"))
                .sigunguCode(SourceText.text(item, "sigungucode"))
                .tel(SourceText.text(item, "tel"))
                .homepage(SourceText.extractUrl(SourceText.text(item, "homepage")))
                .description(overview)
                .imageUrl(SourceText.text(item, "firstimage"))
                .thumbnailUrl(SourceText.text(item, "firstimage2"))
                .recommendedAges(AgeGroupInference.infer(title, overview))
                .amenities(amenities(item))
                .operatingHours(operatingHours(item))
                .admissionFee(admissionFee(item))
                .build();
    }

    static PlaceCategory mapCategory(String cat2) {
        if (cat2 == null) return PlaceCategory.OTHER;
        return CAT2_CATEGORIES.getOrDefault(cat2, PlaceCategory.OTHER);
    }

    /**
     * 상세 조회(detailIntro) 필드가 함께 온 경우에만 채운다
     */
    private Amenities amenities(JsonNode item) {
        String stroller = SourceText.text(item, "chkbabycarriage");
        String parking = SourceText.text(item, "parking");
        if (stroller == null && parking == null) return null;
        return Amenities.builder()
                .strollerAccess(stroller != null ? available(stroller) : null)
                .parking(parking != null ? available(parking) : null)
                .build();
    }

    private OperatingHours operatingHours(JsonNode item) {
        String useTime = SourceText.stripHtml(SourceText.text(item, "usetime"));
        if (useTime == null) return null;
        return OperatingHours.builder()
                .weekday(useTime)
                .closedDays(SourceText.stripHtml(SourceText.text(item, "restdate")))
                .build();
    }

    private AdmissionFee admissionFee(JsonNode item) {
        String useFee = SourceText.stripHtml(SourceText.text(item, "usefee"));
        if (useFee == null) return null;
        return AdmissionFee.builder()
                .isFree(useFee.contains("무료"))
                .description(useFee)
                .build();
    }

    private boolean available(String value) {
        return value.contains("가능") || value.contains("있음");
    }

    private DataBlockProperties.Source settings() {
        return properties.getSources().getTourApi();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
