package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.crawl.CrawlJobConfig;
import com.kidsmap.datablock.entity.CrawlJobType;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.PlaceSourceType;
import com.kidsmap.datablock.exception.ConfigurationException;
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
import java.util.Locale;

/**
 * 카카오 로컬 키워드 검색 (search/keyword.json) 어댑터.
 * 한 페이지 최대 15건, 최대 45페이지.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KakaoLocalClient implements PlaceSourceClient {

    static final String SOURCE_NAME = "KakaoLocal";

    static final int MAX_PAGE_SIZE = 15;
    static final int MAX_PAGE = 45;

    static final List<String> DEFAULT_KEYWORDS = List.of("키즈카페", "어린이 놀이터", "실내 놀이터", "아이랑 갈만한곳");

    private final SourceHttpClient httpClient;
    private final DataBlockProperties properties;

    @PostConstruct
    void checkConfiguration() {
        DataBlockProperties.Source settings = settings();
        if (settings.isEnabled() && (settings.getApiKey() == null || settings.getApiKey().isBlank())) {
            throw ConfigurationException.missing(SOURCE_NAME, "datablock.sources.kakao-local.api-key");
        }
    }

    @Override
    public PlaceSourceType getSourceType() {
        return PlaceSourceType.KAKAO_LOCAL;
    }

    @Override
    public boolean isAvailable() {
        return settings().isEnabled() && settings().getApiKey() != null && !settings().getApiKey().isBlank();
    }

    @Override
    public List<SourceQuery> planQueries(CrawlJobType type, CrawlJobConfig config) {
        if (type == CrawlJobType.INCREMENTAL) {
            return List.of();
        }
        List<String> keywords = config.getKeywords() != null && !config.getKeywords().isEmpty()
                ? config.getKeywords() : DEFAULT_KEYWORDS;
        int pageSize = Math.min(config.getPageSize(), MAX_PAGE_SIZE);

        List<SourceQuery> queries = new ArrayList<>();
        for (String keyword : keywords) {
            queries.add(SourceQuery.builder().keyword(keyword).pageSize(pageSize).build());
        }
        return queries;
    }

    @Override
    public SourcePage fetchPage(SourceQuery query) {
        if (query.getPage() > MAX_PAGE) {
            return SourcePage.empty();
        }
        URI uri = UriComponentsBuilder.fromUriString(settings().getBaseUrl())
                .queryParam("query", query.getKeyword())
                .queryParam("page", query.getPage())
                .queryParam("size", Math.min(query.getPageSize(), MAX_PAGE_SIZE))
                .queryParam("sort", "accuracy")
                .encode()
                .build()
                .toUri();

        return httpClient.getJson(SOURCE_NAME, settings(), uri,
                        headers -> headers.set("Authorization", "KakaoAK " + settings().getApiKey()))
                .map(this::toPage)
                .orElseGet(SourcePage::unreadable);
    }

    SourcePage toPage(JsonNode root) {
        List<JsonNode> items = new ArrayList<>();
        root.path("documents").forEach(items::add);
        JsonNode meta = root.path("meta");
        return new SourcePage(items, meta.path("total_count").asLong(items.size()), !meta.path("is_end").asBoolean(true));
    }

    @Override
    public NormalizedPlace normalize(JsonNode item) {
        String id = SourceText.text(item, "id");
        if (id == null) {
            throw new MalformedRecordException("Kakao document without id");
        }
        String roadAddress = SourceText.text(item, "road_address_name");
        String lotAddress = SourceText.text(item, "address_name");
        String categoryName = SourceText.text(item, "category_name");

        return NormalizedPlace.builder()
                .id("kakao-" + id)
                .source(PlaceSourceType.KAKAO_LOCAL)
                .sourceUrl(SourceText.text(item, "place_url"))
                .fetchedAt(LocalDateTime.now())
                .name(SourceText.text(item, "place_name"))
                .category(mapCategory(categoryName, SourceText.text(item, "category_group_code")))
                .address(roadAddress != null ? roadAddress : lotAddress)
                .addressDetail(roadAddress != null && lotAddress != null && !lotAddress.equals(roadAddress) ? lotAddress : null)
                .latitude(SourceText.parseDouble(SourceText.text(item, "y")))
                .longitude(SourceText.parseDouble(SourceText.text(item, "x")))
                .tel(SourceText.text(item, "phone"))
                .description(categoryName)
                .recommendedAges(AgeGroupInference.DEFAULT_AGES)
                .build();
    }

    /**
     * 카테고리 이름 우선, 없으면 그룹 코드(CT1 문화시설, AT4 관광명소)로 판단
     */
    static PlaceCategory mapCategory(String categoryName, String groupCode) {
        String name = categoryName != null ? categoryName.toLowerCase(Locale.ROOT) : "";
        if (name.contains("키즈카페") || name.contains("실내놀이터")) return PlaceCategory.KIDS_CAFE;
        if (name.contains("놀이공원") || name.contains("테마파크")) return PlaceCategory.AMUSEMENT_PARK;
        if (name.contains("동물원") || name.contains("수족관") || name.contains("아쿠아리움")) return PlaceCategory.ZOO_AQUARIUM;
        if (name.contains("박물관") || name.contains("체험관") || name.contains("과학관")) return PlaceCategory.MUSEUM;
        if (name.contains("공원") || name.contains("숲") || name.contains("자연")) return PlaceCategory.NATURE_PARK;

        if ("CT1".equals(groupCode)) return PlaceCategory.MUSEUM;
        if ("AT4".equals(groupCode)) return PlaceCategory.AMUSEMENT_PARK;
        return PlaceCategory.OTHER;
    }

    private DataBlockProperties.Source settings() {
        return properties.getSources().getKakaoLocal();
    }
}
