package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * 네이버 검색 API 공통 부분 (X-Naver-Client-Id / X-Naver-Client-Secret 인증, start/display 페이징)
 */
abstract class NaverSearchClient implements ContentSourceClient {

    static final String SOURCE_NAME = "Naver";

    static final int MAX_DISPLAY = 100;
    static final int MAX_START = 1000;

    private final SourceHttpClient httpClient;
    private final DataBlockProperties properties;

    protected NaverSearchClient(SourceHttpClient httpClient, DataBlockProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    /** blog.json, video.json */
    protected abstract String endpoint();

    @PostConstruct
    void checkConfiguration() {
        DataBlockProperties.Source settings = settings();
        if (!settings.isEnabled()) return;
        if (isBlank(settings.getClientId())) {
            throw ConfigurationException.missing(SOURCE_NAME, "datablock.sources.naver.client-id");
        }
        if (isBlank(settings.getClientSecret())) {
            throw ConfigurationException.missing(SOURCE_NAME, "datablock.sources.naver.client-secret");
        }
    }

    @Override
    public boolean isAvailable() {
        DataBlockProperties.Source settings = settings();
        return settings.isEnabled() && !isBlank(settings.getClientId()) && !isBlank(settings.getClientSecret());
    }

    @Override
    public SourcePage fetchPage(SourceQuery query) {
        int display = Math.min(query.getPageSize(), MAX_DISPLAY);
        int start = (query.getPage() - 1) * display + 1;
        if (start > MAX_START) {
            return SourcePage.empty();
        }

        URI uri = UriComponentsBuilder.fromUriString(settings().getBaseUrl())
                .path("/" + endpoint())
                .queryParam("query", query.getKeyword())
                .queryParam("display", display)
                .queryParam("start", start)
                .queryParam("sort", "sim")
                .encode()
                .build()
                .toUri();

        String sourceName = SOURCE_NAME + "/" + getSourceType().name();
        return httpClient.getJson(sourceName, settings(), uri, headers -> {
                    headers.set("X-Naver-Client-Id", settings().getClientId());
                    headers.set("X-Naver-Client-Secret", settings().getClientSecret());
                })
                .map(root -> {
                    List<JsonNode> items = new ArrayList<>();
                    root.path("items").forEach(items::add);
                    long total = root.path("total").asLong(items.size());
                    boolean hasMore = !items.isEmpty() && (long) start + display <= Math.min(total, MAX_START);
                    return new SourcePage(items, total, hasMore);
                })
                .orElseGet(SourcePage::unreadable);
    }

    /**
     * 링크 기반 식별자 (base64 앞 20자)
     */
    protected static String idFromLink(String prefix, String link) {
        String encoded = Base64.getEncoder().encodeToString(link.getBytes(StandardCharsets.UTF_8));
        return prefix + encoded.substring(0, Math.min(20, encoded.length()));
    }

    private DataBlockProperties.Source settings() {
        return properties.getSources().getNaver();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
