package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.ContentType;
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
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * YouTube Data API v3 search 어댑터.
 * 페이지 이동은 nextPageToken 으로 하므로 키워드별 토큰을 기억한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YouTubeClient implements ContentSourceClient {

    static final String SOURCE_NAME = "YouTube";

    /** search.list maxResults 상한 */
    static final int MAX_PAGE_SIZE = 50;

    private final SourceHttpClient httpClient;
    private final DataBlockProperties properties;

    /** "keyword#page" → 해당 페이지 pageToken */
    private final Map<String, String> pageTokens = new ConcurrentHashMap<>();

    @PostConstruct
    void checkConfiguration() {
        DataBlockProperties.Source settings = settings();
        if (settings.isEnabled() && (settings.getApiKey() == null || settings.getApiKey().isBlank())) {
            throw ConfigurationException.missing(SOURCE_NAME, "datablock.sources.youtube.api-key");
        }
    }

    @Override
    public ContentSourceType getSourceType() {
        return ContentSourceType.YOUTUBE;
    }

    @Override
    public boolean isAvailable() {
        return settings().isEnabled() && settings().getApiKey() != null && !settings().getApiKey().isBlank();
    }

    @Override
    public SourcePage fetchPage(SourceQuery query) {
        String tokenKey = query.getKeyword() + "#" + query.getPage();
        String pageToken = pageTokens.remove(tokenKey);
        if (query.getPage() > 1 && pageToken == null) {
            return SourcePage.empty();
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(settings().getBaseUrl())
                .queryParam("key", settings().getApiKey())
                .queryParam("part", "snippet")
                .queryParam("type", "video")
                .queryParam("q", query.getKeyword())
                .queryParam("maxResults", Math.min(query.getPageSize(), MAX_PAGE_SIZE))
                .queryParam("regionCode", "KR")
                .queryParam("relevanceLanguage", "ko")
                .queryParam("safeSearch", "strict");
        if (pageToken != null) {
            builder.queryParam("pageToken", pageToken);
        }
        URI uri = builder.encode().build().toUri();

        return httpClient.getJson(SOURCE_NAME, settings(), uri, headers -> { })
                .map(root -> {
                    String next = SourceText.text(root, "nextPageToken");
                    if (next != null) {
                        pageTokens.put(query.getKeyword() + "#" + (query.getPage() + 1), next);
                    }
                    List<JsonNode> items = new ArrayList<>();
                    root.path("items").forEach(items::add);
                    long total = root.path("pageInfo").path("totalResults").asLong(items.size());
                    return new SourcePage(items, total, next != null);
                })
                .orElseGet(SourcePage::unreadable);
    }

    @Override
    public NormalizedContent normalize(JsonNode item) {
        String videoId = SourceText.text(item.path("id"), "videoId");
        if (videoId == null) {
            throw new MalformedRecordException("YouTube item without id.videoId");
        }
        JsonNode snippet = item.path("snippet");
        JsonNode thumbnails = snippet.path("thumbnails");
        String thumbnail = SourceText.text(thumbnails.path("high"), "url");
        if (thumbnail == null) thumbnail = SourceText.text(thumbnails.path("medium"), "url");
        if (thumbnail == null) thumbnail = SourceText.text(thumbnails.path("default"), "url");
        String channelId = SourceText.text(snippet, "channelId");

        return NormalizedContent.builder()
                .id("youtube-" + videoId)
                .source(ContentSourceType.YOUTUBE)
                .type(ContentType.VIDEO)
                .sourceUrl("https://www.youtube.com/watch?v=" + videoId)
                .fetchedAt(LocalDateTime.now())
                .title(SourceText.stripHtml(SourceText.text(snippet, "title")))
                .description(SourceText.stripHtml(SourceText.text(snippet, "description")))
                .thumbnailUrl(thumbnail)
                .author(SourceText.text(snippet, "channelTitle"))
                .authorUrl(channelId != null ? "https://www.youtube.com/channel/" + channelId : null)
                .publishedAt(SourceText.parseIsoDateTime(SourceText.text(snippet, "publishedAt")))
                .build();
    }

    private DataBlockProperties.Source settings() {
        return properties.getSources().getYoutube();
    }
}
