package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.ContentType;
import com.kidsmap.datablock.exception.MalformedRecordException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 네이버 비디오 검색 (video.json). 결과는 짧은 영상(클립)으로 저장한다.
 */
@Component
public class NaverClipClient extends NaverSearchClient {

    public NaverClipClient(SourceHttpClient httpClient, DataBlockProperties properties) {
        super(httpClient, properties);
    }

    @Override
    protected String endpoint() {
        return "video.json";
    }

    @Override
    public ContentSourceType getSourceType() {
        return ContentSourceType.NAVER_CLIP;
    }

    @Override
    public NormalizedContent normalize(JsonNode item) {
        String link = SourceText.text(item, "link");
        if (link == null) {
            throw new MalformedRecordException("Naver video item without link");
        }
        Long playtime = SourceText.parseLong(SourceText.text(item, "playtime"));

        return NormalizedContent.builder()
                .id(idFromLink("naver-clip-", link))
                .source(ContentSourceType.NAVER_CLIP)
                .type(ContentType.SHORT_VIDEO)
                .sourceUrl(link)
                .fetchedAt(LocalDateTime.now())
                .title(SourceText.stripHtml(SourceText.text(item, "title")))
                .description(SourceText.stripHtml(SourceText.text(item, "description")))
                .thumbnailUrl(SourceText.text(item, "thumbnail"))
                .author(SourceText.text(item, "publisher"))
                .duration(playtime != null ? playtime.intValue() : null)
                .build();
    }
}
