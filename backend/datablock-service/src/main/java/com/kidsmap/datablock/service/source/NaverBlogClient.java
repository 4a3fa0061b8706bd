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
 * 네이버 블로그 검색 (blog.json)
 */
@Component
public class NaverBlogClient extends NaverSearchClient {

    public NaverBlogClient(SourceHttpClient httpClient, DataBlockProperties properties) {
        super(httpClient, properties);
    }

    @Override
    protected String endpoint() {
        return "blog.json";
    }

    @Override
    public ContentSourceType getSourceType() {
        return ContentSourceType.NAVER_BLOG;
    }

    @Override
    public NormalizedContent normalize(JsonNode item) {
        String link = SourceText.text(item, "link");
        if (link == null) {
            throw new MalformedRecordException("Naver blog item without link");
        }
        return NormalizedContent.builder()
                .id(idFromLink("naver-blog-", link))
                .source(ContentSourceType.NAVER_BLOG)
                .type(ContentType.BLOG_POST)
                .sourceUrl(link)
                .fetchedAt(LocalDateTime.now())
                .title(SourceText.stripHtml(SourceText.text(item, "title")))
                .description(SourceText.stripHtml(SourceText.text(item, "description")))
                .author(SourceText.text(item, "bloggername"))
                .authorUrl(SourceText.text(item, "bloggerlink"))
                .publishedAt(SourceText.parseBasicDate(SourceText.text(item, "postdate")))
                .build();
    }
}
